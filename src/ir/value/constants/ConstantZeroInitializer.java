package ir.value.constants;

import ir.type.Type;

public class ConstantZeroInitializer extends Constant {
    public ConstantZeroInitializer(Type type) {
        // Nothing is stored: the whole object is zero.
        super(type);
    }

    @Override
    public String getReference() {
        return "zeroinitializer";
    }
}
