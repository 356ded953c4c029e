package ir.value.constants;

import ir.type.Type;
import ir.value.User;

/**
 * 常量的 toIR() 形如 "i32 42"，getReference() 只给出取值部分 "42"。
 */
public abstract class Constant extends User {
    public Constant(Type type) {
        super(type, "");
    }

    @Override public boolean isConstant() { return true; };

    @Override
    public abstract String getReference();

    @Override
    public String toIR() {
        return getType().toIR() + " " + getReference();
    }
}
