package ir.value.constants;

import ir.type.IntegerType;

public class ConstantInt extends Constant {
    private final long value;

    public ConstantInt(IntegerType type, long value) {
        super(type);
        this.value = value;
    }

    public static ConstantInt get(IntegerType type, long value) {
        return new ConstantInt(type, value);
    }

    public long getValue() { return value; }

    public boolean isZero() { return value == 0; }

    @Override
    public String getReference() {
        if (getType().isI1()) {
            return value != 0 ? "true" : "false";
        }
        return Long.toString(value);
    }
}
