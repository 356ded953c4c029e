package ir.type;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import exception.CompileException;
import java.util.Objects;

public final class IntegerType extends Type {
    private final int bitWidth;

    private static final Map<Integer, IntegerType> pool
        = new ConcurrentHashMap<>();

    public static final IntegerType i1 = IntegerType.getInteger(1);
    public static final IntegerType i8 = IntegerType.getInteger(8);
    public static final IntegerType i16 = IntegerType.getInteger(16);
    public static final IntegerType i32 = IntegerType.getInteger(32);
    public static final IntegerType i64 = IntegerType.getInteger(64);

    private IntegerType(int bitWidth) {
        super(getKindFromWidth(bitWidth));
        this.bitWidth = bitWidth;
    }


    public int getBitWidth() {
        return bitWidth;
    }

    private static TypeKind getKindFromWidth(int bitWidth) {
        return switch (bitWidth) {
        case 1 -> TypeKind.I1;
        case 8 -> TypeKind.I8;
        case 16 -> TypeKind.I16;
        case 32 -> TypeKind.I32;
        case 64 -> TypeKind.I64;
        default ->
            throw CompileException.
            unSupported("Integer with bitWidth " + bitWidth);
        };
    }

    public static IntegerType getInteger(int bitWidth) {
        return pool.computeIfAbsent(bitWidth, IntegerType::new);
    }

    public static IntegerType getI1() { return i1; }
    public static IntegerType getI8() { return i8; }
    // exit code / location id
    public static IntegerType getI16() { return i16; }
    public static IntegerType getI32() { return i32; }
    public static IntegerType getI64() { return i64; }

    @Override
    public String toIR() {
        return "i" + bitWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerType other)) return false;
        return bitWidth == other.bitWidth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), bitWidth);
    }
}
