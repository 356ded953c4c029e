package ir.type;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import exception.CompileException;

public final class ArrayType extends Type {
    private final Type elementType;
    private final int length;

    private static final Map<Key, ArrayType> pool =
        new ConcurrentHashMap<>();


    private record Key(Type elementType, int length) {}

    private ArrayType(Type elementType, int length) {
        super(TypeKind.ARRAY);
        this.elementType = elementType;
        this.length = length;
    }

    public static ArrayType get(Type elementType, int length) {
        if (length < 0) {
            throw CompileException.
                unSupported("Array length cannot be negative");
        }

        return pool.computeIfAbsent(
            new Key(elementType, length),
            k -> new ArrayType(k.elementType(), k.length())
        );
    }

    public Type getElementType() {
        return elementType;
    }

    public int getLength() {
        return length;
    }

    @Override
    public String toIR() {
        return "[" + length + " x " + elementType.toIR() + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType other)) return false;
        return length == other.length && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementType, length);
    }
}
