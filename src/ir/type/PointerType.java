package ir.type;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 带地址空间的指针类型。
 * addrspace(0) 为普通内存，{@link #GLOBAL_SPACE} 指向某个节点拥有的远程内存，
 * {@link #SYMMETRIC_SPACE} 指向每个节点上都有一份拷贝的对称内存。
 */
public final class PointerType extends Type {
    public static final int DEFAULT_SPACE = 0;
    public static final int GLOBAL_SPACE = 100;
    public static final int SYMMETRIC_SPACE = 200;

    private final Type pointeeType;
    private final int addressSpace;

    private static final Map<Key, PointerType> pool =
        new ConcurrentHashMap<>();

    private record Key(Type pointee, int space) {}

    private PointerType(Type pointeeType, int addressSpace) {
        super(TypeKind.POINTER);
        this.pointeeType = pointeeType;
        this.addressSpace = addressSpace;
    }

    public static PointerType get(Type pointeeType) {
        return get(pointeeType, DEFAULT_SPACE);
    }

    public static PointerType get(Type pointeeType, int addressSpace) {
        if (addressSpace < 0) {
            throw new IllegalArgumentException("negative address space " + addressSpace);
        }
        return pool.computeIfAbsent(new Key(pointeeType, addressSpace),
                k -> new PointerType(k.pointee(), k.space()));
    }

    public Type getPointeeType() {
        return pointeeType;
    }

    @Override
    public int getAddressSpace() {
        return addressSpace;
    }

    public boolean isGlobal() {
        return addressSpace == GLOBAL_SPACE;
    }

    public boolean isSymmetric() {
        return addressSpace == SYMMETRIC_SPACE;
    }

    @Override
    public String toIR() {
        if (addressSpace == DEFAULT_SPACE) {
            return pointeeType.toIR() + "*";
        }
        return pointeeType.toIR() + " addrspace(" + addressSpace + ")*";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointerType other)) return false;
        return addressSpace == other.addressSpace && pointeeType.equals(other.pointeeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), pointeeType, addressSpace);
    }
}
