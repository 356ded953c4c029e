package ir.type;

public abstract class Type {
    private TypeKind kind;

    protected Type(TypeKind kind) {
        this.kind = kind;
    }

    public TypeKind getKind() {
        return this.kind;
    }

    public abstract String toIR();

    /* classification helpers */
    public boolean is(TypeKind k) { return kind == k; }
    public boolean isI1() { return is(TypeKind.I1); };
    public boolean isI8() { return is(TypeKind.I8); };
    public boolean isI16() { return is(TypeKind.I16); };
    public boolean isI32() { return is(TypeKind.I32); };
    public boolean isI64() { return is(TypeKind.I64); };
    public boolean isArray() { return is(TypeKind.ARRAY); };
    public boolean isStruct() { return is(TypeKind.STRUCT); };
    public boolean isFunc() { return is(TypeKind.FUNC); };
    public boolean isVoid() { return is(TypeKind.VOID); };
    public boolean isPointer() { return is(TypeKind.POINTER); };
    public boolean isInteger() {
        return isI1() || isI8() || isI16() || isI32() || isI64();
    }

    /* 指针所在的地址空间，非指针类型返回 -1 */
    public int getAddressSpace() {
        return -1;
    }

    @Override public String toString() { return toIR(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

}
