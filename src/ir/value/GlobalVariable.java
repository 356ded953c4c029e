package ir.value;

import ir.IRModule;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.constants.Constant;

import java.util.Objects;

public class GlobalVariable extends Value {
    private final IRModule parent; // 模块的引用，便于获取数据布局等信息
    private Constant initializer;
    private boolean isConst;

    public GlobalVariable(IRModule parent, Type type,
                          String name, Constant initializer) {
        super(Objects.requireNonNull(type, "type"), name);
        if (!(type instanceof PointerType)) {
            throw new IllegalArgumentException("GlobalVariable must be a pointer type");
        }
        this.initializer = initializer;
        this.isConst = false; // 默认不是常量
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    /* getter setter */
    public Constant getInitializer() { return initializer; }
    public boolean hasInitializer() { return initializer != null; }
    public boolean isConst() { return isConst; }
    public void setConst(boolean isConst) { this.isConst = isConst; }

    public Type getValueType() {
        return ((PointerType) getType()).getPointeeType();
    }

    public int getAddressSpace() {
        return getType().getAddressSpace();
    }

    @Override
    public String getReference() {
        return "@" + getName();
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append("@").append(getName()).append(" = ");
        if (getAddressSpace() != PointerType.DEFAULT_SPACE) {
            sb.append("addrspace(").append(getAddressSpace()).append(") ");
        }
        sb.append(isConst() ? "constant " : "global ");
        Type valueType = getValueType();
        if (initializer != null) {
            sb.append(initializer.toIR());
        } else {
            // If initializer is null, it means it's implicitly zero-initialized
            sb.append(valueType.toIR()).append(" zeroinitializer");
        }

        int align = parent.getTargetDataLayout().getAlignment(valueType);
        if (align > 0) {
            sb.append(", align ").append(align);
        } else {
            throw new IllegalStateException("Alignment must be greater than 0");
        }
        return sb.toString();
    }
}
