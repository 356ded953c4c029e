package ir.value.constants;

import java.util.ArrayList;
import java.util.List;

import ir.type.PointerType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.GEPInst;

/**
 * 常量表达式：只支持 getelementptr 和各类转换两种形状，
 * 例如 {@code getelementptr inbounds ([4 x i32], [4 x i32] addrspace(100)* @g, i64 0, i64 1)}
 * 和 {@code bitcast (i32* @x to i8*)}。
 *
 * 操作数布局和对应的指令一致：GEP 为 [pointer, idx...]，转换为 [value]。
 */
public class ConstantExpr extends Constant {
    private final Opcode opcode;
    private final boolean inBounds;

    private ConstantExpr(Opcode opcode, Type type, boolean inBounds, List<Value> operands) {
        super(type);
        this.opcode = opcode;
        this.inBounds = inBounds;
        for (Value operand : operands) {
            addOperand(operand);
        }
    }

    public static ConstantExpr getGEP(Value pointer, List<Value> indices, boolean inBounds) {
        List<Value> ops = new ArrayList<>();
        ops.add(pointer);
        ops.addAll(indices);
        return new ConstantExpr(Opcode.GETELEMENTPOINTER,
                GEPInst.computeResultType(pointer.getType(), indices), inBounds, ops);
    }

    public static ConstantExpr getCast(Opcode op, Value value, Type destType) {
        if (!op.isCast()) {
            throw new IllegalArgumentException("not a cast opcode: " + op);
        }
        return new ConstantExpr(op, destType, false, List.of(value));
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public boolean isGEP() {
        return opcode == Opcode.GETELEMENTPOINTER;
    }

    public boolean isCast() {
        return opcode.isCast();
    }

    public boolean isInBounds() {
        return inBounds;
    }

    /* GEP 的基址或转换的源操作数 */
    public Value getPointerOperand() {
        return getOperand(0);
    }

    public List<Value> getIndices() {
        return getOperands().subList(1, getNumOperands());
    }

    @Override
    public String getReference() {
        StringBuilder sb = new StringBuilder();
        if (isGEP()) {
            Value pointer = getPointerOperand();
            Type baseType = ((PointerType) pointer.getType()).getPointeeType();
            sb.append("getelementptr ");
            if (inBounds) {
                sb.append("inbounds ");
            }
            sb.append("(").append(baseType.toIR()).append(", ")
              .append(pointer.getType().toIR()).append(" ").append(pointer.getReference());
            for (Value idx : getIndices()) {
                sb.append(", ").append(idx.getType().toIR()).append(" ").append(idx.getReference());
            }
            sb.append(")");
        } else {
            Value src = getPointerOperand();
            sb.append(opcode.getKeyword()).append(" (")
              .append(src.getType().toIR()).append(" ").append(src.getReference())
              .append(" to ").append(getType().toIR()).append(")");
        }
        return sb.toString();
    }
}
