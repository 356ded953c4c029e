package ir.value.instructions;

import java.util.Map;

import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class CastInst extends Instruction {

    private final Opcode op;

    public CastInst(Opcode op, Value value, Type destType, String name) {
        super(destType, name);
        this.op = op;
        addOperand(value);
        Type srcType = value.getType();

        switch (op) {
            case ZEXT:
            case SEXT:
                assert srcType.isInteger() && destType.isInteger()
                        && srcType != destType : "ZEXT/SEXT require integer types of different width";
                break;
            case TRUNC:
                assert srcType.isInteger() && destType.isInteger()
                        && srcType != destType : "TRUNC requires integer types of different width";
                break;
            case BITCAST:
                assert srcType != null && destType != null
                        : "BITCAST types must not be null";
                break;
            case PTRTOINT:
                assert srcType.isPointer() && destType.isInteger()
                        : "PTRTOINT requires pointer to integer";
                break;
            case INTTOPTR:
                assert srcType.isInteger() && destType.isPointer()
                        : "INTTOPTR requires integer to pointer";
                break;
            case ADDRSPACECAST:
                assert srcType.isPointer() && destType.isPointer()
                        : "ADDRSPACECAST requires pointer to pointer";
                break;
            default:
                throw new IllegalArgumentException("Unknown cast opcode: " + op);
        }

    }

    @Override
    public Opcode opCode() {
        return op;
    }

    @Override
    public String toIR() {
        Value value = getOperand(0);
        return "%" + getName() + " = " + op.getKeyword() + " " + typed(value) + " to " + getDestType().toIR();
    }

    public Value getValue() {
        return getOperand(0);
    }

    public Type getDestType() {
        return getType();
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        return new CastInst(op, mapValue(valueMap, getValue()), getDestType(), getName());
    }
}
