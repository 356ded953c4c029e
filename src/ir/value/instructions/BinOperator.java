package ir.value.instructions;

import java.util.Map;

import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class BinOperator extends Instruction {
    private final Opcode opcode;

    public BinOperator(String name, Opcode opcode,
            Type type, Value lhs, Value rhs) {
        super(type, name);
        if (!opcode.isBinary()) {
            throw new IllegalArgumentException("not a binary opcode: " + opcode);
        }
        this.opcode = opcode;
        addOperand(lhs);
        addOperand(rhs);
    }

    @Override
    public Opcode opCode() {
        return opcode;
    }

    @Override
    public String toIR() {
        Value lhs = getOperand(0);
        Value rhs = getOperand(1);
        return "%" + getName() + " = "
                + opcode.getKeyword() + " "
                + getType().toIR() + " "
                + lhs.getReference() + ", " + rhs.getReference();
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        return new BinOperator(getName(), opcode, getType(),
                mapValue(valueMap, getOperand(0)), mapValue(valueMap, getOperand(1)));
    }
}
