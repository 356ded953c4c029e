package ir.value.instructions;

import java.util.Map;

import ir.type.IntegerType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class ICmpInst extends Instruction {
    private final Opcode opcode;

    public ICmpInst(Opcode opcode, String name, Value lhs, Value rhs) {
        super(IntegerType.getI1(), name);
        if (!opcode.isICmp()) {
            throw new IllegalArgumentException("not an icmp predicate: " + opcode);
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
        return "%" + getName() + " = icmp "
                + opcode.getKeyword()
                + " " + typed(lhs) + ", " + rhs.getReference();
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        return new ICmpInst(opcode, getName(),
                mapValue(valueMap, getOperand(0)), mapValue(valueMap, getOperand(1)));
    }
}
