package ir.value.instructions;

import java.util.Map;

import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class ReturnInst extends Instruction {

    public ReturnInst(Value value) {
        super(VoidType.getVoid(), "");
        if (value != null) {
            addOperand(value);
        }
    }

    public boolean hasReturnValue() {
        return getNumOperands() > 0;
    }

    public Value getReturnValue() {
        return hasReturnValue() ? getOperand(0) : null;
    }

    @Override
    public String toIR() {
        if (hasReturnValue()) {
            return "ret " + typed(getOperand(0));
        } else {
            return "ret void";
        }
    }

    @Override
    public Opcode opCode() {
        return Opcode.RET;
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        if (hasReturnValue()) {
            return new ReturnInst(mapValue(valueMap, getReturnValue()));
        } else {
            return new ReturnInst(null);
        }
    }
}
