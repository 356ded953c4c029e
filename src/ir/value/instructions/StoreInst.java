package ir.value.instructions;

import java.util.Map;

import ir.IRModule;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class StoreInst extends Instruction {

    public StoreInst(Value pointer, Value value) {
        super(VoidType.getVoid(), "");
        addOperand(pointer);
        addOperand(value);
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public Value getValue() {
        return getOperand(1);
    }

    @Override
    public Opcode opCode() {
        return Opcode.STORE;
    }

    @Override
    public String toIR() {
        int align = IRModule.getModule().getTargetDataLayout()
                .getAlignment(getValue().getType());
        return "store " + typed(getValue()) +
                ", " + typed(getPointer()) +
                ", align " + align;
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        return new StoreInst(mapValue(valueMap, getPointer()), mapValue(valueMap, getValue()));
    }
}
