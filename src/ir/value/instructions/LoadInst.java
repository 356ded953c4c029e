package ir.value.instructions;

import java.util.Map;

import ir.IRModule;
import ir.type.PointerType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class LoadInst extends Instruction {

    public LoadInst(Value pointer, String name) {
        super(((PointerType) pointer.getType()).getPointeeType(), name);
        addOperand(pointer);
    }

    public Value getPointer() {
        return getOperand(0);
    }

    @Override
    public String toIR() {
        int align = IRModule.getModule()
                .getTargetDataLayout().getAlignment(getType());
        return "%" + getName() + " = load " + getType().toIR() +
                ", " + typed(getPointer()) +
                ", align " + align;
    }

    @Override
    public Opcode opCode() {
        return Opcode.LOAD;
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        return new LoadInst(mapValue(valueMap, getPointer()), getName());
    }
}
