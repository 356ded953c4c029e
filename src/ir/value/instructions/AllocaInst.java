package ir.value.instructions;

import java.util.Map;

import ir.IRModule;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class AllocaInst extends Instruction {

    public AllocaInst(Type allocatedType, String name) {
        super(PointerType.get(allocatedType), name);
    }

    public Type getAllocatedType() {
        return ((PointerType) getType()).getPointeeType();
    }

    @Override
    public Opcode opCode() {
        return Opcode.ALLOCA;
    }

    @Override
    public String toIR() {
        String typeStr = getAllocatedType().toIR();
        int align = IRModule.getModule().getTargetDataLayout().getAlignment(getAllocatedType());
        return "%" + getName() + " = alloca " + typeStr + ", align " + align;
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        return new AllocaInst(getAllocatedType(), getName());
    }
}
