package ir.value.instructions;

import java.util.List;
import java.util.Map;

import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

// branch
public class BranchInst extends Instruction {

    public BranchInst(BasicBlock dest) {
        super(VoidType.getVoid(), "");
        addOperand(dest);
    }

    public BranchInst(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        super(VoidType.getVoid(), "");
        addOperand(condition);
        addOperand(thenBlock);
        addOperand(elseBlock);
    }

    @Override
    public Opcode opCode() {
        return Opcode.BR;
    }

    @Override
    public String toIR() {
        if (isConditional()) {
            Value condition = getOperand(0);
            BasicBlock thenBlock = (BasicBlock) getOperand(1);
            BasicBlock elseBlock = (BasicBlock) getOperand(2);
            return "br " + condition.getType().toIR()
                + " " + condition.getReference()
                + ", label %" + thenBlock.getName()
                + ", label %" + elseBlock.getName();
        } else {
            BasicBlock thenBlock = (BasicBlock) getOperand(0);
            return "br label %" + thenBlock.getName();
        }
    }

    public boolean isConditional() {
        return getNumOperands() > 1;
    }

    public Value getCondition() {
        return isConditional() ? getOperand(0) : null;
    }

    public BasicBlock getThenBlock() {
        return (BasicBlock)(isConditional() ? getOperand(1) : getOperand(0));
    }

    public BasicBlock getElseBlock() {
        return isConditional() ? (BasicBlock)getOperand(2) : null;
    }

    /* 按 terminator 中出现的顺序 */
    public List<BasicBlock> getSuccessors() {
        if (isConditional()) {
            return List.of(getThenBlock(), getElseBlock());
        }
        return List.of(getThenBlock());
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        if (isConditional()) {
            return new BranchInst(mapValue(valueMap, getCondition()),
                    mapBlock(blockMap, getThenBlock()), mapBlock(blockMap, getElseBlock()));
        } else {
            return new BranchInst(mapBlock(blockMap, getThenBlock()));
        }
    }
}
