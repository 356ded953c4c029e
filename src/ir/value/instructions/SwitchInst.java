package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;

/**
 * 多路分支。
 * operand: [cond, default, case0Value, case0Block, case1Value, case1Block, ...]
 */
public class SwitchInst extends Instruction {

    public SwitchInst(Value condition, BasicBlock defaultBlock) {
        super(VoidType.getVoid(), "");
        addOperand(condition);
        addOperand(defaultBlock);
    }

    public void addCase(ConstantInt value, BasicBlock dest) {
        assert value.getType().equals(getCondition().getType())
            : "case value must match switch condition type";
        addOperand(value);
        addOperand(dest);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public BasicBlock getDefaultBlock() {
        return (BasicBlock) getOperand(1);
    }

    public int getNumCases() {
        return (getNumOperands() - 2) / 2;
    }

    public ConstantInt getCaseValue(int index) {
        return (ConstantInt) getOperand(2 + index * 2);
    }

    public BasicBlock getCaseBlock(int index) {
        return (BasicBlock) getOperand(3 + index * 2);
    }

    /* default 在前，随后是各个 case，可能有重复 */
    public List<BasicBlock> getSuccessors() {
        List<BasicBlock> succs = new ArrayList<>();
        succs.add(getDefaultBlock());
        for (int i = 0; i < getNumCases(); i++) {
            succs.add(getCaseBlock(i));
        }
        return succs;
    }

    @Override
    public Opcode opCode() {
        return Opcode.SWITCH;
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append("switch ").append(typed(getCondition()))
          .append(", label %").append(getDefaultBlock().getName())
          .append(" [");
        for (int i = 0; i < getNumCases(); i++) {
            sb.append(" ").append(typed(getCaseValue(i)))
              .append(", label %").append(getCaseBlock(i).getName());
        }
        sb.append(" ]");
        return sb.toString();
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        SwitchInst copy = new SwitchInst(mapValue(valueMap, getCondition()), mapBlock(blockMap, getDefaultBlock()));
        for (int i = 0; i < getNumCases(); i++) {
            copy.addCase(getCaseValue(i), mapBlock(blockMap, getCaseBlock(i)));
        }
        return copy;
    }
}
