package ir.value.instructions;

import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

import java.util.Map;

/**
 * SSA 三元选择指令：result = cond ? trueVal : falseVal
 * 要求：
 * - cond 为 i1
 * - trueVal、falseVal 类型一致，且与结果类型一致
 */
public class SelectInst extends Instruction {
    public SelectInst(Value cond, Value trueVal, Value falseVal, String name) {
        super(trueVal.getType(), name);
        if (!cond.getType().isI1()) {
            throw new IllegalArgumentException("select condition must be i1");
        }
        if (!trueVal.getType().equals(falseVal.getType())) {
            throw new IllegalArgumentException("select operands must have the same type");
        }
        // 依次添加操作数：cond, true, false
        addOperand(cond);
        addOperand(trueVal);
        addOperand(falseVal);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public Value getTrueValue() {
        return getOperand(1);
    }

    public Value getFalseValue() {
        return getOperand(2);
    }

    @Override
    public Opcode opCode() {
        return Opcode.SELECT;
    }

    @Override
    public String toIR() {
        // %res = select i1 %cond, T %t, T %f
        return "%" + getName() + " = select " + typed(getCondition()) + ", "
                + typed(getTrueValue()) + ", " + typed(getFalseValue());
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        return new SelectInst(mapValue(valueMap, getCondition()), mapValue(valueMap, getTrueValue()),
                mapValue(valueMap, getFalseValue()), getName());
    }
}
