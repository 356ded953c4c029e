package ir.value;

import ir.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public abstract class User extends Value {

    private final ArrayList<Value> operands;

    protected User(Type type, String name) {
        super(type, name);
        this.operands = new ArrayList<>();
    }

    /* getter */
    public int getNumOperands() { return operands.size(); }
    public Value getOperand(int index) { return operands.get(index); }

    // to assure the consistency, you can only get a read only list
    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /* updater */
    public void setOperand(int index, Value value) {
        assert index >= 0 && index < getNumOperands();
        Objects.requireNonNull(value, "Operand value cannot be null");

        operands.get(index).removeUseBy(this, index);
        operands.set(index, value);
        value.addUse(new Use(this, value, index));
    }

    public void addOperand(Value value) {
        Objects.requireNonNull(value, "Operand value cannot be null");
        this.operands.add(value);
        value.addUse(new Use(this, value, operands.size() - 1));
    }

    /**
     * 把所有等于 from 的操作数替换成 to，返回替换的个数。
     * 用于重定向分支目标、phi 的前驱块等局部改写。
     */
    public int replaceUsesOfWith(Value from, Value to) {
        int replaced = 0;
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i) == from) {
                setOperand(i, to);
                replaced++;
            }
        }
        return replaced;
    }

    /* clear all operands */
    public void clearOperands() {
        for (Value operand : operands) {
            operand.removeUseFrom(this);
        }
        operands.clear();
    }
}
