package ir.value.instructions;

import java.util.List;
import java.util.Map;

import ir.type.Type;
import ir.value.*;
import util.IList.INode;

public abstract class Instruction extends User {
    private INode<Instruction, BasicBlock> instNode;

    public Instruction(Type type, String name) {
        super(type, name);
        this.instNode = new INode<>(this);
    }

    public abstract Opcode opCode();

    public INode<Instruction, BasicBlock> _getINode() {
        return instNode;
    }

    public Instruction getNext() {
        return instNode.getNext() != null ? instNode.getNext().getVal() : null;
    }

    public Instruction getPrev() {
        return instNode.getPrev() != null ? instNode.getPrev().getVal() : null;
    }

    public BasicBlock getParent() {
        return instNode.getParent() != null ? instNode.getParent().getVal() : null;
    }

    public List<Value> getOperands() {
        return super.getOperands();
    }

    public boolean isTerminator() {
        return opCode().isTerminator();
    }

    public boolean isBinary() {
        return opCode().isBinary();
    }

    /* 是否访问内存：load、store 以及非 readnone 的调用 */
    public boolean mayTouchMemory() {
        return switch (opCode()) {
            case LOAD, STORE -> true;
            case CALL -> !((CallInst) this).getCalledFunction().hasAttribute(FunctionAttribute.READNONE);
            default -> false;
        };
    }

    public void setParent(BasicBlock parent) {
        if (parent == null) {
            this.instNode.removeSelf();
        } else {
            this.instNode.setParent(parent.getInstructions());
        }
    }

    /* 块内第一条指令 */
    public boolean isBlockInitial() {
        return instNode.getPrev() == null;
    }

    /**
     * 文本形式，不带缩进。有返回值的指令以 "%name = " 开头。
     */
    public abstract String toIR();

    /**
     * Create a clone of this instruction with new operands mapped through valueMap
     * 
     * @param valueMap mapping from old values to new values
     * @param blockMap mapping from old blocks to new blocks
     * @return cloned instruction
     */
    public abstract Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap);

    protected static Value mapValue(Map<Value, Value> valueMap, Value value) {
        return valueMap.getOrDefault(value, value);
    }

    protected static BasicBlock mapBlock(Map<BasicBlock, BasicBlock> blockMap, BasicBlock block) {
        return blockMap.getOrDefault(block, block);
    }

    /* 形如 "i32 %x" 的带类型操作数 */
    protected static String typed(Value value) {
        return value.getType().toIR() + " " + value.getReference();
    }
}
