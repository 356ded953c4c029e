package ir.value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ir.type.VoidType;
import ir.value.instructions.BranchInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;
import util.IList;
import util.IList.INode;

public class BasicBlock extends Value {
    private final IList<Instruction, BasicBlock> instructions;
    private final INode<BasicBlock, Function> blockNode;
    // 保持插入顺序：后继的顺序就是 terminator 里目标的顺序
    private final Set<BasicBlock> predecessors;
    private final Set<BasicBlock> successors;

    public BasicBlock(String name, Function parent) {
        this(name);
        blockNode.insertAtEnd(parent.getBlocks());
    }

    public BasicBlock(String name) {
        super(VoidType.getVoid(), name);
        this.instructions = new IList<>(this);
        this.predecessors = new LinkedHashSet<>();
        this.successors = new LinkedHashSet<>();
        this.blockNode = new INode<>(this);
    }

    /* getter setter */
    public IList<Instruction, BasicBlock> getInstructions() {
        return instructions;
    }

    public INode<BasicBlock, Function> _getINode() {
        return this.blockNode;
    }

    public BasicBlock getNext() {
        return blockNode.getNext() != null ? blockNode.getNext().getVal() : null;
    }

    public Set<BasicBlock> getPredecessors() {
        return predecessors;
    }

    public Set<BasicBlock> getSuccessors() {
        return successors;
    }

    public Instruction getFirstInstruction() {
        return instructions.getEntry() != null ? instructions.getEntry().getVal() : null;
    }

    public Instruction getLastInstruction() {
        return instructions.getLast() != null ? instructions.getLast().getVal() : null;
    }

    public Function getParent() {
        return blockNode.getParent() != null ? blockNode.getParent().getVal() : null;
    }

    public void addInstruction(Instruction inst) {
        if (inst == null) {
            return;
        }
        rename(inst);
        INode<Instruction, BasicBlock> node = inst._getINode();
        node.insertAtEnd(instructions);
        inst.setParent(this);
    }

    public void addInstructionBefore(Instruction inst, Instruction before) {
        if (inst == null) {
            return;
        }
        rename(inst);
        INode<Instruction, BasicBlock> node = inst._getINode();
        node.insertBefore(before._getINode());
        inst.setParent(this);
    }

    /* 在函数命名空间里给指令取一个不冲突的名字 */
    private void rename(Instruction inst) {
        Function parent = getParent();
        if (parent != null && inst.getName() != null && !inst.getName().isEmpty()) {
            inst.setName(parent.getUniqueName(inst.getName()));
        }
    }

    /**
     * 在 inst 之前把块一分为二：inst 及其之后的指令搬进新块 name，
     * 原块末尾补一条跳到新块的 br。新块紧跟在原块后面。
     * 原块的后继（以及它们 phi 里的前驱）改为新块。
     *
     * @return 以 inst 开头的新块
     */
    public BasicBlock splitBefore(Instruction inst, String name) {
        if (inst.getParent() != this) {
            throw new IllegalArgumentException(
                "split point " + inst.getReference() + " is not in block " + getName());
        }
        Function func = getParent();
        BasicBlock tail = func.insertBlockAfter(this, name);

        List<Instruction> toMove = new ArrayList<>();
        for (Instruction cur = inst; cur != null; cur = cur.getNext()) {
            toMove.add(cur);
        }
        for (Instruction i : toMove) {
            i._getINode().removeSelf();
            INode<Instruction, BasicBlock> node = i._getINode();
            node.insertAtEnd(tail.instructions);
            i.setParent(tail);
        }

        // 更新后继关系
        for (BasicBlock succ : new ArrayList<>(successors)) {
            succ.replacePredecessor(this, tail);
        }

        BranchInst br = new BranchInst(tail);
        addInstruction(br);
        setSuccessor(tail);
        return tail;
    }

    /* 判断整个block是否已经插入过terminator */
    /* 判断最后一条指令是不是terminator */
    public boolean lastInstIsTerminator() {
        Instruction last = getLastInstruction();
        return last != null && last.opCode().isTerminator();
    }

    /* Phi can only insert at the entry of the block */
    public void insertPhi(Phi phi) {
        rename(phi);
        phi._getINode().insertAtEntry(instructions);
        phi.setParent(this);
    }

    public void setSuccessor(BasicBlock succ) {
        if (succ == null || successors.contains(succ)) {
            return;
        }
        successors.add(succ);
        succ.predecessors.add(this);
    }

    public void replacePredecessor(BasicBlock oldPred, BasicBlock newPred) {
        if (oldPred == null || newPred == null) {
            return;
        }
        if (oldPred == newPred) {
            return;
        }
        predecessors.remove(oldPred);
        predecessors.add(newPred);
        oldPred.successors.remove(this);
        newPred.successors.add(this);

        // Also update any PHI nodes in this block.
        for (Phi phi : getPhis()) {
            for (int i = 0; i < phi.getNumIncoming(); i++) {
                if (phi.getIncomingBlock(i) == oldPred) {
                    phi.setIncomingBlock(i, newPred);
                }
            }
        }
    }

    public INode<Instruction, BasicBlock> getTerminator() {
        for (var node : instructions) {
            if (node.getVal().opCode().isTerminator()) {
                return node;
            }
        }
        return null;
    }

    public Instruction getTerminatorInst() {
        INode<Instruction, BasicBlock> node = getTerminator();
        return node != null ? node.getVal() : null;
    }

    public List<Phi> getPhis() {
        List<Phi> phis = new ArrayList<>();
        for (var instNode : instructions) {
            if (instNode.getVal() instanceof Phi phi) {
                phis.add(phi);
            } else {
                break;
            }
        }
        return phis;
    }

    public Instruction getFirstNonPhi() {
        for (var instNode : getInstructions()) {
            Instruction inst = instNode.getVal();
            if (!(inst instanceof Phi)) {
                return inst;
            }
        }
        return null;
    }

    @Override
    public String getReference() {
        return "%" + getName();
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append(getName()).append(":\n");
        for (var node : instructions) {
            sb.append("  ").append(node.getVal().toIR()).append("\n");
        }
        return sb.toString();
    }
}
