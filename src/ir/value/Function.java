package ir.value;

import ir.IRModule;
import ir.type.FunctionType;
import ir.type.Type;
import ir.value.instructions.CallInst;
import ir.value.instructions.Instruction;
import util.IList;
import util.IList.INode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class Function extends Value {
    private final IRModule module;
    private final ArrayList<Argument> arguments;

    private final INode<Function, IRModule> funcNode;
    private final IList<BasicBlock, Function> blocks;

    private final Map<String, Integer> nameCounts;
    private final Set<FunctionAttribute> attributes = EnumSet.noneOf(FunctionAttribute.class);

    public Function(IRModule parent, FunctionType type, String name) {
        this(parent, type, name, null);
    }

    /**
     * @param argNames 形参名字，为 null 时使用 arg0, arg1 ...
     */
    public Function(IRModule parent, FunctionType type, String name, List<String> argNames) {
        super(type, name);
        this.arguments = new ArrayList<>();
        this.nameCounts = new HashMap<>();
        this.blocks = new IList<>(this);
        this.funcNode = new INode<>(this);
        this.module = parent;

        // 根据FunctionType创建参数，参数名也占用函数级命名空间
        List<Type> paramTypes = type.getParamTypes();
        for (int i = 0; i < paramTypes.size(); i++) {
            String argName = argNames != null ? argNames.get(i) : "arg" + i;
            Argument arg = new Argument(paramTypes.get(i), getUniqueName(argName), i, this);
            this.arguments.add(arg);
        }
    }

    // for the IR loader
    public BasicBlock getBlockByName(String name) {
        for (var node : this.getBlocks()) {
            BasicBlock block = node.getVal();
            if (block.getName().equals(name)) {
                return block;
            }
        }
        return null; // Not found
    }

    /* getter setter */
    public IRModule getParent() {
        return module;
    }

    public FunctionType getFunctionType() {
        return (FunctionType) super.getType();
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    public IList<BasicBlock, Function> getBlocks() {
        return blocks;
    }

    public INode<Function, IRModule> _getINode() {
        return funcNode;
    }

    public Argument getParam(int index) {
        return arguments.get(index);
    }

    public BasicBlock getEntryBlock() {
        return blocks.getEntry() != null ? blocks.getEntry().getVal() : null;
    }

    public BasicBlock appendBasicBlock(String name) {
        String uniqueName = this.getUniqueName(name);  // 使用函数级别的命名空间
        return new BasicBlock(uniqueName, this);
    }

    public BasicBlock insertBlockAfter(BasicBlock anchor, String name) {
        BasicBlock block = new BasicBlock(getUniqueName(name));
        block._getINode().insertAfter(anchor._getINode());
        return block;
    }

    public BasicBlock insertBlockBefore(BasicBlock anchor, String name) {
        BasicBlock block = new BasicBlock(getUniqueName(name));
        block._getINode().insertBefore(anchor._getINode());
        return block;
    }

    /**
     * 删除一个已经和外界断开的块：先断开块内所有指令的 use-def 边，再从块表中摘除。
     * 调用者保证没有别的指令还在使用块内的值。
     */
    public void removeBlock(BasicBlock block) {
        for (var node : block.getInstructions()) {
            node.getVal().clearOperands();
        }
        for (BasicBlock succ : new ArrayList<>(block.getSuccessors())) {
            succ.getPredecessors().remove(block);
        }
        for (BasicBlock pred : new ArrayList<>(block.getPredecessors())) {
            pred.getSuccessors().remove(block);
        }
        block.getSuccessors().clear();
        block.getPredecessors().clear();
        block._getINode().removeSelf();
    }

    /* 获得该函数中一个未被命名的变量名 */
    public String getUniqueName(String name) {
        Integer count = nameCounts.get(name);
        if (count == null) {
            nameCounts.put(name, 1);
            return name;
        }
        // 形如 a.1 的名字可能已经被源程序占用
        String candidate;
        do {
            candidate = name + "." + count;
            count++;
        } while (nameCounts.containsKey(candidate));
        nameCounts.put(name, count);
        nameCounts.put(candidate, 1);
        return candidate;
    }

    public boolean isDeclaration() {
        return false;
    }

    /* attributes */
    public Set<FunctionAttribute> getAttributes() {
        return attributes;
    }

    public boolean hasAttribute(FunctionAttribute attr) {
        return attributes.contains(attr);
    }

    public void addAttribute(FunctionAttribute attr) {
        attributes.add(attr);
    }

    /* 本函数直接调用的函数，按出现顺序 */
    public Set<Function> getCallees() {
        Set<Function> callees = new LinkedHashSet<>();
        for (var bbNode : blocks) {
            for (var instNode : bbNode.getVal().getInstructions()) {
                Instruction inst = instNode.getVal();
                if (inst instanceof CallInst call) {
                    callees.add(call.getCalledFunction());
                }
            }
        }
        return callees;
    }

    protected String attributesToIR() {
        if (attributes.isEmpty()) {
            return "";
        }
        return " " + attributes.stream()
            .map(FunctionAttribute::getKeyword)
            .collect(Collectors.joining(" "));
    }

    @Override
    public String getReference() {
        return "@" + getName();
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        FunctionType fnType = getFunctionType();

        String argsStr = arguments.stream()
                .map(Argument::toIR)
                .collect(Collectors.joining(", "));

        sb.append("define ").append(fnType.getReturnType().toIR())
                .append(" @").append(getName()).append("(")
                .append(argsStr).append(")")
                .append(attributesToIR()).append(" {\n");

        boolean first = true;
        for (var node : blocks) {
            if (!first) {
                sb.append("\n");
            }
            sb.append(node.getVal().toIR());
            first = false;
        }

        sb.append("}\n");
        return sb.toString();
    }
}
