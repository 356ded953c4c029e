package ir;

import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.instructions.Instruction;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试里按名字查找块和指令。
 */
public final class IRTestUtils {
    private IRTestUtils() {
    }

    public static Function function(String name) {
        Function f = IRModule.getModule().getFunction(name);
        if (f == null) {
            throw new AssertionError("no function @" + name);
        }
        return f;
    }

    public static BasicBlock block(Function f, String name) {
        BasicBlock bb = f.getBlockByName(name);
        if (bb == null) {
            throw new AssertionError("no block %" + name + " in @" + f.getName());
        }
        return bb;
    }

    /* 有名字的指令 */
    public static Instruction inst(Function f, String name) {
        for (Instruction inst : instructions(f)) {
            if (name.equals(inst.getName())) {
                return inst;
            }
        }
        throw new AssertionError("no instruction %" + name + " in @" + f.getName());
    }

    /* 块里第 index 条指令 */
    public static Instruction inst(BasicBlock bb, int index) {
        int i = 0;
        for (var node : bb.getInstructions()) {
            if (i++ == index) {
                return node.getVal();
            }
        }
        throw new AssertionError("block %" + bb.getName() + " has only " + i + " instructions");
    }

    public static List<Instruction> instructions(Function f) {
        List<Instruction> result = new ArrayList<>();
        for (var bbNode : f.getBlocks()) {
            for (var node : bbNode.getVal().getInstructions()) {
                result.add(node.getVal());
            }
        }
        return result;
    }

    public static List<String> blockNames(Function f) {
        List<String> names = new ArrayList<>();
        for (var bbNode : f.getBlocks()) {
            names.add(bbNode.getVal().getName());
        }
        return names;
    }

    public static List<String> blockNames(List<BasicBlock> blocks) {
        List<String> names = new ArrayList<>();
        for (BasicBlock bb : blocks) {
            names.add(bb.getName());
        }
        return names;
    }
}
