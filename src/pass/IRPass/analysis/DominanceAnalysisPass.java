package pass.IRPass.analysis;

import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;

import java.util.*;

/**
 * 迭代数据流求支配集。调用前 CFG 必须是最新的。
 */
public class DominanceAnalysisPass {
    private Function function;
    private final Map<BasicBlock, Set<BasicBlock>> dominators;
    private final Map<BasicBlock, BasicBlock> immediateDominators;

    public DominanceAnalysisPass(Function func) {
        this.function = func;
        this.dominators = new HashMap<>();
        this.immediateDominators = new HashMap<>();
    }

    // 允许重复使用同一实例分析不同函数
    public void runOnFunction(Function func) {
        this.function = func;
        this.dominators.clear();
        this.immediateDominators.clear();
        run();
    }

    public void run() {
        if (function == null)
            return;
        computeDominators();
        computeImmediateDominators();
    }

    private void computeDominators() {
        // 仅对从真实入口可达的基本块计算支配关系
        BasicBlock entry = function.getEntryBlock();
        if (entry == null)
            return;
        // 收集可达块，保持发现顺序让迭代结果稳定
        LinkedHashSet<BasicBlock> reachable = new LinkedHashSet<>();
        ArrayDeque<BasicBlock> dq = new ArrayDeque<>();
        reachable.add(entry);
        dq.add(entry);
        while (!dq.isEmpty()) {
            BasicBlock cur = dq.poll();
            for (BasicBlock succ : cur.getSuccessors()) {
                if (reachable.add(succ))
                    dq.add(succ);
            }
        }
        List<BasicBlock> blocks = new ArrayList<>(reachable);

        // 初始化
        for (BasicBlock bb : blocks) {
            if (bb == entry) {
                dominators.put(bb, Set.of(bb));
            } else {
                dominators.put(bb, new HashSet<>(blocks));
            }
        }

        // 迭代计算
        boolean changed = true;
        while (changed) {
            changed = false;
            for (BasicBlock bb : blocks) {
                if (bb == entry)
                    continue;
                Set<BasicBlock> newDom = new HashSet<>(blocks);
                // 忽略不可达的前驱
                for (BasicBlock pred : bb.getPredecessors()) {
                    Set<BasicBlock> predDom = dominators.get(pred);
                    if (predDom == null)
                        continue;
                    newDom.retainAll(predDom);
                }
                newDom.add(bb);
                if (!newDom.equals(dominators.get(bb))) {
                    dominators.put(bb, newDom);
                    changed = true;
                }
            }
        }
    }

    private void computeImmediateDominators() {
        BasicBlock entry = function.getEntryBlock();
        for (BasicBlock bb : dominators.keySet()) {
            if (bb == entry)
                continue;
            Set<BasicBlock> doms = new HashSet<>(dominators.get(bb));
            doms.remove(bb);
            // 严格支配者中唯一一个被其余所有严格支配者支配的块
            for (BasicBlock candidate : doms) {
                boolean isImmediate = true;
                for (BasicBlock other : doms) {
                    if (other != candidate && dominators.get(other).contains(candidate)) {
                        isImmediate = false;
                        break;
                    }
                }
                if (isImmediate) {
                    immediateDominators.put(bb, candidate);
                    break;
                }
            }
        }
    }

    public boolean isReachable(BasicBlock bb) {
        return dominators.containsKey(bb);
    }

    public boolean dominates(BasicBlock a, BasicBlock b) {
        return dominators.getOrDefault(b, Collections.emptySet()).contains(a);
    }

    /**
     * def 是否支配 user 处的使用。phi 的使用点在对应前驱块的末尾。
     */
    public boolean dominates(Instruction def, Instruction user, BasicBlock incomingBlock) {
        BasicBlock defBlock = def.getParent();
        BasicBlock useBlock = user instanceof Phi ? incomingBlock : user.getParent();
        if (defBlock != useBlock) {
            return dominates(defBlock, useBlock);
        }
        if (user instanceof Phi) {
            // 前驱块末尾，块内任何定义都在它之前
            return true;
        }
        for (Instruction cur = def.getNext(); cur != null; cur = cur.getNext()) {
            if (cur == user) {
                return true;
            }
        }
        return false;
    }

    public BasicBlock getImmediateDominator(BasicBlock bb) {
        return immediateDominators.get(bb);
    }

    public Set<BasicBlock> getDominators(BasicBlock bb) {
        return dominators.getOrDefault(bb, new HashSet<>());
    }
}
