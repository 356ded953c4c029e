package pass.IRPass.delegate;

import ir.value.BasicBlock;
import ir.value.Value;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.CFGAnalysisPass;
import util.UniqueQueue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 一个待外提的区域：从 entry 出发向前生长，所有访存都落在 target 所在的节点上。
 *
 * exits 把边界指令（区域外的第一条指令）映射到 frontier 指令（区域内最后执行的指令），
 * 保持记录顺序，外提后出口编号就是这个顺序。
 */
public class CandidateRegion {
    private final int id;
    // 在 ExtractionContext 区域表里的下标
    private final int index;
    private final Instruction entry;
    private final Value target;
    private final Set<Value> validPtrs = new LinkedHashSet<>();
    private final Map<Instruction, Instruction> exits = new LinkedHashMap<>();

    CandidateRegion(int id, int index, Instruction entry, Value target) {
        this.id = id;
        this.index = index;
        this.entry = entry;
        this.target = target;
        this.validPtrs.add(target);
    }

    public int getId() {
        return id;
    }

    int getIndex() {
        return index;
    }

    /* 外提出的函数名 */
    public String getName() {
        return "d" + id;
    }

    public Instruction getEntry() {
        return entry;
    }

    public Value getTarget() {
        return target;
    }

    public Set<Value> getValidPtrs() {
        return Collections.unmodifiableSet(validPtrs);
    }

    public Map<Instruction, Instruction> getExits() {
        return Collections.unmodifiableMap(exits);
    }

    void putExit(Instruction boundary, Instruction frontier) {
        exits.put(boundary, frontier);
    }

    void removeExit(Instruction boundary) {
        exits.remove(boundary);
    }

    boolean isExit(Instruction inst) {
        return exits.containsKey(inst);
    }

    /* 边界指令被别的区域外提删掉时换成新的边界，出口顺序不变 */
    void replaceExitBoundary(Instruction oldBoundary, Instruction newBoundary) {
        if (!exits.containsKey(oldBoundary)) {
            return;
        }
        Map<Instruction, Instruction> copy = new LinkedHashMap<>(exits);
        exits.clear();
        copy.forEach((boundary, frontier) ->
            exits.put(boundary == oldBoundary ? newBoundary : boundary, frontier));
    }

    /**
     * 从 entry 出发按区域形状遍历：遇到出口边界就停，走到块尾就继续所有后继的第一条指令。
     */
    public void visit(Consumer<Instruction> yield) {
        UniqueQueue<Instruction> q = new UniqueQueue<>();
        q.push(entry);

        while (!q.isEmpty()) {
            Instruction cur = q.pop();
            BasicBlock bb = cur.getParent();
            boolean reachedEnd = true;
            for (; cur != null; cur = cur.getNext()) {
                if (exits.containsKey(cur)) {
                    reachedEnd = false;
                    break;
                }
                yield.accept(cur);
            }
            if (reachedEnd) {
                for (BasicBlock succ : CFGAnalysisPass.successorsOf(bb.getTerminatorInst())) {
                    q.push(succ.getFirstInstruction());
                }
            }
        }
    }

    /* 区域涉及到的块，按遍历顺序 */
    public List<BasicBlock> getBlocks() {
        Set<BasicBlock> blocks = new LinkedHashSet<>();
        visit(inst -> blocks.add(inst.getParent()));
        return new ArrayList<>(blocks);
    }

    /**
     * 形如
     * <pre>
     * Candidate 0:
     *   entry:
     *     %v = load i32, i32 addrspace(100)* %p, align 4
     *   valid_ptrs:
     *     %p
     *   exits:
     *     ret void
     *        => br label %exit
     *   blocks: entry, body
     * </pre>
     */
    public String toHeaderString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Candidate ").append(id).append(":\n");
        sb.append("  entry:\n    ").append(entry.toIR()).append("\n");
        sb.append("  valid_ptrs:\n");
        for (Value p : validPtrs) {
            sb.append("    ").append(p.getReference()).append("\n");
        }
        sb.append("  exits:\n");
        for (var e : exits.entrySet()) {
            sb.append("    ").append(e.getKey().toIR()).append("\n");
            sb.append("       => ").append(e.getValue().toIR()).append("\n");
        }
        sb.append("  blocks:");
        List<BasicBlock> blocks = getBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(blocks.get(i).getName());
        }
        sb.append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return getName() + " @ " + target.getReference();
    }
}
