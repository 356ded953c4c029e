package pass.IRPass.delegate;

import exception.CompileException;
import ir.value.Value;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.ProvenanceAnalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次 pass 运行期间的全部状态：区域表、指令归属、区域编号计数器和指针来源缓存。
 * 区域只通过下标互相引用，指令归属表记录的也是下标。
 */
public class ExtractionContext {
    private final List<CandidateRegion> regions = new ArrayList<>();
    private final Map<Instruction, Integer> owners = new HashMap<>();
    private final ProvenanceAnalysis provenance = new ProvenanceAnalysis();
    private final List<Instruction> stackAnchors = new ArrayList<>();
    private int nextId = 0;

    public CandidateRegion newRegion(Instruction entry, Value target) {
        CandidateRegion region = new CandidateRegion(nextId++, regions.size(), entry, target);
        regions.add(region);
        return region;
    }

    public List<CandidateRegion> getRegions() {
        return Collections.unmodifiableList(regions);
    }

    public ProvenanceAnalysis getProvenance() {
        return provenance;
    }

    /* 指令所属的区域，没有则返回 null */
    public CandidateRegion getOwner(Instruction inst) {
        Integer idx = owners.get(inst);
        return idx != null ? regions.get(idx) : null;
    }

    public boolean isOwned(Instruction inst) {
        return owners.containsKey(inst);
    }

    void claim(Instruction inst, CandidateRegion region) {
        Integer prev = owners.putIfAbsent(inst, region.getIndex());
        if (prev != null && prev != region.getIndex()) {
            throw CompileException.doubleOwner(inst.toIR() + " is owned by region " + prev
                + ", claimed again by " + region.getName());
        }
    }

    /* 外提时指令会被删除，归属随之释放 */
    void release(Instruction inst) {
        owners.remove(inst);
    }

    /**
     * 区域外提后原来的入口指令被删掉，把其他区域指向它的出口改到调用块的第一条指令上。
     */
    void retargetExits(Instruction oldBoundary, Instruction newBoundary) {
        for (CandidateRegion region : regions) {
            region.replaceExitBoundary(oldBoundary, newBoundary);
        }
    }

    /* 栈上的锚点目前只记录，不生长区域 */
    public void reserveStackAnchor(Instruction anchor) {
        stackAnchors.add(anchor);
    }

    public List<Instruction> getStackAnchors() {
        return Collections.unmodifiableList(stackAnchors);
    }
}
