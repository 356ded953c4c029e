package pass.IRPass.delegate;

import exception.CompileException;
import ir.value.BasicBlock;
import ir.value.FunctionAttribute;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.CallInst;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.CFGAnalysisPass;
import pass.IRPass.analysis.ProvenanceAnalysis;
import util.LoggingManager;
import util.UniqueQueue;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 从锚点出发贪心地生长区域。
 *
 * <p>每个工作项是某个块里的一条起始指令，沿块向前认领合法指令；走到块尾时块被“封闭”，
 * 再看每个后继：第一条指令合法且所有前驱都已封闭才并入区域，合法但还有前驱没封闭的
 * 记为待定出口放进重试集合，不合法的记为永久出口。工作表清空后反复检查重试集合，
 * 直到某一轮没有新块加入。
 *
 * <p>只做标记，不改 IR；改写全部在 {@link DelegateExtractor} 里做。
 */
public class RegionBuilder {
    private static final Logger log = LoggingManager.getLogger(RegionBuilder.class);

    private final ExtractionContext ctx;
    private final CandidateRegion region;
    private final ProvenanceAnalysis provenance;

    private final UniqueQueue<Instruction> worklist = new UniqueQueue<>();
    private final Set<BasicBlock> sealed = new HashSet<>();
    private final Set<BasicBlock> retry = new LinkedHashSet<>();
    // 还可能被撤销的出口边界
    private final Set<Instruction> tentative = new HashSet<>();
    // 待定出口上出现过不同的 frontier，生长结束时仍是出口就报错
    private final Set<Instruction> conflicts = new LinkedHashSet<>();

    public RegionBuilder(ExtractionContext ctx, CandidateRegion region) {
        this.ctx = ctx;
        this.region = region;
        this.provenance = ctx.getProvenance();
    }

    public CandidateRegion getRegion() {
        return region;
    }

    public void expand() {
        worklist.push(region.getEntry());

        boolean progress;
        do {
            while (!worklist.isEmpty()) {
                process(worklist.pop());
            }
            progress = false;
            for (BasicBlock bb : new ArrayList<>(retry)) {
                if (allPredsSealed(bb)) {
                    log.debug("{}: retry absorbs {}", region.getName(), bb.getName());
                    retry.remove(bb);
                    dropExit(bb.getFirstInstruction());
                    worklist.push(bb.getFirstInstruction());
                    progress = true;
                }
            }
        } while (progress);

        for (Instruction boundary : conflicts) {
            if (region.isExit(boundary)) {
                throw CompileException.ambiguousMerge(describe(boundary)
                    + " is reached from several frontiers of " + region.getName());
            }
        }
    }

    private void process(Instruction first) {
        BasicBlock bb = first.getParent();
        Instruction cur = first;
        Instruction prev = first.getPrev();
        while (cur != null && isValid(cur)) {
            ctx.claim(cur, region);
            prev = cur;
            cur = cur.getNext();
        }

        if (cur != null) {
            // 块中间停下：cur 留在区域外
            if (prev == null) {
                // 起始指令本身不合法，只会出现在被别的区域抢先认领的锚点上
                throw CompileException.unSupported("region " + region.getName()
                    + " cannot start at " + describe(cur));
            }
            recordExit(cur, prev, false);
            return;
        }

        sealed.add(bb);
        Instruction terminator = bb.getTerminatorInst();
        for (BasicBlock succ : CFGAnalysisPass.successorsOf(terminator)) {
            Instruction target = succ.getFirstInstruction();
            if (worklist.hasSeen(target)) {
                // 已经并入（包括自己跳回自己所在块的开头）
                continue;
            }
            if (!isValid(target)) {
                recordExit(target, terminator, false);
            } else if (allPredsSealed(succ)) {
                retry.remove(succ);
                dropExit(target);
                worklist.push(target);
            } else {
                log.debug("{}: deferring merge block {}", region.getName(), succ.getName());
                retry.add(succ);
                recordExit(target, terminator, true);
            }
        }
    }

    private boolean allPredsSealed(BasicBlock bb) {
        return sealed.containsAll(bb.getPredecessors());
    }

    private void recordExit(Instruction boundary, Instruction frontier, boolean isTentative) {
        Instruction existing = region.getExits().get(boundary);
        if (existing != null && existing != frontier) {
            if (!tentative.contains(boundary)) {
                throw CompileException.ambiguousMerge(describe(boundary) + " already exits "
                    + region.getName() + " from " + describe(existing) + ", now also from " + describe(frontier));
            }
            conflicts.add(boundary);
            if (!isTentative) {
                tentative.remove(boundary);
            }
            return;
        }
        if (existing == null) {
            region.putExit(boundary, frontier);
            if (isTentative) {
                tentative.add(boundary);
            }
        } else if (!isTentative) {
            tentative.remove(boundary);
        }
    }

    private void dropExit(Instruction boundary) {
        if (region.isExit(boundary)) {
            region.removeExit(boundary);
            tentative.remove(boundary);
        }
    }

    /**
     * 指令能否放进本区域。
     */
    public boolean isValid(Instruction inst) {
        CandidateRegion owner = ctx.getOwner(inst);
        if (owner != null) {
            return owner == region;
        }
        Opcode op = inst.opCode();
        if (op == Opcode.RET || op == Opcode.ALLOCA) {
            // 返回和栈分配留在调用者的栈帧里
            return false;
        }
        if (!inst.mayTouchMemory()) {
            return true;
        }
        Value base = provenance.getProvenance(inst);
        if (base != null) {
            return region.getValidPtrs().contains(base)
                || ProvenanceAnalysis.classify(base).isLocationAgnostic();
        }
        if (inst instanceof CallInst call
                && call.getCalledFunction().hasAttribute(FunctionAttribute.UNBOUND)) {
            return true;
        }
        log.warn("{}: no provenance for {}", region.getName(), inst.toIR());
        return false;
    }

    /**
     * 按区域形状重新走一遍，每条指令都必须已经归本区域所有。
     */
    public void checkVisit() {
        region.visit(inst -> {
            if (ctx.getOwner(inst) != region) {
                throw CompileException.badVisit(describe(inst) + " is reached inside "
                    + region.getName() + " but owned by "
                    + (ctx.getOwner(inst) != null ? ctx.getOwner(inst).getName() : "nobody"));
            }
        });
    }

    private static String describe(Instruction inst) {
        BasicBlock bb = inst.getParent();
        String where = bb != null && bb.getParent() != null
            ? bb.getParent().getName() + "/" + bb.getName() : "?";
        return "'" + inst.toIR() + "' (" + where + ")";
    }
}
