package pass.IRPass;

import driver.Config;
import ir.IRModule;
import ir.RemotePrimitive;
import ir.value.Function;
import ir.value.FunctionAttribute;
import ir.value.Value;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.CFGAnalysisPass;
import pass.IRPass.analysis.ProvenanceAnalysis;
import pass.IRPass.delegate.CandidateRegion;
import pass.IRPass.delegate.DelegateExtractor;
import pass.IRPass.delegate.ExtractionContext;
import pass.IRPass.delegate.ProvenanceKind;
import pass.IRPass.delegate.RegionBuilder;
import pass.IRPassType;
import pass.Pass;
import util.LoggingManager;
import util.UniqueQueue;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * 从 async 函数出发，沿调用图找出只访问单个远程位置的最大区域，并把它们外提成 delegate。
 *
 * <p>每个函数只处理一次：先生长完所有区域，再逐个外提。
 */
public class DelegateExtractionPass implements Pass.IRPass {
    private static final Logger log = LoggingManager.getLogger(DelegateExtractionPass.class);

    private final IRModule module = IRModule.getModule();
    private final CFGAnalysisPass cfg = new CFGAnalysisPass();
    private ExtractionContext ctx;
    private boolean canExtract;

    @Override
    public IRPassType getType() {
        return IRPassType.DelegateExtraction;
    }

    /* 最近一次运行的上下文，供测试和 -dump-regions 查看 */
    public ExtractionContext getContext() {
        return ctx;
    }

    @Override
    public void run() {
        log.info("Running delegate extractor");
        Config config = Config.getInstance();
        ctx = new ExtractionContext();
        canExtract = preparePrimitives(config);

        UniqueQueue<Function> worklist = new UniqueQueue<>();
        for (Function function : module.getFunctions()) {
            if (!function.isDeclaration() && function.hasAttribute(FunctionAttribute.ASYNC)) {
                worklist.push(function);
            }
        }
        log.info("task functions: {}", worklist.size());

        while (!worklist.isEmpty()) {
            Function function = worklist.pop();
            runOnFunction(function, worklist);
        }
    }

    private boolean preparePrimitives(Config config) {
        boolean missing = false;
        for (RemotePrimitive primitive : RemotePrimitive.values()) {
            if (module.hasPrimitive(primitive)) {
                continue;
            }
            if (config.declarePrimitives) {
                module.getOrDeclarePrimitive(primitive);
            } else {
                log.warn("runtime primitive @{} is not declared", primitive.getName());
                missing = true;
            }
        }
        if (missing) {
            log.warn("disabling extraction");
            return false;
        }
        if (!config.extractEnabled) {
            log.info("extraction turned off, regions are only reported");
            return false;
        }
        return true;
    }

    /**
     * 生长 function 的全部区域，把它调用的函数放进 worklist，再外提。
     * 被调函数必须在外提前收集，外提后区域里的调用已经搬进 delegate。
     */
    public void runOnFunction(Function function, UniqueQueue<Function> worklist) {
        cfg.runOnFunction(function);
        ProvenanceAnalysis provenance = ctx.getProvenance();
        List<Instruction> anchors = provenance.analyze(function);

        List<CandidateRegion> regions = new ArrayList<>();
        for (Instruction anchor : anchors) {
            if (ctx.isOwned(anchor)) {
                log.debug("anchor already in another delegate: {}", anchor.toIR());
                continue;
            }
            Value base = provenance.getProvenance(anchor);
            ProvenanceKind kind = ProvenanceAnalysis.classify(base);
            if (kind == ProvenanceKind.STACK) {
                ctx.reserveStackAnchor(anchor);
                continue;
            }
            CandidateRegion region = ctx.newRegion(anchor, base);
            RegionBuilder builder = new RegionBuilder(ctx, region);
            builder.expand();
            builder.checkVisit();
            regions.add(region);

            String header = region.toHeaderString();
            log.debug("{}: {}", function.getName(), header);
            if (Config.getInstance().dumpRegions) {
                System.out.print(header);
            }
        }
        log.info("{}: {} regions, {} anchors", function.getName(), regions.size(), anchors.size());

        for (Function callee : function.getCallees()) {
            if (!callee.isDeclaration()) {
                worklist.push(callee);
            }
        }

        if (!canExtract) {
            return;
        }
        for (CandidateRegion region : regions) {
            new DelegateExtractor(ctx, region).extract();
        }
    }
}
