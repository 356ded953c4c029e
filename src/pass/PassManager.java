package pass;

import driver.Config;
import exception.CompileException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import pass.Pass.IRPass;
import util.LoggingManager;
import util.logging.Logger;

public class PassManager {
    private final List<IRPass> irPipeline = new ArrayList<>();

    private final Set<String> enabledIR;

    private Logger log = LoggingManager.getLogger(PassManager.class);

    private static PassManager INSTANCE = null;

    public static PassManager getInstance() {
        if (INSTANCE == null) {
            INSTANCE = new PassManager();
        }
        return INSTANCE;
    }

    private PassManager() {
        // read the system property
        // eg: -Dir.passes=cfganalysis,delegateextraction
        enabledIR = loadEnabled("ir.passes");

        if (Config.getInstance().verifyAfterPasses) {
            setIRPipeline(
                    IRPassType.CFGAnalysis,
                    IRPassType.DelegateExtraction,
                    IRPassType.Verify);
        } else {
            setIRPipeline(
                    IRPassType.CFGAnalysis,
                    IRPassType.DelegateExtraction);
        }
    }

    /**
     * Reset the singleton instance (used for testing different configurations)
     */
    public static void resetInstance() {
        INSTANCE = null;
    }

    /** read “a,b,c” from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    // 查询工具，当需要获得其他pass作为上下文时通过这个方法得到
    @SuppressWarnings("unchecked")
    public <T extends Pass> T getPass(Class<T> cls) {
        for (Pass p : irPipeline) {
            if (cls.isInstance(p)) {
                return (T) p;
            }
        }

        throw new CompileException("can not get the pass: " + cls.getName());
    }

    public List<String> getPipelineNames() {
        return irPipeline.stream().map(p -> p.getType().getName()).toList();
    }

    public void runIRPasses() {
        for (IRPass p : irPipeline) {
            if (Config.getInstance().isDebug) {
                log.info("[IR] " + p.getType().getName());
            }
            p.run();
        }
    }

    /**
     * 按顺序整体设置 IR pipeline（会清空重建）
     *
     * @param types 只有被 -Dir.passes 选中（或未设置该属性）的 pass 才会加入
     */
    public void setIRPipeline(IRPassType... types) {
        irPipeline.clear();
        for (IRPassType type : types) {
            if (enabledIR.isEmpty() || enabledIR.contains(type.getName())) {
                irPipeline.add(type.create());
            }
        }
    }
}
