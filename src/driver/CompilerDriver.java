package driver;

import exception.CompileException;
import ir.IRModule;
import pass.PassManager;
import util.LoggingManager;
import util.llvm.IRLoader;
import util.llvm.IRParseException;
import util.logging.Logger;

import java.io.IOException;
import java.util.Arrays;

public class CompilerDriver {
    private static CompilerDriver compilerDriver = new CompilerDriver();
    private static final Logger logger = LoggingManager.getLogger(CompilerDriver.class);

    private String source = null;
    private String target = null;

    private CompilerDriver() {
    }

    public static CompilerDriver getInstance() {
        return compilerDriver;
    }

    /* 丢弃上一次解析的参数，测试里反复解析命令行时使用 */
    public static void resetInstance() {
        compilerDriver = new CompilerDriver();
    }

    /*
     * parse the args based on the input
     * usage: input.ll [-o out.ll] [-declare-primitives] [-dump-regions] [-verify]
     */
    public void parseArgs(String[] args) throws CompileException {
        if (args == null || args.length == 0) {
            throw CompileException.noArgs();
        }
        var cmds = Arrays.asList(args);
        var iter = cmds.iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> {
                    if (iter.hasNext()) {
                        target = iter.next();
                    } else {
                        throw CompileException.wrongArgs("Need arg after -o but got nothing");
                    }
                }
                case "-declare-primitives" -> Config.getInstance().declarePrimitives = true;
                case "-dump-regions" -> Config.getInstance().dumpRegions = true;
                case "-verify" -> Config.getInstance().verifyAfterPasses = true;
                default -> {
                    if (cmd.endsWith(".ll") && source == null) {
                        source = cmd;
                    } else {
                        throw CompileException.wrongArgs(cmd);
                    }
                }
            }
        }
        if (source == null) {
            throw CompileException.wrongArgs("no input .ll file");
        }
    }

    /*
     * real driver
     * load -> pass pipeline -> print
     */
    public void run() {
        IRModule module = loadIR(source);

        // -verify 需要在 PassManager 创建前设置好
        PassManager passManager = PassManager.getInstance();
        logger.debug("IR pipeline: {}", passManager.getPipelineNames());
        passManager.runIRPasses();

        if (target == null) {
            System.out.print(module.toIR());
            return;
        }
        try {
            module.printToFile(target);
        } catch (IOException e) {
            throw new CompileException("failed to write " + target, e);
        }
        logger.info("wrote {}", target);
    }

    private IRModule loadIR(String path) {
        try {
            return IRLoader.loadFromFile(path);
        } catch (IOException e) {
            throw new CompileException("failed to read " + path, e);
        } catch (IRParseException e) {
            throw new CompileException("failed to parse " + path + ": " + e.getMessage(), e);
        }
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }
}
