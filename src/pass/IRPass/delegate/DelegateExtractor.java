package pass.IRPass.delegate;

import exception.CompileException;
import ir.Builder;
import ir.IRModule;
import ir.RemotePrimitive;
import ir.TargetDataLayout;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.value.Argument;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.UndefValue;
import ir.value.Use;
import ir.value.Value;
import ir.value.constants.ConstantInt;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;
import ir.value.instructions.SwitchInst;
import pass.IRPass.analysis.CFGAnalysisPass;
import pass.IRPass.analysis.DominanceAnalysisPass;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把一个已经生长完的区域外提成函数 {@code d<ID>}，原位置换成一次远程调用加出口分发。
 *
 * <p>外提后的调用方形如
 * <pre>
 * d0.call:
 *   ; 输入写进 d0.in
 *   %d0.loc = call i16 @resolve_location(i8 addrspace(100)* %target)
 *   %d0.code = call i16 @invoke_remote(i16 %d0.loc, i16 (i8*, i8*)* @d0, i8* %in, i64 N, i8* %out, i64 M)
 *   ; 输出从 d0.out 读回
 *   switch i16 %d0.code, label %exit0 [ i16 0, label %exit0  i16 1, label %exit1 ]
 * </pre>
 * delegate 的每个出口对应一个 stub 块，stub 把能到达该出口的输出写回 out 缓冲区，
 * 再把出口编号交给公共的返回块。
 *
 * <p>一个 extractor 只用一次。
 */
public class DelegateExtractor {
    private static final Logger log = LoggingManager.getLogger(DelegateExtractor.class);

    private final ExtractionContext ctx;
    private final CandidateRegion region;
    private final IRModule module;
    private final Builder builder;
    private final Function caller;
    private final String name;

    private BasicBlock entryBlock;
    private BasicBlock callBlock;
    private final List<RegionExit> exits = new ArrayList<>();
    private List<BasicBlock> blocks;
    private Set<BasicBlock> inside;
    private final List<Value> inputs = new ArrayList<>();
    private final List<Instruction> outputs = new ArrayList<>();
    private StructType inType;
    private StructType outType;

    /* 出口编号 code 对应的边界块和原来跳向它的 frontier 块 */
    private record RegionExit(int code, BasicBlock block, BasicBlock frontierBlock) {
    }

    public DelegateExtractor(ExtractionContext ctx, CandidateRegion region) {
        this.ctx = ctx;
        this.region = region;
        this.module = IRModule.getModule();
        this.builder = new Builder(module);
        this.caller = region.getEntry().getParent().getParent();
        this.name = region.getName();
    }

    public Function extract() {
        log.debug("extracting {} from {}", region, caller.getName());
        Function delegate = outline();
        checkIntegrity(delegate);

        for (BasicBlock bb : blocks) {
            for (var node : bb.getInstructions()) {
                ctx.release(node.getVal());
            }
            caller.removeBlock(bb);
        }
        // 其他区域若以本区域入口为出口边界，改为指向调用块
        ctx.retargetExits(region.getEntry(), callBlock.getFirstInstruction());

        CFGAnalysisPass cfg = new CFGAnalysisPass();
        cfg.runOnFunction(caller);
        cfg.runOnFunction(delegate);

        log.info("{}: extracted {} ({} inputs, {} outputs, {} exits)",
                caller.getName(), delegate.getName(), inputs.size(), outputs.size(), exits.size());
        log.debug("delegate {}:\n{}", delegate.getName(), delegate.toIR());
        return delegate;
    }

    /* 步骤 1 到 8：生成 delegate 并改写调用方，原区域的块还没有删除 */
    Function outline() {
        materializeBoundaries();
        blocks = region.getBlocks();
        inside = new HashSet<>(blocks);
        computeLiveness();
        buildLayout();

        Function delegate = module.addFunction(module.getUniqueGlobalName(name),
                RemotePrimitive.delegateType(), List.of("in", "out"));
        Map<Value, Value> valueMap = new HashMap<>();
        Map<BasicBlock, BasicBlock> blockMap = new HashMap<>();
        Value outBuffer = cloneRegion(delegate, valueMap, blockMap);
        List<BasicBlock> stubs = collapseExits(delegate, blockMap);
        captureOutputs(delegate, stubs, valueMap, outBuffer);

        callBlock = rewriteCaller(delegate);
        return delegate;
    }

    /* 1. 在入口和每个出口边界处切块，使区域恰好由整块组成 */
    private void materializeBoundaries() {
        Instruction entry = region.getEntry();
        if (region.isExit(entry)) {
            throw CompileException.unSupported(name + " in " + caller.getName()
                    + ": back edge into region entry '" + entry.toIR() + "'");
        }
        if (region.getExits().isEmpty()) {
            throw CompileException.unSupported(name + " in " + caller.getName() + " has no exit");
        }
        entryBlock = entry.isBlockInitial()
                ? entry.getParent()
                : entry.getParent().splitBefore(entry, name + ".eblk");

        int code = 0;
        for (var e : region.getExits().entrySet()) {
            Instruction boundary = e.getKey();
            Instruction frontier = e.getValue();
            BasicBlock exitBlock;
            if (boundary.isBlockInitial()) {
                exitBlock = boundary.getParent();
            } else {
                exitBlock = boundary.getParent().splitBefore(boundary, name + ".exit");
                // 切块补上的 br 属于区域
                ctx.claim(frontier.getParent().getTerminatorInst(), region);
            }
            BasicBlock frontierBlock = frontier.getParent();
            if (!CFGAnalysisPass.successorsOf(frontierBlock.getTerminatorInst()).contains(exitBlock)) {
                throw CompileException.unSupported(name + ": frontier '" + frontier.toIR()
                        + "' does not reach exit block " + exitBlock.getName());
            }
            exits.add(new RegionExit(code++, exitBlock, frontierBlock));
        }
    }

    /* 3. 输入：区域外定义、区域内使用；输出：区域内定义、区域外使用 */
    private void computeLiveness() {
        Set<Value> seenInputs = new LinkedHashSet<>();
        Set<Instruction> seenOutputs = new LinkedHashSet<>();
        for (BasicBlock bb : blocks) {
            for (var node : bb.getInstructions()) {
                Instruction inst = node.getVal();
                for (Value op : inst.getOperands()) {
                    if (op instanceof Argument
                            || op instanceof Instruction def && !inside.contains(def.getParent())) {
                        seenInputs.add(op);
                    }
                }
                for (Use use : inst.getUses()) {
                    if (use.getUser() instanceof Instruction user && !inside.contains(user.getParent())) {
                        seenOutputs.add(inst);
                        break;
                    }
                }
            }
        }
        inputs.addAll(seenInputs);
        outputs.addAll(seenOutputs);

        if (region.getTarget() instanceof Instruction target && inside.contains(target.getParent())) {
            throw CompileException.unSupported(name + ": target '" + target.toIR()
                    + "' is defined inside the region");
        }
        log.debug("{}: inputs {}, outputs {}", name, references(inputs), references(outputs));
    }

    /* 4. 输入输出缓冲区的结构体布局，字段顺序与集合顺序一致 */
    private void buildLayout() {
        List<Type> inFields = new ArrayList<>();
        for (Value v : inputs) {
            inFields.add(v.getType());
        }
        List<Type> outFields = new ArrayList<>();
        for (Value v : outputs) {
            outFields.add(v.getType());
        }
        inType = StructType.get(inFields);
        outType = StructType.get(outFields);
    }

    /**
     * 5. 建 delegate 的入口块并克隆区域里的块。
     *
     * @return 入口块里转换好类型的输出缓冲区指针
     */
    private Value cloneRegion(Function delegate, Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        BasicBlock dEntry = delegate.appendBasicBlock(name + ".entry");
        builder.positionAtEnd(dEntry);
        Value inBuffer = builder.buildBitCast(delegate.getParam(0), PointerType.get(inType), "inbuf");
        Value outBuffer = builder.buildBitCast(delegate.getParam(1), PointerType.get(outType), "outbuf");
        for (int i = 0; i < inputs.size(); i++) {
            Value input = inputs.get(i);
            Value field = builder.buildStructGEP(inBuffer, i, "in." + i);
            valueMap.put(input, builder.buildLoad(field, input.getName()));
        }

        for (BasicBlock bb : blocks) {
            BasicBlock cloned = delegate.appendBasicBlock(bb.getName());
            blockMap.put(bb, cloned);
            valueMap.put(bb, cloned);
        }
        // 先放占位符，处理区域内的前向引用（phi、回边）
        for (BasicBlock bb : blocks) {
            for (var node : bb.getInstructions()) {
                Instruction inst = node.getVal();
                if (!inst.getType().isVoid()) {
                    valueMap.put(inst, UndefValue.createUnique(inst.getType()));
                }
            }
        }
        for (BasicBlock bb : blocks) {
            BasicBlock cloned = blockMap.get(bb);
            for (var node : bb.getInstructions()) {
                Instruction inst = node.getVal();
                Instruction copy = inst.clone(valueMap, blockMap);
                cloned.addInstruction(copy);
                Value placeholder = valueMap.get(inst);
                if (placeholder != null) {
                    placeholder.replaceAllUsesWith(copy);
                }
                valueMap.put(inst, copy);
            }
        }

        builder.positionAtEnd(dEntry);
        builder.buildBr(blockMap.get(entryBlock));
        return outBuffer;
    }

    /* 6. 每个出口一个 stub，stub 把出口编号交给公共返回块 */
    private List<BasicBlock> collapseExits(Function delegate, Map<BasicBlock, BasicBlock> blockMap) {
        BasicBlock retBlock = delegate.appendBasicBlock(name + ".ret");
        builder.positionAtEnd(retBlock);
        Phi code = builder.buildPhi(IntegerType.getI16(), "code");
        builder.buildRet(code);

        List<BasicBlock> stubs = new ArrayList<>();
        for (RegionExit exit : exits) {
            BasicBlock stub = delegate.insertBlockBefore(retBlock, name + ".exit" + exit.code());
            builder.positionAtEnd(stub);
            builder.buildBr(retBlock);
            code.addIncoming(ConstantInt.get(IntegerType.getI16(), exit.code()), stub);
            stubs.add(stub);

            Instruction term = blockMap.get(exit.frontierBlock()).getTerminatorInst();
            term.replaceUsesOfWith(exit.block(), stub);
        }
        return stubs;
    }

    /* 7. 输出只在定义支配该出口时写回 */
    private void captureOutputs(Function delegate, List<BasicBlock> stubs,
                                Map<Value, Value> valueMap, Value outBuffer) {
        if (outputs.isEmpty()) {
            return;
        }
        new CFGAnalysisPass().runOnFunction(delegate);
        DominanceAnalysisPass dom = new DominanceAnalysisPass(delegate);
        dom.run();

        for (int k = 0; k < stubs.size(); k++) {
            BasicBlock stub = stubs.get(k);
            builder.positionBefore(stub.getTerminatorInst());
            for (int j = 0; j < outputs.size(); j++) {
                Instruction def = (Instruction) valueMap.get(outputs.get(j));
                if (!dom.dominates(def.getParent(), stub)) {
                    log.trace("{}: {} does not reach exit {}", name, def.getReference(), k);
                    continue;
                }
                Value field = builder.buildStructGEP(outBuffer, j, "out." + j);
                builder.buildStore(def, field);
            }
        }
    }

    /**
     * 8. 在区域入口前插入调用块，调用方里原来进入区域的边、出口块的 phi、
     * 以及对输出的使用全部改到调用块上。
     */
    private BasicBlock rewriteCaller(Function delegate) {
        TargetDataLayout layout = module.getTargetDataLayout();
        BasicBlock callBlock = caller.insertBlockBefore(entryBlock, name + ".call");
        builder.positionAtEnd(callBlock);
        Value inAlloca = builder.buildAlloca(inType, name + ".in");
        Value outAlloca = builder.buildAlloca(outType, name + ".out");

        builder.positionAtEnd(callBlock);
        for (int i = 0; i < inputs.size(); i++) {
            Value field = builder.buildStructGEP(inAlloca, i, name + ".in." + i);
            builder.buildStore(inputs.get(i), field);
        }

        PointerType remoteBytePtr = PointerType.get(IntegerType.getI8(), PointerType.GLOBAL_SPACE);
        PointerType bytePtr = PointerType.get(IntegerType.getI8());
        Value target = builder.buildPointerCast(region.getTarget(), remoteBytePtr, name + ".target");
        Value location = builder.buildCallToPrimitive(RemotePrimitive.RESOLVE_LOCATION,
                List.of(target), name + ".loc");
        Value inBytes = builder.buildBitCast(inAlloca, bytePtr, name + ".inbuf");
        Value outBytes = builder.buildBitCast(outAlloca, bytePtr, name + ".outbuf");
        Value code = builder.buildCallToPrimitive(RemotePrimitive.INVOKE_REMOTE,
                List.of(location, delegate,
                        inBytes, ConstantInt.get(IntegerType.getI64(), layout.getTypeSize(inType)),
                        outBytes, ConstantInt.get(IntegerType.getI64(), layout.getTypeSize(outType))),
                name + ".code");

        List<Value> outputLoads = new ArrayList<>();
        for (int j = 0; j < outputs.size(); j++) {
            Value field = builder.buildStructGEP(outAlloca, j, name + ".out." + j);
            outputLoads.add(builder.buildLoad(field, outputs.get(j).getName()));
        }

        SwitchInst sw = builder.buildSwitch(code, exits.get(0).block());
        for (RegionExit exit : exits) {
            builder.addCase(sw, exit.code(), exit.block());
            for (Phi phi : exit.block().getPhis()) {
                for (int i = 0; i < phi.getNumIncoming(); i++) {
                    if (phi.getIncomingBlock(i) == exit.frontierBlock()) {
                        phi.setIncomingBlock(i, callBlock);
                    }
                }
            }
        }

        for (Use use : new ArrayList<>(entryBlock.getUses())) {
            if (use.getUser() instanceof Instruction user && user.isTerminator()
                    && !inside.contains(user.getParent())) {
                user.setOperand(use.getOperandIndex(), callBlock);
            }
        }

        for (int j = 0; j < outputs.size(); j++) {
            Instruction output = outputs.get(j);
            for (Use use : new ArrayList<>(output.getUses())) {
                if (use.getUser() instanceof Instruction user && !inside.contains(user.getParent())) {
                    user.setOperand(use.getOperandIndex(), outputLoads.get(j));
                }
            }
        }
        return callBlock;
    }

    /* 9. delegate 与调用方之间除了全局量、常量和函数外不能再有引用 */
    void checkIntegrity(Function delegate) {
        for (var bbNode : delegate.getBlocks()) {
            for (var node : bbNode.getVal().getInstructions()) {
                Instruction inst = node.getVal();
                for (Value op : inst.getOperands()) {
                    if (op instanceof BasicBlock bb && bb.getParent() != delegate) {
                        throw CompileException.escapedBlock(delegate.getName() + ": '" + inst.toIR()
                                + "' branches to " + caller.getName() + "/" + bb.getName());
                    }
                    Function owner = ownerOf(op);
                    // 残留的克隆占位符也算逃逸
                    boolean placeholder = op instanceof UndefValue && op != UndefValue.get(op.getType());
                    if ((owner != null && owner != delegate) || placeholder) {
                        throw CompileException.escapedUse(delegate.getName() + ": '" + inst.toIR()
                                + "' uses " + op.getReference() + " from outside");
                    }
                }
            }
        }

        for (BasicBlock bb : blocks) {
            for (Use use : bb.getUses()) {
                if (use.getUser() instanceof Instruction user && !inside.contains(user.getParent())) {
                    throw CompileException.escapedBlock(name + ": " + caller.getName() + "/" + bb.getName()
                            + " is still referenced by '" + user.toIR() + "'");
                }
            }
            for (var node : bb.getInstructions()) {
                Instruction inst = node.getVal();
                for (Use use : inst.getUses()) {
                    if (use.getUser() instanceof Instruction user && !inside.contains(user.getParent())) {
                        throw CompileException.escapedUse(name + ": " + inst.getReference()
                                + " is still used by '" + user.toIR() + "'");
                    }
                }
            }
        }
    }

    private static Function ownerOf(Value v) {
        if (v instanceof Instruction inst) {
            BasicBlock bb = inst.getParent();
            return bb != null ? bb.getParent() : null;
        }
        if (v instanceof Argument arg) {
            return arg.getParent();
        }
        return null;
    }

    private static String references(List<? extends Value> values) {
        List<String> refs = new ArrayList<>();
        for (Value v : values) {
            refs.add(v.getReference());
        }
        return "[" + String.join(", ", refs) + "]";
    }
}
