package pass.IRPass.analysis;

import ir.type.PointerType;
import ir.value.Argument;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.UndefValue;
import ir.value.Value;
import ir.value.constants.Constant;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantInt;
import ir.value.instructions.AllocaInst;
import ir.value.instructions.CastInst;
import ir.value.instructions.GEPInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.StoreInst;
import pass.IRPass.delegate.ProvenanceKind;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 指针来源分析：沿 getelementptr 和类型转换向上找到访存地址的基址。
 *
 * <p>只看地址的结构推导，不做别名分析。下列情况停止向上：
 * <ul>
 *   <li>非 inbounds 的 GEP；</li>
 *   <li>基址在 addrspace(100) 且第一个下标不是常量 0 的 GEP，
 *       它可能跨到别的节点的内存；</li>
 *   <li>转换结果不是指针；</li>
 *   <li>其他任何值（形参、phi、call、load 结果、全局量、alloca、常量）。</li>
 * </ul>
 * 结果按指令缓存，同一条指令再次查询返回同一个对象。
 */
public class ProvenanceAnalysis {
    private static final Logger log = LoggingManager.getLogger(ProvenanceAnalysis.class);

    private final Map<Instruction, Value> provenance = new HashMap<>();

    /**
     * 访存指令的基址；不是 load/store 时返回 null。
     */
    public Value getProvenance(Instruction inst) {
        Value cached = provenance.get(inst);
        if (cached != null) {
            return cached;
        }
        Value pointer;
        if (inst instanceof LoadInst load) {
            pointer = load.getPointer();
        } else if (inst instanceof StoreInst store) {
            pointer = store.getPointer();
        } else {
            return null;
        }
        Value base = search(pointer);
        provenance.put(inst, base);
        log.trace("provenance {} => {}", inst.toIR(), base.getReference());
        return base;
    }

    public boolean hasProvenance(Instruction inst) {
        return getProvenance(inst) != null;
    }

    /**
     * 对函数里所有 load/store 求基址，返回其中能作为种子的访存，按指令顺序。
     */
    public List<Instruction> analyze(Function function) {
        List<Instruction> anchors = new ArrayList<>();
        for (var bbNode : function.getBlocks()) {
            for (var instNode : bbNode.getVal().getInstructions()) {
                Instruction inst = instNode.getVal();
                Value base = getProvenance(inst);
                if (base != null && classify(base).isAnchor()) {
                    anchors.add(inst);
                }
            }
        }
        log.debug("{}: {} memory accesses, {} anchors", function.getName(), provenance.size(), anchors.size());
        return anchors;
    }

    /* 分析期间缓存的指令数 */
    public int size() {
        return provenance.size();
    }

    /**
     * 地址 v 的基址。
     */
    public static Value search(Value v) {
        if (v instanceof GEPInst gep) {
            if (!isTransparentGEP(gep.isInBounds(), gep.getPointer(), gep.getIndices())) {
                return v;
            }
            return search(gep.getPointer());
        }
        if (v instanceof CastInst cast) {
            return throughCast(v, cast.getValue());
        }
        if (v instanceof ConstantExpr expr) {
            if (expr.isGEP()) {
                if (!isTransparentGEP(expr.isInBounds(), expr.getPointerOperand(), expr.getIndices())) {
                    return v;
                }
                return search(expr.getPointerOperand());
            }
            return throughCast(v, expr.getPointerOperand());
        }
        return v;
    }

    private static Value throughCast(Value cast, Value operand) {
        Value base = search(operand);
        return base.getType().isPointer() ? base : cast;
    }

    private static boolean isTransparentGEP(boolean inBounds, Value pointer, List<Value> indices) {
        if (!inBounds) {
            return false;
        }
        if (pointer.getType() instanceof PointerType ptrType && ptrType.isGlobal()) {
            // 没有下标等同于偏移 0
            return indices.isEmpty()
                || indices.get(0) instanceof ConstantInt first && first.isZero();
        }
        return true;
    }

    /**
     * 基址分类，依次判定：远程全局、对称、静态、常量、栈、未知。
     */
    public static ProvenanceKind classify(Value base) {
        if (base.getType() instanceof PointerType ptrType) {
            if (ptrType.isGlobal()) {
                return ProvenanceKind.GLOBAL_REMOTE;
            }
            if (ptrType.isSymmetric()) {
                return ProvenanceKind.SYMMETRIC;
            }
        }
        if (base instanceof GlobalVariable) {
            return ProvenanceKind.STATIC;
        }
        if (base instanceof Constant || base instanceof UndefValue
                || base instanceof BasicBlock || base instanceof Function) {
            return ProvenanceKind.CONSTANT;
        }
        if (base instanceof AllocaInst || base instanceof Argument) {
            return ProvenanceKind.STACK;
        }
        return ProvenanceKind.UNKNOWN;
    }
}
