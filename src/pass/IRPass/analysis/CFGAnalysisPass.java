package pass.IRPass.analysis;

import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.instructions.BranchInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SwitchInst;
import pass.IRPassType;
import pass.Pass;
import util.IList.INode;

import java.util.List;

public class CFGAnalysisPass implements Pass.IRPass {

    @Override
    public IRPassType getType() {
        return IRPassType.CFGAnalysis;
    }

    @Override
    public void run() {
        IRModule module = IRModule.getModule();
        for (Function function : module.getFunctions()) {
            if (function != null && !function.isDeclaration()) {
                runOnFunction(function);
            }
        }
    }

    /**
     * 按 terminator 重建前驱后继。后继集合保持 terminator 中目标出现的顺序，
     * switch 的 default 排在所有 case 之前。
     */
    public void runOnFunction(Function function) {
        // Clear existing CFG info to ensure correctness
        for (INode<BasicBlock, Function> bbNode : function.getBlocks()) {
            BasicBlock block = bbNode.getVal();
            block.getPredecessors().clear();
            block.getSuccessors().clear();
        }

        // Rebuild the CFG by analyzing terminator instructions
        for (INode<BasicBlock, Function> bbNode : function.getBlocks()) {
            BasicBlock block = bbNode.getVal();
            for (BasicBlock succ : successorsOf(block.getTerminatorInst())) {
                block.setSuccessor(succ);
            }
        }
    }

    /* ret 或缺少 terminator 时没有后继 */
    public static List<BasicBlock> successorsOf(Instruction terminator) {
        if (terminator instanceof BranchInst branch) {
            return branch.getSuccessors();
        }
        if (terminator instanceof SwitchInst sw) {
            return sw.getSuccessors();
        }
        return List.of();
    }
}
