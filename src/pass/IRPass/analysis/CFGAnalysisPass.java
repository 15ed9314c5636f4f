package pass.IRPass.analysis;

import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.instructions.BranchInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SwitchInst;
import pass.IRPassType;
import pass.Pass;

/**
 * Rebuilds predecessor and successor sets from the terminators. Edges are
 * added in layout order, and within a block in terminator operand order.
 */
public class CFGAnalysisPass implements Pass.IRPass {

    @Override
    public IRPassType getType() {
        return IRPassType.CFGAnalysis;
    }

    @Override
    public void run(IRModule module) {
        for (Function function : module.getFunctions()) {
            if (function != null && !function.isDeclaration()) {
                runOnFunction(function);
            }
        }
    }

    public void runOnFunction(Function function) {
        // Clear existing CFG info to ensure correctness
        for (BasicBlock block : function.getBlocks()) {
            block.clearEdges();
        }

        for (BasicBlock block : function.getBlocks()) {
            Instruction terminator = block.getTerminator();
            if (terminator == null) {
                // Block is not properly terminated, has no successors
                continue;
            }

            if (terminator instanceof BranchInst branch) {
                for (BasicBlock succ : branch.getSuccessors()) {
                    block.setSuccessor(succ);
                }
            } else if (terminator instanceof SwitchInst sw) {
                for (BasicBlock succ : sw.getSuccessors()) {
                    block.setSuccessor(succ);
                }
            }
            // ReturnInst has no successors, so we do nothing.
        }
    }
}
