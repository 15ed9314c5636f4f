package vplan.builder;

import exception.InvariantViolationException;
import ir.value.BasicBlock;
import ir.value.Value;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.Loop;
import pass.IRPass.analysis.LoopInfo;

import java.util.Set;

/**
 * Roles the blocks around the outermost loop play during one build, computed
 * once up front.
 *
 * @param theLoop    the outermost loop being translated
 * @param loopInfo   loop forest of the enclosing function
 * @param preheader  the single block entering theLoop
 * @param latch      the single block branching back to theLoop's header
 * @param exitBlocks blocks outside theLoop reached from inside it
 */
public record LoopNestRoles(Loop theLoop, LoopInfo loopInfo, BasicBlock preheader, BasicBlock latch,
                            Set<BasicBlock> exitBlocks) {

    public static LoopNestRoles of(Loop theLoop, LoopInfo loopInfo) {
        BasicBlock preheader = theLoop.getLoopPreheader();
        if (preheader == null) {
            throw InvariantViolationException.shape("loop has no preheader", theLoop.getHeader(), null);
        }
        if (preheader.getSuccessors().size() != 1) {
            throw InvariantViolationException.shape("preheader must have a single successor", preheader,
                    preheader.getTerminator());
        }
        BasicBlock latch = theLoop.getLoopLatch();
        if (latch == null) {
            throw InvariantViolationException.shape("loop must have a single latch", theLoop.getHeader(), null);
        }
        return new LoopNestRoles(theLoop, loopInfo, preheader, latch, Set.copyOf(theLoop.getExitBlocks()));
    }

    public Loop loopFor(BasicBlock bb) {
        return loopInfo.getLoopFor(bb);
    }

    public boolean isTheLoopHeader(BasicBlock bb) {
        return bb == theLoop.getHeader();
    }

    public boolean isTheLoopLatch(BasicBlock bb) {
        return bb == latch;
    }

    public boolean inTheLoop(BasicBlock bb) {
        return theLoop.contains(bb);
    }

    /** true for a loop strictly inside theLoop; such loops become regions */
    public boolean isNestedLoop(Loop loop) {
        return loop != null && loop != theLoop && theLoop.contains(loop);
    }

    public static boolean isHeader(BasicBlock bb, Loop loop) {
        return loop != null && loop.getHeader() == bb;
    }

    /**
     * A value is defined outside the plan when it is not an instruction, or its
     * block is the preheader, an exit block, or anywhere outside theLoop.
     */
    public boolean isExternalDef(Value value) {
        if (!(value instanceof Instruction inst)) {
            return true;
        }
        BasicBlock parent = inst.getParent();
        if (parent == preheader || exitBlocks.contains(parent)) {
            return true;
        }
        return !theLoop.contains(parent);
    }
}
