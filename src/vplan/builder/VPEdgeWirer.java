package vplan.builder;

import exception.InvariantViolationException;
import ir.value.BasicBlock;
import ir.value.instructions.BranchInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SwitchInst;
import pass.IRPass.analysis.Loop;
import vplan.VPBasicBlock;
import vplan.VPBlockBase;
import vplan.VPBlockUtils;
import vplan.VPRegionBlock;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Sets the predecessors and successors of the node of one IR block.
 * Edges entering an inner loop go to its region, edges leaving it start
 * from the region; the inner back edge itself is not materialized.
 */
public class VPEdgeWirer {
    private final LoopNestRoles roles;
    private final VPBlockRegistry registry;

    public VPEdgeWirer(LoopNestRoles roles, VPBlockRegistry registry) {
        this.roles = roles;
        this.registry = registry;
    }

    /**
     * Predecessors of a non-header block, in IR predecessor order. A block
     * whose single predecessor belongs to another loop is the exit of that
     * loop and is entered from the loop's region.
     */
    public void setPredecessors(VPBasicBlock vpbb, BasicBlock bb) {
        for (BasicBlock pred : bb.getPredecessors()) {
            rejectRepeatedTargets(pred);
        }
        BasicBlock latch = getLatchOfExit(bb);
        if (latch != null) {
            VPRegionBlock predRegion = registry.getOrCreate(latch).getParent();
            if (predRegion == null) {
                throw InvariantViolationException.shape(
                        "predecessor %" + latch.getName() + " is not the latch of a nested loop", bb, null);
            }
            if (predRegion.getSingleSuccessor() != vpbb) {
                throw InvariantViolationException.traversalOrder(
                        "region " + predRegion.getName() + " must already have this block as its single successor",
                        bb, null);
            }
            vpbb.setPredecessors(List.of(predRegion));
            return;
        }

        List<VPBlockBase> preds = new ArrayList<>();
        for (BasicBlock pred : bb.getPredecessors()) {
            preds.add(registry.getOrCreate(pred));
        }
        vpbb.setPredecessors(preds);
    }

    private BasicBlock getLatchOfExit(BasicBlock bb) {
        BasicBlock singlePred = bb.getSinglePredecessor();
        if (singlePred == null) {
            return null;
        }
        Loop predLoop = roles.loopFor(singlePred);
        if (predLoop == roles.loopFor(bb)) {
            return null;
        }
        // loop-simplify form: an exit has the latch as its only predecessor
        if (predLoop == null || singlePred != predLoop.getLoopLatch()) {
            throw InvariantViolationException.shape(
                    "loop exit is reached from %" + singlePred.getName() + ", which is not the loop latch", bb, null);
        }
        return singlePred;
    }

    /** The region of a nested loop header is entered from the loop predecessor. */
    public void setRegionPredecessors(VPRegionBlock region, BasicBlock header) {
        BasicBlock loopPred = roles.loopFor(header).getLoopPredecessor();
        if (loopPred == null) {
            throw InvariantViolationException.shape("loop header has no unique predecessor outside the loop",
                    header, null);
        }
        region.setPredecessors(List.of(registry.getOrCreate(loopPred)));
    }

    public void setSuccessors(VPBasicBlock vpbb, BasicBlock bb) {
        Instruction terminator = bb.getTerminator();
        Loop loopForBB = roles.loopFor(bb);
        rejectRepeatedTargets(bb);

        if (roles.isTheLoopLatch(bb)) {
            VPBlockUtils.connectBlocks(vpbb, registry.getOrCreate(loopForBB.getHeader()));
            return;
        }

        if (terminator instanceof SwitchInst sw) {
            List<VPBlockBase> succs = new ArrayList<>();
            for (BasicBlock succ : sw.getSuccessors()) {
                succs.add(registry.getOrCreate(succ));
            }
            vpbb.setSuccessors(succs);
            return;
        }

        if (!(terminator instanceof BranchInst br)) {
            throw InvariantViolationException.shape("block inside the loop nest must end with br or switch",
                    bb, terminator);
        }

        boolean innerLatch = loopForBB != null && loopForBB.isLoopLatch(bb);
        if (innerLatch && !br.isConditional()) {
            throw InvariantViolationException.shape("latch of a nested loop must end with a two-way branch",
                    bb, br);
        }

        if (!br.isConditional()) {
            VPBasicBlock successor = registry.getOrCreate(br.getThenBlock());
            vpbb.setOneSuccessor(VPBlockRegistry.isRegionEntry(successor) ? successor.getParent() : successor);
            return;
        }

        BasicBlock irSucc0 = br.getThenBlock();
        BasicBlock irSucc1 = br.getElseBlock();

        if (innerLatch) {
            // the region leaves through its exiting block towards the non-header target
            VPRegionBlock region = vpbb.getParent();
            BasicBlock exitTarget = irSucc0 == loopForBB.getHeader() ? irSucc1 : irSucc0;
            region.setOneSuccessor(registry.getOrCreate(exitTarget));
            region.setExiting(vpbb);
            return;
        }

        boolean inside0 = loopForBB == null || loopForBB.contains(irSucc0);
        boolean inside1 = loopForBB == null || loopForBB.contains(irSucc1);
        if (!inside0 && !inside1) {
            throw InvariantViolationException.shape("both branch targets leave the loop", bb, br);
        }
        // only the target inside the current loop is connected; the other one is never created
        if (!inside0) {
            vpbb.setOneSuccessor(registry.getOrCreate(irSucc1));
            return;
        }
        if (!inside1) {
            vpbb.setOneSuccessor(registry.getOrCreate(irSucc0));
            return;
        }
        vpbb.setTwoSuccessors(registry.getOrCreate(irSucc0), registry.getOrCreate(irSucc1));
    }

    // IR block edges are a set, a second edge to the same target would be lost
    private static void rejectRepeatedTargets(BasicBlock bb) {
        Instruction terminator = bb.getTerminator();
        List<BasicBlock> targets;
        if (terminator instanceof SwitchInst sw) {
            targets = sw.getSuccessors();
        } else if (terminator instanceof BranchInst br) {
            targets = br.getSuccessors();
        } else {
            return;
        }
        Set<BasicBlock> seen = new HashSet<>();
        for (BasicBlock target : targets) {
            if (!seen.add(target)) {
                throw InvariantViolationException.shape(
                        "terminator names %" + target.getName() + " more than once", bb, terminator);
            }
        }
    }
}
