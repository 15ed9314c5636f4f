package vplan;

import exception.InvariantViolationException;
import util.LoggingManager;
import util.logging.Logger;
import vplan.analysis.ReachabilityAnalysis;
import vplan.analysis.VPDataFlowSolver;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a built plan:
 * - successor and predecessor lists agree edge for edge, an edge into a
 * region entry counting as an edge into the region
 * - region entries have no predecessors, exiting blocks have no successors
 * - parents are regions of this plan holding the block, without cycles
 * - recipes point back to their block
 * - each widen-phi has one operand per hierarchical predecessor
 * - every basic block is reachable from the plan entry
 */
public class VPlanVerifier {
    private static final Logger log = LoggingManager.getLogger(VPlanVerifier.class);

    public void verify(VPlan plan) {
        Set<VPBlockBase> owned = new HashSet<>(plan.getBlocks());
        if (plan.getEntry().getNumPredecessors() != 0) {
            fail(plan, plan.getEntry(), "plan entry has predecessors");
        }

        for (VPBlockBase block : plan.getBlocks()) {
            verifyEdges(plan, block);
            verifyParent(plan, block, owned);
            if (block instanceof VPRegionBlock region) {
                verifyRegion(plan, region);
            } else if (block instanceof VPBasicBlock vpbb) {
                verifyRecipes(plan, vpbb);
            }
        }
        verifyReachability(plan);
        log.debug("VPlan {} verified: {} blocks", plan.getName(), plan.getBlocks().size());
    }

    private void verifyEdges(VPlan plan, VPBlockBase block) {
        for (VPBlockBase succ : new LinkedHashSet<>(block.getSuccessors())) {
            int incoming = countIncoming(succ, block);
            if (incoming == 0) {
                fail(plan, block, "successor " + succ.getName() + " does not list it as predecessor");
            }
            int outgoing = Collections.frequency(block.getSuccessors(), succ);
            if (incoming != outgoing) {
                fail(plan, block, "edge to " + succ.getName() + " is recorded " + outgoing
                        + " times as successor but " + incoming + " times as predecessor");
            }
        }
        for (VPBlockBase pred : block.getPredecessors()) {
            if (countOutgoing(pred, block) == 0) {
                fail(plan, block, "predecessor " + pred.getName() + " does not list it as successor");
            }
        }
    }

    // an edge to a region entry is recorded on the region
    private static int countIncoming(VPBlockBase block, VPBlockBase pred) {
        int count = Collections.frequency(block.getPredecessors(), pred);
        VPRegionBlock region = block.getParent();
        if (count == 0 && region != null && region.getEntry() == block) {
            count = Collections.frequency(region.getPredecessors(), pred);
        }
        return count;
    }

    private static int countOutgoing(VPBlockBase block, VPBlockBase succ) {
        int count = Collections.frequency(block.getSuccessors(), succ);
        if (succ instanceof VPRegionBlock region) {
            count += Collections.frequency(block.getSuccessors(), region.getEntry());
        }
        return count;
    }

    private void verifyParent(VPlan plan, VPBlockBase block, Set<VPBlockBase> owned) {
        Set<VPRegionBlock> chain = new HashSet<>();
        for (VPRegionBlock r = block.getParent(); r != null; r = r.getParent()) {
            if (!owned.contains(r)) {
                fail(plan, block, "parent region " + r.getName() + " does not belong to the plan");
            }
            if (r == block || !chain.add(r)) {
                fail(plan, block, "region " + r.getName() + " appears twice in the parent chain");
            }
        }
    }

    private void verifyRegion(VPlan plan, VPRegionBlock region) {
        VPBlockBase entry = region.getEntry();
        VPBlockBase exiting = region.getExiting();
        if (entry == null) {
            fail(plan, region, "region has no entry");
        }
        if (exiting == null) {
            fail(plan, region, "region has no exiting block");
        }
        if (entry.getParent() != region || exiting.getParent() != region) {
            fail(plan, region, "region entry or exiting block is owned by another region");
        }
        if (entry.getNumPredecessors() != 0) {
            fail(plan, region, "region entry " + entry.getName() + " has predecessors");
        }
        if (exiting.getNumSuccessors() != 0) {
            fail(plan, region, "region exiting block " + exiting.getName() + " has successors");
        }
    }

    private void verifyRecipes(VPlan plan, VPBasicBlock vpbb) {
        List<VPBasicBlock> preds = VPBlockUtils.getFlatPredecessors(vpbb);
        for (VPRecipeBase recipe : vpbb.getRecipes()) {
            if (recipe.getParent() != vpbb) {
                fail(plan, vpbb, "recipe " + recipe.print() + " has a different parent");
            }
            if (recipe instanceof VPWidenPhiRecipe phi && phi.getNumOperands() != preds.size()) {
                fail(plan, vpbb, "phi " + phi.getReference() + " has " + phi.getNumOperands()
                        + " operands but the block has " + preds.size() + " predecessors");
            }
        }
    }

    private void verifyReachability(VPlan plan) {
        VPDataFlowSolver<ReachabilityAnalysis.State> solver = new VPDataFlowSolver<>(new ReachabilityAnalysis());
        solver.initializeAndRun(plan);
        for (VPBasicBlock vpbb : plan.getBasicBlocks()) {
            if (!solver.getStateAfter(vpbb).isReachable()) {
                fail(plan, vpbb, "block is unreachable from the plan entry");
            }
        }
    }

    private static void fail(VPlan plan, VPBlockBase block, String msg) {
        throw new InvariantViolationException(InvariantViolationException.Kind.SHAPE,
                "[VPlanVerifier] " + msg + " (block " + block.getName() + " in plan " + plan.getName() + ")");
    }
}
