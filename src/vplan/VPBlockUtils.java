package vplan;

import java.util.ArrayList;
import java.util.List;

/**
 * Edge helpers, and the flattened view of the hierarchical CFG where regions
 * are replaced by their contents and loop back edges are explicit.
 */
public final class VPBlockUtils {
    private VPBlockUtils() {
    }

    /** appends to to the successors of from, and from to the predecessors of to */
    public static void connectBlocks(VPBlockBase from, VPBlockBase to) {
        from.appendSuccessor(to);
        to.appendPredecessor(from);
    }

    /**
     * Successors of a basic block with regions looked through. The exiting
     * block of a region continues to the region's entry (the back edge) and
     * then to whatever follows the region.
     */
    public static List<VPBasicBlock> getFlatSuccessors(VPBasicBlock block) {
        List<VPBasicBlock> result = new ArrayList<>();
        collectFlatSuccessors(block, result);
        return result;
    }

    /**
     * Predecessors of a basic block with regions looked through. The entry of
     * a region is reached from the region's predecessors, then from its
     * exiting block.
     */
    public static List<VPBasicBlock> getFlatPredecessors(VPBasicBlock block) {
        List<VPBasicBlock> result = new ArrayList<>();
        collectFlatPredecessors(block, result);
        return result;
    }

    private static void collectFlatSuccessors(VPBlockBase block, List<VPBasicBlock> result) {
        if (block.getNumSuccessors() > 0) {
            for (VPBlockBase succ : block.getSuccessors()) {
                addIfPresent(result, succ.getEntryBasicBlock());
            }
            return;
        }
        VPRegionBlock region = block.getParent();
        if (region != null && region.getExiting() == block) {
            addIfPresent(result, region.getEntryBasicBlock());
            collectFlatSuccessors(region, result);
        }
    }

    private static void collectFlatPredecessors(VPBlockBase block, List<VPBasicBlock> result) {
        if (block.getNumPredecessors() > 0) {
            for (VPBlockBase pred : block.getPredecessors()) {
                addIfPresent(result, pred.getExitingBasicBlock());
            }
            return;
        }
        VPRegionBlock region = block.getParent();
        if (region != null && region.getEntry() == block) {
            collectFlatPredecessors(region, result);
            addIfPresent(result, region.getExitingBasicBlock());
        }
    }

    private static void addIfPresent(List<VPBasicBlock> result, VPBasicBlock block) {
        if (block != null) {
            result.add(block);
        }
    }

    /** every VPBasicBlock nested in the region, at any depth */
    public static List<VPBasicBlock> getBasicBlocksIn(VPlan plan, VPRegionBlock region) {
        List<VPBasicBlock> result = new ArrayList<>();
        for (VPBlockBase block : plan.getBlocks()) {
            if (block instanceof VPBasicBlock vpbb && isNestedIn(vpbb, region)) {
                result.add(vpbb);
            }
        }
        return result;
    }

    public static boolean isNestedIn(VPBlockBase block, VPRegionBlock region) {
        for (VPRegionBlock r = block.getParent(); r != null; r = r.getParent()) {
            if (r == region) {
                return true;
            }
        }
        return false;
    }
}
