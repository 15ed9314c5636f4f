package vplan.builder;

import exception.InvariantViolationException;
import ir.value.BasicBlock;
import pass.IRPass.analysis.Loop;
import util.LoggingManager;
import util.logging.Logger;
import vplan.VPBasicBlock;
import vplan.VPBlockBase;
import vplan.VPRegionBlock;
import vplan.VPlan;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One VPBasicBlock per IR block, and one region per loop nested inside the
 * outermost loop. A region is created when its header is first seen, or
 * earlier when a loop nested inside it needs it as a parent.
 */
public class VPBlockRegistry {
    private static final Logger log = LoggingManager.getLogger(VPBlockRegistry.class);

    static final String TOP_HEADER_NAME = "vector.body";

    private final VPlan plan;
    private final LoopNestRoles roles;
    private final Map<BasicBlock, VPBasicBlock> bb2VPBB;
    private final Map<VPBasicBlock, BasicBlock> vpbb2BB;
    private final Map<Loop, VPRegionBlock> loop2Region;

    public VPBlockRegistry(VPlan plan, LoopNestRoles roles) {
        this.plan = plan;
        this.roles = roles;
        this.bb2VPBB = new LinkedHashMap<>();
        this.vpbb2BB = new HashMap<>();
        this.loop2Region = new HashMap<>();
    }

    public VPBasicBlock getOrCreate(BasicBlock bb) {
        VPBasicBlock existing = bb2VPBB.get(bb);
        if (existing != null) {
            return existing;
        }

        String name = roles.isTheLoopHeader(bb) ? TOP_HEADER_NAME : bb.getName();
        log.debug("Creating VPBasicBlock for {}", name);
        VPBasicBlock vpbb = plan.createVPBasicBlock(name);
        bb2VPBB.put(bb, vpbb);
        vpbb2BB.put(vpbb, bb);

        Loop loopOfBB = roles.loopFor(bb);
        if (!roles.isNestedLoop(loopOfBB)) {
            return vpbb;
        }

        VPRegionBlock regionOfVPBB = loop2Region.get(loopOfBB);
        if (!LoopNestRoles.isHeader(bb, loopOfBB)) {
            if (regionOfVPBB == null) {
                throw InvariantViolationException.traversalOrder(
                        "region of loop " + loopOfBB.getHeader().getName() + " requested before its header",
                        bb, null);
            }
            vpbb.setParent(regionOfVPBB);
            return vpbb;
        }

        if (regionOfVPBB != null) {
            throw InvariantViolationException.traversalOrder("region created twice for the same loop", bb, null);
        }
        regionOfVPBB = plan.createVPRegionBlock(name);
        regionOfVPBB.setParent(parentRegionOf(loopOfBB));
        regionOfVPBB.setEntry(vpbb);
        loop2Region.put(loopOfBB, regionOfVPBB);
        log.debug("Creating VPRegionBlock {} (depth {})", name, loopOfBB.getLoopDepth());
        return vpbb;
    }

    // region of the enclosing loop, null when that loop is the outermost one;
    // created through its header when this header is reached first
    private VPRegionBlock parentRegionOf(Loop loop) {
        Loop parentLoop = loop.getParentLoop();
        if (!roles.isNestedLoop(parentLoop)) {
            return null;
        }
        if (!loop2Region.containsKey(parentLoop)) {
            getOrCreate(parentLoop.getHeader());
        }
        return loop2Region.get(parentLoop);
    }

    public VPBasicBlock lookup(BasicBlock bb) {
        return bb2VPBB.get(bb);
    }

    public BasicBlock getIRBasicBlock(VPBasicBlock vpbb) {
        return vpbb2BB.get(vpbb);
    }

    public VPRegionBlock getRegion(Loop loop) {
        return loop2Region.get(loop);
    }

    public static boolean isRegionEntry(VPBasicBlock vpbb) {
        return vpbb.getParent() != null && vpbb.getParent().getEntry() == vpbb;
    }

    /** node to IR block, in node creation order */
    public Map<VPBlockBase, BasicBlock> buildVPB2IRBB() {
        Map<VPBlockBase, BasicBlock> result = new LinkedHashMap<>();
        for (Map.Entry<BasicBlock, VPBasicBlock> e : bb2VPBB.entrySet()) {
            result.put(e.getValue(), e.getKey());
        }
        return result;
    }
}
