package vplan.builder;

import ir.value.BasicBlock;
import pass.IRPass.analysis.Loop;
import pass.IRPass.analysis.LoopInfo;
import util.LoggingManager;
import util.logging.Logger;
import vplan.VPBlockBase;
import vplan.VPlan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the hierarchical CFG of a loop nest into a VPlan. Inner loops become
 * {@link vplan.VPRegionBlock}s; the outermost loop stays a plain cycle between
 * its latch and the {@code vector.body} node.
 *
 * <pre>
 *   VPlan plan = new VPlan("loop");
 *   VPlanHCFGBuilder builder = new VPlanHCFGBuilder(loop, loopInfo, plan);
 *   builder.buildHierarchicalCFG();
 * </pre>
 */
public class VPlanHCFGBuilder {
    private static final Logger log = LoggingManager.getLogger(VPlanHCFGBuilder.class);

    private final Loop theLoop;
    private final LoopInfo loopInfo;
    private final VPlan plan;
    private final Map<VPBlockBase, BasicBlock> vpb2IRBB;
    private boolean built;

    public VPlanHCFGBuilder(Loop theLoop, LoopInfo loopInfo, VPlan plan) {
        this.theLoop = theLoop;
        this.loopInfo = loopInfo;
        this.plan = plan;
        this.vpb2IRBB = new LinkedHashMap<>();
    }

    public void buildHierarchicalCFG() {
        if (built) {
            throw new IllegalStateException("hierarchical CFG of " + plan.getName() + " already built");
        }
        built = true;
        vpb2IRBB.putAll(new PlainCFGBuilder(theLoop, loopInfo, plan).buildPlainCFG());
        if (log.isDebugEnabled()) {
            log.debug("HCFGBuilder: Plain CFG\n{}", plan.print());
        }
    }

    public VPlan getPlan() {
        return plan;
    }

    /** every VPBasicBlock mapped to the IR block it was built from */
    public Map<VPBlockBase, BasicBlock> getVPB2IRBB() {
        return Collections.unmodifiableMap(vpb2IRBB);
    }
}
