package pass.IRPass;

import driver.Config;
import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Function;
import pass.IRPass.analysis.Loop;
import pass.IRPass.analysis.LoopInfo;
import pass.IRPass.analysis.LoopInfoFullAnalysis;
import pass.IRPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;
import vplan.VPBlockBase;
import vplan.VPlan;
import vplan.VPlanVerifier;
import vplan.builder.VPlanHCFGBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds a hierarchical CFG for every top-level loop in LoopSimplify form.
 * Expects the CFG edges to be up to date (run CFGAnalysis first).
 */
public class VPlanHCFGPass implements Pass.IRPass {
    private static final Logger log = LoggingManager.getLogger(VPlanHCFGPass.class);

    /** a built plan with the loop it was built from */
    public record LoopPlan(Function function, Loop loop, VPlan plan, Map<VPBlockBase, BasicBlock> vpb2IRBB) {}

    private final List<LoopPlan> plans = new ArrayList<>();

    @Override
    public IRPassType getType() {
        return IRPassType.VPlanHCFG;
    }

    @Override
    public void run(IRModule module) {
        plans.clear();
        LoopInfoFullAnalysis loopAnalysis = new LoopInfoFullAnalysis();
        for (Function function : module.getFunctions()) {
            if (function.isDeclaration()) {
                continue;
            }
            runOnFunction(function, loopAnalysis.runOnFunction(function));
        }
    }

    private void runOnFunction(Function function, LoopInfo loopInfo) {
        for (Loop loop : loopInfo.getTopLevelLoops()) {
            if (!loop.isLoopSimplifyForm()) {
                log.warn("skip loop {} in @{}: not in LoopSimplify form", loop.getHeader().getName(),
                        function.getName());
                continue;
            }
            VPlan plan = new VPlan(function.getName() + "." + loop.getHeader().getName());
            VPlanHCFGBuilder builder = new VPlanHCFGBuilder(loop, loopInfo, plan);
            builder.buildHierarchicalCFG();
            if (Config.getInstance().isVerifyVPlan()) {
                new VPlanVerifier().verify(plan);
            }
            plans.add(new LoopPlan(function, loop, plan, builder.getVPB2IRBB()));
            log.info("built VPlan {}: {} blocks, {} regions", plan.getName(), plan.getBlocks().size(),
                    plan.getRegions().size());
        }
    }

    public List<LoopPlan> getPlans() {
        return Collections.unmodifiableList(plans);
    }
}
