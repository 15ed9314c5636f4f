package vplan.builder;

import ir.value.BasicBlock;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.Loop;
import pass.IRPass.analysis.LoopBlocksRPO;
import pass.IRPass.analysis.LoopInfo;
import util.LoggingManager;
import util.logging.Logger;
import vplan.VPBasicBlock;
import vplan.VPBlockBase;
import vplan.VPBlockUtils;
import vplan.VPRegionBlock;
import vplan.VPlan;

import java.util.Map;

/**
 * Builds the plain hierarchical CFG of one outermost loop. Blocks are visited
 * in reverse postorder so every operand except a header phi's latch value is
 * translated before its users.
 */
public class PlainCFGBuilder {
    private static final Logger log = LoggingManager.getLogger(PlainCFGBuilder.class);

    private final Loop theLoop;
    private final LoopInfo loopInfo;
    private final VPlan plan;

    public PlainCFGBuilder(Loop theLoop, LoopInfo loopInfo, VPlan plan) {
        this.theLoop = theLoop;
        this.loopInfo = loopInfo;
        this.plan = plan;
    }

    /**
     * @return every created node mapped to its IR block, in creation order
     */
    public Map<VPBlockBase, BasicBlock> buildPlainCFG() {
        LoopNestRoles roles = LoopNestRoles.of(theLoop, loopInfo);
        VPOperandResolver resolver = new VPOperandResolver(plan, roles);
        VPBlockRegistry registry = new VPBlockRegistry(plan, roles);
        HeaderPhiFixer phiFixer = new HeaderPhiFixer(roles, resolver);
        VPInstructionTranslator translator = new VPInstructionTranslator(roles, resolver, registry, phiFixer);
        VPEdgeWirer wirer = new VPEdgeWirer(roles, registry);

        // the preheader is not part of the traversal, its values are live-ins
        for (Instruction inst : roles.preheader().getInstructions()) {
            if (!inst.getType().isVoid()) {
                resolver.registerLiveIn(inst);
            }
        }

        LoopBlocksRPO rpo = new LoopBlocksRPO(theLoop);
        log.debug("RPO of loop {}: {}", theLoop.getHeader().getName(), rpo.getBlocks());
        for (BasicBlock bb : rpo) {
            VPBasicBlock vpbb = registry.getOrCreate(bb);
            VPRegionBlock region = vpbb.getParent();
            Loop loopForBB = loopInfo.getLoopFor(bb);

            // predecessors keep the IR order
            if (!LoopNestRoles.isHeader(bb, loopForBB)) {
                wirer.setPredecessors(vpbb, bb);
            } else if (region != null) {
                wirer.setRegionPredecessors(region, bb);
            }

            translator.translate(vpbb, bb);
            wirer.setSuccessors(vpbb, bb);
        }

        phiFixer.fixHeaderPhis();

        VPBlockUtils.connectBlocks(plan.getEntry(), registry.getOrCreate(theLoop.getHeader()));
        return registry.buildVPB2IRBB();
    }
}
