package pass;

import exception.CompileException;
import ir.IRModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import pass.IRPass.VPlanHCFGPass;
import pass.IRPass.analysis.CFGAnalysisPass;
import util.llvm.LLVMIRLoader;
import vplan.VPlan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PassManagerTest {

    @AfterEach
    void clearPassFilter() {
        System.clearProperty("ir.passes");
    }

    @Test
    void defaultPipeline() throws Exception {
        PassManager pm = new PassManager(LLVMIRLoader.loadFromTestResource("nest.ll"));
        assertEquals(List.of(IRPassType.CFGAnalysis, IRPassType.VPlanHCFG), pm.getPipeline());
    }

    @Test
    void pipelineIsFilteredBySystemProperty() throws Exception {
        System.setProperty("ir.passes", "CFGAnalysis");
        PassManager pm = new PassManager(LLVMIRLoader.loadFromTestResource("nest.ll"));

        assertEquals(List.of(IRPassType.CFGAnalysis), pm.getPipeline());
        assertNotNull(pm.getPass(CFGAnalysisPass.class));
        assertThrows(CompileException.class, () -> pm.getPass(VPlanHCFGPass.class));
    }

    @Test
    void plansAreKeptForLaterPasses() throws Exception {
        IRModule module = LLVMIRLoader.loadFromTestResource("nest.ll");
        PassManager pm = new PassManager(module);
        pm.runIRPasses();

        List<VPlanHCFGPass.LoopPlan> plans = pm.getPass(VPlanHCFGPass.class).getPlans();
        assertEquals(1, plans.size());
        VPlanHCFGPass.LoopPlan loopPlan = plans.get(0);
        VPlan plan = loopPlan.plan();
        assertEquals("nest.outer", plan.getName());
        assertSame(module.getFunction("nest"), loopPlan.function());
        assertEquals("outer", loopPlan.loop().getHeader().getName());
        assertEquals(5, loopPlan.vpb2IRBB().size());
        assertEquals(1, plan.getRegions().size());
    }

    @Test
    void loopsOutsideSimplifyFormAreSkipped() throws Exception {
        PassManager pm = new PassManager(LLVMIRLoader.loadFromTestResource("no_preheader.ll"));
        pm.runIRPasses();
        assertTrue(pm.getPass(VPlanHCFGPass.class).getPlans().isEmpty());
    }

    @Test
    void explicitPipeline() throws Exception {
        PassManager pm = new PassManager(LLVMIRLoader.loadFromTestResource("switch.ll"));
        pm.setIRPipeline(IRPassType.VPlanHCFG);
        pm.runIRPasses();

        assertEquals(List.of(IRPassType.VPlanHCFG), pm.getPipeline());
        assertEquals("sw.loop", pm.getPass(VPlanHCFGPass.class).getPlans().get(0).plan().getName());
    }
}
