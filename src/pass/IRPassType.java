package pass;

import java.util.function.Supplier;

import pass.IRPass.VPlanHCFGPass;
import pass.IRPass.analysis.CFGAnalysisPass;
import pass.Pass.IRPass;

/**
 * IRPassFactory: create the IRPass here
 */
public enum IRPassType implements PassType<IRPass> {
    CFGAnalysis(CFGAnalysisPass::new),
    VPlanHCFG(VPlanHCFGPass::new),
    // add more irpass here
    ;

    private final Supplier<IRPass> supplier;

    IRPassType(Supplier<IRPass> constructor) {
        this.supplier = constructor;
    }

    @Override
    public Supplier<IRPass> constructor() {
        return supplier;
    }
}
