package pass;

import driver.Config;
import exception.CompileException;
import ir.IRModule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import pass.Pass.IRPass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Runs the IR pipeline over one module. Each module gets its own manager, so
 * pass results of different modules never mix.
 */
public class PassManager {
    private final List<IRPass> irPipeline = new ArrayList<>();
    private final Set<String> enabledIR;
    private final IRModule module;

    private final Logger log = LoggingManager.getLogger(PassManager.class);

    public PassManager(IRModule module) {
        this.module = module;
        // read the system property
        // eg: -Dir.passes=cfganalysis,vplanhcfg
        enabledIR = loadEnabled("ir.passes");
        setDefaultPipeline();
    }

    private void setDefaultPipeline() {
        setIRPipeline(
                IRPassType.CFGAnalysis,
                IRPassType.VPlanHCFG);
    }

    /** read "a,b,c" from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    // other passes use this to get the results of a pass that already ran
    public <T extends Pass> T getPass(Class<T> cls) {
        for (Pass p : irPipeline) {
            if (cls.isInstance(p)) {
                return cls.cast(p);
            }
        }
        throw CompileException.unknownPass("can not get the pass: " + cls.getName());
    }

    public List<IRPassType> getPipeline() {
        return irPipeline.stream().map(IRPass::getType).collect(Collectors.toList());
    }

    public void runIRPasses() {
        for (IRPass p : irPipeline) {
            if (Config.getInstance().isDebug) {
                log.info("[IR] " + p.getType().getName());
            }
            p.run(module);
        }
        if (log.isTraceEnabled()) {
            log.trace("module after IR passes:\n{}", module.toLLVM());
        }
    }

    /**
     * Set the whole IR pipeline in order, filtered by -Dir.passes.
     */
    public void setIRPipeline(IRPassType... types) {
        irPipeline.clear();
        for (IRPassType type : types) {
            if (enabledIR.isEmpty() || enabledIR.contains(type.getName())) {
                irPipeline.add(type.create());
            }
        }
    }
}
