package driver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import exception.CompileException;
import ir.IRModule;
import pass.IRPass.VPlanHCFGPass;
import pass.PassManager;
import util.LoggingManager;
import util.llvm.LLVMIRLoader;
import util.llvm.LLVMParseException;
import util.llvm.LoaderConfig;
import util.logging.Logger;

/**
 * Command line front: loads a .ll file, runs the IR pipeline and prints the
 * plan of every loop nest.
 *
 * <pre>
 *   HCFG input.ll [-o plans.txt] [--no-verify]
 * </pre>
 */
public class HCFGDriver {
    private static final HCFGDriver hcfgDriver = new HCFGDriver();
    private static final Logger logger = LoggingManager.getLogger(HCFGDriver.class);

    private String source = null;
    private String target = null;

    private HCFGDriver() {
    }

    public static HCFGDriver getInstance() {
        return hcfgDriver;
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws CompileException {
        if (args == null || args.length == 0) {
            throw CompileException.noArgs();
        }
        var iter = Arrays.asList(args).iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> {
                    if (iter.hasNext()) {
                        target = iter.next();
                    } else {
                        throw CompileException.wrongArgs("need a file after -o");
                    }
                }
                case "--no-verify" -> Config.getInstance().isVerifyVPlan = false;
                default -> {
                    if (cmd.endsWith(".ll")) {
                        source = cmd;
                    } else {
                        throw CompileException.wrongArgs(cmd);
                    }
                }
            }
        }
        if (source == null) {
            throw CompileException.wrongArgs("no .ll input given");
        }
    }

    public void run() {
        IRModule irModule = loadIR(source);

        PassManager passManager = new PassManager(irModule);
        passManager.runIRPasses();

        String output = render(passManager.getPass(VPlanHCFGPass.class));
        if (target == null) {
            System.out.print(output);
            return;
        }
        try {
            Files.writeString(Path.of(target), output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompileException("failed to write " + target, e);
        }
    }

    static String render(VPlanHCFGPass pass) {
        StringBuilder sb = new StringBuilder();
        for (VPlanHCFGPass.LoopPlan loopPlan : pass.getPlans()) {
            sb.append(loopPlan.plan().print()).append("\n");
        }
        return sb.toString();
    }

    private IRModule loadIR(String path) {
        try {
            LoaderConfig cfg = LoaderConfig.defaultConfig()
                    .setDebugMode(Config.getInstance().isDebug);
            return LLVMIRLoader.loadFromFile(path, cfg);
        } catch (IOException e) {
            throw new CompileException("failed to read " + path, e);
        } catch (LLVMParseException e) {
            logger.error(e.getMessage());
            throw new CompileException("failed to parse LLVM IR: " + e.getMessage(), e);
        }
    }

    public String getSource() {
        return source;
    }
}
