package util.llvm;

/**
 * Options controlling how {@link LLVMIRParser} reacts to input it cannot handle.
 */
public class LoaderConfig {

    public enum ErrorHandling {
        /** throw on the first error */
        STRICT,
        /** keep parsing, report every error at the end */
        COLLECT
    }

    private ErrorHandling errorHandling = ErrorHandling.STRICT;
    private boolean allowForwardReferences = true;
    private boolean debugMode = false;
    private int maxErrors = 10;

    public static LoaderConfig defaultConfig() {
        return new LoaderConfig();
    }

    /** collects every error so one run reports all broken lines of a fixture */
    public static LoaderConfig collectingConfig() {
        return new LoaderConfig().setErrorHandling(ErrorHandling.COLLECT);
    }

    public static LoaderConfig debugConfig() {
        return new LoaderConfig().setDebugMode(true);
    }

    public ErrorHandling getErrorHandling() {
        return errorHandling;
    }

    public LoaderConfig setErrorHandling(ErrorHandling errorHandling) {
        this.errorHandling = errorHandling;
        return this;
    }

    public boolean isAllowForwardReferences() {
        return allowForwardReferences;
    }

    public LoaderConfig setAllowForwardReferences(boolean allowForwardReferences) {
        this.allowForwardReferences = allowForwardReferences;
        return this;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public LoaderConfig setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
        return this;
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public LoaderConfig setMaxErrors(int maxErrors) {
        this.maxErrors = maxErrors;
        return this;
    }

    @Override
    public String toString() {
        return "LoaderConfig{errorHandling=" + errorHandling
                + ", allowForwardReferences=" + allowForwardReferences
                + ", debugMode=" + debugMode
                + ", maxErrors=" + maxErrors + '}';
    }
}
