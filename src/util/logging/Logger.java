package util.logging;

/**
 * Minimal logger facade with {} placeholders
 */
public interface Logger {
    void trace(String message);
    void debug(String message);
    void info(String message);
    void warn(String message);
    void error(String message);

    void trace(String format, Object... args);
    void debug(String format, Object... args);
    void info(String format, Object... args);
    void warn(String format, Object... args);
    void error(String format, Object... args);

    boolean isEnabled(LogLevel level);

    default boolean isTraceEnabled() {
        return isEnabled(LogLevel.TRACE);
    }

    default boolean isDebugEnabled() {
        return isEnabled(LogLevel.DEBUG);
    }
}
