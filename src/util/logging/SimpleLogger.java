package util.logging;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logger that formats records and hands them to {@link LogManager}.
 * The effective level follows the root level unless one was pinned.
 */
public class SimpleLogger implements Logger {
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{}");

    private final String name;
    private final LogLevel pinnedLevel;

    public SimpleLogger(String name, LogLevel pinnedLevel) {
        this.name = name;
        this.pinnedLevel = pinnedLevel;
    }

    public String getName() {
        return name;
    }

    @Override
    public void trace(String message) {
        log(LogLevel.TRACE, message);
    }

    @Override
    public void debug(String message) {
        log(LogLevel.DEBUG, message);
    }

    @Override
    public void info(String message) {
        log(LogLevel.INFO, message);
    }

    @Override
    public void warn(String message) {
        log(LogLevel.WARN, message);
    }

    @Override
    public void error(String message) {
        log(LogLevel.ERROR, message);
    }

    @Override
    public void trace(String format, Object... args) {
        if (isEnabled(LogLevel.TRACE)) {
            log(LogLevel.TRACE, formatMessage(format, args));
        }
    }

    @Override
    public void debug(String format, Object... args) {
        if (isEnabled(LogLevel.DEBUG)) {
            log(LogLevel.DEBUG, formatMessage(format, args));
        }
    }

    @Override
    public void info(String format, Object... args) {
        if (isEnabled(LogLevel.INFO)) {
            log(LogLevel.INFO, formatMessage(format, args));
        }
    }

    @Override
    public void warn(String format, Object... args) {
        if (isEnabled(LogLevel.WARN)) {
            log(LogLevel.WARN, formatMessage(format, args));
        }
    }

    @Override
    public void error(String format, Object... args) {
        if (isEnabled(LogLevel.ERROR)) {
            log(LogLevel.ERROR, formatMessage(format, args));
        }
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return !level.isLessSpecificThan(effectiveLevel());
    }

    private LogLevel effectiveLevel() {
        return pinnedLevel != null ? pinnedLevel : LogManager.getRootLevel();
    }

    private void log(LogLevel level, String message) {
        if (!isEnabled(level) || !LogManager.hasAppender()) {
            return;
        }

        StackTraceElement caller = getCaller();
        String methodInfo = "";
        if (caller != null) {
            methodInfo = String.format("[%s:%d] ", caller.getMethodName(), caller.getLineNumber());
        }

        String timestamp = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss,SSS").format(new Date());
        String logMessage = String.format("%s [%s] [%s] %s - %s%s",
                timestamp,
                Thread.currentThread().getName(),
                level,
                name,
                methodInfo,
                message);

        LogManager.writeLog(level, logMessage);
    }

    // first frame outside the logging classes
    private StackTraceElement getCaller() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();
        String loggerClassName = SimpleLogger.class.getName();
        boolean foundLogger = false;

        for (StackTraceElement element : stackTrace) {
            boolean isLogging = element.getClassName().equals(loggerClassName)
                    || element.getClassName().equals(LogManager.class.getName());
            if (foundLogger && !isLogging) {
                return element;
            }
            if (element.getClassName().equals(loggerClassName)) {
                foundLogger = true;
            }
        }
        return null;
    }

    static String formatMessage(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }

        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(format);
        while (matcher.find()) {
            if (argIndex < args.length) {
                Object arg = args[argIndex++];
                matcher.appendReplacement(result, Matcher.quoteReplacement(arg == null ? "null" : arg.toString()));
            } else {
                matcher.appendReplacement(result, "{}");
            }
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
