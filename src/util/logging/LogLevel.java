package util.logging;

/**
 * Severity of a log record, ordered from least to most specific.
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    FATAL(5);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /** true if this level is below {@code other}, i.e. filtered out by it */
    public boolean isLessSpecificThan(LogLevel other) {
        return value < other.value;
    }

    public static LogLevel parse(String name, LogLevel fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
