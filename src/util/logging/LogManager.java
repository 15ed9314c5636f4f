package util.logging;

import driver.Config;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates loggers and owns the console and file appenders.
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static volatile LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    private static volatile boolean consoleEnabled = false;
    private static volatile boolean fileEnabled = false;
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    private LogManager() {
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), null);
    }

    public static Logger getLogger(Class<?> clazz, LogLevel level) {
        return getLogger(clazz.getName(), level);
    }

    /**
     * @param level pinned level, or null to follow the root level
     */
    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }
        return loggers.computeIfAbsent(name, n -> new SimpleLogger(n, level));
    }

    public static synchronized void init() {
        if (initialized) {
            return;
        }
        Config config = Config.getInstance();
        if (config.isDebug) {
            rootLevel = LogLevel.DEBUG;
        }
        rootLevel = LogLevel.parse(System.getProperty("log.level"), rootLevel);
        consoleEnabled = config.isLogConsole;
        if (config.isLogFile) {
            openFile();
        }
        initialized = true;
    }

    private static void openFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("Cannot create log directory " + logDir.getAbsolutePath());
            return;
        }
        try {
            File logFile = new File(logDir, "hcfg" + System.currentTimeMillis() + ".log");
            synchronized (FILE_LOCK) {
                fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
            }
            fileEnabled = true;
        } catch (IOException e) {
            System.err.println("Cannot open log file: " + e.getMessage());
            fileEnabled = false;
        }
    }

    public static synchronized void setRootLevel(LogLevel level) {
        rootLevel = level;
    }

    public static LogLevel getRootLevel() {
        return rootLevel;
    }

    static boolean hasAppender() {
        return consoleEnabled || fileEnabled;
    }

    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }
        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }

    public static void enableConsole() {
        consoleEnabled = true;
    }

    public static void disableConsole() {
        consoleEnabled = false;
    }

    public static synchronized void enableFile() {
        if (!fileEnabled) {
            openFile();
        }
    }

    public static void disableFile() {
        fileEnabled = false;
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }

    public static void shutdown() {
        disableConsole();
        disableFile();
    }
}
