package util.logging;

import driver.Config;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manager for creating and configuring Logger instances
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    // 配置选项，init() 时由 -Dlog.console / -Dlog.file 覆盖
    private static boolean consoleEnabled = false;  // 默认不输出到控制台
    private static boolean fileEnabled = false;     // 默认不输出到文件
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    private LogManager() {
        // Private constructor to prevent instantiation
    }

    /**
     * Get a logger for the specified class
     * @param clazz The class requesting the logger
     * @return A Logger instance
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), rootLevel);
    }

    /**
     * Get a logger for the specified class
     * @param clazz The class requesting the logger
     * @return A Logger instance
     */
    public static Logger getLogger(Class<?> clazz, LogLevel level) {
        return getLogger(clazz.getName(), level);
    }

    /**
     * Get a logger for the specified name
     * @param name The logger name
     * @return A Logger instance
     */
    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }

        return loggers.computeIfAbsent(name, n -> new SimpleLogger(n, level));
    }

    /**
     * Initialize the logging system
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }

        Config config = Config.getInstance();
        // Set log level based on configuration
        rootLevel = LogLevel.parse(config.logLevel, rootLevel);
        if (config.isDebug) {
            rootLevel = LogLevel.DEBUG;
        }
        consoleEnabled |= config.logConsole;
        fileEnabled |= config.logFile;

        // Initialize file logger only if enabled
        if (fileEnabled) {
            File logDir = new File(LOG_DIRECTORY);
            if (!logDir.exists()) {
                logDir.mkdirs();
            }

            try {
                File logFile = new File(logDir, "delegate" + System.currentTimeMillis() + ".log");
                fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
            } catch (IOException e) {
                // 文件写不了就退回控制台
                fileEnabled = false;
                consoleEnabled = true;
                System.err.println("cannot open log file: " + e.getMessage());
            }
        }

        initialized = true;
    }

    /**
     * Write log message to configured appenders
     * @param level Log level of the message
     * @param message The formatted log message
     */
    static void writeLog(LogLevel level, String message) {
        // Write to console only if enabled
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }

        // Write to file only if enabled
        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }
}
