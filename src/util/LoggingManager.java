package util;

import util.logging.LogLevel;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Forwards to {@link LogManager}; every class declares its logger through here.
 */
public class LoggingManager {
    private static boolean inited = false;

    public static void init() {
        if (inited) return;

        // 级别和输出目标都由 LogManager 按 Config 设置
        LogManager.init();

        inited = true;
    }

    public static Logger getLogger(Class<?> cls) {
        if (!inited) init();
        return LogManager.getLogger(cls);
    }

    /* 单独调高或调低某个类的日志级别 */
    public static Logger getLogger(Class<?> cls, LogLevel level) {
        if (!inited) init();
        return LogManager.getLogger(cls, level);
    }
}
