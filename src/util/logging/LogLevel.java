package util.logging;

/**
 * 日志级别，数值越大越严重
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

    /**
     * @return 本级别比 other 更“啰嗦”（更不严重）时返回 true
     */
    public boolean isLessSpecificThan(LogLevel other) {
        return this.value < other.value;
    }

    /* 不认识的名字返回 fallback */
    public static LogLevel parse(String name, LogLevel fallback) {
        if (name == null) {
            return fallback;
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(name.trim())) {
                return level;
            }
        }
        return fallback;
    }
}
