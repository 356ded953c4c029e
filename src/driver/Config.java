package driver;

/*
 * configuration of the compiler, read once from system properties
 */
public class Config {
    private static Config config = new Config();

    public boolean isDebug = false;
    // -Ddelegate.extract=false 时只生长区域，不做外提
    public boolean extractEnabled = true;
    public boolean verifyAfterPasses = false;
    public boolean logConsole = false;
    public boolean logFile = false;
    public String logLevel = null;
    // 以下由命令行设置
    public boolean declarePrimitives = false;
    public boolean dumpRegions = false;

    private Config() {
        isDebug = getFlag("debug");
        extractEnabled = getFlag("delegate.extract", true);
        verifyAfterPasses = getFlag("delegate.verify");
        logConsole = getFlag("log.console");
        logFile = getFlag("log.file");
        logLevel = System.getProperty("log.level");
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    /* 属性未设置时返回默认值 */
    public static boolean getFlag(String name, boolean defaultValue) {
        String raw = System.getProperty(name);
        if (raw == null) {
            return defaultValue;
        }
        return raw.equalsIgnoreCase("true");
    }

    public static Config getInstance() {
        return config;
    }

    /* 重新读取系统属性，命令行设置的开关恢复默认 */
    public static void reset() {
        config = new Config();
    }
}
