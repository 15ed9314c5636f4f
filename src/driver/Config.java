package driver;

/*
 * configuration of the hcfg builder, read from system properties
 */
public class Config {
    private static Config config = new Config();

    public boolean isDebug = false;
    public boolean isVerifyVPlan = true;
    public boolean isLogConsole = false;
    public boolean isLogFile = false;

    private Config() {
        reload();
    }

    /**
     * Re-read every flag from the system properties.
     */
    public void reload() {
        isDebug = getFlag("debug");
        isVerifyVPlan = getFlag("vplan.verify", true);
        isLogConsole = getFlag("log.console");
        isLogFile = getFlag("log.file");
    }

    public boolean isVerifyVPlan() {
        return isVerifyVPlan;
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        return getFlag(name, false);
    }

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
}
