package work.lcod.derivation.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the CLI, mapped onto the SLF4J simple logger levels.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    OFF("off");

    static final String SIMPLE_LOGGER_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private final String simpleLoggerName;

    LogLevel(String simpleLoggerName) {
        this.simpleLoggerName = simpleLoggerName;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public String simpleLoggerName() {
        return simpleLoggerName;
    }

    /**
     * Sets the default simple-logger threshold. Only effective before the first logger is created.
     */
    public void install() {
        System.setProperty(SIMPLE_LOGGER_LEVEL_PROPERTY, simpleLoggerName);
    }
}
