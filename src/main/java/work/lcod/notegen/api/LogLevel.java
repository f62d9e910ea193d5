package work.lcod.notegen.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the CLI. {@code FATAL} maps to Logback's {@code ERROR}.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

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

    public String logbackName() {
        return this == FATAL ? "ERROR" : name();
    }
}
