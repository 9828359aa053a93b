package io.kwinctl.api;

import java.util.Locale;

/**
 * Log threshold applied to the {@code io.kwinctl} logger hierarchy.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Returns the more verbose of the two levels.
     */
    public LogLevel mostVerbose(LogLevel other) {
        return other.ordinal() < ordinal() ? other : this;
    }
}
