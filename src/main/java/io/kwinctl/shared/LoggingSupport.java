package io.kwinctl.shared;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.kwinctl.api.LogLevel;
import org.slf4j.LoggerFactory;

/**
 * Applies the effective log threshold to the Logback logger that owns the {@code io.kwinctl} packages.
 */
public final class LoggingSupport {
    static final String ROOT_LOGGER = "io.kwinctl";

    private LoggingSupport() {}

    public static void apply(LogLevel level) {
        var logger = LoggerFactory.getLogger(ROOT_LOGGER);
        if (logger instanceof Logger logback) {
            logback.setLevel(Level.toLevel(level.name(), Level.INFO));
        }
    }
}
