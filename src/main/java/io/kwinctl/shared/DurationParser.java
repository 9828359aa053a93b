package io.kwinctl.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the duration syntax accepted in configuration files ({@code 1500}, {@code 30s}, {@code 2m}).
 * A bare number is milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long unitMillis = 1L;
        String digits = trimmed;
        if (trimmed.endsWith("ms")) {
            digits = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 1_000L;
        } else if (trimmed.endsWith("m")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 60_000L;
        }
        long value;
        try {
            value = Long.parseLong(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(value * unitMillis));
    }

    public static Duration parseOrDefault(String raw, Duration fallback) {
        return parse(raw).orElse(fallback);
    }
}
