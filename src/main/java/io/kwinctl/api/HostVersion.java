package io.kwinctl.api;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Generation of the KWin scripting host. The two generations expose loaded scripts under different object paths.
 */
public enum HostVersion {
    /** Plasma 5: scripts live at {@code /<id>}. */
    PLASMA_5("/%d"),
    /** Plasma 6 and later: scripts live at {@code /Scripting/Script<id>}. */
    PLASMA_6("/Scripting/Script%d");

    static final String SESSION_VERSION_VARIABLE = "KDE_SESSION_VERSION";

    private final String objectPathPattern;

    HostVersion(String objectPathPattern) {
        this.objectPathPattern = objectPathPattern;
    }

    public String scriptObjectPath(int scriptId) {
        return String.format(Locale.ROOT, objectPathPattern, scriptId);
    }

    public boolean isLegacy() {
        return this == PLASMA_5;
    }

    public static HostVersion detect(Map<String, String> environment) {
        String version = environment == null ? null : environment.get(SESSION_VERSION_VARIABLE);
        return "5".equals(version == null ? null : version.trim()) ? PLASMA_5 : PLASMA_6;
    }

    /**
     * Parses a configured version: {@code auto} (or blank) means detect from the environment.
     */
    public static Optional<HostVersion> fromSetting(String value) {
        if (value == null || value.isBlank() || "auto".equalsIgnoreCase(value.trim())) {
            return Optional.empty();
        }
        return switch (value.trim()) {
            case "5" -> Optional.of(PLASMA_5);
            case "6" -> Optional.of(PLASMA_6);
            default -> throw new IllegalArgumentException("Unsupported host version: " + value);
        };
    }
}
