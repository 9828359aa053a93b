package io.kwinctl.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import io.kwinctl.compile.ScriptLiterals;
import io.kwinctl.template.Bindings;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide values every fragment may reference. Fixed once the script marker and callback address are known.
 *
 * @param debug      whether the script logs each step to the host log
 * @param kde5       whether the host is a Plasma 5 KWin
 * @param marker     file name of the persisted script, used to recognise it in host logs
 * @param dbusAddr   bus address the script sends its callbacks to
 * @param scriptName name the script is loaded under, may be empty
 * @param shortcut   key sequence to register the pipeline under, empty for a one-shot run
 * @param cmdline    invoking command line, single-line
 */
public record SessionContext(
    boolean debug,
    boolean kde5,
    String marker,
    String dbusAddr,
    String scriptName,
    String shortcut,
    String cmdline
) {
    private static final ObjectMapper BINDING_MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};
    // Bound inside double-quoted script literals.
    private static final List<String> LITERAL_KEYS = List.of("marker", "dbus_addr", "script_name", "shortcut");

    public SessionContext {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(dbusAddr, "dbusAddr");
        Objects.requireNonNull(scriptName, "scriptName");
        Objects.requireNonNull(shortcut, "shortcut");
        cmdline = cmdline == null ? "" : cmdline.replaceAll("[\\r\\n]+", " ");
    }

    public static SessionContext of(RunConfiguration configuration, String marker, String dbusAddr) {
        return new SessionContext(
            configuration.debug(),
            configuration.hostVersion().isLegacy(),
            marker,
            dbusAddr,
            configuration.scriptName(),
            configuration.shortcut().orElse(""),
            configuration.cmdline()
        );
    }

    /**
     * Base bindings for every fragment, keyed by the snake_case component names ({@code dbus_addr}, ...).
     * Values that end up inside script string literals are escaped.
     */
    public Bindings toBindings() {
        Map<String, Object> values = BINDING_MAPPER.convertValue(this, MAP_REF);
        for (String key : LITERAL_KEYS) {
            values.computeIfPresent(key, (name, value) -> ScriptLiterals.quoteContent(value.toString()));
        }
        return Bindings.of(values);
    }
}
