package io.kwinctl.compile;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Window properties that {@code windowstate} can change, keyed by their command-line name.
 */
public enum WindowStateProperty {
    ABOVE("above", "keepAbove"),
    BELOW("below", "keepBelow"),
    SKIP_TASKBAR("skip_taskbar", "skipTaskbar"),
    SKIP_PAGER("skip_pager", "skipPager"),
    SKIP_SWITCHER("skip_switcher", "skipSwitcher"),
    FULLSCREEN("fullscreen", "fullScreen"),
    SHADED("shaded", "shade"),
    DEMANDS_ATTENTION("demands_attention", "demandsAttention"),
    NO_BORDER("no_border", "noBorder"),
    MINIMIZED("minimized", "minimized"),
    MAXIMIZED("maximized", "maximized");

    private static final Map<String, WindowStateProperty> BY_KEY = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(WindowStateProperty::key, Function.identity()));

    private final String key;
    private final String hostProperty;

    WindowStateProperty(String key, String hostProperty) {
        this.key = key;
        this.hostProperty = hostProperty;
    }

    public String key() {
        return key;
    }

    public String hostProperty() {
        return hostProperty;
    }

    public static Optional<WindowStateProperty> byKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key.toLowerCase(Locale.ROOT)));
    }
}
