package io.kwinctl.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable key/value record bound into fragment placeholders. Every {@code with} call returns a new instance
 * layered on top of this one; the receiver is never modified.
 */
public final class Bindings {
    private static final Bindings EMPTY = new Bindings(Map.of());

    private final Map<String, Object> values;

    private Bindings(Map<String, Object> values) {
        this.values = values;
    }

    public static Bindings empty() {
        return EMPTY;
    }

    public static Bindings of(Map<String, ?> values) {
        return EMPTY.withAll(values);
    }

    public Bindings with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        var extended = new LinkedHashMap<String, Object>(values);
        extended.put(key, value);
        return new Bindings(Collections.unmodifiableMap(extended));
    }

    public Bindings withAll(Map<String, ?> additions) {
        if (additions == null || additions.isEmpty()) {
            return this;
        }
        var extended = new LinkedHashMap<String, Object>(values);
        additions.forEach((key, value) -> extended.put(Objects.requireNonNull(key, "key"), value));
        return new Bindings(Collections.unmodifiableMap(extended));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Returns the bound value, which may be {@code null} for keys bound to nothing.
     */
    public Object get(String key) {
        return values.get(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "Bindings" + values;
    }
}
