package io.kwinctl.compile;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * Escaping for user text placed inside double-quoted script string literals.
 */
public final class ScriptLiterals {
    private ScriptLiterals() {}

    public static String quoteContent(String raw) {
        return new String(JsonStringEncoder.getInstance().quoteAsString(raw));
    }
}
