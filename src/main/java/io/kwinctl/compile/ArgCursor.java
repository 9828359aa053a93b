package io.kwinctl.compile;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cursor over the directive tokens that follow the global options.
 *
 * <p>{@code --name} and {@code --name=value} are long flags, {@code -x} and {@code -xyz} short flags, anything
 * else is a value. {@code -} alone is a value, and after {@code --} every token is a value until the next
 * directive starts. {@link #nextAllowingNumbers()} additionally reads {@code -12} and {@code -12%} as values.</p>
 */
public final class ArgCursor {
    private static final Pattern NEGATIVE_NUMBER = Pattern.compile("-[0-9]+%?");

    private final List<String> tokens;
    private int position;
    private String inlineOption;
    private String inlineValue;
    private String pendingShorts;
    private boolean optionsEnded;

    public ArgCursor(List<String> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    public Optional<Arg> next() {
        return next(false);
    }

    public Optional<Arg> nextAllowingNumbers() {
        return next(true);
    }

    private Optional<Arg> next(boolean numbers) {
        if (inlineValue != null) {
            throw DirectiveException.unexpectedValue(inlineOption, inlineValue);
        }
        if (pendingShorts != null) {
            char flag = pendingShorts.charAt(0);
            pendingShorts = pendingShorts.length() > 1 ? pendingShorts.substring(1) : null;
            return Optional.of(Arg.shortFlag(flag));
        }
        if (position >= tokens.size()) {
            return Optional.empty();
        }
        String token = tokens.get(position++);
        if (optionsEnded) {
            return Optional.of(Arg.value(token));
        }
        if ("--".equals(token)) {
            optionsEnded = true;
            return next(numbers);
        }
        if (token.startsWith("--")) {
            String body = token.substring(2);
            int equals = body.indexOf('=');
            if (equals >= 0) {
                inlineOption = "--" + body.substring(0, equals);
                inlineValue = body.substring(equals + 1);
                body = body.substring(0, equals);
            }
            return Optional.of(Arg.longFlag(body));
        }
        if (token.startsWith("-") && token.length() > 1) {
            if (numbers && NEGATIVE_NUMBER.matcher(token).matches()) {
                return Optional.of(Arg.value(token));
            }
            pendingShorts = token.length() > 2 ? token.substring(2) : null;
            return Optional.of(Arg.shortFlag(token.charAt(1)));
        }
        return Optional.of(Arg.value(token));
    }

    /**
     * Reads the value of the flag just returned: its inline {@code =value}, the rest of a short-flag cluster,
     * or the next raw token.
     */
    public String value(String option) {
        if (inlineValue != null) {
            String value = inlineValue;
            inlineValue = null;
            inlineOption = null;
            return value;
        }
        if (pendingShorts != null) {
            String value = pendingShorts.startsWith("=") ? pendingShorts.substring(1) : pendingShorts;
            pendingShorts = null;
            return value;
        }
        if (position >= tokens.size()) {
            throw DirectiveException.missingOptionValue(option);
        }
        return tokens.get(position++);
    }

    /**
     * Raw lookahead past the token most recently returned; {@code ahead = 0} is the next token.
     */
    public Optional<String> peek(int ahead) {
        int index = position + ahead;
        if (inlineValue != null || pendingShorts != null || index >= tokens.size()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(index));
    }

    /**
     * Clears per-directive state; {@code --} only applies to the directive it appears in.
     */
    void beginDirective() {
        optionsEnded = false;
    }
}
