package io.kwinctl.compile;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a token as a window reference. Explicit window ids are tried first, then {@code %@}, then
 * {@code %N}; any other token is not a window reference and belongs to the caller's grammar.
 */
public final class WindowReferenceResolver {
    private static final Pattern DECIMAL_ID = Pattern.compile("[0-9]+");
    private static final Pattern HEX_ID = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final Pattern UUID_ID = Pattern.compile(
        "\\{?([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})\\}?");
    private static final Pattern STACK_INDEX = Pattern.compile("%([1-9][0-9]*)");
    private static final String ALL_STACK = "%@";

    public Optional<WindowReference> resolve(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> explicit = explicitId(token);
        if (explicit.isPresent()) {
            return Optional.of(new WindowReference.ExplicitId(explicit.get()));
        }
        if (ALL_STACK.equals(token)) {
            return Optional.of(new WindowReference.AllStack());
        }
        Matcher index = STACK_INDEX.matcher(token);
        if (index.matches()) {
            try {
                return Optional.of(new WindowReference.StackIndex(Integer.parseInt(index.group(1))));
            } catch (NumberFormatException ex) {
                throw DirectiveException.invalidValue("window", token, ex);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the token can only be a window reference ({@code %@} or {@code %N}), never a number.
     */
    public boolean isStackReference(String token) {
        return ALL_STACK.equals(token) || STACK_INDEX.matcher(token).matches();
    }

    static Optional<String> explicitId(String token) {
        if (DECIMAL_ID.matcher(token).matches() || HEX_ID.matcher(token).matches()) {
            return Optional.of(token);
        }
        Matcher uuid = UUID_ID.matcher(token);
        if (uuid.matches() && token.startsWith("{") == token.endsWith("}")) {
            return Optional.of("{" + uuid.group(1).toLowerCase(Locale.ROOT) + "}");
        }
        return Optional.empty();
    }
}
