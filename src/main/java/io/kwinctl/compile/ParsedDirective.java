package io.kwinctl.compile;

import java.util.Objects;
import java.util.Optional;

/**
 * A directive plus the value token that ended it, which names the next directive.
 */
public record ParsedDirective(Directive directive, Optional<String> pushback) {
    public ParsedDirective {
        Objects.requireNonNull(directive, "directive");
        Objects.requireNonNull(pushback, "pushback");
    }
}
