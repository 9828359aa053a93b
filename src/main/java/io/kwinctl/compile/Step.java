package io.kwinctl.compile;

import java.util.Objects;
import java.util.Optional;

/**
 * One compiled directive.
 *
 * @param command  directive the fragment was rendered for
 * @param fragment rendered script text
 * @param query    whether the fragment replaces the window stack with a new result set
 * @param pushback name of the following directive when this one ended on a bare value
 */
public record Step(Command command, String fragment, boolean query, Optional<String> pushback) {
    public Step {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(fragment, "fragment");
        Objects.requireNonNull(pushback, "pushback");
    }
}
