package io.kwinctl.compile;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Header, one fragment per step, the optional last-output trailer and the footer.
 */
public record GeneratedScript(String header, List<Step> steps, Optional<String> trailer, String footer) {
    public GeneratedScript {
        Objects.requireNonNull(header, "header");
        steps = List.copyOf(steps);
        Objects.requireNonNull(trailer, "trailer");
        Objects.requireNonNull(footer, "footer");
    }

    public String text() {
        var out = new StringBuilder(header);
        for (Step step : steps) {
            out.append(step.fragment());
        }
        trailer.ifPresent(out::append);
        return out.append(footer).toString();
    }
}
