package io.kwinctl.compile;

import java.util.Objects;
import java.util.Optional;

/**
 * One {@code --add}, {@code --remove} or {@code --toggle} of a {@code windowstate} directive.
 */
public record StateMutation(Operation operation, WindowStateProperty property) {
    public enum Operation {
        ADD("add"),
        REMOVE("remove"),
        TOGGLE("toggle");

        private final String flag;

        Operation(String flag) {
            this.flag = flag;
        }

        static Optional<Operation> byFlag(String flag) {
            for (Operation operation : values()) {
                if (operation.flag.equals(flag)) {
                    return Optional.of(operation);
                }
            }
            return Optional.empty();
        }
    }

    public StateMutation {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(property, "property");
    }

    /**
     * Script statement applying this mutation to the window bound to {@code w}.
     */
    String toScript() {
        String target = "w." + property.hostProperty();
        return switch (operation) {
            case ADD -> target + " = true; ";
            case REMOVE -> target + " = false; ";
            case TOGGLE -> target + " = !" + target + "; ";
        };
    }
}
