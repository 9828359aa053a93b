package io.kwinctl.compile;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * One parsed directive. Immutable once the parser returns it.
 */
public interface Directive {
    Command command();

    /**
     * Directives addressed at a window, defaulting to the first entry of the window stack.
     */
    interface WindowDirective extends Directive {
        WindowReference target();
    }

    record Search(SearchOptions options) implements Directive {
        @Override
        public Command command() {
            return Command.SEARCH;
        }
    }

    record ActiveWindow() implements Directive {
        @Override
        public Command command() {
            return Command.GETACTIVEWINDOW;
        }
    }

    record WindowStack(Command command, String name) implements Directive {
        public WindowStack {
            if (command != Command.SAVEWINDOWSTACK && command != Command.LOADWINDOWSTACK) {
                throw new IllegalArgumentException("Not a window stack command: " + command);
            }
            Objects.requireNonNull(name, "name");
        }
    }

    record WindowAction(Command command, WindowReference target) implements WindowDirective {
        public WindowAction {
            Objects.requireNonNull(target, "target");
        }
    }

    record WindowState(WindowReference target, List<StateMutation> mutations) implements WindowDirective {
        public WindowState {
            Objects.requireNonNull(target, "target");
            mutations = List.copyOf(mutations);
        }

        @Override
        public Command command() {
            return Command.WINDOWSTATE;
        }
    }

    record WindowGeometry(Command command, WindowReference target, boolean relative, AxisValue x, AxisValue y)
        implements WindowDirective {
        public WindowGeometry {
            if (command != Command.WINDOWMOVE && command != Command.WINDOWSIZE) {
                throw new IllegalArgumentException("Not a geometry command: " + command);
            }
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(x, "x");
            Objects.requireNonNull(y, "y");
        }
    }

    record WindowDesktop(WindowReference target, int desktop) implements WindowDirective {
        public WindowDesktop {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public Command command() {
            return Command.SET_DESKTOP_FOR_WINDOW;
        }
    }

    record GlobalAction(Command command, OptionalInt argument) implements Directive {
        public GlobalAction {
            if (command.category() != Command.Category.GLOBAL_ACTION) {
                throw new IllegalArgumentException("Not a global action: " + command);
            }
            Objects.requireNonNull(argument, "argument");
        }
    }
}
