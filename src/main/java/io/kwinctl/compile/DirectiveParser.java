package io.kwinctl.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Reads one directive from an {@link ArgCursor}.
 *
 * <p>Directives are chained without separators: once a directive's value slots are filled, the next bare value
 * is not consumed as an argument but handed back as {@link ParsedDirective#pushback()}, the name of the
 * following directive. {@code search foo activatewindow} is therefore {@code search foo} followed by
 * {@code activatewindow}.</p>
 */
public final class DirectiveParser {
    private final WindowReferenceResolver resolver;

    public DirectiveParser() {
        this(new WindowReferenceResolver());
    }

    public DirectiveParser(WindowReferenceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public ParsedDirective parse(String name, ArgCursor cursor) {
        Command command = Command.byName(name).orElseThrow(() -> DirectiveException.unknownCommand(name));
        cursor.beginDirective();
        return switch (command) {
            case SEARCH -> parseSearch(cursor);
            case GETACTIVEWINDOW -> withoutArguments(new Directive.ActiveWindow(), cursor);
            case SAVEWINDOWSTACK, LOADWINDOWSTACK -> parseWindowStack(command, cursor);
            case WINDOWSTATE -> parseWindowState(cursor);
            case WINDOWMOVE, WINDOWSIZE -> parseGeometry(command, cursor);
            case SET_DESKTOP_FOR_WINDOW -> parseWindowDesktop(cursor);
            case GETWINDOWNAME, GETWINDOWCLASSNAME, GETWINDOWGEOMETRY, GETWINDOWPID, GET_DESKTOP_FOR_WINDOW,
                WINDOWACTIVATE, ACTIVATEWINDOW, WINDOWRAISE, WINDOWMINIMIZE, WINDOWCLOSE -> parseWindowAction(command, cursor);
            case SET_DESKTOP, SET_NUM_DESKTOPS -> parseNumberedGlobal(command, cursor);
            case GET_DESKTOP, GET_NUM_DESKTOPS, GETMOUSELOCATION ->
                withoutArguments(new Directive.GlobalAction(command, OptionalInt.empty()), cursor);
        };
    }

    private ParsedDirective withoutArguments(Directive directive, ArgCursor cursor) {
        Optional<Arg> next = cursor.nextAllowingNumbers();
        if (next.isEmpty()) {
            return new ParsedDirective(directive, Optional.empty());
        }
        Arg arg = next.get();
        if (!arg.isValue()) {
            throw arg.unexpected();
        }
        return new ParsedDirective(directive, Optional.of(arg.text()));
    }

    private ParsedDirective parseSearch(ArgCursor cursor) {
        var options = new SearchOptions.Builder();
        String pushback = null;
        while (true) {
            Optional<Arg> next = cursor.next();
            if (next.isEmpty()) {
                break;
            }
            Arg arg = next.get();
            if (arg.type() == Arg.Type.LONG) {
                applySearchFlag(options, arg, cursor);
            } else if (arg.isValue() && options.searchTerm == null) {
                options.searchTerm = arg.text();
            } else if (arg.isValue()) {
                pushback = arg.text();
                break;
            } else {
                throw arg.unexpected();
            }
        }
        return new ParsedDirective(new Directive.Search(options.build()), Optional.ofNullable(pushback));
    }

    private void applySearchFlag(SearchOptions.Builder options, Arg arg, ArgCursor cursor) {
        String flag = "--" + arg.text();
        switch (arg.text()) {
            case "class" -> options.matchClass = true;
            case "classname" -> options.matchClassname = true;
            case "role" -> options.matchRole = true;
            case "name" -> options.matchName = true;
            case "pid" -> {
                options.matchPid = true;
                options.pid = parseInteger(flag, cursor.value(flag));
            }
            case "desktop" -> {
                options.matchDesktop = true;
                options.desktop = parseInteger(flag, cursor.value(flag));
            }
            case "screen" -> {
                options.matchScreen = true;
                options.screen = parseInteger(flag, cursor.value(flag));
            }
            case "limit" -> options.limit = parseNonNegative(flag, cursor.value(flag));
            case "all" -> options.matchAll = true;
            case "any" -> options.matchAll = false;
            default -> throw arg.unexpected();
        }
    }

    private ParsedDirective parseWindowStack(Command command, ArgCursor cursor) {
        String stackName = null;
        String pushback = null;
        while (true) {
            Optional<Arg> next = cursor.next();
            if (next.isEmpty()) {
                break;
            }
            Arg arg = next.get();
            if (!arg.isValue()) {
                throw arg.unexpected();
            }
            if (stackName == null) {
                stackName = arg.text();
            } else {
                pushback = arg.text();
                break;
            }
        }
        if (stackName == null) {
            throw DirectiveException.missingArgument("name");
        }
        return new ParsedDirective(new Directive.WindowStack(command, stackName), Optional.ofNullable(pushback));
    }

    private ParsedDirective parseWindowAction(Command command, ArgCursor cursor) {
        WindowReference target = null;
        String pushback = null;
        Optional<Arg> next = cursor.nextAllowingNumbers();
        if (next.isPresent()) {
            Arg arg = next.get();
            if (!arg.isValue()) {
                throw arg.unexpected();
            }
            Optional<WindowReference> resolved = resolver.resolve(arg.text());
            if (resolved.isPresent()) {
                target = resolved.get();
                pushback = takeFollowingCommand(cursor);
            } else {
                pushback = arg.text();
            }
        }
        return new ParsedDirective(new Directive.WindowAction(command, orDefault(target)), Optional.ofNullable(pushback));
    }

    private ParsedDirective parseWindowState(ArgCursor cursor) {
        WindowReference target = null;
        boolean sawPositional = false;
        List<StateMutation> mutations = new ArrayList<>();
        String pushback = null;
        while (true) {
            Optional<Arg> next = cursor.next();
            if (next.isEmpty()) {
                break;
            }
            Arg arg = next.get();
            Optional<StateMutation.Operation> operation = arg.type() == Arg.Type.LONG
                ? StateMutation.Operation.byFlag(arg.text())
                : Optional.empty();
            if (operation.isPresent()) {
                String key = cursor.value("--" + arg.text());
                WindowStateProperty property = WindowStateProperty.byKey(key)
                    .orElseThrow(() -> DirectiveException.unknownProperty(key));
                mutations.add(new StateMutation(operation.get(), property));
            } else if (arg.isValue() && !sawPositional) {
                sawPositional = true;
                Optional<WindowReference> resolved = resolver.resolve(arg.text());
                if (resolved.isEmpty()) {
                    pushback = arg.text();
                    break;
                }
                target = resolved.get();
            } else if (arg.isValue()) {
                pushback = arg.text();
                break;
            } else {
                throw arg.unexpected();
            }
        }
        return new ParsedDirective(new Directive.WindowState(orDefault(target), mutations), Optional.ofNullable(pushback));
    }

    private ParsedDirective parseGeometry(Command command, ArgCursor cursor) {
        boolean relative = false;
        boolean sawPositional = false;
        WindowReference target = null;
        String x = null;
        String y = null;
        String pushback = null;
        while (true) {
            Optional<Arg> next = cursor.nextAllowingNumbers();
            if (next.isEmpty()) {
                break;
            }
            Arg arg = next.get();
            if (command == Command.WINDOWMOVE && arg.isLong("relative")) {
                relative = true;
            } else if (arg.isValue() && !sawPositional) {
                sawPositional = true;
                if (leadsGeometry(arg.text(), cursor)) {
                    target = resolver.resolve(arg.text()).orElseThrow();
                } else {
                    x = arg.text();
                }
            } else if (arg.isValue() && x == null) {
                x = arg.text();
            } else if (arg.isValue() && y == null) {
                y = arg.text();
            } else if (arg.isValue()) {
                pushback = arg.text();
                break;
            } else {
                throw arg.unexpected();
            }
        }
        if (x == null) {
            throw DirectiveException.missingArgument("x");
        }
        if (y == null) {
            throw DirectiveException.missingArgument("y");
        }
        var directive = new Directive.WindowGeometry(
            command, orDefault(target), relative, AxisValue.parse(x, "x"), AxisValue.parse(y, "y"));
        return new ParsedDirective(directive, Optional.ofNullable(pushback));
    }

    private ParsedDirective parseWindowDesktop(ArgCursor cursor) {
        boolean sawPositional = false;
        WindowReference target = null;
        Integer desktop = null;
        String pushback = null;
        while (true) {
            Optional<Arg> next = cursor.nextAllowingNumbers();
            if (next.isEmpty()) {
                break;
            }
            Arg arg = next.get();
            if (!arg.isValue()) {
                throw arg.unexpected();
            }
            if (!sawPositional) {
                sawPositional = true;
                if (leadsDesktop(arg.text(), cursor)) {
                    target = resolver.resolve(arg.text()).orElseThrow();
                } else {
                    desktop = parseInteger("desktop_id", arg.text());
                }
            } else if (desktop == null) {
                desktop = parseInteger("desktop_id", arg.text());
            } else {
                pushback = arg.text();
                break;
            }
        }
        if (desktop == null) {
            throw DirectiveException.missingArgument("desktop_id");
        }
        return new ParsedDirective(new Directive.WindowDesktop(orDefault(target), desktop), Optional.ofNullable(pushback));
    }

    private ParsedDirective parseNumberedGlobal(Command command, ArgCursor cursor) {
        String argumentName = command == Command.SET_DESKTOP ? "desktop_id" : "num";
        Integer value = null;
        String pushback = null;
        while (true) {
            Optional<Arg> next = cursor.nextAllowingNumbers();
            if (next.isEmpty()) {
                break;
            }
            Arg arg = next.get();
            if (!arg.isValue()) {
                throw arg.unexpected();
            }
            if (value == null) {
                value = parseInteger(argumentName, arg.text());
            } else {
                pushback = arg.text();
                break;
            }
        }
        if (value == null) {
            throw DirectiveException.missingArgument(argumentName);
        }
        return new ParsedDirective(new Directive.GlobalAction(command, OptionalInt.of(value)), Optional.ofNullable(pushback));
    }

    /**
     * After a window reference only the next directive's name may follow.
     */
    private String takeFollowingCommand(ArgCursor cursor) {
        Optional<Arg> next = cursor.nextAllowingNumbers();
        if (next.isEmpty()) {
            return null;
        }
        if (!next.get().isValue()) {
            throw next.get().unexpected();
        }
        return next.get().text();
    }

    // A numeric window id is only taken as the target when the two coordinates still follow it.
    private boolean leadsGeometry(String token, ArgCursor cursor) {
        if (resolver.isStackReference(token)) {
            return true;
        }
        return WindowReferenceResolver.explicitId(token).isPresent()
            && cursor.peek(0).filter(next -> AxisValue.isValid(next, "x")).isPresent()
            && cursor.peek(1).filter(next -> AxisValue.isValid(next, "y")).isPresent();
    }

    private boolean leadsDesktop(String token, ArgCursor cursor) {
        if (resolver.isStackReference(token)) {
            return true;
        }
        return WindowReferenceResolver.explicitId(token).isPresent()
            && cursor.peek(0).filter(DirectiveParser::isInteger).isPresent();
    }

    private static WindowReference orDefault(WindowReference target) {
        return target == null ? WindowReference.defaultReference() : target;
    }

    private static boolean isInteger(String token) {
        try {
            Integer.parseInt(token);
            return true;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    static int parseInteger(String name, String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            throw DirectiveException.invalidValue(name, token, ex);
        }
    }

    private static int parseNonNegative(String name, String token) {
        int value = parseInteger(name, token);
        if (value < 0) {
            throw DirectiveException.invalidValue(name, token, null);
        }
        return value;
    }
}
