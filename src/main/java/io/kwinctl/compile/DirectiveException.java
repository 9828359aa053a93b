package io.kwinctl.compile;

/**
 * A directive's arguments do not fit its grammar.
 */
public final class DirectiveException extends RuntimeException {
    /**
     * Category of argument failure.
     */
    public enum Kind {
        UNEXPECTED_ARGUMENT,
        UNEXPECTED_VALUE,
        MISSING_ARGUMENT,
        INVALID_VALUE,
        UNKNOWN_COMMAND,
        UNKNOWN_PROPERTY
    }

    private final Kind kind;

    public DirectiveException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DirectiveException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    static DirectiveException unexpectedArgument(String display) {
        return new DirectiveException(Kind.UNEXPECTED_ARGUMENT, "unexpected argument " + display);
    }

    static DirectiveException unexpectedValue(String option, String value) {
        return new DirectiveException(Kind.UNEXPECTED_VALUE, "unexpected value '" + value + "' for option '" + option + "'");
    }

    static DirectiveException missingArgument(String name) {
        return new DirectiveException(Kind.MISSING_ARGUMENT, "missing argument '" + name + "'");
    }

    static DirectiveException missingOptionValue(String option) {
        return new DirectiveException(Kind.MISSING_ARGUMENT, "missing value for option '" + option + "'");
    }

    static DirectiveException invalidValue(String name, String value, Throwable cause) {
        return new DirectiveException(Kind.INVALID_VALUE, "invalid value '" + value + "' for '" + name + "'", cause);
    }

    static DirectiveException unknownCommand(String command) {
        return new DirectiveException(Kind.UNKNOWN_COMMAND, "unknown command: " + command);
    }

    static DirectiveException unknownProperty(String property) {
        return new DirectiveException(Kind.UNKNOWN_PROPERTY, "unsupported property '" + property + "'");
    }
}
