package io.kwinctl.compile;

/**
 * One classified command-line token.
 */
public record Arg(Type type, String text) {
    public enum Type {
        LONG,
        SHORT,
        VALUE
    }

    static Arg longFlag(String name) {
        return new Arg(Type.LONG, name);
    }

    static Arg shortFlag(char name) {
        return new Arg(Type.SHORT, String.valueOf(name));
    }

    static Arg value(String text) {
        return new Arg(Type.VALUE, text);
    }

    public boolean isLong(String name) {
        return type == Type.LONG && text.equals(name);
    }

    public boolean isValue() {
        return type == Type.VALUE;
    }

    public String display() {
        return switch (type) {
            case LONG -> "'--" + text + "'";
            case SHORT -> "'-" + text + "'";
            case VALUE -> "'" + text + "'";
        };
    }

    public DirectiveException unexpected() {
        return DirectiveException.unexpectedArgument(display());
    }
}
