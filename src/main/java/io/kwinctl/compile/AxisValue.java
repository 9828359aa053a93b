package io.kwinctl.compile;

/**
 * One coordinate of a move or size directive.
 */
public record AxisValue(Mode mode, int value) {
    public enum Mode {
        /** The keyword ({@code x} or {@code y}) was given: leave this axis as it is. */
        UNSET,
        ABSOLUTE,
        PERCENT
    }

    public static AxisValue unset() {
        return new AxisValue(Mode.UNSET, 0);
    }

    public static AxisValue absolute(int value) {
        return new AxisValue(Mode.ABSOLUTE, value);
    }

    public static AxisValue percent(int value) {
        return new AxisValue(Mode.PERCENT, value);
    }

    /**
     * Parses {@code keyword}, an integer, or an integer followed by {@code %}.
     */
    public static AxisValue parse(String token, String keyword) {
        if (keyword.equals(token)) {
            return unset();
        }
        try {
            if (token.endsWith("%")) {
                return percent(Integer.parseInt(token.substring(0, token.length() - 1)));
            }
            return absolute(Integer.parseInt(token));
        } catch (NumberFormatException ex) {
            throw DirectiveException.invalidValue(keyword, token, ex);
        }
    }

    public static boolean isValid(String token, String keyword) {
        try {
            parse(token, keyword);
            return true;
        } catch (DirectiveException ex) {
            return false;
        }
    }

    String absoluteBinding() {
        return mode == Mode.ABSOLUTE ? Integer.toString(value) : "";
    }

    String percentBinding() {
        return mode == Mode.PERCENT ? Integer.toString(value) : "";
    }
}
