package io.kwinctl.ipc;

import java.util.Objects;

/**
 * One callback received from the running script, in arrival order.
 */
public record Message(String tag, String payload) {
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    /** Reserved tag the script sends last in one-shot mode; never printed. */
    public static final String DONE = "done";

    public Message {
        Objects.requireNonNull(tag, "tag");
        payload = payload == null ? "" : payload;
    }

    public boolean isResult() {
        return RESULT.equals(tag);
    }

    public boolean isError() {
        return ERROR.equals(tag);
    }

    public boolean isDone() {
        return DONE.equals(tag);
    }
}
