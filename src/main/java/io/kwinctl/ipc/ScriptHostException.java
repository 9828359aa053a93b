package io.kwinctl.ipc;

/**
 * A remote call to the scripting host failed, timed out, or the bus could not be reached.
 */
public final class ScriptHostException extends RuntimeException {
    private final String operation;

    public ScriptHostException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public ScriptHostException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
