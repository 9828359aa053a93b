package io.kwinctl.compile;

/**
 * Wraps a failure raised while compiling one directive with the name of that directive.
 */
public final class PipelineCompileException extends RuntimeException {
    private final String command;

    public PipelineCompileException(String command, RuntimeException cause) {
        super("in command '" + command + "'", cause);
        this.command = command;
    }

    public String command() {
        return command;
    }
}
