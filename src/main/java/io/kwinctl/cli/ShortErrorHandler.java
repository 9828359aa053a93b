package io.kwinctl.cli;

import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

/**
 * Prints a failure as its message followed by one line per distinct cause; the stack trace only with
 * {@code --debug}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        List<String> lines = messages(ex);
        commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + lines.get(0)));
        for (String cause : lines.subList(1, lines.size())) {
            commandLine.getErr().println("  caused by: " + cause);
        }
        if (parseResult != null && parseResult.hasMatchedOption("--debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        commandLine.getErr().flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static List<String> messages(Throwable failure) {
        List<String> lines = new ArrayList<>();
        for (Throwable current = failure; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message == null || message.isBlank()) {
                message = current.getClass().getSimpleName();
            }
            if (!lines.contains(message)) {
                lines.add(message);
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return lines;
    }
}
