package io.kwinctl.cli;

import io.kwinctl.compile.Command;
import io.kwinctl.ipc.DbusScriptHost;
import io.kwinctl.ipc.ScriptHostFactory;
import java.util.Map;
import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        int exitCode = commandLine(DbusScriptHost.factory(), System.getenv()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(ScriptHostFactory hosts, Map<String, String> environment) {
        var commandLine = new CommandLine(new KwinctlCommand(hosts, environment))
            .setStopAtPositional(true)
            .setExpandAtFiles(false)
            .setExecutionExceptionHandler(new ShortErrorHandler());
        commandLine.getCommandSpec().usageMessage().footer(footer());
        return commandLine;
    }

    static String footer() {
        var footer = new StringBuilder("%nCommands:%n");
        for (Command command : Command.values()) {
            footer.append("  ").append(command.usageLine().replace("%", "%%")).append("%n");
        }
        footer.append("%nWindow can be specified as:%n")
            .append("  %%1 - the first window in the stack (default)%n")
            .append("  %%N - the Nth window in the stack%n")
            .append("  %%@ - all windows in the stack%n")
            .append("  <window id> - the window with the given ID%n");
        return footer.toString();
    }
}
