package io.kwinctl.cli;

import io.kwinctl.api.HostVersion;
import io.kwinctl.api.KwinctlRunner;
import io.kwinctl.api.LogLevel;
import io.kwinctl.api.RunConfiguration;
import io.kwinctl.api.RunResult;
import io.kwinctl.compile.PipelineCompiler;
import io.kwinctl.ipc.ScriptHostFactory;
import io.kwinctl.shared.KwinctlConfig;
import io.kwinctl.shared.LoggingSupport;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "kwinctl",
    description = "Compile a chain of window commands into a KWin script and run it.",
    versionProvider = VersionProvider.class,
    sortOptions = false
)
final class KwinctlCommand implements Callable<Integer> {
    private final ScriptHostFactory hosts;
    private final Map<String, String> environment;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help.")
    private boolean help;

    @CommandLine.Option(names = {"-v", "--version"}, versionHelp = true, description = "Show program version.")
    private boolean version;

    @CommandLine.Option(names = {"-d", "--debug"}, description = "Enable debug output.")
    private boolean debug;

    @CommandLine.Option(names = {"-n", "--dry-run"}, description = "Print the generated script without running it.")
    private boolean dryRun;

    @CommandLine.Option(
        names = "--shortcut",
        paramLabel = "KEY",
        description = "Register the pipeline under a global shortcut instead of running it once."
    )
    private String shortcut;

    @CommandLine.Option(
        names = "--name",
        paramLabel = "NAME",
        description = "Name to load the script under; use it with --remove later."
    )
    private String name;

    @CommandLine.Option(names = "--remove", paramLabel = "NAME", description = "Remove a previously registered script.")
    private String remove;

    @CommandLine.Option(names = "--config", paramLabel = "PATH", description = "Configuration file (TOML).")
    private Path configFile;

    @CommandLine.Parameters(paramLabel = "COMMAND", arity = "0..*", description = "Commands and their arguments.")
    private List<String> pipeline = new ArrayList<>();

    KwinctlCommand(ScriptHostFactory hosts, Map<String, String> environment) {
        this.hosts = Objects.requireNonNull(hosts, "hosts");
        this.environment = Map.copyOf(environment);
    }

    @Override
    public Integer call() throws Exception {
        CommandLine commandLine = spec.commandLine();
        if (pipeline.isEmpty() && remove == null) {
            commandLine.usage(commandLine.getOut());
            return 0;
        }

        KwinctlConfig config = KwinctlConfig.load(KwinctlConfig.locate(configFile, environment));
        LogLevel logLevel = debug ? config.logLevel().mostVerbose(LogLevel.DEBUG) : config.logLevel();
        LoggingSupport.apply(logLevel);
        HostVersion hostVersion = config.hostVersion().orElseGet(() -> HostVersion.detect(environment));

        RunConfiguration configuration = RunConfiguration.builder()
            .tokens(pipeline)
            .debug(debug)
            .dryRun(dryRun)
            .shortcut(Optional.ofNullable(shortcut).filter(value -> !value.isEmpty()))
            .scriptName(name == null ? "" : name)
            .remove(Optional.ofNullable(remove))
            .hostVersion(hostVersion)
            .replyTimeout(config.replyTimeout())
            .completionTimeout(config.completionTimeout())
            .logLevel(logLevel)
            .cmdline(commandLineText(commandLine))
            .build();

        var runner = new KwinctlRunner(hosts, PipelineCompiler.bundled(), commandLine.getOut(), commandLine.getErr());
        RunResult result = runner.run(configuration);
        return result.status().exitCode();
    }

    private static String commandLineText(CommandLine commandLine) {
        List<String> words = new ArrayList<>();
        words.add(commandLine.getCommandName());
        CommandLine.ParseResult parseResult = commandLine.getParseResult();
        if (parseResult != null) {
            words.addAll(parseResult.originalArgs());
        }
        return String.join(" ", words);
    }
}
