package io.kwinctl.api;

import io.kwinctl.compile.PipelineCompiler;
import io.kwinctl.ipc.ScriptHost;
import io.kwinctl.ipc.ScriptHostFactory;
import io.kwinctl.ipc.ScriptSession;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one invocation: unload a script by name, or compile the pipeline and either print it (dry run) or ship
 * it to the scripting host and relay what it reports.
 */
public final class KwinctlRunner {
    private static final Logger log = LoggerFactory.getLogger(KwinctlRunner.class);

    private final ScriptHostFactory hosts;
    private final PipelineCompiler compiler;
    private final PrintWriter out;
    private final PrintWriter err;

    public KwinctlRunner(ScriptHostFactory hosts, PipelineCompiler compiler, PrintWriter out, PrintWriter err) {
        this.hosts = Objects.requireNonNull(hosts, "hosts");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public RunResult run(RunConfiguration configuration) throws IOException, InterruptedException {
        var started = Instant.now();
        log.debug("Host {}, log level {}", configuration.hostVersion(), configuration.logLevel());
        if (configuration.remove().isPresent()) {
            return remove(configuration, started);
        }
        ScriptHost host = hosts.open(configuration.hostVersion(), configuration.replyTimeout());
        try (var session = new ScriptSession(host, configuration.replyTimeout(), configuration.completionTimeout())) {
            log.debug("===== Generate KWin script =====");
            Path scriptFile = ScriptSession.createScriptFile();
            try {
                var context = SessionContext.of(configuration, scriptFile.getFileName().toString(), session.callbackAddress());
                String script = compiler.compile(configuration.tokens(), context.toBindings()).text();
                log.debug("Script:{}", script);
                if (configuration.dryRun()) {
                    out.println(script.trim());
                    out.flush();
                    return RunResult.dryRun(started);
                }
                var outcome = session.execute(scriptFile, script, configuration.scriptName(), configuration.persistent());

                log.debug("===== Output =====");
                ScriptSession.drain(outcome.messages(), out, err);
                if (configuration.persistent()) {
                    printRegistration(configuration, outcome.scriptId());
                    return RunResult.registered(outcome.scriptId(), outcome.messages(), started);
                }
                return outcome.completed()
                    ? RunResult.completed(outcome.scriptId(), outcome.messages(), started)
                    : RunResult.incomplete(outcome.scriptId(), outcome.messages(), started);
            } finally {
                Files.deleteIfExists(scriptFile);
            }
        }
    }

    private RunResult remove(RunConfiguration configuration, Instant started) {
        String name = configuration.remove().orElseThrow();
        try (ScriptHost host = hosts.open(configuration.hostVersion(), configuration.replyTimeout())) {
            log.debug("Unloading script {}", name);
            host.unloadScript(name);
        }
        return RunResult.removed(started);
    }

    private void printRegistration(RunConfiguration configuration, int scriptId) {
        out.println("Shortcut registered: " + configuration.shortcut().orElseThrow());
        out.println("Script ID: " + scriptId);
        if (!configuration.scriptName().isEmpty()) {
            out.println("Script name: " + configuration.scriptName());
        }
        out.flush();
    }
}
