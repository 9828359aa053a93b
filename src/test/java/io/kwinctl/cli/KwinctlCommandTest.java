package io.kwinctl.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.kwinctl.api.HostVersion;
import io.kwinctl.ipc.FakeScriptHost;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class KwinctlCommandTest {
    @TempDir
    Path tempDir;

    private final FakeScriptHost host = new FakeScriptHost();
    private final List<HostVersion> opened = new ArrayList<>();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(Map<String, String> environment, String... args) {
        CommandLine commandLine = Main.commandLine((version, timeout) -> {
            opened.add(version);
            return host;
        }, environment);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private int execute(String... args) {
        return execute(Map.of("KWINCTL_CONFIG", tempDir.resolve("none.toml").toString()), args);
    }

    @Test
    void printsUsageWithoutCommands() {
        assertEquals(0, execute());
        String usage = out.toString();
        assertTrue(usage.contains("Usage: kwinctl"));
        assertTrue(usage.contains("Commands:"));
        assertTrue(usage.contains("windowmove [--relative] [window] <x> <y>"));
        assertTrue(usage.contains("%@ - all windows in the stack"));
        assertTrue(host.calls().isEmpty());
    }

    @Test
    void printsVersion() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().startsWith("kwinctl "));
    }

    @Test
    void dryRunPrintsTheGeneratedScript() {
        assertEquals(0, execute("-n", "search", "--class", "firefox", "windowactivate"));
        assertTrue(out.toString().contains("function run()"));
        assertTrue(out.toString().contains("// kwinctl -n search --class firefox windowactivate"));
        assertTrue(host.calls().isEmpty());
    }

    @Test
    void atPrefixedTermIsNotReadFromAFile() throws Exception {
        Path terms = Files.writeString(tempDir.resolve("terms"), "konsole");
        assertEquals(0, execute("-n", "search", "@" + terms));
        assertTrue(out.toString().contains("new RegExp(\"@" + terms + "\", \"i\")"));
        assertFalse(out.toString().contains("konsole"));
    }

    @Test
    void removeUnloadsByName() {
        assertEquals(0, execute("--remove", "focus-firefox"));
        assertEquals(List.of("unloadScript:focus-firefox"), host.calls());
    }

    @Test
    void runsThePipelineAndPrintsResults() {
        host.reply("result", "{0a1b}");
        assertEquals(0, execute("search", "firefox"));
        assertEquals("{0a1b}", out.toString().trim());
        assertEquals(List.of("loadScript:", "run:7", "stop:7"), host.calls());
    }

    @Test
    void globalOptionsStopAtTheFirstCommand() {
        assertEquals(1, execute("-n", "search", "-d", "firefox"));
        assertTrue(err.toString().contains("in command 'search'"));
        assertTrue(err.toString().contains("unexpected argument '-d'"));
    }

    @Test
    void argumentErrorsNameTheCommand() {
        assertEquals(1, execute("windowmove", "abc", "5"));
        String errors = err.toString();
        assertTrue(errors.contains("in command 'windowmove'"));
        assertTrue(errors.contains("invalid value 'abc' for 'x'"));
        assertFalse(errors.contains("at io.kwinctl"));
        assertTrue(host.calls().isEmpty());
    }

    @Test
    void debugAddsTheStackTrace() {
        assertEquals(1, execute("--debug", "windowmove", "abc", "5"));
        assertTrue(err.toString().contains("at io.kwinctl"));
    }

    @Test
    void sessionVersionFromEnvironmentSelectsTheHost() {
        var environment = Map.of(
            "KWINCTL_CONFIG", tempDir.resolve("none.toml").toString(),
            "KDE_SESSION_VERSION", "5");
        assertEquals(0, execute(environment, "-n", "get_desktop"));
        assertEquals(List.of(HostVersion.PLASMA_5), opened);
    }

    @Test
    void configFileOverridesTheEnvironment() throws Exception {
        Path config = tempDir.resolve("config.toml");
        Files.writeString(config, "[host]\nversion = \"6\"\n");
        var environment = Map.of("KWINCTL_CONFIG", config.toString(), "KDE_SESSION_VERSION", "5");
        assertEquals(0, execute(environment, "-n", "get_desktop"));
        assertEquals(List.of(HostVersion.PLASMA_6), opened);
    }

    @Test
    void unknownGlobalOptionIsAUsageError() {
        assertEquals(2, execute("--bogus", "search", "x"));
        assertTrue(err.toString().contains("--bogus"));
    }
}
