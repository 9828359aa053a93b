package io.kwinctl.ipc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.kwinctl.api.HostVersion;
import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.messages.MethodCall;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Runs against a throwaway message bus; skipped where {@code dbus-daemon} is not installed.
 */
class DbusScriptHostTest {
    private static final Duration REPLY_TIMEOUT = Duration.ofSeconds(2);
    private static final int PIPELINED_CALLS = 300;

    @TempDir
    Path tempDir;

    private Process daemon;
    private String busAddress;
    private DbusScriptHost host;

    @BeforeEach
    void startBus() throws Exception {
        Optional<Path> executable = findOnPath("dbus-daemon");
        Assumptions.assumeTrue(executable.isPresent(), "dbus-daemon not installed");

        Path config = tempDir.resolve("bus.conf");
        Files.writeString(config, String.join("\n",
            "<!DOCTYPE busconfig PUBLIC \"-//freedesktop//DTD D-Bus Bus Configuration 1.0//EN\"",
            " \"http://www.freedesktop.org/standards/dbus/1.0/busconfig.dtd\">",
            "<busconfig>",
            "  <type>session</type>",
            "  <listen>unix:path=" + tempDir.resolve("bus") + "</listen>",
            "  <auth>EXTERNAL</auth>",
            "  <policy context=\"default\">",
            "    <allow send_destination=\"*\" eavesdrop=\"true\"/>",
            "    <allow eavesdrop=\"true\"/>",
            "    <allow own=\"*\"/>",
            "    <allow user=\"*\"/>",
            "  </policy>",
            "</busconfig>",
            ""));
        daemon = new ProcessBuilder(executable.get().toString(), "--config-file=" + config,
            "--nofork", "--nopidfile", "--print-address")
            .redirectError(ProcessBuilder.Redirect.DISCARD)
            .start();
        var reader = new BufferedReader(new InputStreamReader(daemon.getInputStream(), StandardCharsets.UTF_8));
        busAddress = reader.readLine();
        Assumptions.assumeTrue(busAddress != null && !busAddress.isBlank(), "dbus-daemon did not start");
        busAddress = busAddress.trim();

        host = DbusScriptHost.connect(busAddress, HostVersion.PLASMA_6, REPLY_TIMEOUT);
    }

    @AfterEach
    void stopBus() {
        if (host != null) {
            host.close();
        }
        if (daemon != null) {
            daemon.destroy();
        }
    }

    @Test
    void callbacksUseTheirOwnConnection() {
        String callbackAddress = host.callbackAddress();

        assertTrue(callbackAddress.startsWith(":"));
        assertNotEquals(host.controlAddress(), callbackAddress);
        assertEquals(callbackAddress, host.callbackAddress());
    }

    @Test
    void callbacksArriveInSendOrderWhateverTheirMember() throws Exception {
        var log = new MessageLog();
        String destination = host.callbackAddress();

        try (var registration = host.receiveCallbacks((tag, payload) -> log.append(new Message(tag, payload)));
             var sender = DBusConnectionBuilder.forAddress(busAddress).withShared(false).build()) {
            for (int i = 0; i < PIPELINED_CALLS; i++) {
                sender.sendMessage(new MethodCall(destination, "/", null, "result",
                    org.freedesktop.dbus.messages.Message.Flags.NO_REPLY_EXPECTED, "s", String.valueOf(i)));
            }
            sender.sendMessage(new MethodCall(destination, "/", null, "progress", (byte) 0, "s", "half"));

            assertTrue(log.awaitTag("progress", Duration.ofSeconds(10)));
        }

        List<Message> expected = new ArrayList<>();
        for (int i = 0; i < PIPELINED_CALLS; i++) {
            expected.add(new Message(Message.RESULT, String.valueOf(i)));
        }
        expected.add(new Message("progress", "half"));
        assertEquals(expected, log.snapshot());
    }

    @Test
    void missingScriptingHostFailsTheCall() {
        var ex = assertThrows(ScriptHostException.class, () -> host.unloadScript("focus-firefox"));
        assertEquals("unloadScript", ex.operation());
    }

    private static Optional<Path> findOnPath(String name) {
        String path = System.getenv("PATH");
        if (path == null) {
            return Optional.empty();
        }
        for (String directory : path.split(File.pathSeparator)) {
            Path candidate = Path.of(directory, name);
            if (Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
