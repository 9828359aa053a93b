package io.kwinctl.ipc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScriptSessionTest {
    private static final Duration REPLY_TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path tempDir;

    @Test
    void oneShotRunLoadsRunsStopsAndCollectsCallbacks() throws Exception {
        var host = new FakeScriptHost().reply("result", "{a}").reply("error", "boom").reply("result", "{b}");
        Path scriptFile = tempDir.resolve("kwinctl-1.js");

        ScriptSession.SessionOutcome outcome;
        try (var session = new ScriptSession(host, REPLY_TIMEOUT, Duration.ofSeconds(5))) {
            outcome = session.execute(scriptFile, "run();", "", false);
        }

        assertEquals(List.of("loadScript:", "run:7", "stop:7"), host.calls());
        assertEquals("run();", host.loadedScript());
        assertTrue(outcome.completed());
        assertEquals(7, outcome.scriptId());
        assertEquals(List.of(
            new Message("result", "{a}"),
            new Message("error", "boom"),
            new Message("result", "{b}"),
            new Message(Message.DONE, "kwinctl-1.js")
        ), outcome.messages());
        assertFalse(Files.exists(scriptFile));
        assertTrue(host.isClosed());
    }

    @Test
    void persistentRunIsNotStopped() throws Exception {
        var host = new FakeScriptHost().withoutCompletion();
        try (var session = new ScriptSession(host, REPLY_TIMEOUT, Duration.ofSeconds(5))) {
            var outcome = session.execute(tempDir.resolve("kwinctl-2.js"), "", "focus", true);
            assertFalse(outcome.completed());
        }
        assertEquals(List.of("loadScript:focus", "run:7"), host.calls());
    }

    @Test
    void missingCompletionStillReturnsWhatArrived() throws Exception {
        var host = new FakeScriptHost().reply("result", "1").withoutCompletion();
        try (var session = new ScriptSession(host, REPLY_TIMEOUT, Duration.ofMillis(50))) {
            var outcome = session.execute(tempDir.resolve("kwinctl-3.js"), "", "", false);
            assertFalse(outcome.completed());
            assertEquals(List.of(new Message("result", "1")), outcome.messages());
        }
    }

    @Test
    void listenerRegistrationFailureSurfaces() {
        var host = new FakeScriptHost();
        var failing = new ScriptHost() {
            @Override
            public String callbackAddress() {
                return host.callbackAddress();
            }

            @Override
            public int loadScript(Path script, String name) {
                return host.loadScript(script, name);
            }

            @Override
            public void runScript(int scriptId) {
                host.runScript(scriptId);
            }

            @Override
            public void stopScript(int scriptId) {
                host.stopScript(scriptId);
            }

            @Override
            public void unloadScript(String name) {
                host.unloadScript(name);
            }

            @Override
            public Registration receiveCallbacks(CallbackHandler handler) {
                throw new ScriptHostException("receiveCallbacks", "bus gone");
            }

            @Override
            public void close() {
                host.close();
            }
        };

        try (var session = new ScriptSession(failing, REPLY_TIMEOUT, Duration.ofMillis(50))) {
            var ex = assertThrows(ScriptHostException.class,
                () -> session.execute(tempDir.resolve("kwinctl-4.js"), "", "", false));
            assertEquals("receiveCallbacks", ex.operation());
        }
        assertEquals(List.of("loadScript:"), host.calls());
    }

    @Test
    void drainRoutesMessagesByTag() {
        var out = new StringWriter();
        var err = new StringWriter();
        ScriptSession.drain(List.of(
            new Message("result", "42"),
            new Message("error", "no window"),
            new Message("debug", "step 1"),
            new Message(Message.DONE, "kwinctl-5.js")
        ), new PrintWriter(out), new PrintWriter(err));

        String nl = System.lineSeparator();
        assertEquals("42" + nl + "debug: step 1" + nl, out.toString());
        assertEquals("ERROR: no window" + nl, err.toString());
    }
}
