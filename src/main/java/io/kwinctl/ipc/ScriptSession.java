package io.kwinctl.ipc;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One load-and-run exchange with the scripting host.
 *
 * <p>The session owns the {@link MessageLog} and the callback listener task. Remote calls are issued strictly
 * one after another from the calling thread; the listener is the only writer of the log and the log is read
 * only after {@code run} (and {@code stop}) have returned.</p>
 */
public final class ScriptSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScriptSession.class);
    private static final String SCRIPT_PREFIX = "kwinctl-";
    private static final String SCRIPT_SUFFIX = ".js";

    private final ScriptHost host;
    private final Duration replyTimeout;
    private final Duration completionTimeout;
    private final MessageLog messages = new MessageLog();
    private final ExecutorService listenerExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "kwinctl-callbacks");
        thread.setDaemon(true);
        return thread;
    });
    private CallbackListener listener;

    public ScriptSession(ScriptHost host, Duration replyTimeout, Duration completionTimeout) {
        this.host = Objects.requireNonNull(host, "host");
        this.replyTimeout = Objects.requireNonNull(replyTimeout, "replyTimeout");
        this.completionTimeout = Objects.requireNonNull(completionTimeout, "completionTimeout");
    }

    /**
     * Creates the uniquely named file the script is written to; its file name is the script marker.
     */
    public static Path createScriptFile() throws IOException {
        return Files.createTempFile(SCRIPT_PREFIX, SCRIPT_SUFFIX);
    }

    public String callbackAddress() {
        return host.callbackAddress();
    }

    /**
     * Writes, loads and runs the script. In one-shot mode the script is stopped right after {@code run} and the
     * session waits up to the completion timeout for the script's {@code done} callback. The script file is
     * deleted once the host has loaded it.
     */
    public SessionOutcome execute(Path scriptFile, String scriptText, String scriptName, boolean persistent)
        throws IOException, InterruptedException {
        Files.writeString(scriptFile, scriptText, StandardCharsets.UTF_8);
        int scriptId;
        log.debug("===== Load script into KWin =====");
        try {
            scriptId = host.loadScript(scriptFile, scriptName);
        } finally {
            deleteScriptFile(scriptFile);
        }
        log.debug("Script ID: {}", scriptId);

        startListener();

        log.debug("===== Run script =====");
        host.runScript(scriptId);
        boolean completed = false;
        if (!persistent) {
            host.stopScript(scriptId);
            completed = messages.awaitTag(Message.DONE, completionTimeout);
            if (!completed) {
                log.warn("Script did not report completion within {} ms; printing what arrived",
                    completionTimeout.toMillis());
            }
        }
        return new SessionOutcome(scriptId, messages.snapshot(), completed);
    }

    private void startListener() throws InterruptedException {
        if (listener != null) {
            return;
        }
        listener = new CallbackListener(host, messages);
        listenerExecutor.execute(listener);
        listener.awaitReady(replyTimeout);
    }

    /**
     * Prints received callbacks in arrival order: results to {@code out}, errors to {@code err} prefixed with
     * {@code ERROR:}, any other tag as {@code tag: payload}. The completion callback is not printed.
     */
    public static void drain(List<Message> received, PrintWriter out, PrintWriter err) {
        for (Message message : received) {
            if (message.isResult()) {
                out.println(message.payload());
            } else if (message.isError()) {
                err.println("ERROR: " + message.payload());
            } else if (!message.isDone()) {
                out.println(message.tag() + ": " + message.payload());
            }
        }
        out.flush();
        err.flush();
    }

    MessageLog messages() {
        return messages;
    }

    private static void deleteScriptFile(Path scriptFile) {
        try {
            Files.deleteIfExists(scriptFile);
        } catch (IOException ex) {
            log.warn("Unable to delete script file {}: {}", scriptFile, ex.getMessage());
        }
    }

    /**
     * Cancels the listener, waits briefly for it to release its registration, then closes the host.
     */
    @Override
    public void close() {
        if (listener != null) {
            listener.cancel();
        }
        listenerExecutor.shutdown();
        try {
            if (!listenerExecutor.awaitTermination(replyTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Callback listener did not stop within {} ms", replyTimeout.toMillis());
                listenerExecutor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            listenerExecutor.shutdownNow();
        } finally {
            host.close();
        }
    }

    /**
     * @param completed whether the script reported completion; always {@code false} for persistent scripts
     */
    public record SessionOutcome(int scriptId, List<Message> messages, boolean completed) {
        public SessionOutcome {
            messages = List.copyOf(messages);
        }
    }
}
