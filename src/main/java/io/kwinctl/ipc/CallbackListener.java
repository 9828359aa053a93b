package io.kwinctl.ipc;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that keeps the host's callback registration open and appends every callback to the
 * session's {@link MessageLog}. Runs until {@link #cancel()} is called.
 */
final class CallbackListener implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(CallbackListener.class);
    private static final long POLL_TIMEOUT_MILLIS = 1_000;

    private final ScriptHost host;
    private final MessageLog messages;
    private final CountDownLatch ready = new CountDownLatch(1);
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile RuntimeException failure;

    CallbackListener(ScriptHost host, MessageLog messages) {
        this.host = Objects.requireNonNull(host, "host");
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    @Override
    public void run() {
        try (ScriptHost.Registration ignored = host.receiveCallbacks(this::onCallback)) {
            ready.countDown();
            while (!cancelled.await(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.trace("Listening for callbacks, {} received", messages.size());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException ex) {
            failure = ex;
        } finally {
            ready.countDown();
        }
        log.debug("Callback listener stopped");
    }

    private void onCallback(String tag, String payload) {
        log.debug("Callback {}: {}", tag, payload);
        messages.append(new Message(tag, payload));
    }

    /**
     * Waits until the registration is in place, rethrowing a failure to register.
     */
    void awaitReady(Duration timeout) throws InterruptedException {
        if (!ready.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new ScriptHostException("receiveCallbacks", "listener not ready after " + timeout.toMillis() + " ms");
        }
        RuntimeException error = failure;
        if (error != null) {
            throw error;
        }
    }

    void cancel() {
        cancelled.countDown();
    }
}
