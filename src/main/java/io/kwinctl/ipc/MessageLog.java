package io.kwinctl.ipc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only, ordered log of received callbacks. The listener is the only writer.
 */
public final class MessageLog {
    private final List<Message> messages = new ArrayList<>();

    public synchronized void append(Message message) {
        messages.add(message);
        notifyAll();
    }

    /**
     * Blocks until a message with {@code tag} has been appended or {@code timeout} elapses.
     *
     * @return whether the tag arrived
     */
    public synchronized boolean awaitTag(String tag, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!containsTag(tag)) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0L) {
                return false;
            }
            wait(remainingMillis);
        }
        return true;
    }

    private boolean containsTag(String tag) {
        for (Message message : messages) {
            if (message.tag().equals(tag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copy of everything received so far, in arrival order.
     */
    public synchronized List<Message> snapshot() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }
}
