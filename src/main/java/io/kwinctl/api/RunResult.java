package io.kwinctl.api;

import io.kwinctl.ipc.Message;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Outcome of a {@link KwinctlRunner} invocation.
 */
public record RunResult(Status status, OptionalInt scriptId, List<Message> messages, Instant startedAt, Instant finishedAt) {
    public RunResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(scriptId, "scriptId");
        messages = List.copyOf(messages);
    }

    public static RunResult completed(int scriptId, List<Message> messages, Instant startedAt) {
        return new RunResult(Status.COMPLETED, OptionalInt.of(scriptId), messages, startedAt, Instant.now());
    }

    public static RunResult incomplete(int scriptId, List<Message> messages, Instant startedAt) {
        return new RunResult(Status.INCOMPLETE, OptionalInt.of(scriptId), messages, startedAt, Instant.now());
    }

    public static RunResult registered(int scriptId, List<Message> messages, Instant startedAt) {
        return new RunResult(Status.REGISTERED, OptionalInt.of(scriptId), messages, startedAt, Instant.now());
    }

    public static RunResult dryRun(Instant startedAt) {
        return new RunResult(Status.DRY_RUN, OptionalInt.empty(), List.of(), startedAt, Instant.now());
    }

    public static RunResult removed(Instant startedAt) {
        return new RunResult(Status.REMOVED, OptionalInt.empty(), List.of(), startedAt, Instant.now());
    }

    public enum Status {
        COMPLETED(0),
        /** The script never sent its completion callback; whatever arrived was still printed. */
        INCOMPLETE(0),
        REGISTERED(0),
        DRY_RUN(0),
        REMOVED(0);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
