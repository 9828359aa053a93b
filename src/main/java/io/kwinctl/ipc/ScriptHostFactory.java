package io.kwinctl.ipc;

import io.kwinctl.api.HostVersion;
import java.time.Duration;

/**
 * Opens a {@link ScriptHost}; swapped for an in-memory host in tests.
 */
@FunctionalInterface
public interface ScriptHostFactory {
    ScriptHost open(HostVersion version, Duration replyTimeout);
}
