package io.kwinctl.ipc;

import io.kwinctl.api.HostVersion;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ScriptHost} backed by KWin's scripting interface on the session bus.
 *
 * <p>Remote calls run one at a time on a private executor so that each can be bounded by the reply timeout.
 * Callbacks arrive on a separate {@link CallbackChannel} with its own unique name.</p>
 */
public final class DbusScriptHost implements ScriptHost {
    private static final Logger log = LoggerFactory.getLogger(DbusScriptHost.class);

    static final String BUS_NAME = "org.kde.KWin";
    static final String SCRIPTING_PATH = "/Scripting";

    private final DBusConnection control;
    private final HostVersion version;
    private final Duration replyTimeout;
    private final ExecutorService calls = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "kwinctl-dbus-call");
        thread.setDaemon(true);
        return thread;
    });
    private CallbackChannel receiver;

    private DbusScriptHost(DBusConnection control, HostVersion version, Duration replyTimeout) {
        this.control = control;
        this.version = version;
        this.replyTimeout = replyTimeout;
    }

    public static ScriptHostFactory factory() {
        return DbusScriptHost::connect;
    }

    public static DbusScriptHost connect(HostVersion version, Duration replyTimeout) {
        return connect(DBusConnectionBuilder.forSessionBus(), version, replyTimeout);
    }

    static DbusScriptHost connect(String busAddress, HostVersion version, Duration replyTimeout) {
        return connect(DBusConnectionBuilder.forAddress(busAddress), version, replyTimeout);
    }

    private static DbusScriptHost connect(DBusConnectionBuilder bus, HostVersion version, Duration replyTimeout) {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(replyTimeout, "replyTimeout");
        try {
            return new DbusScriptHost(bus.withShared(false).build(), version, replyTimeout);
        } catch (DBusException ex) {
            throw new ScriptHostException("connect", "cannot open bus connection: " + ex.getMessage(), ex);
        }
    }

    String controlAddress() {
        return control.getUniqueName();
    }

    @Override
    public synchronized String callbackAddress() {
        return receiver().uniqueName();
    }

    private synchronized CallbackChannel receiver() {
        if (receiver == null) {
            receiver = call("connect", () -> CallbackChannel.open(control.getAddress()));
        }
        return receiver;
    }

    @Override
    public int loadScript(Path script, String name) {
        KWinScripting scripting = remote("loadScript", SCRIPTING_PATH, KWinScripting.class);
        return call("loadScript", () -> scripting.loadScript(script.toString(), name));
    }

    @Override
    public void runScript(int scriptId) {
        KWinScript script = remote("run", version.scriptObjectPath(scriptId), KWinScript.class);
        call("run", () -> {
            script.run();
            return null;
        });
    }

    @Override
    public void stopScript(int scriptId) {
        KWinScript script = remote("stop", version.scriptObjectPath(scriptId), KWinScript.class);
        call("stop", () -> {
            script.stop();
            return null;
        });
    }

    @Override
    public void unloadScript(String name) {
        KWinScripting scripting = remote("unloadScript", SCRIPTING_PATH, KWinScripting.class);
        boolean unloaded = call("unloadScript", () -> scripting.unloadScript(name));
        log.debug("unloadScript({}) returned {}", name, unloaded);
    }

    @Override
    public Registration receiveCallbacks(CallbackHandler handler) {
        Objects.requireNonNull(handler, "handler");
        CallbackChannel channel = receiver();
        channel.start(handler);
        return channel::close;
    }

    private <T extends DBusInterface> T remote(String operation, String path, Class<T> type) {
        try {
            return control.getRemoteObject(BUS_NAME, path, type);
        } catch (DBusException ex) {
            throw new ScriptHostException(operation, "no object at " + path + ": " + ex.getMessage(), ex);
        }
    }

    private <T> T call(String operation, Callable<T> remote) {
        log.debug("Calling {}", operation);
        Future<T> future = calls.submit(remote);
        try {
            return future.get(replyTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ScriptHostException(operation, "no reply within " + replyTimeout.toMillis() + " ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new ScriptHostException(operation, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ScriptHostException(operation, "interrupted", ex);
        }
    }

    @Override
    public synchronized void close() {
        calls.shutdownNow();
        if (receiver != null) {
            receiver.close();
        }
        closeConnection(control);
    }

    private static void closeConnection(DBusConnection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (IOException ex) {
            log.warn("Failed to close D-Bus connection: {}", ex.getMessage());
        }
    }
}
