package io.kwinctl.ipc;

import java.io.IOException;
import java.util.Objects;
import org.freedesktop.dbus.connections.BusAddress;
import org.freedesktop.dbus.connections.transports.AbstractTransport;
import org.freedesktop.dbus.connections.transports.TransportBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.messages.Message;
import org.freedesktop.dbus.messages.MethodCall;
import org.freedesktop.dbus.messages.MethodReturn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Private bus connection the generated script calls back into.
 *
 * <p>The connection is read at the message level rather than through exported objects, so a method call is
 * accepted whatever its member name: the member is the tag and the first argument the payload. A single
 * reader thread hands calls to the handler in the order the bus delivered them.</p>
 */
final class CallbackChannel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CallbackChannel.class);

    private static final String BUS_NAME = "org.freedesktop.DBus";
    private static final String BUS_PATH = "/org/freedesktop/DBus";

    private final AbstractTransport transport;
    private final String uniqueName;
    private volatile boolean closed;
    private Thread reader;

    private CallbackChannel(AbstractTransport transport, String uniqueName) {
        this.transport = transport;
        this.uniqueName = uniqueName;
    }

    /**
     * Connects to the bus at {@code address} and registers with it, which assigns the unique name.
     */
    static CallbackChannel open(BusAddress address) throws DBusException, IOException {
        AbstractTransport transport = TransportBuilder.create(address).withAutoConnect(true).build();
        try {
            String name = hello(transport);
            log.debug("Receiving connection {}", name);
            return new CallbackChannel(transport, name);
        } catch (DBusException | IOException | RuntimeException ex) {
            try {
                transport.close();
            } catch (IOException closeFailure) {
                ex.addSuppressed(closeFailure);
            }
            throw ex;
        }
    }

    private static String hello(AbstractTransport transport) throws DBusException, IOException {
        MethodCall hello = new MethodCall(BUS_NAME, BUS_PATH, BUS_NAME, "Hello", (byte) 0, null);
        transport.writeMessage(hello);
        while (true) {
            Message reply = transport.readMessage();
            if (reply == null || reply.getReplySerial() != hello.getSerial()) {
                continue;
            }
            if (reply instanceof MethodReturn) {
                return payloadOf(reply.getParameters());
            }
            throw new DBusException("bus refused registration: " + payloadOf(reply.getParameters()));
        }
    }

    String uniqueName() {
        return uniqueName;
    }

    /**
     * Starts the reader thread. Callbacks reach {@code handler} until the channel is closed.
     */
    synchronized void start(ScriptHost.CallbackHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (reader != null) {
            throw new IllegalStateException("callback channel already started");
        }
        reader = new Thread(() -> read(handler), "kwinctl-dbus-receiver");
        reader.setDaemon(true);
        reader.start();
    }

    private void read(ScriptHost.CallbackHandler handler) {
        try {
            while (!closed) {
                Message message = transport.readMessage();
                if (message instanceof MethodCall) {
                    dispatch((MethodCall) message, handler);
                }
            }
        } catch (IOException | DBusException ex) {
            if (!closed) {
                log.warn("Callback channel {} failed: {}", uniqueName, ex.getMessage());
            }
        }
        log.debug("Callback reader for {} stopped", uniqueName);
    }

    private void dispatch(MethodCall call, ScriptHost.CallbackHandler handler) throws DBusException, IOException {
        handler.onCallback(call.getName(), payloadOf(call.getParameters()));
        if ((call.getFlags() & Message.Flags.NO_REPLY_EXPECTED) == 0) {
            transport.writeMessage(new MethodReturn(call, (String) null));
        }
    }

    static String payloadOf(Object[] parameters) {
        if (parameters == null || parameters.length == 0 || parameters[0] == null) {
            return "";
        }
        return String.valueOf(parameters[0]);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            transport.close();
        } catch (IOException ex) {
            log.warn("Failed to close callback channel {}: {}", uniqueName, ex.getMessage());
        }
    }
}
