package io.kwinctl.ipc;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

/**
 * {@code org.kde.kwin.Script}, one object per loaded script.
 */
@DBusInterfaceName("org.kde.kwin.Script")
public interface KWinScript extends DBusInterface {
    void run();

    void stop();
}
