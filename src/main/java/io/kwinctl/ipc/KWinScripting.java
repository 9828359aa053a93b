package io.kwinctl.ipc;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

/**
 * {@code org.kde.kwin.Scripting} at {@code /Scripting} on {@code org.kde.KWin}.
 */
@DBusInterfaceName("org.kde.kwin.Scripting")
public interface KWinScripting extends DBusInterface {
    int loadScript(String filePath, String pluginName);

    boolean unloadScript(String pluginName);
}
