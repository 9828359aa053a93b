package io.kwinctl.compile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every directive the pipeline understands.
 */
public enum Command {
    SEARCH("search", Category.QUERY, "<term>"),
    GETACTIVEWINDOW("getactivewindow", Category.QUERY, ""),
    SAVEWINDOWSTACK("savewindowstack", Category.STACK, "<name>"),
    LOADWINDOWSTACK("loadwindowstack", Category.STACK, "<name>"),

    GETWINDOWNAME("getwindowname", Category.WINDOW_ACTION, "[window]"),
    GETWINDOWCLASSNAME("getwindowclassname", Category.WINDOW_ACTION, "[window]"),
    GETWINDOWGEOMETRY("getwindowgeometry", Category.WINDOW_ACTION, "[window]"),
    GETWINDOWPID("getwindowpid", Category.WINDOW_ACTION, "[window]"),
    GET_DESKTOP_FOR_WINDOW("get_desktop_for_window", Category.WINDOW_ACTION, "[window]"),
    WINDOWACTIVATE("windowactivate", Category.WINDOW_ACTION, "[window]"),
    ACTIVATEWINDOW("activatewindow", Category.WINDOW_ACTION, "[window]"),
    WINDOWRAISE("windowraise", Category.WINDOW_ACTION, "[window]"),
    WINDOWMINIMIZE("windowminimize", Category.WINDOW_ACTION, "[window]"),
    WINDOWCLOSE("windowclose", Category.WINDOW_ACTION, "[window]"),
    WINDOWSTATE("windowstate", Category.WINDOW_ACTION, "[window] (--add|--remove|--toggle <property>)..."),
    WINDOWMOVE("windowmove", Category.WINDOW_ACTION, "[--relative] [window] <x> <y>"),
    WINDOWSIZE("windowsize", Category.WINDOW_ACTION, "[window] <width> <height>"),
    SET_DESKTOP_FOR_WINDOW("set_desktop_for_window", Category.WINDOW_ACTION, "[window] <desktop>"),

    GET_DESKTOP("get_desktop", Category.GLOBAL_ACTION, ""),
    SET_DESKTOP("set_desktop", Category.GLOBAL_ACTION, "<desktop>"),
    GET_NUM_DESKTOPS("get_num_desktops", Category.GLOBAL_ACTION, ""),
    SET_NUM_DESKTOPS("set_num_desktops", Category.GLOBAL_ACTION, "<num>"),
    GETMOUSELOCATION("getmouselocation", Category.GLOBAL_ACTION, "");

    /**
     * Grammar family of a command.
     */
    public enum Category {
        QUERY,
        STACK,
        WINDOW_ACTION,
        GLOBAL_ACTION
    }

    private static final Map<String, Command> BY_NAME;

    static {
        var byName = new LinkedHashMap<String, Command>();
        for (Command command : values()) {
            byName.put(command.commandName, command);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String commandName;
    private final Category category;
    private final String usage;

    Command(String commandName, Category category, String usage) {
        this.commandName = commandName;
        this.category = category;
        this.usage = usage;
    }

    public String commandName() {
        return commandName;
    }

    public Category category() {
        return category;
    }

    /**
     * Whether an action body for this command lives in the fragment catalog under {@link #commandName()}.
     */
    public boolean hasActionBody() {
        return category == Category.WINDOW_ACTION || category == Category.GLOBAL_ACTION;
    }

    public String usageLine() {
        return usage.isEmpty() ? commandName : commandName + " " + usage;
    }

    public static Optional<Command> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
