package io.kwinctl.template;

/**
 * Structural fragments of a generated script. Per-command action bodies are looked up by command name instead.
 */
public enum Fragment {
    HEADER("header"),
    FOOTER("footer"),
    LAST_OUTPUT("last_output"),
    ACTION_ON_WINDOW_ID("action_on_window_id"),
    ACTION_ON_STACK_ITEM("action_on_stack_item"),
    ACTION_ON_STACK_ALL("action_on_stack_all"),
    GLOBAL_ACTION("global_action"),
    SEARCH("search"),
    GET_ACTIVE_WINDOW("getactivewindow"),
    SAVE_WINDOW_STACK("savewindowstack"),
    LOAD_WINDOW_STACK("loadwindowstack");

    private final String key;

    Fragment(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
