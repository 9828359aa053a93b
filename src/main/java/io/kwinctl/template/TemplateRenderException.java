package io.kwinctl.template;

/**
 * Raised when a fragment and its bindings disagree: an unbound placeholder or a malformed fragment.
 * It signals a defect in the fragment catalog or the code that binds it, never bad user input.
 */
public final class TemplateRenderException extends IllegalStateException {
    private final String fragment;

    public TemplateRenderException(String fragment, String message) {
        super("fragment '" + fragment + "': " + message);
        this.fragment = fragment;
    }

    public static TemplateRenderException unbound(String fragment, String variable) {
        return new TemplateRenderException(fragment, "variable '" + variable + "' is not bound");
    }

    public String fragment() {
        return fragment;
    }
}
