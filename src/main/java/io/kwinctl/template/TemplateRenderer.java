package io.kwinctl.template;

import java.util.Objects;

/**
 * Renders catalog fragments against {@link Bindings} in strict mode: an unbound placeholder is a
 * {@link TemplateRenderException}.
 */
public final class TemplateRenderer {
    private final FragmentCatalog catalog;

    public TemplateRenderer(FragmentCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public static TemplateRenderer bundled() {
        return new TemplateRenderer(FragmentCatalog.bundled());
    }

    public FragmentCatalog catalog() {
        return catalog;
    }

    public String render(Fragment fragment, Bindings bindings) {
        return catalog.structural(fragment).render(bindings);
    }

    public String renderCommand(String command, Bindings bindings) {
        return catalog.commandBody(command).render(bindings);
    }
}
