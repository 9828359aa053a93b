package io.kwinctl.compile;

import io.kwinctl.template.Bindings;
import io.kwinctl.template.Fragment;
import io.kwinctl.template.TemplateRenderer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a parsed directive into its script fragment. Each step layers its own fields over the session
 * bindings; the session bindings themselves are never modified.
 */
public final class StepRenderer {
    private final TemplateRenderer renderer;

    public StepRenderer(TemplateRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        for (Command command : Command.values()) {
            if (command.hasActionBody() && !renderer.catalog().hasCommandBody(command.commandName())) {
                throw new IllegalStateException("Fragment catalog has no action body for " + command.commandName());
            }
        }
    }

    public Step render(ParsedDirective parsed, Bindings base) {
        Directive directive = parsed.directive();
        Bindings step = base.with("step_name", directive.command().commandName());
        String fragment;
        boolean query;
        if (directive instanceof Directive.Search search) {
            fragment = renderer.render(Fragment.SEARCH, step.withAll(searchBindings(search.options())));
            query = true;
        } else if (directive instanceof Directive.ActiveWindow) {
            fragment = renderer.render(Fragment.GET_ACTIVE_WINDOW, step);
            query = true;
        } else if (directive instanceof Directive.WindowStack stack) {
            boolean load = stack.command() == Command.LOADWINDOWSTACK;
            Fragment stackFragment = load ? Fragment.LOAD_WINDOW_STACK : Fragment.SAVE_WINDOW_STACK;
            fragment = renderer.render(stackFragment, step.with("name", ScriptLiterals.quoteContent(stack.name())));
            query = load;
        } else if (directive instanceof Directive.WindowDirective window) {
            String action = renderer.renderCommand(window.command().commandName(), step.withAll(actionBindings(window)));
            fragment = renderer.render(window.target().wrapper(), step.withAll(targetBindings(window.target())).with("action", action.strip()));
            query = false;
        } else if (directive instanceof Directive.GlobalAction global) {
            Bindings bindings = step.with("n", global.argument().isPresent() ? global.argument().getAsInt() : null);
            String action = renderer.renderCommand(global.command().commandName(), bindings);
            fragment = renderer.render(Fragment.GLOBAL_ACTION, bindings.with("action", action.strip()));
            query = false;
        } else {
            throw new IllegalArgumentException("Unsupported directive: " + directive);
        }
        return new Step(directive.command(), fragment, query, parsed.pushback());
    }

    private static Map<String, Object> searchBindings(SearchOptions options) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("match_class", options.matchClass());
        values.put("match_classname", options.matchClassname());
        values.put("match_role", options.matchRole());
        values.put("match_name", options.matchName());
        values.put("match_pid", options.matchPid());
        values.put("pid", options.pid());
        values.put("match_desktop", options.matchDesktop());
        values.put("desktop", options.desktop());
        values.put("match_screen", options.matchScreen());
        values.put("screen", options.screen());
        values.put("limit", options.limit());
        values.put("match_all", options.matchAll());
        values.put("search_term", ScriptLiterals.quoteContent(options.searchTerm()));
        return values;
    }

    private static Map<String, Object> actionBindings(Directive.WindowDirective window) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (window instanceof Directive.WindowState state) {
            values.put("windowstate", state.mutations().stream()
                .map(StateMutation::toScript)
                .collect(Collectors.joining())
                .strip());
        } else if (window instanceof Directive.WindowGeometry geometry) {
            values.put("relative", geometry.relative());
            values.put("x", geometry.x().absoluteBinding());
            values.put("x_percent", geometry.x().percentBinding());
            values.put("y", geometry.y().absoluteBinding());
            values.put("y_percent", geometry.y().percentBinding());
        } else if (window instanceof Directive.WindowDesktop desktop) {
            values.put("desktop_id", desktop.desktop());
        }
        return values;
    }

    private static Map<String, Object> targetBindings(WindowReference target) {
        if (target instanceof WindowReference.ExplicitId explicit) {
            return Map.of("window_id", ScriptLiterals.quoteContent(explicit.id()));
        }
        if (target instanceof WindowReference.StackIndex index) {
            return Map.of("item_index", index.index());
        }
        return Map.of();
    }
}
