package io.kwinctl.compile;

import io.kwinctl.template.Bindings;
import io.kwinctl.template.Fragment;
import io.kwinctl.template.TemplateRenderException;
import io.kwinctl.template.TemplateRenderer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a chain of directives into one script: header, one fragment per directive in argument order, the
 * last-output trailer when the final directive is a query, then the footer.
 */
public final class PipelineCompiler {
    private static final Logger log = LoggerFactory.getLogger(PipelineCompiler.class);

    private enum State {
        AWAITING_COMMAND,
        COMPILING,
        DONE
    }

    private final TemplateRenderer renderer;
    private final DirectiveParser parser;
    private final StepRenderer steps;

    public PipelineCompiler(TemplateRenderer renderer) {
        this(renderer, new DirectiveParser());
    }

    public PipelineCompiler(TemplateRenderer renderer, DirectiveParser parser) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.steps = new StepRenderer(renderer);
    }

    public static PipelineCompiler bundled() {
        return new PipelineCompiler(TemplateRenderer.bundled());
    }

    public GeneratedScript compile(List<String> tokens, Bindings base) {
        Objects.requireNonNull(base, "base");
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("No command given");
        }
        var cursor = new ArgCursor(tokens);
        List<Step> compiled = new ArrayList<>();
        State state = State.AWAITING_COMMAND;
        String command = null;
        while (state != State.DONE) {
            switch (state) {
                case AWAITING_COMMAND -> {
                    Optional<Arg> next = cursor.next();
                    if (next.isEmpty()) {
                        state = State.DONE;
                    } else if (!next.get().isValue()) {
                        throw next.get().unexpected();
                    } else {
                        command = next.get().text();
                        state = State.COMPILING;
                    }
                }
                case COMPILING -> {
                    Step step = compileStep(command, cursor, base);
                    compiled.add(step);
                    log.debug("Compiled step {}: {}", compiled.size(), step.command().commandName());
                    if (step.pushback().isPresent()) {
                        command = step.pushback().get();
                    } else {
                        state = State.AWAITING_COMMAND;
                    }
                }
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
        }

        boolean endsWithQuery = compiled.get(compiled.size() - 1).query();
        Optional<String> trailer = endsWithQuery
            ? Optional.of(renderer.render(Fragment.LAST_OUTPUT, base))
            : Optional.empty();
        return new GeneratedScript(
            renderer.render(Fragment.HEADER, base),
            compiled,
            trailer,
            renderer.render(Fragment.FOOTER, base)
        );
    }

    private Step compileStep(String command, ArgCursor cursor, Bindings base) {
        try {
            return steps.render(parser.parse(command, cursor), base);
        } catch (DirectiveException | TemplateRenderException ex) {
            throw new PipelineCompileException(command, ex);
        }
    }
}
