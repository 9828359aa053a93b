package io.kwinctl.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Closed catalog of compiled script fragments: one per {@link Fragment} plus one action body per command name.
 * The bundled catalog is {@code fragments.yaml} next to this class.
 */
public final class FragmentCatalog {
    static final String BUNDLED_RESOURCE = "fragments.yaml";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<Fragment, Template> structural;
    private final Map<String, Template> commandBodies;

    private FragmentCatalog(Map<Fragment, Template> structural, Map<String, Template> commandBodies) {
        this.structural = structural;
        this.commandBodies = commandBodies;
    }

    public static FragmentCatalog bundled() {
        return Holder.BUNDLED;
    }

    public static FragmentCatalog load(InputStream in) throws IOException {
        Document document = YAML_MAPPER.readValue(in, Document.class);
        return of(
            document.fragments() == null ? Map.of() : document.fragments(),
            document.commands() == null ? Map.of() : document.commands()
        );
    }

    /**
     * Builds a catalog from raw fragment sources keyed by {@link Fragment#key()} and by command name.
     * Every structural fragment must be present.
     */
    public static FragmentCatalog of(Map<String, String> fragments, Map<String, String> commands) {
        Map<Fragment, Template> structural = new EnumMap<>(Fragment.class);
        for (Fragment fragment : Fragment.values()) {
            String source = fragments.get(fragment.key());
            if (source == null) {
                throw new IllegalStateException("Fragment catalog is missing '" + fragment.key() + "'");
            }
            structural.put(fragment, Template.compile(fragment.key(), source));
        }
        Map<String, Template> bodies = new LinkedHashMap<>();
        commands.forEach((name, source) ->
            bodies.put(name, Template.compile(name, Objects.requireNonNull(source, name))));
        return new FragmentCatalog(Collections.unmodifiableMap(structural), Collections.unmodifiableMap(bodies));
    }

    Template structural(Fragment fragment) {
        return structural.get(fragment);
    }

    Template commandBody(String command) {
        Template template = commandBodies.get(command);
        if (template == null) {
            throw new TemplateRenderException(command, "no action body in the fragment catalog");
        }
        return template;
    }

    public boolean hasCommandBody(String command) {
        return commandBodies.containsKey(command);
    }

    record Document(Map<String, String> fragments, Map<String, String> commands) {}

    private static final class Holder {
        private static final FragmentCatalog BUNDLED = loadBundled();

        private static FragmentCatalog loadBundled() {
            try (InputStream in = FragmentCatalog.class.getResourceAsStream(BUNDLED_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing bundled resource " + BUNDLED_RESOURCE);
                }
                return load(in);
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to read bundled fragment catalog", ex);
            }
        }
    }
}
