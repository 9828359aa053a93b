package io.kwinctl.template;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A compiled fragment. Supports {@code {{name}}} substitution and {@code {{#if name}}} / {@code {{#unless name}}}
 * blocks with an optional {@code {{else}}}. Values are inserted verbatim; rendering is strict, so every
 * referenced name has to be bound, even inside a branch that is not taken.
 */
final class Template {
    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final List<Node> nodes;

    private Template(String name, List<Node> nodes) {
        this.name = name;
        this.nodes = nodes;
    }

    String name() {
        return name;
    }

    String render(Bindings bindings) {
        var out = new StringBuilder();
        renderAll(nodes, bindings, out);
        return out.toString();
    }

    private void renderAll(List<Node> children, Bindings bindings, StringBuilder out) {
        for (Node node : children) {
            if (node instanceof Text text) {
                out.append(text.value());
            } else if (node instanceof Variable variable) {
                out.append(stringify(lookup(bindings, variable.name())));
            } else if (node instanceof Block block) {
                boolean truthy = isTruthy(lookup(bindings, block.name()));
                // both branches are checked so a missing binding cannot hide behind a false condition
                checkBound(block.whenTrue(), bindings);
                checkBound(block.whenFalse(), bindings);
                renderAll(truthy != block.negated() ? block.whenTrue() : block.whenFalse(), bindings, out);
            }
        }
    }

    private void checkBound(List<Node> children, Bindings bindings) {
        for (Node node : children) {
            if (node instanceof Variable variable) {
                lookup(bindings, variable.name());
            } else if (node instanceof Block block) {
                lookup(bindings, block.name());
                checkBound(block.whenTrue(), bindings);
                checkBound(block.whenFalse(), bindings);
            }
        }
    }

    private Object lookup(Bindings bindings, String variable) {
        if (!bindings.contains(variable)) {
            throw TemplateRenderException.unbound(name, variable);
        }
        return bindings.get(variable);
    }

    static String stringify(Object value) {
        return value == null ? "" : value.toString();
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0d;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    static Template compile(String name, String source) {
        var root = new ArrayList<Node>();
        Deque<OpenBlock> open = new ArrayDeque<>();
        List<Node> target = root;
        int position = 0;
        while (position < source.length()) {
            int start = source.indexOf(OPEN, position);
            if (start < 0) {
                target.add(new Text(source.substring(position)));
                break;
            }
            if (start > position) {
                target.add(new Text(source.substring(position, start)));
            }
            int end = source.indexOf(CLOSE, start + OPEN.length());
            if (end < 0) {
                throw new TemplateRenderException(name, "unterminated tag at offset " + start);
            }
            String tag = source.substring(start + OPEN.length(), end).trim();
            position = end + CLOSE.length();

            if (tag.startsWith("#if ") || tag.startsWith("#unless ")) {
                boolean negated = tag.startsWith("#unless ");
                String variable = requireName(name, tag.substring(tag.indexOf(' ') + 1).trim());
                var block = new OpenBlock(negated ? "unless" : "if", variable, negated, target);
                open.push(block);
                target = block.whenTrue;
            } else if ("else".equals(tag)) {
                OpenBlock block = open.peek();
                if (block == null || block.inElse) {
                    throw new TemplateRenderException(name, "unexpected {{else}} at offset " + start);
                }
                block.inElse = true;
                target = block.whenFalse;
            } else if (tag.startsWith("/")) {
                OpenBlock block = open.poll();
                String keyword = tag.substring(1).trim();
                if (block == null || !block.keyword.equals(keyword)) {
                    throw new TemplateRenderException(name, "unbalanced {{" + tag + "}} at offset " + start);
                }
                target = block.parent;
                target.add(new Block(block.variable, block.negated, List.copyOf(block.whenTrue), List.copyOf(block.whenFalse)));
            } else {
                target.add(new Variable(requireName(name, tag)));
            }
        }
        if (!open.isEmpty()) {
            throw new TemplateRenderException(name, "unclosed {{#" + open.peek().keyword + "}} block");
        }
        return new Template(name, List.copyOf(root));
    }

    private static String requireName(String template, String candidate) {
        if (!NAME.matcher(candidate).matches()) {
            throw new TemplateRenderException(template, "invalid placeholder '" + candidate + "'");
        }
        return candidate;
    }

    private interface Node {}

    private record Text(String value) implements Node {}

    private record Variable(String name) implements Node {}

    private record Block(String name, boolean negated, List<Node> whenTrue, List<Node> whenFalse) implements Node {}

    private static final class OpenBlock {
        private final String keyword;
        private final String variable;
        private final boolean negated;
        private final List<Node> parent;
        private final List<Node> whenTrue = new ArrayList<>();
        private final List<Node> whenFalse = new ArrayList<>();
        private boolean inElse;

        private OpenBlock(String keyword, String variable, boolean negated, List<Node> parent) {
            this.keyword = keyword;
            this.variable = variable;
            this.negated = negated;
            this.parent = parent;
        }
    }
}
