package com.ciro.ncl.component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plantilla de un componente del catálogo, compilada una sola vez.
 * <ul>
 *   <li>{@code {{prop}}}: valor del modelo; nada si falta.</li>
 *   <li>{@code {{slot}}}: los hijos de la etiqueta.</li>
 *   <li>{@code {{#if prop}} … {{else}} … {{/if}}}, también {@code {{#if !prop}}}.</li>
 * </ul>
 * Un {@code {{} sin cerrar se queda como texto.
 */
final class CatalogueTemplate {

    private static final Pattern TAG = Pattern.compile("\\{\\{\\s*([#/]?)\\s*([^{}]*?)\\s*}}");

    interface Part {
        void write(StringBuilder out, Map<String, Object> props, String slot);
    }

    private record Text(String text) implements Part {
        @Override
        public void write(StringBuilder out, Map<String, Object> props, String slot) {
            out.append(text);
        }
    }

    private record Prop(String name) implements Part {
        @Override
        public void write(StringBuilder out, Map<String, Object> props, String slot) {
            Object value = props.get(name);
            if (value != null) out.append(value);
        }
    }

    private static final Part SLOT = (out, props, slot) -> out.append(slot);

    private static final class Branch implements Part {
        private final String prop;
        private final boolean negated;
        private final List<Part> then = new ArrayList<>();
        private final List<Part> otherwise = new ArrayList<>();
        private boolean inElse;

        Branch(String condition) {
            this.negated = condition.startsWith("!");
            this.prop = negated ? condition.substring(1).trim() : condition;
        }

        List<Part> current() {
            return inElse ? otherwise : then;
        }

        @Override
        public void write(StringBuilder out, Map<String, Object> props, String slot) {
            List<Part> chosen = truthy(props.get(prop)) != negated ? then : otherwise;
            for (Part p : chosen) p.write(out, props, slot);
        }
    }

    private final List<Part> parts;

    private CatalogueTemplate(List<Part> parts) {
        this.parts = parts;
    }

    /** @throws IllegalArgumentException con un bloque que no sea {@code #if}. */
    static CatalogueTemplate compile(String source) {
        String src = source == null ? "" : source;
        List<Part> root = new ArrayList<>();
        Deque<Branch> open = new ArrayDeque<>();

        Matcher m = TAG.matcher(src);
        int cursor = 0;
        while (m.find()) {
            List<Part> target = open.isEmpty() ? root : open.peek().current();
            if (m.start() > cursor) target.add(new Text(src.substring(cursor, m.start())));
            cursor = m.end();

            String kind = m.group(1);
            String body = m.group(2);
            if (kind.equals("#")) {
                if (!body.startsWith("if ")) {
                    throw new IllegalArgumentException("Unknown catalogue block: {{#" + body + "}}");
                }
                Branch branch = new Branch(body.substring(3).trim());
                target.add(branch);
                open.push(branch);
            } else if (kind.equals("/")) {
                if (!open.isEmpty()) open.pop();
            } else if (body.equals("else") && !open.isEmpty()) {
                open.peek().inElse = true;
            } else if (body.equals("slot")) {
                target.add(SLOT);
            } else {
                target.add(new Prop(body));
            }
        }
        if (cursor < src.length()) {
            (open.isEmpty() ? root : open.peek().current()).add(new Text(src.substring(cursor)));
        }
        return new CatalogueTemplate(List.copyOf(root));
    }

    String render(Map<String, Object> props, String slot) {
        StringBuilder out = new StringBuilder();
        for (Part p : parts) p.write(out, props, slot == null ? "" : slot);
        return out.toString();
    }

    private static boolean truthy(Object o) {
        if (o == null) return false;
        if (o instanceof Boolean b) return b;
        if (o instanceof String s) return !s.isEmpty();
        if (o instanceof Number n) return n.doubleValue() != 0;
        return true;
    }
}
