package com.ciro.ncl.template;

import com.ciro.ncl.Markup;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resuelve los tokens de interpolación contra el {@link MockDataContext}.
 * Lo que no se resuelve queda intacto para {@link TokenNormalizer}.
 */
public final class SubstitutionEngine {

    static final String SEGMENT = "[A-Za-z_]\\w*(?:\\(\\s*\\))?";
    static final String DOTTED = "[A-Za-z_]\\w*(?:\\.(?:" + SEGMENT + "|\\d+))+";
    static final String SIMPLE = "[A-Za-z_]\\w*";

    static final Pattern DOTTED_DOUBLE = Pattern.compile("\\{\\{\\s*(" + DOTTED + ")\\s*}}");
    static final Pattern DOTTED_SINGLE = Pattern.compile("(?<!\\{)\\{\\s*(" + DOTTED + ")\\s*}(?!})");
    static final Pattern SIMPLE_DOUBLE = Pattern.compile("\\{\\{\\s*(" + SIMPLE + ")\\s*}}");
    static final Pattern SIMPLE_SINGLE = Pattern.compile("(?<!\\{)\\{\\s*(" + SIMPLE + ")\\s*}(?!})");

    private SubstitutionEngine() {}

    /**
     * 1) tokens con punto, 2) tokens simples contra escalares de primer nivel.
     */
    public static String substitute(String html, MockDataContext ctx) {
        if (html == null || html.isEmpty()) return html;
        return Markup.outsideCode(html, text -> {
            String out = replaceDotted(text, ctx);
            out = Markup.replace(out, SIMPLE_DOUBLE, m -> topLevelScalar(ctx, m.group(1)));
            return Markup.replace(out, SIMPLE_SINGLE, m -> topLevelScalar(ctx, m.group(1)));
        });
    }

    /**
     * Sustituye solo los tokens cuya raíz es una de {@code roots} (variables de bucle).
     * Los que no resuelven se marcan como {@code [alias.prop]}.
     */
    public static String substituteRooted(String body, MockDataContext scope, Set<String> roots) {
        if (body == null || body.isEmpty()) return body;
        return Markup.outsideCode(body, text -> {
            String out = text;
            for (Pattern p : new Pattern[] { DOTTED_DOUBLE, DOTTED_SINGLE, SIMPLE_DOUBLE, SIMPLE_SINGLE }) {
                out = Markup.replace(out, p, m -> {
                    String path = compact(m.group(1));
                    if (!roots.contains(rootOf(path))) return null;
                    Object value = scope.resolve(path);
                    return MockDataContext.isScalar(value) ? MockDataContext.display(value) : "[" + path + "]";
                });
            }
            return out;
        });
    }

    private static String replaceDotted(String text, MockDataContext ctx) {
        String out = Markup.replace(text, DOTTED_DOUBLE, m -> scalar(ctx, m.group(1)));
        return Markup.replace(out, DOTTED_SINGLE, m -> scalar(ctx, m.group(1)));
    }

    private static String scalar(MockDataContext ctx, String path) {
        Object value = ctx.resolve(compact(path));
        return MockDataContext.isScalar(value) ? MockDataContext.display(value) : null;
    }

    private static String topLevelScalar(MockDataContext ctx, String name) {
        Object value = ctx.topLevel().get(name);
        return MockDataContext.isScalar(value) ? MockDataContext.display(value) : null;
    }

    static String compact(String path) {
        return path.replaceAll("\\s+", "");
    }

    static String rootOf(String path) {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }
}
