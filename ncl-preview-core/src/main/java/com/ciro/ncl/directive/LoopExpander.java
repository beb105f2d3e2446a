package com.ciro.ncl.directive;

import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;
import com.ciro.ncl.template.MockDataContext;
import com.ciro.ncl.template.SubstitutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expansión de bucles compartida por {@code <n:for>} y {@code {% for %}}.
 * Los bucles internos se resuelven contra el ámbito del elemento actual.
 */
final class LoopExpander {

    private static final Logger log = LoggerFactory.getLogger(LoopExpander.class);

    static final Pattern N_FOR_OPEN = Pattern.compile("<n:for\\b(" + Markup.ATTRS + ")>");
    static final Pattern N_FOR_CLOSE = Pattern.compile("</n:for\\s*>");

    static final Pattern JINJA_FOR_OPEN = Pattern.compile("\\{%-?\\s*for\\b([\\s\\S]*?)-?%}");
    static final Pattern JINJA_FOR_CLOSE = Pattern.compile("\\{%-?\\s*endfor\\s*-?%}");
    static final Pattern JINJA_ANY_OPEN = Pattern.compile("\\{%-?\\s*(?:for|if)\\b[\\s\\S]*?%}");
    static final Pattern JINJA_ANY_CLOSE = Pattern.compile("\\{%-?\\s*end(?:for|if)\\s*-?%}");
    static final Pattern JINJA_EMPTY = Pattern.compile("\\{%-?\\s*(?:empty|else)\\s*-?%}");

    private static final Pattern JINJA_HEADER = Pattern.compile(
        "^\\s*([A-Za-z_]\\w*)\\s+in\\s+([A-Za-z_]\\w*(?:\\.\\w+(?:\\(\\s*\\))?)*)\\s*$");
    private static final Pattern PATH = Pattern.compile("[A-Za-z_]\\w*(?:\\.\\w+(?:\\(\\s*\\))?)*");

    private LoopExpander() {}

    static String expandAll(String html, MockDataContext scope) {
        return expandJinja(expandNFor(html, scope), scope);
    }

    static String expandNFor(String html, MockDataContext scope) {
        if (!html.contains("<n:for")) return html;
        return BlockScanner.rewrite(html, N_FOR_OPEN, N_FOR_CLOSE, (open, body) -> {
            ComponentAttributes attrs = ComponentAttributes.parse(open.group(1));
            String alias = attrs.get("item");
            String path = attrs.get("in");
            if (alias == null || path == null || !alias.matches("[A-Za-z_]\\w*") || !PATH.matcher(path.trim()).matches()) {
                log.debug("n:for left as text, attributes not recognised: {}", open.group(1).trim());
                return null;
            }
            return expand(alias, path.trim(), body, null, scope);
        });
    }

    static String expandJinja(String html, MockDataContext scope) {
        if (!html.contains("{%")) return html;
        return BlockScanner.rewrite(html, JINJA_FOR_OPEN, JINJA_FOR_CLOSE, (open, body) -> {
            Matcher header = JINJA_HEADER.matcher(open.group(1));
            if (!header.matches()) {
                log.debug("for block left as text, header not recognised: {}", open.group(1).trim());
                return null;
            }
            String[] parts = BlockScanner.splitAtTopLevel(body, JINJA_ANY_OPEN, JINJA_ANY_CLOSE, JINJA_EMPTY);
            return expand(header.group(1), header.group(2), parts[0], parts[1], scope);
        });
    }

    private static String expand(String alias, String path, String body, String emptyBranch, MockDataContext scope) {
        List<Object> items = asList(scope.resolve(path));
        if (items.isEmpty()) {
            return emptyBranch != null
                    ? expandAll(emptyBranch, scope)
                    : "<!-- Loop: " + path + " (empty) -->";
        }

        StringJoiner joined = new StringJoiner("\n");
        for (int i = 0; i < items.size(); i++) {
            Map<String, Object> locals = new LinkedHashMap<>();
            locals.put(alias, items.get(i));
            locals.put("loop", loopInfo(i, items.size()));
            MockDataContext child = scope.child(locals);

            String rendered = expandAll(body, child);
            rendered = SubstitutionEngine.substituteRooted(rendered, child, Set.of(alias, "loop"));
            joined.add(rendered);
        }
        return joined.toString();
    }

    private static Map<String, Object> loopInfo(int i, int size) {
        Map<String, Object> loop = new LinkedHashMap<>();
        loop.put("index", i + 1);
        loop.put("index0", i);
        loop.put("first", i == 0);
        loop.put("last", i == size - 1);
        loop.put("length", size);
        return loop;
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection<?> c) return new ArrayList<>(c);
        if (value != null && value.getClass().isArray()) {
            List<Object> out = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) out.add(Array.get(value, i));
            return out;
        }
        return List.of();
    }
}
