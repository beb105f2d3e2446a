package com.ciro.ncl.component;

import com.ciro.ncl.Markup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Expande las etiquetas de componente ({@code <Button …/>}, {@code <Card>…</Card>})
 * a HTML. Las definiciones del autor tienen prioridad sobre el catálogo integrado.
 */
public final class ComponentRenderer {

    private static final Logger log = LoggerFactory.getLogger(ComponentRenderer.class);

    private static final int MAX_ROUNDS = 16;

    private static final Map<String, TagRenderer> BUILT_INS = builtIns();

    private static final ThreadLocal<Boolean> IN_BODY_PASSES = ThreadLocal.withInitial(() -> false);

    private ComponentRenderer() {}

    private static Map<String, TagRenderer> builtIns() {
        Map<String, TagRenderer> m = new LinkedHashMap<>();
        m.put("Button", new NButton());
        m.put("TextInput", new NTextInput());
        m.put("Select", new NSelect());
        m.put("Checkbox", new NCheckbox());
        m.put("Card", new NCard());
        m.put("Badge", new NBadge());
        m.put("StatCard", new NStatCard());
        m.put("FeatureCard", new NFeatureCard());
        m.put("FormGroup", new NFormGroup());
        m.put("NavItem", new NNavItem());
        return Collections.unmodifiableMap(m);
    }

    public static Map<String, TagRenderer> builtInCatalogue() {
        return BUILT_INS;
    }

    public static String render(String html) {
        return render(html, Map.of());
    }

    /**
     * Itera hasta que ninguna etiqueta cambie (acotado), porque un componente
     * puede emitir otros componentes.
     */
    public static String render(String html, Map<String, ComponentDefinition> definitions) {
        return render(html, definitions, UnaryOperator.identity());
    }

    /**
     * Como {@link #render(String, Map)}, pero el cuerpo de cada componente del autor,
     * ya con sus props, pasa por {@code bodyPasses} (las directivas de fragmento).
     */
    public static String render(String html, Map<String, ComponentDefinition> definitions,
                                UnaryOperator<String> bodyPasses) {
        if (html == null || html.isEmpty()) return html;

        UnaryOperator<String> passes = guarded(bodyPasses);
        Map<String, TagRenderer> table = new LinkedHashMap<>();
        definitions.forEach((name, def) -> table.put(name, new DefinedComponent(def, passes)));
        BUILT_INS.forEach(table::putIfAbsent);

        String current = html;
        for (int round = 0; round < MAX_ROUNDS; round++) {
            String next = current;
            for (Map.Entry<String, TagRenderer> e : table.entrySet()) {
                next = expandTag(next, e.getKey(), e.getValue());
            }
            if (next.equals(current)) return next;
            current = next;
        }
        log.debug("Component expansion did not settle after {} rounds", MAX_ROUNDS);
        return current;
    }

    // un render anidado desde las propias pasadas ya no las vuelve a aplicar
    private static UnaryOperator<String> guarded(UnaryOperator<String> passes) {
        return body -> {
            if (IN_BODY_PASSES.get()) return body;
            IN_BODY_PASSES.set(true);
            try {
                return passes.apply(body);
            } finally {
                IN_BODY_PASSES.set(false);
            }
        };
    }

    private static String expandTag(String html, String tag, TagRenderer renderer) {
        if (!html.contains("<" + tag)) return html;

        String t = Pattern.quote(tag);
        Pattern selfClosing = Pattern.compile("<" + t + "(?![\\w-])(" + Markup.ATTRS + "?)/>");
        // el cuerpo no puede contener otra apertura del mismo tag: primero los más internos
        Pattern paired = Pattern.compile(
            "<" + t + "(?![\\w-])(" + Markup.ATTRS + "?)(?<!/)>((?:(?!<" + t + "(?![\\w-]))[\\s\\S])*?)</" + t + "\\s*>");

        String out = Markup.replace(html, selfClosing,
                m -> renderer.render(ComponentAttributes.parse(m.group(1)), ""));

        for (int depth = 0; depth < MAX_ROUNDS; depth++) {
            String next = Markup.replace(out, paired,
                    m -> renderer.render(ComponentAttributes.parse(m.group(1)), m.group(2)));
            if (next.equals(out)) break;
            out = next;
        }
        return out;
    }
}
