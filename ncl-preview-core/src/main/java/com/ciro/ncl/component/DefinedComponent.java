package com.ciro.ncl.component;

import com.ciro.ncl.Markup;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renderiza un componente declarado con {@code <n:component>}: quita
 * {@code <n:props>}, coloca los hijos en {@code <n:slot/>} y sustituye
 * {@code {{ prop }}} / {@code {prop}} por los atributos. Lo que queda pasa por
 * las directivas de fragmento ({@code <n:if>}, {@code <n:link>}, …).
 */
final class DefinedComponent implements TagRenderer {

    private static final Pattern PROPS_BLOCK = Pattern.compile("<n:props\\b" + Markup.ATTRS + ">([\\s\\S]*?)</n:props>");
    // variant: String = "primary"
    private static final Pattern PROP_DECL = Pattern.compile(
        "(\\w+)\\s*:\\s*[\\w:<>?\\[\\]]+(?:\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s,;]+)))?");
    private static final Pattern DEFAULT_SLOT = Pattern.compile("<n:slot\\s*/>|<n:slot\\s*>\\s*</n:slot>");
    private static final Pattern NAMED_SLOT = Pattern.compile("<n:slot\\s+name\\s*=\\s*[\"'][^\"']*[\"']\\s*/>");

    private final ComponentDefinition definition;
    private final UnaryOperator<String> bodyPasses;

    DefinedComponent(ComponentDefinition definition, UnaryOperator<String> bodyPasses) {
        this.definition = definition;
        this.bodyPasses = bodyPasses;
    }

    @Override
    public String render(ComponentAttributes attrs, String children) {
        String body = definition.body();

        Map<String, String> props = new LinkedHashMap<>(declaredDefaults(body));
        attrs.asMap().forEach((k, v) -> props.put(k, v == null ? "true" : v));

        body = PROPS_BLOCK.matcher(body).replaceAll("");
        body = DEFAULT_SLOT.matcher(body).replaceAll(Matcher.quoteReplacement(children == null ? "" : children));
        body = NAMED_SLOT.matcher(body).replaceAll("");

        for (Map.Entry<String, String> e : props.entrySet()) {
            if (!e.getKey().matches("[A-Za-z_]\\w*")) continue;
            String name = Pattern.quote(e.getKey());
            String value = Matcher.quoteReplacement(e.getValue());
            body = body.replaceAll("\\{\\{\\s*" + name + "\\s*}}", value);
            body = body.replaceAll("(?<!\\{)\\{\\s*" + name + "\\s*}(?!})", value);
        }
        return bodyPasses.apply(body).strip();
    }

    private static Map<String, String> declaredDefaults(String body) {
        Map<String, String> defaults = new LinkedHashMap<>();
        Matcher block = PROPS_BLOCK.matcher(body);
        while (block.find()) {
            Matcher decl = PROP_DECL.matcher(block.group(1));
            while (decl.find()) {
                String value = decl.group(2) != null ? decl.group(2)
                        : decl.group(3) != null ? decl.group(3)
                        : decl.group(4);
                if (value != null) defaults.put(decl.group(1), value);
            }
        }
        return defaults;
    }
}
