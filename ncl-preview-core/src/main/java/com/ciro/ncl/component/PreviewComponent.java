package com.ciro.ncl.component;

import java.util.Map;

/**
 * Componente integrado del catálogo: una plantilla en text block
 * ({@code {{prop}}}, {@code {{slot}}}, {@code {{#if}}}, {@code {{else}}}) más el
 * modelo que sale de los atributos de la etiqueta.
 */
public abstract class PreviewComponent implements TagRenderer {

    private volatile CatalogueTemplate compiled;

    protected abstract String template();

    protected abstract Map<String, Object> model(ComponentAttributes attrs, String body);

    @Override
    public final String render(ComponentAttributes attrs, String body) {
        String children = body == null ? "" : body.strip();
        return compiled().render(model(attrs, children), children).strip();
    }

    // las instancias del catálogo son únicas: la plantilla se compila una vez
    private CatalogueTemplate compiled() {
        CatalogueTemplate t = compiled;
        if (t == null) {
            t = CatalogueTemplate.compile(template());
            compiled = t;
        }
        return t;
    }

    /** sm/md/lg también valen. */
    protected static String normalizeSize(String size) {
        if (size == null) return "medium";
        return switch (size.trim().toLowerCase()) {
            case "sm", "small" -> "small";
            case "lg", "large" -> "large";
            default -> "medium";
        };
    }
}
