package com.ciro.ncl.island;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuándo arranca el runtime de una isla ({@code client:load|visible|idle}).
 */
public enum HydrationMode {
    LOAD,
    VISIBLE,
    IDLE;

    private static final Pattern CLIENT_ATTR = Pattern.compile("\\bclient:([A-Za-z]+)");

    public String attributeValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Valores desconocidos o ausentes caen en LOAD. */
    public static HydrationMode parse(String value) {
        if (value == null) return LOAD;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "visible" -> VISIBLE;
            case "idle" -> IDLE;
            default -> LOAD;
        };
    }

    /** Busca {@code client:<modo>} en el texto de atributos de la etiqueta. */
    public static HydrationMode fromAttributes(String rawAttributes) {
        if (rawAttributes == null) return LOAD;
        Matcher m = CLIENT_ATTR.matcher(rawAttributes);
        return m.find() ? parse(m.group(1)) : LOAD;
    }

    public static boolean isDeclared(String rawAttributes) {
        return rawAttributes != null && CLIENT_ATTR.matcher(rawAttributes).find();
    }
}
