package com.ciro.ncl;

import org.jsoup.nodes.Entities;

/**
 * Escapado para mostrar código fuente o HTML generado como texto.
 */
public final class HtmlEscaper {

    private HtmlEscaper() {}

    public static String escape(String text) {
        if (text == null || text.isEmpty()) return "";
        return Entities.escape(text);
    }

    /** Igual que {@link #escape} pero también seguro dentro de comillas dobles. */
    public static String escapeAttribute(String text) {
        return escape(text).replace("\"", "&quot;");
    }
}
