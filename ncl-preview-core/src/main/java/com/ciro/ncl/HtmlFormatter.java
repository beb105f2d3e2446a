package com.ciro.ncl;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * Re-indentación del documento final para la vista "HTML".
 */
public final class HtmlFormatter {

    private static final int INDENT = 2;

    private HtmlFormatter() {}

    public static String format(String html) {
        if (html == null || html.isBlank()) return "";
        Document doc = Jsoup.parse(html);
        doc.outputSettings()
            .prettyPrint(true)
            .indentAmount(INDENT)
            .outline(false);
        return doc.outerHtml();
    }

    /** Formatea y escapa, listo para meter en un {@code <pre>}. */
    public static String formatForDisplay(String html) {
        return HtmlEscaper.escape(format(html));
    }
}
