package com.ciro.ncl.template;

import com.ciro.ncl.Markup;
import org.jsoup.nodes.Entities;

import java.util.regex.Pattern;

/**
 * Pasada final permisiva: todo token sin resolver pasa a {@code [nombre]} y toda
 * directiva que sobrevivió se convierte en texto visible escapado.
 */
public final class TokenNormalizer {

    // una etiqueta sin cerrar no se come la línea siguiente ni otra etiqueta
    private static final Pattern DIRECTIVE_TAG = Pattern.compile(
        "</?(?:n:[\\w-]+|view)\\b(?:[^>\"'<\\n]|\"[^\"\\n]*\"|'[^'\\n]*')*>");
    private static final Pattern BARE_DIRECTIVE = Pattern.compile("<(/?)(n:|view\\b)");
    private static final Pattern BARE_JINJA = Pattern.compile("\\{%");
    private static final Pattern BARE_DOUBLE = Pattern.compile("\\{\\{");
    private static final Pattern JINJA_BLOCK = Pattern.compile("\\{%([\\s\\S]*?)%}");
    private static final Pattern LEFTOVER_DOUBLE = Pattern.compile("\\{\\{\\s*([^{}]*?)\\s*}}");

    private TokenNormalizer() {}

    public static String normalize(String html) {
        if (html == null || html.isEmpty()) return html;
        return Markup.outsideCode(html, text -> {
            String out = Markup.replace(text, DIRECTIVE_TAG, m -> Entities.escape(m.group()));
            out = Markup.replace(out, JINJA_BLOCK, m -> "&#123;%" + Entities.escape(m.group(1)) + "%&#125;");
            out = bracket(out, SubstitutionEngine.DOTTED_DOUBLE);
            out = bracket(out, SubstitutionEngine.DOTTED_SINGLE);
            out = bracket(out, SubstitutionEngine.SIMPLE_DOUBLE);
            out = bracket(out, SubstitutionEngine.SIMPLE_SINGLE);
            out = Markup.replace(out, LEFTOVER_DOUBLE, m -> "[" + m.group(1) + "]");

            // aperturas a medio escribir (la vista previa compila en cada tecla)
            out = Markup.replace(out, BARE_DIRECTIVE, m -> "&lt;" + m.group(1) + m.group(2));
            out = BARE_JINJA.matcher(out).replaceAll("&#123;%");
            return BARE_DOUBLE.matcher(out).replaceAll("&#123;&#123;");
        });
    }

    private static String bracket(String text, Pattern p) {
        return Markup.replace(text, p, m -> "[" + SubstitutionEngine.compact(m.group(1)) + "]");
    }
}
