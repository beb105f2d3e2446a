package com.ciro.ncl;

import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utilidades de texto compartidas por las pasadas.
 */
public final class Markup {

    /** Atributos de una etiqueta: un {@code >} entre comillas no la cierra. */
    public static final String ATTRS = "(?:[^>\"']|\"[^\"]*\"|'[^']*')*";

    private static final Pattern CODE_BLOCK = Pattern.compile(
        "<script\\b[\\s\\S]*?</script\\s*>|<style\\b[\\s\\S]*?</style\\s*>",
        Pattern.CASE_INSENSITIVE);

    private Markup() {}

    /**
     * Aplica {@code fn} solo al texto que queda fuera de los bloques
     * {@code <script>} y {@code <style>}.
     */
    public static String outsideCode(String html, UnaryOperator<String> fn) {
        if (html == null || html.isEmpty()) return html;

        Matcher m = CODE_BLOCK.matcher(html);
        StringBuilder sb = new StringBuilder(html.length());
        int cursor = 0;
        while (m.find()) {
            sb.append(fn.apply(html.substring(cursor, m.start())));
            sb.append(m.group());
            cursor = m.end();
        }
        sb.append(fn.apply(html.substring(cursor)));
        return sb.toString();
    }

    /**
     * Reemplazo con callback. Si el callback devuelve null se conserva el texto original.
     */
    public static String replace(String input, Pattern pattern, Function<MatchResult, String> fn) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder(input.length());
        while (m.find()) {
            String rep = fn.apply(m.toMatchResult());
            m.appendReplacement(sb, Matcher.quoteReplacement(rep != null ? rep : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
