package com.ciro.ncl.directive;

import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Escáner de bloques anidables ({@code <n:for>}, {@code {% if %}}, …) que
 * cuenta profundidad en lugar de confiar en una sola regex.
 */
final class BlockScanner {

    @FunctionalInterface
    interface BlockRewriter {
        /** null = forma no reconocida: se deja la apertura como texto y se sigue. */
        String rewrite(MatchResult open, String body);
    }

    record Span(int start, int end) {}

    private BlockScanner() {}

    static String rewrite(String html, Pattern open, Pattern close, BlockRewriter fn) {
        StringBuilder sb = new StringBuilder(html.length());
        Matcher mOpen = open.matcher(html);
        int cursor = 0;

        while (cursor < html.length() && mOpen.find(cursor)) {
            sb.append(html, cursor, mOpen.start());

            Span end = findMatchingEnd(html, mOpen.end(), open, close);
            if (end == null) { // sin cierre
                sb.append(html, mOpen.start(), mOpen.end());
                cursor = mOpen.end();
                continue;
            }

            String body = html.substring(mOpen.end(), end.start());
            String out = fn.rewrite(mOpen.toMatchResult(), body);
            if (out == null) {
                sb.append(html, mOpen.start(), mOpen.end());
                cursor = mOpen.end();
            } else {
                sb.append(out);
                cursor = end.end();
            }
        }
        if (cursor < html.length()) sb.append(html, cursor, html.length());
        return sb.toString();
    }

    static Span findMatchingEnd(String html, int startIdx, Pattern open, Pattern close) {
        int depth = 1;
        int current = startIdx;
        Matcher mOpen = open.matcher(html);
        Matcher mClose = close.matcher(html);
        while (current <= html.length()) {
            if (!mClose.find(current)) return null;
            int nextOpen = mOpen.find(current) ? mOpen.start() : -1;
            if (nextOpen != -1 && nextOpen < mClose.start()) {
                depth++;
                current = mOpen.end();
            } else {
                depth--;
                if (depth == 0) return new Span(mClose.start(), mClose.end());
                current = mClose.end();
            }
        }
        return null;
    }

    /**
     * Parte {@code body} en el primer separador a profundidad 0.
     * Devuelve {then, else} o {body, null} si no hay separador.
     */
    static String[] splitAtTopLevel(String body, Pattern anyOpen, Pattern anyClose, Pattern separator) {
        Matcher mOpen = anyOpen.matcher(body);
        Matcher mClose = anyClose.matcher(body);
        Matcher mSep = separator.matcher(body);

        int depth = 0;
        int current = 0;
        while (current <= body.length()) {
            int o = mOpen.find(current) ? mOpen.start() : Integer.MAX_VALUE;
            int c = mClose.find(current) ? mClose.start() : Integer.MAX_VALUE;
            int s = mSep.find(current) ? mSep.start() : Integer.MAX_VALUE;

            int next = Math.min(o, Math.min(c, s));
            if (next == Integer.MAX_VALUE) break;

            if (next == o) {
                depth++;
                current = mOpen.end();
            } else if (next == c) {
                depth--;
                current = mClose.end();
            } else {
                if (depth == 0) {
                    return new String[] { body.substring(0, s), body.substring(mSep.end()) };
                }
                current = mSep.end();
            }
        }
        return new String[] { body, null };
    }
}
