package com.ciro.ncl.island;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Busca atributos {@code onclick={ … }} con llaves balanceadas (admite saltos
 * de línea en cualquier punto) y los reescribe a {@code data-n-action}.
 */
final class ClickHandlerScanner {

    private static final Pattern HANDLER_START = Pattern.compile("(?<![\\w-])on:?click\\s*=\\s*\\{", Pattern.CASE_INSENSITIVE);

    private static final Pattern UPDATE = Pattern.compile(
        "([A-Za-z_]\\w*)\\s*\\.\\s*(?:update|modify)\\b[\\s\\S]*?(\\+=|-=|(?<![*/%+-])=)\\s*(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern SET = Pattern.compile(
        "([A-Za-z_]\\w*)\\s*\\.\\s*set\\s*\\(\\s*(-?\\d+(?:\\.\\d+)?)\\s*\\)");

    private ClickHandlerScanner() {}

    static String rewrite(String markup, List<EventAction> found) {
        StringBuilder sb = new StringBuilder(markup.length());
        Matcher m = HANDLER_START.matcher(markup);
        int cursor = 0;

        while (m.find(cursor)) {
            int open = m.end() - 1;
            int close = matchingBrace(markup, open);
            if (close < 0) break;

            String handler = markup.substring(open + 1, close);
            EventAction action = match(handler);

            sb.append(markup, cursor, m.start());
            if (action != null) {
                found.add(action);
                sb.append("onclick=\"return false\" data-n-action=\"").append(action.encode()).append('"');
            } else {
                sb.append(markup, m.start(), close + 1);
            }
            cursor = close + 1;
        }
        sb.append(markup.substring(cursor));
        return sb.toString();
    }

    static EventAction match(String handler) {
        Matcher set = SET.matcher(handler);
        Matcher upd = UPDATE.matcher(handler);
        boolean hasSet = set.find();
        boolean hasUpd = upd.find();

        if (hasUpd && (!hasSet || upd.start() <= set.start())) {
            return new EventAction(upd.group(1), upd.group(2), upd.group(3));
        }
        if (hasSet) {
            return new EventAction(set.group(1), "=", set.group(2));
        }
        return null;
    }

    // índice de la '}' que cierra la '{' en 'open', ignorando llaves dentro de comillas
    private static int matchingBrace(String s, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') { i++; continue; }
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }
}
