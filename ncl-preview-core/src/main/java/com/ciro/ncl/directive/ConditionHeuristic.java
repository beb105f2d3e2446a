package com.ciro.ncl.directive;

import java.util.regex.Pattern;

/**
 * Aproximación textual de una condición: no se evalúa ninguna expresión.
 * Igualdad a cero o chequeos de vacío = false; lo demás = true.
 * Las expresiones compuestas ({@code a && b}) no se distinguen.
 */
public final class ConditionHeuristic {

    private static final Pattern FALSY = Pattern.compile(
        "={2,3}\\s*0(?![\\d.])|\\bis\\s+empty\\b|\\.is_empty\\s*\\(\\s*\\)|\\.isEmpty\\s*\\(\\s*\\)");
    private static final Pattern NOT_PREFIX = Pattern.compile("^not\\s+", Pattern.CASE_INSENSITIVE);

    private ConditionHeuristic() {}

    public static boolean evaluate(String condition) {
        if (condition == null) return true;
        String c = condition.trim();
        boolean negate = false;

        if (c.startsWith("!") && !c.startsWith("!=")) {
            negate = true;
            c = c.substring(1).trim();
        } else if (NOT_PREFIX.matcher(c).find()) {
            negate = true;
            c = NOT_PREFIX.matcher(c).replaceFirst("");
        }

        boolean truthy = !FALSY.matcher(c).find();
        return negate != truthy;
    }
}
