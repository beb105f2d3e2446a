package com.ciro.ncl.component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Atributos de una etiqueta, en cualquier orden: {@code a="x"}, {@code a='x'},
 * {@code a=x} o banderas sin valor (guardadas como null).
 */
public final class ComponentAttributes {

    private static final Pattern ATTR = Pattern.compile(
        "([:\\w@.-]+)(?:\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>\"']+)))?");

    private final Map<String, String> values;

    private ComponentAttributes(Map<String, String> values) {
        this.values = values;
    }

    public static ComponentAttributes parse(String raw) {
        Map<String, String> map = new LinkedHashMap<>();
        if (raw != null && !raw.isBlank()) {
            Matcher m = ATTR.matcher(raw);
            while (m.find()) {
                String value = m.group(2) != null ? m.group(2)
                        : m.group(3) != null ? m.group(3)
                        : m.group(4);
                map.put(m.group(1), value);
            }
        }
        return new ComponentAttributes(map);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public String get(String name) {
        return values.get(name);
    }

    /** Valor o el default cuando falta o viene vacío. */
    public String getOrDefault(String name, String fallback) {
        String v = values.get(name);
        return (v == null || v.isBlank()) ? fallback : v;
    }

    /** Presente y distinto de "false". */
    public boolean flag(String name) {
        if (!values.containsKey(name)) return false;
        String v = values.get(name);
        return v == null || !v.trim().equalsIgnoreCase("false");
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Re-emite los atributos cuyo nombre empieza por {@code prefix}, con un espacio delante.
     */
    public String passThrough(String prefix) {
        StringBuilder sb = new StringBuilder();
        values.forEach((k, v) -> {
            if (!k.startsWith(prefix)) return;
            sb.append(' ').append(k);
            if (v != null) sb.append("=\"").append(v).append('"');
        });
        return sb.toString();
    }

    /** Todos los atributos menos los excluidos, re-emitidos con un espacio delante. */
    public String toAttributeString(String... excluded) {
        Set<String> skip = Set.of(excluded);
        StringBuilder sb = new StringBuilder();
        values.forEach((k, v) -> {
            if (skip.contains(k)) return;
            sb.append(' ').append(k);
            if (v != null) sb.append("=\"").append(v).append('"');
        });
        return sb.toString();
    }
}
