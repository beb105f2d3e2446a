package com.ciro.ncl.template;

import com.ciro.ncl.ObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Datos de ejemplo de solo lectura contra los que se resuelven los tokens
 * de interpolación. Cada bucle crea un hijo cuyas variables tapan a las del padre.
 */
public final class MockDataContext {

    public static final String DEFAULTS_RESOURCE = "ncl/mock-data.json";

    private static final Set<String> LENGTH_PROPS = Set.of("len", "length", "size", "count");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, Object> vars;
    private final MockDataContext parent;

    private MockDataContext(Map<String, Object> vars, MockDataContext parent) {
        this.vars = vars;
        this.parent = parent;
    }

    /** Datos de ejemplo empaquetados en {@value #DEFAULTS_RESOURCE}. */
    public static MockDataContext defaults() {
        return new MockDataContext(DefaultsHolder.DATA, null);
    }

    public static MockDataContext empty() {
        return new MockDataContext(Map.of(), null);
    }

    public static MockDataContext of(Map<String, ?> data) {
        if (data == null || data.isEmpty()) return empty();
        return new MockDataContext(Collections.unmodifiableMap(new LinkedHashMap<>(data)), null);
    }

    public static MockDataContext fromJson(String json) {
        return of(readMap(ObjectMapperFactory.shared(), json));
    }

    public MockDataContext child(String name, Object value) {
        Map<String, Object> locals = new LinkedHashMap<>();
        locals.put(name, value);
        return new MockDataContext(locals, this);
    }

    public MockDataContext child(Map<String, Object> locals) {
        return new MockDataContext(new LinkedHashMap<>(locals), this);
    }

    /** Vista de las entradas de primer nivel (sin los alias de bucle). */
    public Map<String, Object> topLevel() {
        MockDataContext root = this;
        while (root.parent != null) root = root.parent;
        return root.vars;
    }

    public boolean hasRoot(String name) {
        if (vars.containsKey(name)) return true;
        return parent != null && parent.hasRoot(name);
    }

    private Object root(String name) {
        if (vars.containsKey(name)) return vars.get(name);
        return parent != null ? parent.root(name) : null;
    }

    /**
     * Resuelve rutas como {@code user.name}, {@code todos.len()} o {@code posts.0.title}.
     * Devuelve null cuando algún tramo no existe.
     */
    public Object resolve(String path) {
        if (path == null || path.isBlank()) return null;

        String[] parts = path.trim().split("\\.");
        for (int i = 0; i < parts.length; i++) {
            parts[i] = stripCall(parts[i].trim());
        }

        Object value = root(parts[0]);
        if (value == null) return null;

        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            Object next = getProperty(value, part);
            if (next == null && LENGTH_PROPS.contains(part)) {
                next = sizeOf(value);
            }
            if (next == null) return null;
            value = next;
        }
        return value;
    }

    /** true para String, Number y Boolean. */
    public static boolean isScalar(Object o) {
        return o instanceof String || o instanceof Number || o instanceof Boolean;
    }

    /** Texto mostrable de un escalar: los double enteros salen sin decimales. */
    public static String display(Object o) {
        if (o == null) return "";
        if (o instanceof Double d && !d.isInfinite() && d == Math.rint(d)) {
            return String.valueOf(d.longValue());
        }
        if (o instanceof Float f && !f.isInfinite() && f == Math.rint(f)) {
            return String.valueOf(f.longValue());
        }
        return String.valueOf(o);
    }

    private static String stripCall(String part) {
        return part.endsWith("()") ? part.substring(0, part.length() - 2).trim() : part;
    }

    private static Integer sizeOf(Object o) {
        if (o instanceof Collection<?> c) return c.size();
        if (o instanceof Map<?, ?> m) return m.size();
        if (o instanceof String s) return s.length();
        if (o != null && o.getClass().isArray()) return Array.getLength(o);
        return null;
    }

    // ========================================================================
    // Navegación: mapas, listas por índice, records, getters y campos
    // ========================================================================
    private static Object getProperty(Object obj, String name) {
        if (obj == null || name.isEmpty()) return null;
        if (obj instanceof Map<?, ?> m) return m.get(name);
        if (obj instanceof List<?> list) {
            if (!isIndex(name)) return null;
            int idx = Integer.parseInt(name);
            return idx < list.size() ? list.get(idx) : null;
        }
        if (isScalar(obj)) return null;

        Class<?> c = obj.getClass();
        try {
            Method m = findMethod(c, name);
            if (m != null) {
                m.trySetAccessible();
                return m.invoke(obj);
            }

            Field f = findField(c, name);
            if (f != null) {
                f.setAccessible(true);
                return f.get(obj);
            }
        } catch (ReflectiveOperationException | RuntimeException e) {
            // propiedad inaccesible: se trata como ausente
            return null;
        }
        return null;
    }

    private static boolean isIndex(String s) {
        return s.matches("\\d{1,9}");
    }

    private static Field findField(Class<?> c, String name) {
        while (c != null && c != Object.class) {
            try { return c.getDeclaredField(name); } catch (NoSuchFieldException e) { c = c.getSuperclass(); }
        }
        return null;
    }

    private static Method findMethod(Class<?> c, String name) {
        String cap = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String candidate : new String[] { name, "get" + cap, "is" + cap }) {
            try { return c.getMethod(candidate); } catch (NoSuchMethodException e) { /* siguiente */ }
        }
        return null;
    }

    private static Map<String, Object> readMap(ObjectMapper mapper, String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            Map<String, Object> map = mapper.readValue(json, MAP_TYPE);
            return map == null ? Map.of() : map;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Mock data is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    private static final class DefaultsHolder {
        static final Map<String, Object> DATA = load();

        private static Map<String, Object> load() {
            try (InputStream in = MockDataContext.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
                if (in == null) return Map.of();
                Map<String, Object> map = ObjectMapperFactory.shared().readValue(in, MAP_TYPE);
                return Collections.unmodifiableMap(map);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
            }
        }
    }
}
