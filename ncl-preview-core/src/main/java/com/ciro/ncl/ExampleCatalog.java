package com.ciro.ncl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ejemplos que ofrece el editor. Viajan en el classpath como
 * {@code ncl/examples/<nombre>.ncl}, con un {@code .css} opcional al lado.
 */
public final class ExampleCatalog {

    private static final Logger log = LoggerFactory.getLogger(ExampleCatalog.class);

    private static final String ROOT = "ncl/examples/";

    public record Example(String name, String title, String source, String style) {}

    // orden del desplegable
    private static final Map<String, String> TITLES = titles();

    private static final Map<String, Example> LOADED = new ConcurrentHashMap<>();

    private ExampleCatalog() {}

    private static Map<String, String> titles() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("hello", "Hello World");
        m.put("counter", "Interactive Counter");
        m.put("form", "Forms & Inputs");
        m.put("card", "Card Component");
        m.put("button", "Button System");
        m.put("wizard", "Multi-Step Form");
        m.put("dashboard", "Dashboard");
        m.put("auth", "Auth Pages");
        return Collections.unmodifiableMap(m);
    }

    public static List<String> names() {
        return List.copyOf(TITLES.keySet());
    }

    public static Optional<Example> find(String name) {
        if (name == null || !TITLES.containsKey(name)) return Optional.empty();
        return Optional.of(LOADED.computeIfAbsent(name, ExampleCatalog::load));
    }

    public static List<Example> all() {
        List<Example> out = new ArrayList<>();
        for (String name : TITLES.keySet()) out.add(find(name).orElseThrow());
        return out;
    }

    private static Example load(String name) {
        String source = read(ROOT + name + ".ncl")
                .orElseThrow(() -> new IllegalStateException("Bundled example missing: " + ROOT + name + ".ncl"));
        String style = read(ROOT + name + ".css").orElse("");
        log.debug("Loaded example '{}' ({} chars)", name, source.length());
        return new Example(name, TITLES.get(name), source, style);
    }

    private static Optional<String> read(String resource) {
        try (InputStream in = ExampleCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) return Optional.empty();
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }
}
