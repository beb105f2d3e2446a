package com.ciro.ncl;

import com.ciro.ncl.component.ComponentDefinition;
import com.ciro.ncl.template.MockDataContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Estado de una sola compilación. Nunca se comparte entre llamadas.
 */
public final class CompileContext {

    private final CompileOptions options;
    private final Map<String, String> islands;
    private final Map<String, ComponentDefinition> definitions = new LinkedHashMap<>();
    private String documentTitle;

    public CompileContext(CompileOptions options, Map<String, String> islands) {
        this.options = options != null ? options : CompileOptions.defaults();
        this.islands = islands == null || islands.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(islands));
    }

    public CompileOptions options() {
        return options;
    }

    public MockDataContext data() {
        return options.mockData();
    }

    public void define(ComponentDefinition definition) {
        definitions.put(definition.name(), definition);
    }

    public Optional<ComponentDefinition> definition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public Map<String, ComponentDefinition> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    /** Título que fijó la vista; sin vista, el de las opciones. */
    public String documentTitle() {
        return documentTitle != null ? documentTitle : options.defaultTitle();
    }

    public void documentTitle(String title) {
        this.documentTitle = title;
    }

    public Optional<String> island(String key) {
        return Optional.ofNullable(islands.get(key));
    }

    public Map<String, String> islands() {
        return islands;
    }
}
