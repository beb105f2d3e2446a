package com.ciro.ncl.standalone;

import com.ciro.ncl.ExampleCatalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code GET /examples}: nombres y títulos del catálogo.
 * {@code GET /examples/{nombre}}: fuente y estilos de un ejemplo.
 */
public final class ExamplesEndpoint implements HttpHandler {

    private final ObjectMapper mapper;

    public ExamplesEndpoint(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws JsonProcessingException {
        if (!exchange.getRequestMethod().equalToString("GET")) {
            JsonResponses.error(exchange, mapper, 405, "METHOD_NOT_ALLOWED", "Only GET is allowed");
            return;
        }

        String name = exchange.getRelativePath().replaceFirst("^/", "");
        if (name.isEmpty()) {
            List<Map<String, String>> index = new ArrayList<>();
            for (ExampleCatalog.Example e : ExampleCatalog.all()) {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("name", e.name());
                entry.put("title", e.title());
                index.add(entry);
            }
            send(exchange, mapper.writeValueAsString(index));
            return;
        }

        Optional<ExampleCatalog.Example> example = ExampleCatalog.find(name);
        if (example.isEmpty()) {
            JsonResponses.error(exchange, mapper, 404, "NOT_FOUND", "No example named '" + name + "'");
            return;
        }
        send(exchange, mapper.writeValueAsString(example.get()));
    }

    private static void send(HttpServerExchange exchange, String json) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JsonResponses.JSON);
        exchange.getResponseSender().send(json);
    }
}
