package com.ciro.ncl.standalone;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/** {@code GET /preview/last}: último documento de la sesión o 404. */
public final class LastPreviewEndpoint implements HttpHandler {

    private final PreviewSessionStore store;
    private final ObjectMapper mapper;
    private final SessionManager sessions;

    public LastPreviewEndpoint(PreviewSessionStore store, ObjectMapper mapper, SessionManager sessions) {
        this.store = store;
        this.mapper = mapper;
        this.sessions = sessions;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!exchange.getRequestMethod().equalToString("GET")) {
            JsonResponses.error(exchange, mapper, 405, "METHOD_NOT_ALLOWED", "Only GET is allowed");
            return;
        }

        String sid = sessions.ensureSession(exchange);
        Optional<String> html = store.last(sid);
        if (html.isEmpty()) {
            JsonResponses.error(exchange, mapper, 404, "NOT_FOUND", "Nothing compiled yet");
            return;
        }

        sessions.touchNoCache(exchange);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=utf-8");
        exchange.getResponseSender().send(html.get(), StandardCharsets.UTF_8);
    }
}
