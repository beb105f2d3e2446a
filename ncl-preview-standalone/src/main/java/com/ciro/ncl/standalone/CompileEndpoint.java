package com.ciro.ncl.standalone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * {@code POST /compile}: JSON de entrada, documento HTML de salida.
 * El resultado queda como última vista previa de la sesión.
 */
public final class CompileEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(CompileEndpoint.class);

    private final PreviewService previews;
    private final ObjectMapper mapper;
    private final SessionManager sessions;

    public CompileEndpoint(PreviewService previews, ObjectMapper mapper, SessionManager sessions) {
        this.previews = previews;
        this.mapper = mapper;
        this.sessions = sessions;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!exchange.getRequestMethod().equalToString("POST")) {
            JsonResponses.error(exchange, mapper, 405, "METHOD_NOT_ALLOWED", "Only POST is allowed");
            return;
        }

        exchange.getRequestReceiver().receiveFullBytes((ex, bytes) -> {
            String sid = sessions.ensureSession(ex);
            CompileRequest request;
            try {
                request = parse(bytes);
            } catch (JsonProcessingException e) {
                log.debug("Rejected compile request: {}", e.getOriginalMessage());
                JsonResponses.error(ex, mapper, 400, "BAD_REQUEST", e.getOriginalMessage());
                return;
            }

            try {
                String html = previews.compile(sid, request);
                sessions.touchNoCache(ex);
                ex.setStatusCode(200);
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=utf-8");
                ex.getResponseSender().send(html, StandardCharsets.UTF_8);
            } catch (RuntimeException e) {
                log.error("Compile failed for session {}", sid, e);
                JsonResponses.error(ex, mapper, 500, "INTERNAL", e.getMessage());
            }
        }, (ex, err) -> JsonResponses.error(ex, mapper, 400, "BAD_REQUEST", err.getMessage()));
    }

    private CompileRequest parse(byte[] bytes) throws JsonProcessingException {
        if (bytes == null || bytes.length == 0) return new CompileRequest();
        String raw = new String(bytes, StandardCharsets.UTF_8).trim();
        if (raw.isEmpty()) return new CompileRequest();
        CompileRequest request = mapper.readValue(raw, CompileRequest.class);
        return request == null ? new CompileRequest() : request;
    }
}
