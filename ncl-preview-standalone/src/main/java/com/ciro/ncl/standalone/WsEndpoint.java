package com.ciro.ncl.standalone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * {@code /ws}: cada mensaje es un {@link CompileRequest}. Las ediciones se
 * agrupan por conexión y solo se compila la última.
 */
public class WsEndpoint {

    private static final Logger log = LoggerFactory.getLogger(WsEndpoint.class);

    private final PreviewService previews;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;
    private final long debounceMs;

    public WsEndpoint(PreviewService previews, ObjectMapper mapper, ScheduledExecutorService scheduler, long debounceMs) {
        this.previews = previews;
        this.mapper = mapper;
        this.scheduler = scheduler;
        this.debounceMs = debounceMs;
    }

    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String sessionId = CookieUtil.fromHeader(exchange.getRequestHeader("Cookie"), SessionManager.COOKIE_NAME);
        if (sessionId == null || sessionId.isBlank()) {
            // sin cookie: la sesión vive lo que viva la conexión
            sessionId = "WS@" + SessionManager.newId();
        }
        final String sid = sessionId;
        final Debouncer debouncer = new Debouncer(scheduler, debounceMs);

        log.info("WS connect sid={}", sid);

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                String payload = message.getData();
                debouncer.submit(() -> compileAndPush(sid, payload, ch));
            }
        });

        channel.getCloseSetter().set(ch -> {
            debouncer.cancel();
            log.info("WS close sid={}", sid);
        });

        channel.resumeReceives();
    }

    void compileAndPush(String sid, String payload, WebSocketChannel channel) {
        String reply;
        try {
            CompileRequest request = mapper.readValue(payload, CompileRequest.class);
            reply = compiledMessage(previews.compile(sid, request == null ? new CompileRequest() : request));
        } catch (JsonProcessingException e) {
            reply = JsonResponses.errorBody(mapper, "BAD_REQUEST", e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("WS compile failed for session {}", sid, e);
            reply = JsonResponses.errorBody(mapper, "INTERNAL", e.getMessage());
        }
        if (channel.isOpen()) WebSockets.sendText(reply, channel, null);
    }

    String compiledMessage(String html) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "compiled");
        msg.put("html", html);
        try {
            return mapper.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise compiled message", e);
        }
    }
}
