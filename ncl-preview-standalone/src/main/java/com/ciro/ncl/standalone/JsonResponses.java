package com.ciro.ncl.standalone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.LinkedHashMap;
import java.util.Map;

/** Errores en el formato {@code {"ok":false,"code":"…","error":"…"}}. */
final class JsonResponses {

    static final String JSON = "application/json; charset=utf-8";

    private JsonResponses() {}

    static void error(HttpServerExchange ex, ObjectMapper mapper, int status, String code, String message) {
        ex.setStatusCode(status);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
        ex.getResponseSender().send(errorBody(mapper, code, message));
    }

    static String errorBody(ObjectMapper mapper, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("code", code);
        body.put("error", message == null ? "" : message);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return "{\"ok\":false,\"code\":\"" + code + "\",\"error\":\"\"}";
        }
    }
}
