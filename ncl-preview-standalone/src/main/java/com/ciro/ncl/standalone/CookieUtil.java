package com.ciro.ncl.standalone;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

public final class CookieUtil {

    private CookieUtil() {}

    public static String getCookie(HttpServerExchange exchange, String name) {
        return fromHeader(exchange.getRequestHeaders().getFirst(Headers.COOKIE), name);
    }

    /** Parsing simple de "a=b; c=d". También lo usa el handshake del WebSocket. */
    public static String fromHeader(String cookieHeader, String name) {
        if (cookieHeader == null) return null;
        for (String p : cookieHeader.split(";")) {
            String s = p.trim();
            int idx = s.indexOf('=');
            if (idx <= 0) continue;
            if (name.equals(s.substring(0, idx).trim())) return s.substring(idx + 1).trim();
        }
        return null;
    }

    public static void setCookie(HttpServerExchange exchange, String name, String value) {
        // Path=/ para que llegue también a /ws y /compile
        exchange.getResponseHeaders().add(Headers.SET_COOKIE, name + "=" + value + "; Path=/; HttpOnly; SameSite=Lax");
    }
}
