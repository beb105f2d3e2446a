package com.ciro.ncl.standalone;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;

import java.security.SecureRandom;
import java.util.Base64;

/** Identifica al navegador con la cookie {@value #COOKIE_NAME}. */
public class SessionManager {

    public static final String COOKIE_NAME = "NCLID";
    static final AttachmentKey<String> SESSION_ID = AttachmentKey.create(String.class);

    private static final SecureRandom RNG = new SecureRandom();

    public String ensureSession(HttpServerExchange exchange) {
        String sid = exchange.getAttachment(SESSION_ID);
        if (sid != null) return sid;

        sid = CookieUtil.getCookie(exchange, COOKIE_NAME);
        if (sid == null || sid.isBlank()) {
            sid = newId();
            CookieUtil.setCookie(exchange, COOKIE_NAME, sid);
        }
        exchange.putAttachment(SESSION_ID, sid);
        return sid;
    }

    public void touchNoCache(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store, no-cache, must-revalidate, max-age=0");
        exchange.getResponseHeaders().put(Headers.PRAGMA, "no-cache");
    }

    static String newId() {
        byte[] b = new byte[18];
        RNG.nextBytes(b);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(b);
    }
}
