package com.ciro.ncl.standalone;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/** Último documento compilado por sesión, en memoria. */
public class PreviewSessionStore {

    private static final Logger log = LoggerFactory.getLogger(PreviewSessionStore.class);

    private final Cache<String, String> cache;

    public PreviewSessionStore(long ttlMinutes, long maxSessions) {
        this(ttlMinutes, maxSessions, null);
    }

    PreviewSessionStore(long ttlMinutes, long maxSessions, Executor executor) {
        Caffeine<String, String> builder = Caffeine.newBuilder()
                .expireAfterAccess(ttlMinutes, TimeUnit.MINUTES)
                .maximumSize(maxSessions)
                .removalListener((String sid, String html, RemovalCause cause) -> {
                    if (cause.wasEvicted()) log.debug("Preview of session {} evicted ({})", sid, cause);
                });
        if (executor != null) builder.executor(executor);
        this.cache = builder.build();
    }

    public Optional<String> last(String sid) {
        if (sid == null) return Optional.empty();
        return Optional.ofNullable(cache.getIfPresent(sid));
    }

    public void remember(String sid, String html) {
        if (sid == null || html == null) return;
        cache.put(sid, html);
    }

    public void forget(String sid) {
        if (sid != null) cache.invalidate(sid);
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
