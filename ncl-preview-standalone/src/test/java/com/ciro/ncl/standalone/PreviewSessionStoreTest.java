package com.ciro.ncl.standalone;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PreviewSessionStoreTest {

    private final PreviewSessionStore store = new PreviewSessionStore(30, 100, Runnable::run);

    @Test
    void remembersPerSession() {
        store.remember("a", "<p>a</p>");
        store.remember("b", "<p>b</p>");
        store.remember("a", "<p>a2</p>");

        assertEquals(Optional.of("<p>a2</p>"), store.last("a"));
        assertEquals(Optional.of("<p>b</p>"), store.last("b"));
        assertTrue(store.last("c").isEmpty());
        assertTrue(store.last(null).isEmpty());
    }

    @Test
    void forget() {
        store.remember("a", "x");
        store.forget("a");
        assertTrue(store.last("a").isEmpty());
    }

    @Test
    void boundedBySessionCount() {
        PreviewSessionStore small = new PreviewSessionStore(30, 2, Runnable::run);
        for (int i = 0; i < 10; i++) small.remember("s" + i, "html");
        assertTrue(small.size() <= 2);
    }
}
