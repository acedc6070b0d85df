package com.ehrgateway.store;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

@DisplayName("InMemoryTokenStore Tests")
class InMemoryTokenStoreTest {

    private InMemoryTokenStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTokenStore();
    }

    @Test
    @DisplayName("Should return stored entries by key")
    void shouldReturnStoredEntries() {
        ObjectNode tokenData = new ObjectMapper().createObjectNode().put("access_token", "tok");
        Instant expiresAt = Instant.parse("2026-01-15T11:00:00Z");

        store.put("state-1", StoredToken.oauthState());
        store.put("tok", StoredToken.issued(tokenData, expiresAt));

        assertEquals(StoredToken.Kind.OAUTH_STATE, store.get("state-1").orElseThrow().getKind());
        StoredToken issued = store.get("tok").orElseThrow();
        assertEquals(StoredToken.Kind.ACCESS_TOKEN, issued.getKind());
        assertEquals(expiresAt, issued.getExpiresAt());
        assertSame(tokenData, issued.getTokenData());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("Should report unknown keys as absent")
    void shouldReportUnknownKeys() {
        assertTrue(store.get("missing").isEmpty());
        assertFalse(store.contains("missing"));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Should keep expired entries")
    void shouldKeepExpiredEntries() {
        store.put("old", StoredToken.issued(null, Instant.EPOCH));

        assertTrue(store.contains("old"));
        assertEquals(Instant.EPOCH, store.get("old").orElseThrow().getExpiresAt());
    }

    @Test
    @DisplayName("Should accept concurrent writers without losing distinct keys")
    void shouldAcceptConcurrentWriters() throws InterruptedException {
        int writers = 8;
        int perWriter = 500;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);

        for (int w = 0; w < writers; w++) {
            int writer = w;
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    store.put(writer + "-" + i, StoredToken.oauthState());
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();

        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(writers * perWriter, store.size());
    }
}
