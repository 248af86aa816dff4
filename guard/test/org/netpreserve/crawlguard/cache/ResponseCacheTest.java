package org.netpreserve.crawlguard.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.crawlguard.config.CacheConfig;
import org.netpreserve.crawlguard.store.JsonDirectoryStore;
import org.netpreserve.crawlguard.store.MemoryStore;
import org.netpreserve.crawlguard.util.Json;
import org.netpreserve.crawlguard.util.MutableClock;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {
    private static final CacheConfig CONFIG = new CacheConfig(true, Duration.ofHours(24), 10_000_000L);

    private MutableClock clock;
    private MemoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        store = new MemoryStore();
    }

    private static JsonNode json(String text) throws IOException {
        return Json.mapper().readTree(text);
    }

    @Test
    void storedResponseIsReturned() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        JsonNode paris = json("{\"answer\":\"Paris\"}");

        String key = cache.put("capital of France?", paris, "gpt-4");

        assertNotNull(key);
        assertEquals(64, key.length());
        assertEquals(paris, cache.get("capital of France?"));
        assertEquals(paris, cache.get("capital of France?", null, "gpt-4"));
        assertNull(cache.get("capital of France?", null, "gpt-3.5"));
        assertNull(cache.get("capital of Spain?"));
    }

    @Test
    void contextSeparatesEntries() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        JsonNode contextA = json("{\"page\":\"a\",\"lang\":\"en\"}");
        JsonNode contextB = json("{\"page\":\"b\",\"lang\":\"en\"}");

        String keyA = cache.put("summarise", json("{\"v\":\"A\"}"), "gpt-4", contextA);
        String keyB = cache.put("summarise", json("{\"v\":\"B\"}"), "gpt-4", contextB);

        assertNotEquals(keyA, keyB);
        assertEquals(json("{\"v\":\"A\"}"), cache.get("summarise", contextA));
        assertEquals(json("{\"v\":\"B\"}"), cache.get("summarise", contextB));
        assertNull(cache.get("summarise"));
        // key order within the context doesn't matter
        assertEquals(json("{\"v\":\"A\"}"), cache.get("summarise", json("{\"lang\":\"en\",\"page\":\"a\"}")));
        // nor does the kind of object it is given as
        assertEquals(json("{\"v\":\"A\"}"), cache.get("summarise", Map.of("page", "a", "lang", "en")));
    }

    @Test
    void emptyContextIsTheSameAsNone() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        cache.put("prompt", json("1"), "m");
        assertEquals(json("1"), cache.get("prompt", json("{}")));
    }

    @Test
    void newestModelAnswerWinsWhenNoModelIsGiven() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        cache.put("prompt", json("\"old\""), "model-a");
        clock.advance(Duration.ofMinutes(1));
        cache.put("prompt", json("\"new\""), "model-b");

        assertEquals(json("\"new\""), cache.get("prompt"));
        assertEquals(json("\"old\""), cache.get("prompt", null, "model-a"));
    }

    @Test
    void hitsAreCounted() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        cache.put("prompt", json("42"), "m");
        cache.get("prompt");
        cache.get("prompt");
        cache.get("other");

        CacheStats stats = cache.stats();
        assertTrue(stats.enabled());
        assertEquals(1, stats.entryCount());
        assertEquals(2, stats.totalHits());
        assertEquals(Duration.ofHours(24), stats.ttl());
        assertTrue(stats.sizeBytes() > 0);
    }

    @Test
    void expiredEntriesAreNeverReturned() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        cache.put("prompt", json("42"), "m");

        clock.advance(Duration.ofHours(24).minusSeconds(1));
        assertEquals(json("42"), cache.get("prompt"));

        clock.advance(Duration.ofSeconds(1));
        assertNull(cache.get("prompt"));
        assertEquals(0, cache.stats().entryCount());
        assertTrue(store.list().isEmpty(), "expired entry should be purged from the store");
    }

    @Test
    void cleanExpiredPurgesEverythingPastItsTtl() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        cache.put("first", json("1"), "m");
        clock.advance(Duration.ofHours(12));
        cache.put("second", json("2"), "m");
        clock.advance(Duration.ofHours(13));

        assertEquals(1, cache.cleanExpired());
        assertNull(cache.get("first"));
        assertEquals(json("2"), cache.get("second"));
    }

    @Test
    void invalidateRemovesEntries() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        cache.put("prompt", json("1"), "model-a");
        cache.put("prompt", json("2"), "model-b");
        cache.put("other", json("3"), "model-a");

        assertFalse(cache.invalidate("missing"));
        assertTrue(cache.invalidate("prompt", null, "model-a"));
        assertFalse(cache.invalidate("prompt", null, "model-a"));
        assertEquals(json("2"), cache.get("prompt"));

        assertTrue(cache.invalidate("prompt"));
        assertNull(cache.get("prompt"));
        assertEquals(json("3"), cache.get("other"));

        cache.clear();
        assertEquals(0, cache.stats().entryCount());
        assertTrue(store.list().isEmpty());
    }

    @Test
    void disabledCacheIsANoOp() throws IOException {
        var cache = new ResponseCache(CacheConfig.disabled(), store, clock);
        assertNull(cache.put("prompt", json("1"), "m"));
        assertNull(cache.get("prompt"));
        assertFalse(cache.invalidate("prompt"));
        assertEquals(0, cache.cleanExpired());
        assertEquals(List.of(), cache.findSimilar("prompt", 10));
        assertFalse(cache.stats().enabled());
        assertTrue(store.list().isEmpty());
    }

    @Test
    void leastRecentlyUsedEntryIsEvicted() throws IOException {
        var sizing = new ResponseCache(CONFIG, new MemoryStore(), clock);
        sizing.put("prompt-a", json("{\"answer\":\"aaaa\"}"), "m");
        long entrySize = sizing.stats().sizeBytes();

        var cache = new ResponseCache(new CacheConfig(true, Duration.ofHours(1), entrySize * 5 / 2), store, clock);
        cache.put("prompt-a", json("{\"answer\":\"aaaa\"}"), "m");
        clock.advance(Duration.ofSeconds(1));
        cache.put("prompt-b", json("{\"answer\":\"bbbb\"}"), "m");
        clock.advance(Duration.ofSeconds(1));
        assertNotNull(cache.get("prompt-a"));
        clock.advance(Duration.ofSeconds(1));
        cache.put("prompt-c", json("{\"answer\":\"cccc\"}"), "m");

        assertNull(cache.get("prompt-b"));
        assertNotNull(cache.get("prompt-a"));
        assertNotNull(cache.get("prompt-c"));
        CacheStats stats = cache.stats();
        assertEquals(2, stats.entryCount());
        assertTrue(stats.sizeBytes() <= stats.maxSizeBytes());
        assertEquals(2, store.list().size());
    }

    @Test
    void findSimilarMatchesOnHashPrefix() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        cache.put("prompt", json("1"), "model-a");
        cache.put("prompt", json("2"), "model-b", json("{\"x\":1}"));
        cache.put("unrelated", json("3"), "model-a");
        cache.get("prompt", json("{\"x\":1}"));

        List<CacheEntrySummary> similar = cache.findSimilar("prompt", 10);
        assertEquals(2, similar.size());
        assertEquals("model-b", similar.get(0).model());
        assertEquals(1, similar.get(0).hitCount());
        assertEquals(similar.get(0).promptHash(), similar.get(1).promptHash());
        assertEquals(1, cache.findSimilar("prompt", 1).size());
        assertTrue(cache.findSimilar("prompt!", 10).isEmpty());
    }

    @Test
    void entriesSurviveReopening(@TempDir Path tempDir) throws IOException {
        try (var cache = new ResponseCache(CONFIG, new JsonDirectoryStore(tempDir), clock)) {
            cache.put("prompt", json("{\"answer\":[1,2,3]}"), "m", json("{\"page\":1}"));
            cache.get("prompt", json("{\"page\":1}"));
        }

        try (var reopened = new ResponseCache(CONFIG, new JsonDirectoryStore(tempDir), clock)) {
            assertEquals(json("{\"answer\":[1,2,3]}"), reopened.get("prompt", json("{\"page\":1}"), "m"));
            assertEquals(2, reopened.stats().totalHits());
        }
    }

    @Test
    void expiredEntriesArePurgedOnOpen() throws IOException {
        new ResponseCache(CONFIG, store, clock).put("prompt", json("1"), "m");
        clock.advance(Duration.ofDays(2));

        var reopened = new ResponseCache(CONFIG, store, clock);
        assertEquals(0, reopened.stats().entryCount());
        assertTrue(store.list().isEmpty());
    }

    @Test
    void unreadableDocumentsAreSkipped() throws IOException {
        new ResponseCache(CONFIG, store, clock).put("prompt", json("1"), "m");
        store.put("corrupt", "{not json");

        var reopened = new ResponseCache(CONFIG, store, clock);
        assertEquals(1, reopened.stats().entryCount());
        assertEquals(json("1"), reopened.get("prompt"));
    }

    @Test
    void incompleteDocumentsAreSkipped() throws IOException {
        String key = new ResponseCache(CONFIG, store, clock).put("prompt", json("1"), "m");
        store.put("null", "null");
        store.put("empty", "{}");
        store.put("no-expiry", "{\"key\":\"no-expiry\",\"requestKey\":\"r\",\"promptHash\":\"h\","
                               + "\"response\":1,\"model\":\"m\",\"createdAt\":\"2024-05-01T12:00:00Z\"}");
        store.put("elsewhere", store.get(key));

        var reopened = new ResponseCache(CONFIG, store, clock);
        assertEquals(1, reopened.stats().entryCount());
        assertEquals(json("1"), reopened.get("prompt"));
        assertEquals(0, reopened.cleanExpired());
    }

    @Test
    void returnedResponsesCannotChangeTheCache() throws IOException {
        var cache = new ResponseCache(CONFIG, store, clock);
        cache.put("capital of France?", json("{\"answer\":\"Paris\"}"), "gpt-4");

        ((ObjectNode) cache.get("capital of France?")).put("answer", "Lyon");
        ((ObjectNode) cache.get("capital of France?", null, "gpt-4")).put("answer", "Nice");

        assertEquals(json("{\"answer\":\"Paris\"}"), cache.get("capital of France?"));
        var reopened = new ResponseCache(CONFIG, store, clock);
        assertEquals(json("{\"answer\":\"Paris\"}"), reopened.get("capital of France?"));
    }
}
