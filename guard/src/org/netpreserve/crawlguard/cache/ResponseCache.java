package org.netpreserve.crawlguard.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.crawlguard.config.CacheConfig;
import org.netpreserve.crawlguard.store.KeyValueStore;
import org.netpreserve.crawlguard.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Cache of model responses keyed by request content, model and an optional context object.
 * <p>
 * Entries expire a fixed TTL after being stored. When the total serialized size of the entries exceeds the
 * configured maximum the least recently used entries are evicted. With a store attached every change is written
 * through, so a cache reopened on the same store sees the same entries. Store failures are logged and the
 * in-memory state stays authoritative.
 * <p>
 * A disabled cache stores nothing and answers every lookup with a miss.
 */
public class ResponseCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final boolean enabled;
    private final Duration ttl;
    private final long maxSize;
    private final Clock clock;
    private @Nullable KeyValueStore store;
    // insertion order is kept as least recently used first
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
    private final Map<String, Set<String>> keysByRequest = new HashMap<>();
    private final Map<String, Integer> sizes = new HashMap<>();
    private long totalSize;

    public ResponseCache(CacheConfig config) {
        this(config, null, Clock.systemUTC());
    }

    public ResponseCache(CacheConfig config, @Nullable KeyValueStore store) {
        this(config, store, Clock.systemUTC());
    }

    public ResponseCache(CacheConfig config, @Nullable KeyValueStore store, Clock clock) {
        this.enabled = config.enabled();
        this.ttl = config.ttl();
        this.maxSize = config.maxSize();
        this.clock = clock;
        this.store = store;
        if (enabled) {
            load();
            int expired = cleanExpired();
            if (expired > 0) log.info("Purged {} expired cache entries", expired);
            enforceSizeLimit();
        }
    }

    private void load() {
        if (store == null) return;
        List<String> keys;
        try {
            keys = store.list();
        } catch (IOException e) {
            log.error("Unable to read cache store, continuing in memory only", e);
            store = null;
            return;
        }
        List<CacheEntry> loaded = new ArrayList<>();
        for (String key : keys) {
            try {
                String document = store.get(key);
                if (document == null) continue;
                CacheEntry entry = Json.mapper().readValue(document, CacheEntry.class);
                if (entry == null) {
                    log.warn("Skipping empty cache entry {}", key);
                    continue;
                }
                if (!entry.key().equals(key)) {
                    log.warn("Skipping cache entry {} stored under another key {}", entry.key(), key);
                    continue;
                }
                loaded.add(entry);
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable cache entry {}", key, e);
            }
        }
        loaded.sort(Comparator.comparing(CacheEntry::lastUsed));
        for (CacheEntry entry : loaded) {
            index(entry, serialize(entry));
        }
        log.debug("Loaded {} cache entries", loaded.size());
    }

    /**
     * Returns the stored response for the request, whichever model produced it.
     */
    public @Nullable JsonNode get(String content) {
        return get(content, null);
    }

    /**
     * Returns the most recently stored live response for this request and context, whichever model produced it, or
     * null on a miss.
     */
    public synchronized @Nullable JsonNode get(String content, @Nullable Object context) {
        if (!enabled) return null;
        Instant now = clock.instant();
        Set<String> keys = keysByRequest.get(CacheKeys.requestKey(content, context));
        if (keys == null) return null;
        CacheEntry newest = null;
        for (String key : new ArrayList<>(keys)) {
            CacheEntry entry = entries.get(key);
            if (entry.isExpired(now)) {
                remove(key);
            } else if (newest == null || entry.createdAt().isAfter(newest.createdAt())) {
                newest = entry;
            }
        }
        return newest == null ? null : hit(newest, now);
    }

    /**
     * Returns the live response stored for this request, context and model, or null on a miss.
     */
    public synchronized @Nullable JsonNode get(String content, @Nullable Object context, String model) {
        if (!enabled) return null;
        Instant now = clock.instant();
        String key = CacheKeys.entryKey(CacheKeys.requestKey(content, context), model);
        CacheEntry entry = entries.get(key);
        if (entry == null) return null;
        if (entry.isExpired(now)) {
            remove(key);
            return null;
        }
        return hit(entry, now);
    }

    private JsonNode hit(CacheEntry entry, Instant now) {
        CacheEntry updated = entry.withHit(now);
        unindex(entry.key());
        String document = serialize(updated);
        index(updated, document);
        write(updated.key(), document);
        // the hit metadata makes the entry slightly larger
        enforceSizeLimit();
        return updated.response().deepCopy();
    }

    public @Nullable String put(String content, JsonNode response, String model) {
        return put(content, response, model, null);
    }

    /**
     * Stores a response, replacing any entry for the same request, context and model.
     *
     * @return the entry's key, or null if the cache is disabled
     */
    public synchronized @Nullable String put(String content, JsonNode response, String model, @Nullable Object context) {
        if (!enabled) return null;
        Instant now = clock.instant();
        String requestKey = CacheKeys.requestKey(content, context);
        String key = CacheKeys.entryKey(requestKey, model);
        var entry = new CacheEntry(key, requestKey, CacheKeys.promptHash(content), response.deepCopy(), model,
                now, now.plus(ttl), 0, null);
        unindex(key);
        String document = serialize(entry);
        index(entry, document);
        write(key, document);
        enforceSizeLimit();
        return key;
    }

    /**
     * Removes the entries for this request and context under every model.
     *
     * @return true if anything was removed
     */
    public synchronized boolean invalidate(String content, @Nullable Object context) {
        if (!enabled) return false;
        Set<String> keys = keysByRequest.get(CacheKeys.requestKey(content, context));
        if (keys == null) return false;
        for (String key : new ArrayList<>(keys)) {
            remove(key);
        }
        return true;
    }

    public boolean invalidate(String content) {
        return invalidate(content, null);
    }

    /**
     * Removes the entry for this request, context and model.
     *
     * @return true if it existed
     */
    public synchronized boolean invalidate(String content, @Nullable Object context, String model) {
        if (!enabled) return false;
        String key = CacheKeys.entryKey(CacheKeys.requestKey(content, context), model);
        if (!entries.containsKey(key)) return false;
        remove(key);
        return true;
    }

    public synchronized void clear() {
        if (!enabled) return;
        for (String key : new ArrayList<>(entries.keySet())) {
            remove(key);
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return the number removed
     */
    public synchronized int cleanExpired() {
        if (!enabled) return 0;
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        for (CacheEntry entry : entries.values()) {
            if (entry.isExpired(now)) expired.add(entry.key());
        }
        expired.forEach(this::remove);
        return expired.size();
    }

    public synchronized CacheStats stats() {
        if (!enabled) return CacheStats.disabled();
        long totalHits = 0;
        for (CacheEntry entry : entries.values()) {
            totalHits += entry.hitCount();
        }
        return new CacheStats(true, entries.size(), totalSize, maxSize, ttl, totalHits);
    }

    /**
     * Lists entries whose prompt hash starts with the same eight hex digits as the hash of {@code text}, most hit
     * first.
     * <p>
     * This is a structural coincidence of hash prefixes, not a semantic similarity search: it finds entries stored
     * for exactly the same text (under any context or model) and, rarely, unrelated entries whose hashes happen to
     * collide on the prefix. Two texts that differ by a single character practically never match.
     */
    public synchronized List<CacheEntrySummary> findSimilar(String text, int limit) {
        if (!enabled) return List.of();
        String prefix = CacheKeys.promptHash(text).substring(0, CacheKeys.SIMILARITY_PREFIX_LENGTH);
        return entries.values().stream()
                .filter(entry -> entry.promptHash().startsWith(prefix))
                .sorted(Comparator.comparingLong(CacheEntry::hitCount).reversed())
                .limit(limit)
                .map(CacheEntry::summary)
                .toList();
    }

    public boolean isEnabled() {
        return enabled;
    }

    private void enforceSizeLimit() {
        var iterator = entries.values().iterator();
        List<String> evicted = new ArrayList<>();
        long size = totalSize;
        while (size > maxSize && iterator.hasNext()) {
            CacheEntry entry = iterator.next();
            size -= sizes.get(entry.key());
            evicted.add(entry.key());
        }
        if (evicted.isEmpty()) return;
        evicted.forEach(this::remove);
        log.atDebug().addKeyValue("evicted", evicted.size())
                .addKeyValue("size", totalSize)
                .addKeyValue("maxSize", maxSize)
                .log("Evicted least recently used cache entries");
    }

    private void index(CacheEntry entry, String document) {
        entries.put(entry.key(), entry);
        keysByRequest.computeIfAbsent(entry.requestKey(), k -> new LinkedHashSet<>()).add(entry.key());
        int size = document.getBytes(UTF_8).length;
        sizes.put(entry.key(), size);
        totalSize += size;
    }

    private @Nullable CacheEntry unindex(String key) {
        CacheEntry entry = entries.remove(key);
        if (entry == null) return null;
        Set<String> siblings = keysByRequest.get(entry.requestKey());
        if (siblings != null) {
            siblings.remove(key);
            if (siblings.isEmpty()) keysByRequest.remove(entry.requestKey());
        }
        Integer size = sizes.remove(key);
        if (size != null) totalSize -= size;
        return entry;
    }

    private void remove(String key) {
        if (unindex(key) == null) return;
        if (store == null) return;
        try {
            store.delete(key);
        } catch (IOException e) {
            log.warn("Failed to delete cache entry {} from store", key, e);
        }
    }

    private void write(String key, String document) {
        if (store == null) return;
        try {
            store.put(key, document);
        } catch (IOException e) {
            log.warn("Failed to write cache entry {} to store", key, e);
        }
    }

    private static String serialize(CacheEntry entry) {
        try {
            return Json.mapper().writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized void close() {
        if (store == null) return;
        try {
            store.close();
        } catch (IOException e) {
            log.warn("Failed to close cache store", e);
        }
        store = null;
    }
}
