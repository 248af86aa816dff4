package org.netpreserve.crawlguard.cache;

import java.time.Instant;

/**
 * Metadata of a cache entry, without the response.
 */
public record CacheEntrySummary(String key, String promptHash, String model, Instant createdAt, long hitCount) {
}
