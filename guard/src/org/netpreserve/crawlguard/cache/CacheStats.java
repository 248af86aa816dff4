package org.netpreserve.crawlguard.cache;

import java.time.Duration;

/**
 * @param enabled      false when the cache is switched off, in which case every other field is zero
 * @param entryCount   live and not yet purged entries
 * @param sizeBytes    total serialized size of all entries
 * @param maxSizeBytes size above which entries are evicted
 * @param ttl          lifespan of new entries
 * @param totalHits    sum of the hit counts of all entries
 */
public record CacheStats(boolean enabled, int entryCount, long sizeBytes, long maxSizeBytes, Duration ttl,
                         long totalHits) {
    static CacheStats disabled() {
        return new CacheStats(false, 0, 0, 0, Duration.ZERO, 0);
    }
}
