package org.netpreserve.crawlguard.config;

/**
 * Root configuration for a crawl session's resilience services.
 *
 * @param rateLimit   adaptive pacing of outbound requests
 * @param tokenBucket burst control for outbound requests
 * @param cache       response cache for expensive model calls
 * @param selectors   selector library seeding
 * @param storage     where cache entries and selectors are persisted
 */
public record GuardConfig(
        RateLimitConfig rateLimit,
        TokenBucketConfig tokenBucket,
        CacheConfig cache,
        SelectorConfig selectors,
        StorageConfig storage
) {
    public StorageConfig storageOrDefault() {
        return storage == null ? new StorageConfig(StorageConfig.Type.MEMORY) : storage;
    }

    public SelectorConfig selectorsOrDefault() {
        return selectors == null ? new SelectorConfig(null) : selectors;
    }
}
