package org.netpreserve.crawlguard.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.crawlguard.util.ByteSizeDeserializer;
import org.netpreserve.crawlguard.util.DurationDeserializer;

import java.time.Duration;

/**
 * Response cache settings.
 *
 * @param enabled whether the cache stores and serves anything at all
 * @param ttl     how long an entry stays valid after being stored
 * @param maxSize upper bound on the total serialized size of all entries, in bytes
 */
public record CacheConfig(
        boolean enabled,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration ttl,
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        Long maxSize
) {
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final long DEFAULT_MAX_SIZE = 100L * 1024 * 1024;

    public CacheConfig {
        if (ttl == null) ttl = DEFAULT_TTL;
        if (maxSize == null) maxSize = DEFAULT_MAX_SIZE;
        if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive: " + ttl);
        if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(false, null, null);
    }
}
