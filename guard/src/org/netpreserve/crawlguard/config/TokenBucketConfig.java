package org.netpreserve.crawlguard.config;

/**
 * Token bucket settings.
 *
 * @param rate     tokens added per second
 * @param capacity maximum number of tokens held, i.e. the largest burst
 */
public record TokenBucketConfig(double rate, int capacity) {
    public TokenBucketConfig {
        if (!(rate > 0) || Double.isInfinite(rate)) throw new IllegalArgumentException("rate must be positive: " + rate);
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
}
