package org.netpreserve.crawlguard.ratelimit;

import org.netpreserve.crawlguard.config.TokenBucketConfig;
import org.netpreserve.crawlguard.util.Ticker;

import java.time.Duration;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket allowing short bursts of up to {@code capacity} operations while holding the long run average to
 * {@code rate} per second. The bucket starts full.
 * <p>
 * Refill is computed lazily from elapsed time. Acquirers are served one at a time in arrival order so that two
 * threads can never both spend the same tokens.
 */
public class TokenBucketLimiter {
    private final double rate;
    private final int capacity;
    private final Ticker ticker;
    private final Lock acquireLock = new ReentrantLock(true);
    private double tokens;
    private long lastRefillNanos;

    public TokenBucketLimiter(TokenBucketConfig config) {
        this(config.rate(), config.capacity(), Ticker.SYSTEM);
    }

    public TokenBucketLimiter(double rate, int capacity) {
        this(rate, capacity, Ticker.SYSTEM);
    }

    public TokenBucketLimiter(double rate, int capacity, Ticker ticker) {
        if (!(rate > 0) || Double.isInfinite(rate)) throw new IllegalArgumentException("rate must be positive: " + rate);
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.rate = rate;
        this.capacity = capacity;
        this.ticker = ticker;
        this.tokens = capacity;
        this.lastRefillNanos = ticker.nanos();
    }

    public Duration acquire() throws InterruptedException {
        return acquire(1);
    }

    /**
     * Takes {@code count} tokens, blocking until enough have accumulated.
     *
     * @return how long the call waited, zero if the tokens were already available
     * @throws IllegalArgumentException if count is negative or larger than the capacity
     */
    public Duration acquire(int count) throws InterruptedException {
        if (count < 0) throw new IllegalArgumentException("count must not be negative: " + count);
        if (count > capacity) {
            throw new IllegalArgumentException("cannot acquire " + count + " tokens from a bucket of capacity " + capacity);
        }
        acquireLock.lockInterruptibly();
        try {
            long waitedNanos = 0;
            while (true) {
                long shortfallNanos;
                synchronized (this) {
                    refill();
                    if (tokens >= count) {
                        tokens -= count;
                        return Duration.ofNanos(waitedNanos);
                    }
                    shortfallNanos = Math.max(1, (long) Math.ceil((count - tokens) / rate * 1e9));
                }
                ticker.sleep(shortfallNanos);
                waitedNanos += shortfallNanos;
            }
        } finally {
            acquireLock.unlock();
        }
    }

    private void refill() {
        long now = ticker.nanos();
        tokens = projectedTokens(now);
        lastRefillNanos = now;
    }

    private double projectedTokens(long now) {
        double elapsedSeconds = Math.max(0, now - lastRefillNanos) / 1e9;
        return Math.min(capacity, tokens + elapsedSeconds * rate);
    }

    /**
     * Tokens that could be taken right now. Reading does not commit the refill.
     */
    public synchronized double availableTokens() {
        return projectedTokens(ticker.nanos());
    }

    public double rate() {
        return rate;
    }

    public int capacity() {
        return capacity;
    }
}
