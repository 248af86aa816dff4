package org.netpreserve.crawlguard.ratelimit;

import org.junit.jupiter.api.Test;
import org.netpreserve.crawlguard.util.FakeTicker;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketLimiterTest {

    @Test
    void drainedBucketMakesTheNextAcquireWait() throws InterruptedException {
        var ticker = new FakeTicker();
        var bucket = new TokenBucketLimiter(10, 5, ticker);

        assertEquals(Duration.ZERO, bucket.acquire(5));
        assertEquals(0.0, bucket.availableTokens(), 1e-9);
        assertEquals(Duration.ofMillis(100), bucket.acquire(1));
        assertEquals(1, ticker.sleeps());
    }

    @Test
    void drainedBucketWaitsOnTheRealClock() throws InterruptedException {
        var bucket = new TokenBucketLimiter(10, 5);

        Duration first = bucket.acquire(5);
        assertTrue(first.toMillis() < 50, "full bucket should not wait: " + first);
        Duration second = bucket.acquire(1);
        assertTrue(second.compareTo(Duration.ZERO) > 0, "drained bucket should wait");
        assertTrue(second.toMillis() <= 150, "wait should be about 100ms: " + second);
    }

    @Test
    void tokensRefillOverTimeUpToCapacity() throws InterruptedException {
        var ticker = new FakeTicker();
        var bucket = new TokenBucketLimiter(2, 4, ticker);
        bucket.acquire(4);

        ticker.advance(Duration.ofMillis(500));
        assertEquals(1.0, bucket.availableTokens(), 1e-9);
        // reading doesn't commit the refill, so a second read sees the same amount
        assertEquals(1.0, bucket.availableTokens(), 1e-9);

        ticker.advance(Duration.ofMinutes(1));
        assertEquals(4.0, bucket.availableTokens(), 1e-9);
        assertEquals(Duration.ZERO, bucket.acquire(4));
    }

    @Test
    void partialTokensShortenTheWait() throws InterruptedException {
        var ticker = new FakeTicker();
        var bucket = new TokenBucketLimiter(10, 5, ticker);
        bucket.acquire(5);
        ticker.advance(Duration.ofMillis(50));
        assertEquals(Duration.ofMillis(50), bucket.acquire(1));
    }

    @Test
    void acquiringZeroNeverWaits() throws InterruptedException {
        var ticker = new FakeTicker();
        var bucket = new TokenBucketLimiter(1, 1, ticker);
        bucket.acquire(1);
        assertEquals(Duration.ZERO, bucket.acquire(0));
    }

    @Test
    void availableTokensStayWithinCapacity() throws InterruptedException {
        var ticker = new FakeTicker();
        var bucket = new TokenBucketLimiter(3, 5, ticker);
        for (int i = 0; i < 50; i++) {
            bucket.acquire(1 + i % 5);
            ticker.advance(Duration.ofMillis(i * 37L));
            double available = bucket.availableTokens();
            assertTrue(available >= 0 && available <= 5, "out of range: " + available);
        }
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketLimiter(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketLimiter(-1, 5));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketLimiter(1, 0));
        var bucket = new TokenBucketLimiter(1, 5);
        assertThrows(IllegalArgumentException.class, () -> bucket.acquire(6));
        assertThrows(IllegalArgumentException.class, () -> bucket.acquire(-1));
    }
}
