package org.netpreserve.crawlguard.ratelimit;

import org.netpreserve.crawlguard.config.RateLimitConfig;
import org.netpreserve.crawlguard.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Paces outbound requests by adjusting a delay from observed response times and failures.
 * <p>
 * Callers invoke {@link #await()} before each request and {@link #recordRequest(Duration, boolean)} once it
 * completes. The delay backs off multiplicatively while the error rate or latency is too high and decays back
 * towards the minimum while requests are fast and succeed. It never leaves [minDelay, maxDelay].
 * <p>
 * Safe to share between threads: waiters queue fairly behind one another, and recording never blocks behind a
 * sleeping waiter.
 */
public class AdaptiveRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateLimiter.class);
    private static final int MIN_OBSERVATIONS = 3;
    private static final double MAX_LATENCY_FACTOR = 2.0;
    private static final long MIN_BACKOFF_STEP_NANOS = Duration.ofMillis(10).toNanos();

    private final RateLimitConfig config;
    private final Ticker ticker;
    private final Lock waitLock = new ReentrantLock(true);
    private final Deque<Observation> window = new ArrayDeque<>();
    private long currentDelayNanos;
    private long lastWaitNanos;
    private boolean waitedBefore;
    private Instant lastWait;
    private long totalRequests;
    private long totalErrors;
    private long totalWaitNanos;

    public AdaptiveRateLimiter(RateLimitConfig config) {
        this(config, Ticker.SYSTEM);
    }

    public AdaptiveRateLimiter(RateLimitConfig config, Ticker ticker) {
        this.config = config;
        this.ticker = ticker;
        this.currentDelayNanos = config.baseDelay().toNanos();
    }

    /**
     * Blocks until at least the current delay has passed since the previous call returned.
     *
     * @return how long this call slept, zero on the first call
     */
    public Duration await() throws InterruptedException {
        waitLock.lockInterruptibly();
        try {
            long waitNanos = 0;
            synchronized (this) {
                if (waitedBefore) {
                    long elapsed = ticker.nanos() - lastWaitNanos;
                    waitNanos = Math.max(0, currentDelayNanos - elapsed);
                }
            }
            if (waitNanos > 0) {
                ticker.sleep(waitNanos);
            }
            synchronized (this) {
                totalWaitNanos += waitNanos;
                lastWaitNanos = ticker.nanos();
                lastWait = Instant.now();
                waitedBefore = true;
            }
            return Duration.ofNanos(waitNanos);
        } finally {
            waitLock.unlock();
        }
    }

    /**
     * Records the outcome of a completed (or failed or timed out) request and adjusts the delay.
     */
    public synchronized void recordRequest(Duration responseTime, boolean success) {
        long responseNanos = responseTime.isNegative() ? 0 : responseTime.toNanos();
        if (window.size() >= config.windowSize()) {
            window.removeFirst();
        }
        window.addLast(new Observation(responseNanos, success));
        totalRequests++;
        if (!success) totalErrors++;
        adjustDelay();
    }

    private void adjustDelay() {
        if (window.size() < Math.min(MIN_OBSERVATIONS, config.windowSize())) return;

        double errorRate = errorRate();
        double avgNanos = averageResponseNanos();
        double targetNanos = config.targetResponseTime().toNanos();
        double factor = 1.0;
        String reason = null;

        if (errorRate > config.errorRateThreshold()) {
            factor = config.errorBackoffMultiplier();
            reason = "error rate";
        } else if (avgNanos > targetNanos) {
            factor = Math.min(avgNanos / targetNanos, MAX_LATENCY_FACTOR);
            reason = "response time";
        } else if (errorRate == 0 && avgNanos < targetNanos * 0.5) {
            factor = config.successRecoveryMultiplier();
            reason = "recovery";
        }
        if (factor == 1.0) return;

        long previous = currentDelayNanos;
        long next = (long) (currentDelayNanos * factor);
        // a zero delay doesn't grow by multiplication alone
        if (factor > 1.0 && next <= currentDelayNanos) next = currentDelayNanos + MIN_BACKOFF_STEP_NANOS;
        currentDelayNanos = clamp(next);
        if (previous != currentDelayNanos) {
            log.atDebug().addKeyValue("reason", reason)
                    .addKeyValue("errorRate", errorRate)
                    .addKeyValue("avgResponseMs", avgNanos / 1e6)
                    .log("Rate limit delay {}ms -> {}ms", previous / 1_000_000, currentDelayNanos / 1_000_000);
        }
    }

    private long clamp(long nanos) {
        return Math.max(config.minDelay().toNanos(), Math.min(config.maxDelay().toNanos(), nanos));
    }

    private double averageResponseNanos() {
        if (window.isEmpty()) return 0;
        double sum = 0;
        for (var observation : window) {
            sum += observation.responseNanos();
        }
        return sum / window.size();
    }

    private int errorsInWindow() {
        int errors = 0;
        for (var observation : window) {
            if (!observation.success()) errors++;
        }
        return errors;
    }

    /**
     * Fraction of failed requests in the current window, 0 when it is empty.
     */
    public synchronized double errorRate() {
        if (window.isEmpty()) return 0.0;
        return (double) errorsInWindow() / window.size();
    }

    public synchronized Duration currentDelay() {
        return Duration.ofNanos(currentDelayNanos);
    }

    public synchronized ResourceMetrics getMetrics() {
        return new ResourceMetrics(
                Duration.ofNanos(currentDelayNanos),
                Duration.ofNanos(Math.round(averageResponseNanos())),
                errorRate(),
                window.size(),
                errorsInWindow(),
                lastWait,
                totalRequests,
                totalErrors,
                Duration.ofNanos(totalWaitNanos));
    }

    /**
     * Clears the window and restores the base delay. Lifetime counters are kept.
     */
    public synchronized void reset() {
        window.clear();
        currentDelayNanos = config.baseDelay().toNanos();
        waitedBefore = false;
        lastWait = null;
    }

    public RateLimitConfig config() {
        return config;
    }

    private record Observation(long responseNanos, boolean success) {
    }
}
