package org.netpreserve.crawlguard.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.crawlguard.util.DurationDeserializer;

import java.time.Duration;
import java.util.Objects;

/**
 * Adaptive rate limiter tuning.
 *
 * @param baseDelay                 delay to start from (and return to on reset)
 * @param minDelay                  lower bound on the delay, even under ideal conditions
 * @param maxDelay                  upper bound on the delay, even under the worst conditions
 * @param targetResponseTime        average response time above which the delay grows
 * @param errorRateThreshold        fraction of failed requests (0 to 1) above which the delay backs off
 * @param windowSize                number of recent requests the averages are computed over
 * @param errorBackoffMultiplier    factor applied to the delay when the error rate is too high
 * @param successRecoveryMultiplier factor applied to the delay while conditions are good
 */
public record RateLimitConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration baseDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration minDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration targetResponseTime,
        double errorRateThreshold,
        int windowSize,
        double errorBackoffMultiplier,
        double successRecoveryMultiplier
) {
    public static final double DEFAULT_ERROR_BACKOFF_MULTIPLIER = 2.0;
    public static final double DEFAULT_SUCCESS_RECOVERY_MULTIPLIER = 0.9;

    public RateLimitConfig {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(minDelay, "minDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(targetResponseTime, "targetResponseTime");
        if (minDelay.isNegative()) throw new IllegalArgumentException("minDelay must not be negative");
        if (minDelay.compareTo(maxDelay) > 0) {
            throw new IllegalArgumentException("minDelay " + minDelay + " exceeds maxDelay " + maxDelay);
        }
        if (baseDelay.compareTo(minDelay) < 0 || baseDelay.compareTo(maxDelay) > 0) {
            throw new IllegalArgumentException("baseDelay " + baseDelay + " outside [" + minDelay + ", " + maxDelay + "]");
        }
        if (targetResponseTime.isNegative() || targetResponseTime.isZero()) {
            throw new IllegalArgumentException("targetResponseTime must be positive");
        }
        if (!(errorRateThreshold >= 0 && errorRateThreshold <= 1)) {
            throw new IllegalArgumentException("errorRateThreshold must be between 0 and 1: " + errorRateThreshold);
        }
        if (windowSize < 1) throw new IllegalArgumentException("windowSize must be at least 1: " + windowSize);
        if (!(errorBackoffMultiplier >= 1)) {
            throw new IllegalArgumentException("errorBackoffMultiplier must be at least 1: " + errorBackoffMultiplier);
        }
        if (!(successRecoveryMultiplier > 0 && successRecoveryMultiplier <= 1)) {
            throw new IllegalArgumentException("successRecoveryMultiplier must be in (0, 1]: " + successRecoveryMultiplier);
        }
    }

    public static RateLimitConfig of(Duration baseDelay, Duration minDelay, Duration maxDelay,
                                     Duration targetResponseTime, double errorRateThreshold, int windowSize) {
        return new RateLimitConfig(baseDelay, minDelay, maxDelay, targetResponseTime, errorRateThreshold, windowSize,
                DEFAULT_ERROR_BACKOFF_MULTIPLIER, DEFAULT_SUCCESS_RECOVERY_MULTIPLIER);
    }

    public static RateLimitConfig defaults() {
        return of(Duration.ofSeconds(1), Duration.ofMillis(500), Duration.ofSeconds(10), Duration.ofSeconds(2),
                0.1, 20);
    }
}
