package org.netpreserve.crawlguard.ratelimit;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of an {@link AdaptiveRateLimiter}.
 *
 * @param currentDelay     delay currently enforced between requests
 * @param avgResponseTime  mean response time over the window
 * @param errorRate        errorsInWindow / requestsInWindow, or 0 for an empty window
 * @param requestsInWindow observations currently held in the window
 * @param errorsInWindow   failed observations currently held in the window
 * @param lastWait         wall-clock time the last wait finished, if any
 * @param totalRequests    requests recorded over the limiter's lifetime
 * @param totalErrors      failed requests recorded over the limiter's lifetime
 * @param totalWaitTime    time spent suspended in waits over the limiter's lifetime
 */
public record ResourceMetrics(
        Duration currentDelay,
        Duration avgResponseTime,
        double errorRate,
        int requestsInWindow,
        int errorsInWindow,
        @Nullable Instant lastWait,
        long totalRequests,
        long totalErrors,
        Duration totalWaitTime
) {
}
