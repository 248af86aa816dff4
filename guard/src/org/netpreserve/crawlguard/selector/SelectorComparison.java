package org.netpreserve.crawlguard.selector;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Observed performance of a primary selector against one of its alternatives.
 */
public record SelectorComparison(
        String primarySelector,
        double primarySuccessRate,
        int primaryAttempts,
        String alternativeSelector,
        double alternativeSuccessRate,
        int alternativeAttempts,
        @Nullable Instant alternativeLastSuccess,
        @Nullable Instant alternativeLastFailure
) {
    public double rateDifference() {
        return alternativeSuccessRate - primarySuccessRate;
    }

    public boolean shouldPromote() {
        return alternativeSuccessRate > primarySuccessRate
               && alternativeSuccessRate >= SelectorEntry.PROMOTION_THRESHOLD;
    }
}
