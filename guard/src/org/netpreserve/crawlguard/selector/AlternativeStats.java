package org.netpreserve.crawlguard.selector;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Usage record of a fallback selector.
 *
 * @param demotedAt set when the selector was the primary until an alternative was promoted over it
 */
public record AlternativeStats(
        int successes,
        int failures,
        @Nullable Instant lastSuccess,
        @Nullable Instant lastFailure,
        @Nullable Instant demotedAt
) {
    public static final AlternativeStats EMPTY = new AlternativeStats(0, 0, null, null, null);

    public AlternativeStats withSuccess(Instant now) {
        return new AlternativeStats(successes + 1, failures, now, lastFailure, demotedAt);
    }

    public AlternativeStats withFailure(Instant now) {
        return new AlternativeStats(successes, failures + 1, lastSuccess, now, demotedAt);
    }

    public int attempts() {
        return successes + failures;
    }

    /**
     * @return the observed success rate, or null without any attempts
     */
    public @Nullable Double successRate() {
        int attempts = attempts();
        return attempts == 0 ? null : (double) successes / attempts;
    }
}
