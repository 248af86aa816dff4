package org.netpreserve.crawlguard.selector;

/**
 * Bayesian estimate of how likely a selector is to keep working.
 */
public final class Confidence {
    public static final int PRIOR_SUCCESSES = 2;
    public static final int PRIOR_FAILURES = 1;
    public static final double RECENT_FAILURE_PENALTY = 0.95;
    public static final double NO_PENALTY = 1.0;

    private Confidence() {
    }

    /**
     * Computes {@code (successes + priorSuccesses) / (successes + failures + priorSuccesses + priorFailures)}
     * scaled by {@code penalty} and clamped to [0, 1]. With few observations the result stays close to the prior.
     *
     * @param penalty multiplier applied to the estimate, {@link #RECENT_FAILURE_PENALTY} when the latest report was
     *                a failure and {@link #NO_PENALTY} otherwise
     */
    public static double bayesian(long successes, long failures, int priorSuccesses, int priorFailures,
                                  double penalty) {
        if (successes < 0 || failures < 0) {
            throw new IllegalArgumentException("counts must not be negative: " + successes + "/" + failures);
        }
        if (priorSuccesses < 0 || priorFailures < 0 || priorSuccesses + priorFailures == 0) {
            throw new IllegalArgumentException("invalid prior: " + priorSuccesses + "/" + priorFailures);
        }
        if (penalty < 0 || Double.isNaN(penalty)) {
            throw new IllegalArgumentException("penalty must not be negative: " + penalty);
        }
        double estimate = (double) (successes + priorSuccesses)
                          / (successes + failures + priorSuccesses + priorFailures);
        return Math.min(1.0, Math.max(0.0, estimate * penalty));
    }

    public static double bayesian(long successes, long failures, boolean recentFailure) {
        return bayesian(successes, failures, PRIOR_SUCCESSES, PRIOR_FAILURES,
                recentFailure ? RECENT_FAILURE_PENALTY : NO_PENALTY);
    }
}
