package org.netpreserve.crawlguard.selector;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility.ANY;
import static com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility.NONE;

/**
 * A selector trusted to locate an element for some purpose, with its track record.
 * <p>
 * The confidence starts at whatever the creator supplies and is recomputed from the success and failure counts
 * every time a result is reported (see {@link Confidence}). Results for the fallback selectors are tracked
 * separately so that an alternative which consistently outperforms the primary can be promoted over it.
 * <p>
 * Not thread-safe. {@link SelectorLibrary} serializes access to the entries it holds and hands out copies.
 */
@JsonAutoDetect(fieldVisibility = ANY, getterVisibility = NONE, isGetterVisibility = NONE, setterVisibility = NONE)
public class SelectorEntry {
    public static final Duration STALE_AFTER = Duration.ofDays(30);
    public static final Duration EXPIRE_AFTER = Duration.ofDays(90);
    public static final double PROMOTION_THRESHOLD = 0.8;
    public static final int MIN_ATTEMPTS_FOR_PROMOTION = 5;
    private static final int FULL_SAMPLE_WEIGHT_ATTEMPTS = 20;

    private String selector;
    private SelectorType selectorType;
    private double confidence;
    private int successCount;
    private int failureCount;
    private @Nullable Instant lastSuccess;
    private @Nullable Instant lastFailure;
    private @Nullable Instant lastUsed;
    private Instant createdAt;
    private List<String> alternatives = new ArrayList<>();
    private Map<String, AlternativeStats> alternativeStats = new LinkedHashMap<>();

    private SelectorEntry() {
    }

    public SelectorEntry(String selector, SelectorType selectorType, double confidence) {
        this(selector, selectorType, confidence, List.of(), Instant.now());
    }

    public SelectorEntry(String selector, SelectorType selectorType, double confidence, List<String> alternatives) {
        this(selector, selectorType, confidence, alternatives, Instant.now());
    }

    public SelectorEntry(String selector, SelectorType selectorType, double confidence, List<String> alternatives,
                         Instant createdAt) {
        if (confidence < 0 || confidence > 1 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be between 0 and 1: " + confidence);
        }
        this.selector = Objects.requireNonNull(selector, "selector");
        this.selectorType = Objects.requireNonNull(selectorType, "selectorType");
        this.confidence = confidence;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        alternatives.forEach(this::addAlternative);
    }

    public SelectorEntry copy() {
        var copy = new SelectorEntry();
        copy.selector = selector;
        copy.selectorType = selectorType;
        copy.confidence = confidence;
        copy.successCount = successCount;
        copy.failureCount = failureCount;
        copy.lastSuccess = lastSuccess;
        copy.lastFailure = lastFailure;
        copy.lastUsed = lastUsed;
        copy.createdAt = createdAt;
        copy.alternatives = new ArrayList<>(alternatives);
        copy.alternativeStats = new LinkedHashMap<>(alternativeStats);
        return copy;
    }

    /**
     * Fills in what an older or hand-written document may leave out.
     */
    SelectorEntry normalize(Instant now) {
        if (selectorType == null) selectorType = SelectorType.of(selector);
        if (createdAt == null) createdAt = now;
        if (alternatives == null) alternatives = new ArrayList<>();
        if (alternativeStats == null) alternativeStats = new LinkedHashMap<>();
        confidence = Math.min(1.0, Math.max(0.0, confidence));
        return this;
    }

    public void recordSuccess() {
        recordSuccess(Instant.now());
    }

    public void recordSuccess(Instant now) {
        successCount++;
        lastSuccess = now;
        lastUsed = now;
        confidence = Confidence.bayesian(successCount, failureCount, false);
    }

    public void recordFailure() {
        recordFailure(Instant.now());
    }

    public void recordFailure(Instant now) {
        failureCount++;
        lastFailure = now;
        lastUsed = now;
        confidence = Confidence.bayesian(successCount, failureCount, true);
    }

    /**
     * Records the result of trying one of the fallback selectors. Unknown alternatives are tracked too, since the
     * caller may have found them elsewhere.
     */
    public void recordAlternativeResult(String alternative, boolean success, Instant now) {
        AlternativeStats stats = alternativeStats.getOrDefault(alternative, AlternativeStats.EMPTY);
        alternativeStats.put(alternative, success ? stats.withSuccess(now) : stats.withFailure(now));
        lastUsed = now;
    }

    /**
     * Appends a fallback selector unless it is already present or is the primary.
     *
     * @return true if added
     */
    public boolean addAlternative(String alternative) {
        if (alternative.equals(selector) || alternatives.contains(alternative)) return false;
        alternatives.add(alternative);
        return true;
    }

    /**
     * Blends the neutral 0.5 with the confidence, trusting the confidence fully only after twenty attempts.
     */
    public double reliability() {
        double sampleWeight = Math.min(1.0, attempts() / (double) FULL_SAMPLE_WEIGHT_ATTEMPTS);
        return 0.5 * (1 - sampleWeight) + confidence * sampleWeight;
    }

    public boolean isStale(Instant now) {
        return daysSinceUsed(now) >= STALE_AFTER.toDays();
    }

    public boolean isExpired(Instant now) {
        return daysSinceUsed(now) >= EXPIRE_AFTER.toDays();
    }

    /**
     * Whole days since the entry was last used, or since it was created if it never was.
     */
    public long daysSinceUsed(Instant now) {
        Instant reference = lastUsed != null ? lastUsed : createdAt;
        return Duration.between(reference, now).toDays();
    }

    /**
     * Success rate of the primary selector, 0.5 before any attempt.
     */
    public double primarySuccessRate() {
        int attempts = attempts();
        return attempts == 0 ? 0.5 : (double) successCount / attempts;
    }

    public @Nullable Double alternativeSuccessRate(String alternative) {
        AlternativeStats stats = alternativeStats.get(alternative);
        return stats == null ? null : stats.successRate();
    }

    /**
     * Returns the alternative with the best success rate among those with enough attempts whose rate is above
     * {@link #PROMOTION_THRESHOLD} and better than the primary's, or null if none qualifies.
     */
    public @Nullable String promotionCandidate() {
        double primaryRate = primarySuccessRate();
        String best = null;
        double bestRate = PROMOTION_THRESHOLD;
        for (var entry : alternativeStats.entrySet()) {
            AlternativeStats stats = entry.getValue();
            if (stats.attempts() < MIN_ATTEMPTS_FOR_PROMOTION) continue;
            double rate = (double) stats.successes() / stats.attempts();
            if (rate > bestRate && rate > primaryRate) {
                bestRate = rate;
                best = entry.getKey();
            }
        }
        return best;
    }

    public @Nullable SelectorComparison compareWithAlternative(String alternative) {
        AlternativeStats stats = alternativeStats.get(alternative);
        if (stats == null || stats.attempts() == 0) return null;
        return new SelectorComparison(selector, primarySuccessRate(), attempts(), alternative,
                (double) stats.successes() / stats.attempts(), stats.attempts(),
                stats.lastSuccess(), stats.lastFailure());
    }

    /**
     * Swaps the primary selector with one of its alternatives. The promoted selector takes over its recorded
     * counts and the demoted one moves to the front of the alternatives, keeping its own.
     *
     * @param force promote even if the alternative has no record or does not outperform the primary
     * @return true if promoted
     */
    public boolean promoteAlternative(String alternative, boolean force, Instant now) {
        if (!alternatives.contains(alternative)) return false;
        if (!force) {
            SelectorComparison comparison = compareWithAlternative(alternative);
            if (comparison == null || !comparison.shouldPromote()) return false;
        }
        String oldPrimary = selector;
        var demoted = new AlternativeStats(successCount, failureCount, lastSuccess, lastFailure, now);
        AlternativeStats promoted = alternativeStats.getOrDefault(alternative, AlternativeStats.EMPTY);

        selector = alternative;
        successCount = promoted.successes();
        failureCount = promoted.failures();
        lastSuccess = promoted.lastSuccess();
        lastFailure = promoted.lastFailure();
        boolean recentFailure = lastFailure != null && (lastSuccess == null || lastFailure.isAfter(lastSuccess));
        confidence = Confidence.bayesian(successCount, failureCount, recentFailure);

        alternatives.remove(alternative);
        alternatives.add(0, oldPrimary);
        alternativeStats.remove(alternative);
        alternativeStats.put(oldPrimary, demoted);
        return true;
    }

    public int attempts() {
        return successCount + failureCount;
    }

    public String selector() {
        return selector;
    }

    public SelectorType selectorType() {
        return selectorType;
    }

    public double confidence() {
        return confidence;
    }

    public int successCount() {
        return successCount;
    }

    public int failureCount() {
        return failureCount;
    }

    public @Nullable Instant lastSuccess() {
        return lastSuccess;
    }

    public @Nullable Instant lastFailure() {
        return lastFailure;
    }

    public @Nullable Instant lastUsed() {
        return lastUsed;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<String> alternatives() {
        return Collections.unmodifiableList(alternatives);
    }

    public Map<String, AlternativeStats> alternativeStats() {
        return Collections.unmodifiableMap(alternativeStats);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorEntry that)) return false;
        return Double.compare(confidence, that.confidence) == 0
               && successCount == that.successCount
               && failureCount == that.failureCount
               && selector.equals(that.selector)
               && selectorType == that.selectorType
               && Objects.equals(lastSuccess, that.lastSuccess)
               && Objects.equals(lastFailure, that.lastFailure)
               && Objects.equals(lastUsed, that.lastUsed)
               && createdAt.equals(that.createdAt)
               && alternatives.equals(that.alternatives)
               && alternativeStats.equals(that.alternativeStats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector, selectorType, confidence, successCount, failureCount, lastSuccess, lastFailure,
                lastUsed, createdAt, alternatives, alternativeStats);
    }

    @Override
    public String toString() {
        return "SelectorEntry{" +
               "selector='" + selector + '\'' +
               ", type=" + selectorType +
               ", confidence=" + confidence +
               ", successes=" + successCount +
               ", failures=" + failureCount +
               ", alternatives=" + alternatives +
               '}';
    }
}
