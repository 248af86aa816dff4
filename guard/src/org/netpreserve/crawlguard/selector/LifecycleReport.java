package org.netpreserve.crawlguard.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * Health of the stored selectors, from {@link SelectorLibrary#lifecycleReport()}.
 *
 * @param totalSelectors         stored selectors across all domains and purposes
 * @param staleSelectors         selectors unused long enough to be stale but not yet expired
 * @param expiredSelectors       selectors that {@link SelectorLibrary#cleanupExpired(boolean)} would remove
 * @param lowConfidenceSelectors selectors with a confidence below {@link #LOW_CONFIDENCE}
 * @param promotionCandidates    alternatives that {@link SelectorLibrary#autoPromoteAlternatives()} would promote
 * @param recommendations        suggested actions, in no particular order
 */
public record LifecycleReport(
        int totalSelectors,
        int staleSelectors,
        int expiredSelectors,
        int lowConfidenceSelectors,
        List<Candidate> promotionCandidates,
        List<String> recommendations
) {
    public static final double LOW_CONFIDENCE = 0.5;
    public static final String HEALTHY = "Selector library is healthy, no action needed";

    public LifecycleReport {
        promotionCandidates = List.copyOf(promotionCandidates);
        recommendations = List.copyOf(recommendations);
    }

    public record Candidate(String domain, String purpose, String currentSelector, String candidate,
                            double candidateSuccessRate) {
    }

    static List<String> recommend(int total, int stale, int expired, int lowConfidence, int promotions) {
        var recommendations = new ArrayList<String>();
        if (expired > 0) {
            recommendations.add("Run cleanupExpired to remove " + expired + " expired selector(s)");
        }
        if (stale > 0 && stale > total * 0.2) {
            recommendations.add(stale + " selector(s) are stale, consider re-validating them");
        }
        if (lowConfidence > 0 && lowConfidence > total * 0.1) {
            recommendations.add(lowConfidence + " selector(s) have low confidence, review their alternatives");
        }
        if (promotions > 0) {
            recommendations.add("Run autoPromoteAlternatives to promote " + promotions + " successful alternative(s)");
        }
        if (recommendations.isEmpty()) recommendations.add(HEALTHY);
        return recommendations;
    }
}
