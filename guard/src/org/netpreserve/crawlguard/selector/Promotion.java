package org.netpreserve.crawlguard.selector;

/**
 * An alternative selector that replaced the primary for a domain and purpose.
 */
public record Promotion(
        String domain,
        String purpose,
        String oldSelector,
        String newSelector,
        double newConfidence,
        SelectorComparison comparison
) {
}
