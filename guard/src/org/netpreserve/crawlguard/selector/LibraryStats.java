package org.netpreserve.crawlguard.selector;

/**
 * @param siteCount          domains with at least one stored selector
 * @param totalSelectors     stored selectors across all domains and purposes
 * @param averageConfidence  mean confidence of the stored selectors, zero if there are none
 * @param globalPatternCount cross-site patterns across all purposes
 * @param archivedCount      selectors in the archive
 * @param archivedSites      domains with at least one archived selector
 */
public record LibraryStats(
        int siteCount,
        int totalSelectors,
        double averageConfidence,
        int globalPatternCount,
        int archivedCount,
        int archivedSites
) {
}
