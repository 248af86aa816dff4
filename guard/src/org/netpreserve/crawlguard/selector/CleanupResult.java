package org.netpreserve.crawlguard.selector;

import java.util.List;

/**
 * Outcome of {@link SelectorLibrary#cleanupExpired(boolean)}.
 *
 * @param expiredRemoved  expired selectors taken out of the library
 * @param expiredArchived how many of those were archived rather than deleted
 * @param staleCount      selectors left in place that are stale but not yet expired
 * @param sitesAffected   domains that lost at least one selector
 * @param archived        the selectors moved to the archive
 */
public record CleanupResult(
        int expiredRemoved,
        int expiredArchived,
        int staleCount,
        int sitesAffected,
        List<Removed> archived
) {
    public CleanupResult {
        archived = List.copyOf(archived);
    }

    public record Removed(String domain, String purpose, String selector) {
    }
}
