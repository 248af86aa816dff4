package org.netpreserve.crawlguard.selector;

import java.time.Instant;

/**
 * A selector taken out of use, kept so it can be restored.
 */
public record ArchivedSelector(SelectorEntry entry, Instant archivedAt, String reason) {
    public static final String REASON_EXPIRED = "expired";

    public ArchivedSelector {
        entry = entry.copy();
    }

    @Override
    public SelectorEntry entry() {
        return entry.copy();
    }
}
