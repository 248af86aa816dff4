package org.netpreserve.crawlguard.config;

import java.util.List;
import java.util.Map;

/**
 * Selector library settings.
 *
 * @param globalPatterns cross-site fallback selectors by purpose, added to the library when a session opens
 */
public record SelectorConfig(Map<String, List<String>> globalPatterns) {
    public SelectorConfig {
        globalPatterns = globalPatterns == null ? Map.of() : globalPatterns;
    }
}
