package org.netpreserve.crawlguard.selector;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SelectorType {
    @JsonProperty("css") CSS,
    @JsonProperty("xpath") XPATH;

    /**
     * Guesses the type of a bare selector string: anything rooted at a slash is XPath.
     */
    public static SelectorType of(String selector) {
        return selector.startsWith("/") || selector.startsWith("(/") ? XPATH : CSS;
    }
}
