package org.netpreserve.crawlguard.selector;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A proposed selector for an element, not yet committed to the library.
 *
 * @param elementType    tag name of the element the selector was derived from
 * @param specificity    rough CSS specificity, higher is more precise
 * @param stabilityScore heuristic estimate between 0 and 1 of how well the selector survives markup changes
 * @param attributes     the element attributes the selector relies on
 * @param textContent    the text the selector matches on, for text based selectors
 */
public record SelectorCandidate(
        String selector,
        SelectorType selectorType,
        String elementType,
        String purpose,
        int specificity,
        double stabilityScore,
        Map<String, String> attributes,
        @Nullable String textContent
) {
    public SelectorCandidate {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public SelectorEntry toSelectorEntry(double initialConfidence) {
        return new SelectorEntry(selector, selectorType, initialConfidence, List.of());
    }
}
