package org.netpreserve.crawlguard.selector;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Proposes selectors for the first element of an HTML fragment, most stable first.
 * <p>
 * Explicit test ids and element ids are preferred over other attributes, attributes over class names, and class
 * names over text and structural position. Values that look generated by a build tool or framework (CSS module
 * hashes, UUIDs, long numbers) are skipped since they change between deployments.
 */
public class CandidateGenerator {
    static final double TEST_ID_STABILITY = 0.98;
    static final double ID_STABILITY = 0.95;
    static final double NAME_STABILITY = 0.92;
    static final double DATA_ATTRIBUTE_STABILITY = 0.85;
    static final double ARIA_LABEL_STABILITY = 0.80;
    static final double CLASS_STABILITY = 0.60;
    static final double TEXT_STABILITY = 0.40;
    static final double STRUCTURAL_STABILITY = 0.20;

    private static final int MAX_TEXT_LENGTH = 50;
    private static final int MAX_TEXT_MATCH = 30;
    private static final int MAX_CLASSES = 2;
    private static final List<String> UTILITY_CLASS_PREFIXES = List.of("col-", "row-", "mt-", "mb-", "px-", "py-");
    private static final List<Pattern> GENERATED_VALUE_PATTERNS = List.of(
            Pattern.compile("^[a-zA-Z_-]+_[a-zA-Z0-9]{5,8}$"),       // CSS modules
            Pattern.compile("^sc-[a-zA-Z0-9]+-[a-zA-Z0-9]+$"),       // styled-components
            Pattern.compile("^css-[a-zA-Z0-9]+(-[a-zA-Z0-9]+)?$"),   // emotion
            Pattern.compile("^[a-zA-Z]+__[a-zA-Z]+--[a-zA-Z0-9]+$"),
            Pattern.compile("^_[a-zA-Z0-9]{8,}$"),
            Pattern.compile("^[a-f0-9]{8}-[a-f0-9]{4}-"),             // uuid
            Pattern.compile("^[a-zA-Z]+[0-9]{6,}$"),
            Pattern.compile("^[0-9]+$"));

    /**
     * Parses the fragment and proposes selectors for its first element.
     *
     * @return candidates ordered by decreasing stability, empty if the fragment contains no element
     */
    public List<SelectorCandidate> generate(String html, String purpose) {
        Element element = firstElement(html);
        if (element == null) return List.of();
        return candidates(element, purpose, false);
    }

    /**
     * Proposes selectors for an element of a parsed page. Unlike a bare fragment this also yields a structural
     * candidate based on the element's position under its parent.
     */
    public List<SelectorCandidate> generate(Element element, String purpose) {
        return candidates(element, purpose, true);
    }

    private List<SelectorCandidate> candidates(Element element, String purpose, boolean structural) {
        String tag = element.normalName();
        List<SelectorCandidate> candidates = new ArrayList<>();

        String testId = element.attr("data-testid");
        if (!testId.isEmpty()) {
            candidates.add(css("[data-testid='" + escape(testId) + "']", tag, purpose, 50, TEST_ID_STABILITY,
                    Map.of("data-testid", testId)));
        }

        String id = element.id();
        if (!id.isEmpty() && !isGenerated(id)) {
            candidates.add(css(idSelector(id), tag, purpose, 100, ID_STABILITY, Map.of("id", id)));
        }

        String name = element.attr("name");
        if (!name.isEmpty()) {
            candidates.add(css(tag + "[name='" + escape(name) + "']", tag, purpose, 41, NAME_STABILITY,
                    Map.of("name", name)));
        }

        for (Attribute attribute : element.attributes()) {
            String key = attribute.getKey();
            if (!key.startsWith("data-") || key.equals("data-testid") || key.startsWith("data-v-")) continue;
            String value = attribute.getValue();
            if (value.isEmpty() || isGenerated(value)) continue;
            candidates.add(css(tag + "[" + key + "='" + escape(value) + "']", tag, purpose, 40,
                    DATA_ATTRIBUTE_STABILITY, Map.of(key, value)));
        }

        String ariaLabel = element.attr("aria-label");
        if (!ariaLabel.isEmpty()) {
            candidates.add(css(tag + "[aria-label='" + escape(ariaLabel) + "']", tag, purpose, 40,
                    ARIA_LABEL_STABILITY, Map.of("aria-label", ariaLabel)));
        }

        List<String> classes = meaningfulClasses(element);
        if (!classes.isEmpty()) {
            candidates.add(css(tag + "." + String.join(".", classes), tag, purpose, 20, CLASS_STABILITY,
                    Map.of("class", String.join(" ", classes))));
        }

        String text = element.text().strip();
        if (!text.isEmpty() && text.length() < MAX_TEXT_LENGTH) {
            String match = text.substring(0, Math.min(text.length(), MAX_TEXT_MATCH));
            candidates.add(new SelectorCandidate("//" + tag + "[contains(text(), " + xpathLiteral(match) + ")]",
                    SelectorType.XPATH, tag, purpose, 10, TEXT_STABILITY, Map.of(), text));
        }

        Element parent = element.parent();
        if (structural && parent != null && !(parent instanceof Document)) {
            int position = 1;
            for (Element sibling : parent.children()) {
                if (sibling == element) break;
                if (sibling.normalName().equals(tag)) position++;
            }
            candidates.add(css(parent.normalName() + " > " + tag + ":nth-of-type(" + position + ")", tag, purpose,
                    2, STRUCTURAL_STABILITY, Map.of()));
        }

        candidates.sort(Comparator.comparingDouble(SelectorCandidate::stabilityScore).reversed());
        return candidates;
    }

    private static @Nullable Element firstElement(String html) {
        Element body = Jsoup.parseBodyFragment(html).body();
        return body.children().isEmpty() ? null : body.child(0);
    }

    static boolean isGenerated(String value) {
        for (Pattern pattern : GENERATED_VALUE_PATTERNS) {
            if (pattern.matcher(value).find()) return true;
        }
        return false;
    }

    private static List<String> meaningfulClasses(Element element) {
        List<String> classes = new ArrayList<>();
        for (String cls : element.classNames()) {
            if (cls.isBlank() || isGenerated(cls)) continue;
            if (UTILITY_CLASS_PREFIXES.stream().anyMatch(cls::startsWith)) continue;
            classes.add(cls);
            if (classes.size() == MAX_CLASSES) break;
        }
        return classes;
    }

    private static SelectorCandidate css(String selector, String tag, String purpose, int specificity,
                                         double stability, Map<String, String> attributes) {
        return new SelectorCandidate(selector, SelectorType.CSS, tag, purpose, specificity, stability, attributes,
                null);
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    private static String idSelector(String id) {
        return id.matches("[A-Za-z_][A-Za-z0-9_-]*") ? "#" + id : "[id='" + escape(id) + "']";
    }

    private static String xpathLiteral(String text) {
        if (!text.contains("'")) return "'" + text + "'";
        if (!text.contains("\"")) return "\"" + text + "\"";
        return "concat('" + text.replace("'", "', \"'\", '") + "')";
    }
}
