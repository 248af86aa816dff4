package org.netpreserve.crawlguard.selector;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandidateGeneratorTest {
    private final CandidateGenerator generator = new CandidateGenerator();

    private static List<String> selectors(List<SelectorCandidate> candidates) {
        return candidates.stream().map(SelectorCandidate::selector).toList();
    }

    @Test
    void stableAttributesComeFirst() {
        var candidates = generator.generate("<button id=\"checkout-btn\" data-testid=\"checkout\" " +
                                            "data-action=\"pay\" aria-label=\"Checkout\" class=\"btn primary mt-2\">" +
                                            "Checkout</button>", "checkout");

        assertEquals(List.of(
                "[data-testid='checkout']",
                "#checkout-btn",
                "button[data-action='pay']",
                "button[aria-label='Checkout']",
                "button.btn.primary",
                "//button[contains(text(), 'Checkout')]"), selectors(candidates));

        for (int i = 1; i < candidates.size(); i++) {
            assertTrue(candidates.get(i - 1).stabilityScore() >= candidates.get(i).stabilityScore());
        }
        SelectorCandidate first = candidates.get(0);
        assertEquals(SelectorType.CSS, first.selectorType());
        assertEquals("button", first.elementType());
        assertEquals("checkout", first.purpose());
        assertEquals(SelectorType.XPATH, candidates.get(candidates.size() - 1).selectorType());
        assertEquals("Checkout", candidates.get(candidates.size() - 1).textContent());
    }

    @Test
    void generatedValuesAreSkipped() {
        var candidates = generator.generate("<div id=\"a1b2c3d4-1234-5678\" class=\"css-1x2y3z Card_title_ab12c col-6 " +
                                            "card\">Hello</div>", "title");
        assertEquals(List.of("div.card", "//div[contains(text(), 'Hello')]"), selectors(candidates));
    }

    @Test
    void nameAttributeIsUsedForFormFields() {
        var candidates = generator.generate("<input type=\"email\" name=\"email\">", "email");
        assertEquals(List.of("input[name='email']"), selectors(candidates));
        assertEquals(CandidateGenerator.NAME_STABILITY, candidates.get(0).stabilityScore());
    }

    @Test
    void longTextIsNotUsed() {
        var candidates = generator.generate("<p>" + "word ".repeat(20) + "</p>", "text");
        assertTrue(candidates.isEmpty());
    }

    @Test
    void quotesInTextAreEscaped() {
        var candidates = generator.generate("<a>Don't miss</a>", "promo");
        assertEquals(List.of("//a[contains(text(), \"Don't miss\")]"), selectors(candidates));
    }

    @Test
    void fragmentWithoutElementsYieldsNothing() {
        assertTrue(generator.generate("just text", "nothing").isEmpty());
        assertTrue(generator.generate("", "nothing").isEmpty());
    }

    @Test
    void elementsOfAPageAlsoGetAStructuralCandidate() {
        var document = Jsoup.parse("<ul><li>One</li><li class=\"x\">Two</li></ul>");
        Element second = document.select("li").get(1);

        var candidates = generator.generate(second, "item");

        assertEquals(List.of("li.x", "//li[contains(text(), 'Two')]", "ul > li:nth-of-type(2)"),
                selectors(candidates));
        assertEquals(CandidateGenerator.STRUCTURAL_STABILITY, candidates.get(2).stabilityScore());
    }

    @Test
    void candidateBecomesAnEntry() {
        var candidate = generator.generate("<button id=\"buy\">Buy</button>", "buy").get(0);
        SelectorEntry entry = candidate.toSelectorEntry(0.7);
        assertEquals("#buy", entry.selector());
        assertEquals(SelectorType.CSS, entry.selectorType());
        assertEquals(0.7, entry.confidence());
        assertEquals(0, entry.attempts());
    }
}
