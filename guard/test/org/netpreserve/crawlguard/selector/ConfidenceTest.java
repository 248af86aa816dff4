package org.netpreserve.crawlguard.selector;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceTest {

    @Test
    void priorDominatesSmallSamples() {
        assertEquals(2.0 / 3, Confidence.bayesian(0, 0, false), 1e-9);
        assertEquals(3.0 / 4, Confidence.bayesian(1, 0, false), 1e-9);
        assertEquals(2.0 / 4 * 0.95, Confidence.bayesian(0, 1, true), 1e-9);
    }

    @Test
    void largeSamplesConvergeOnTheObservedRate() {
        assertEquals(0.9, Confidence.bayesian(9000, 1000, false), 1e-3);
        assertEquals(0.1, Confidence.bayesian(1000, 9000, false), 1e-3);
    }

    @Test
    void resultIsClamped() {
        assertEquals(1.0, Confidence.bayesian(10, 0, 1, 0, 5.0));
        assertEquals(0.0, Confidence.bayesian(0, 10, 2, 1, 0.0));
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Confidence.bayesian(-1, 0, false));
        assertThrows(IllegalArgumentException.class, () -> Confidence.bayesian(0, 0, 0, 0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> Confidence.bayesian(0, 0, 2, 1, -0.5));
    }
}
