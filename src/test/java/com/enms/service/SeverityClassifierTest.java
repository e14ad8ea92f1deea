package com.enms.service;

import com.enms.model.Severity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeverityClassifierTest {

    private final SeverityClassifier classifier = new SeverityClassifier(2.0, 3.0, 2.0);

    @Test
    void testThresholdsInclusiveTowardHigherSeverity() {
        assertEquals(Severity.NORMAL, classifier.classify(0.0));
        assertEquals(Severity.NORMAL, classifier.classify(1.999));
        assertEquals(Severity.WARNING, classifier.classify(2.0));
        assertEquals(Severity.WARNING, classifier.classify(-2.999));
        assertEquals(Severity.CRITICAL, classifier.classify(3.0));
        assertEquals(Severity.CRITICAL, classifier.classify(-12.0));
    }

    @Test
    void testConfidenceGrowsWithMagnitude() {
        assertEquals(0.0, classifier.confidence(0.0), 1e-12);
        assertEquals(1.0 - Math.exp(-1.0), classifier.confidence(2.0), 1e-12);
        assertEquals(classifier.confidence(2.5), classifier.confidence(-2.5), 1e-12);
        assertTrue(classifier.confidence(4.0) > classifier.confidence(3.0));
        assertTrue(classifier.confidence(1e6) <= 1.0);
    }

    @Test
    void testInvalidThresholdsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SeverityClassifier(3.0, 2.0, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new SeverityClassifier(0.0, 2.0, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new SeverityClassifier(2.0, 3.0, 0.0));
    }
}
