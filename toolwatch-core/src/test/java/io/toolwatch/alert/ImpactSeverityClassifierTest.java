package io.toolwatch.alert;

import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.ChangeDetection;
import io.toolwatch.core.ChangeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImpactSeverityClassifierTest {

    private final ImpactSeverityClassifier classifier = new ImpactSeverityClassifier();

    @Test
    void impactBandsShouldMapToSeverity() {
        assertEquals(AlertSeverity.CRITICAL, classifier.forImpact(5));
        assertEquals(AlertSeverity.CRITICAL, classifier.forImpact(4));
        assertEquals(AlertSeverity.HIGH, classifier.forImpact(3));
        assertEquals(AlertSeverity.MEDIUM, classifier.forImpact(2));
        assertEquals(AlertSeverity.LOW, classifier.forImpact(1));
        assertEquals(AlertSeverity.INFO, classifier.forImpact(0));
    }

    @Test
    void changeTypeFloorsShouldApply() {
        assertEquals(AlertSeverity.CRITICAL, classifier.classify(change(ChangeType.PRICE_CHANGE, 1)));
        assertEquals(AlertSeverity.HIGH, classifier.classify(change(ChangeType.VERSION_BUMP, 1)));
        assertEquals(AlertSeverity.CRITICAL, classifier.classify(change(ChangeType.VERSION_BUMP, 4)));
        assertEquals(AlertSeverity.LOW, classifier.classify(change(ChangeType.MODIFIED, 1)));
    }

    @Test
    void severityShouldNeverDecreaseWithImpact() {
        for (ChangeType type : ChangeType.values()) {
            AlertSeverity previous = AlertSeverity.INFO;
            for (int impact = 0; impact <= 10; impact++) {
                AlertSeverity current = classifier.classify(change(type, impact));
                assertTrue(current.isAtLeast(previous), type + " impact " + impact);
                previous = current;
            }
        }
    }

    @Test
    void increasingBandsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ImpactSeverityClassifier(2, 3, 1, 0));
    }

    private static ChangeDetection change(ChangeType type, int impact) {
        return new ChangeDetection(type, "field", "a", "b", 0.8, "changed", impact);
    }
}
