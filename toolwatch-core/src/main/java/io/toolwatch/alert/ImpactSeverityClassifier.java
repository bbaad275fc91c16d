package io.toolwatch.alert;

import io.toolwatch.config.ToolwatchProperties;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.ChangeDetection;
import io.toolwatch.core.ChangeType;

import java.util.Objects;

/**
 * Derives an alert severity for a detected change.
 *
 * <p>The impact score selects a band ({@code >= critical} CRITICAL, {@code >= high} HIGH, and so on, INFO below the
 * low band). Version bumps are at least HIGH and price changes are always CRITICAL. The result never decreases as the
 * impact score grows.
 */
public class ImpactSeverityClassifier {

    private final int criticalAt;
    private final int highAt;
    private final int mediumAt;
    private final int lowAt;

    public ImpactSeverityClassifier() {
        this(4, 3, 2, 1);
    }

    public ImpactSeverityClassifier(int criticalAt, int highAt, int mediumAt, int lowAt) {
        if (criticalAt < highAt || highAt < mediumAt || mediumAt < lowAt) {
            throw new IllegalArgumentException("severity bands must be non-increasing from critical to low: critical="
                    + criticalAt + ", high=" + highAt + ", medium=" + mediumAt + ", low=" + lowAt);
        }
        this.criticalAt = criticalAt;
        this.highAt = highAt;
        this.mediumAt = mediumAt;
        this.lowAt = lowAt;
    }

    public static ImpactSeverityClassifier from(ToolwatchProperties.SeverityBands bands) {
        Objects.requireNonNull(bands, "bands must not be null");
        return new ImpactSeverityClassifier(bands.getCritical(), bands.getHigh(), bands.getMedium(), bands.getLow());
    }

    public AlertSeverity classify(ChangeDetection change) {
        Objects.requireNonNull(change, "change must not be null");
        return AlertSeverity.max(forImpact(change.impactScore()), floorFor(change.changeType()));
    }

    public AlertSeverity forImpact(int impactScore) {
        if (impactScore >= criticalAt) {
            return AlertSeverity.CRITICAL;
        }
        if (impactScore >= highAt) {
            return AlertSeverity.HIGH;
        }
        if (impactScore >= mediumAt) {
            return AlertSeverity.MEDIUM;
        }
        if (impactScore >= lowAt) {
            return AlertSeverity.LOW;
        }
        return AlertSeverity.INFO;
    }

    private static AlertSeverity floorFor(ChangeType type) {
        return switch (type) {
            case PRICE_CHANGE -> AlertSeverity.CRITICAL;
            case VERSION_BUMP -> AlertSeverity.HIGH;
            default -> AlertSeverity.INFO;
        };
    }
}
