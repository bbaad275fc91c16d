package io.toolwatch.alert;

import io.toolwatch.core.AlertSeverity;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of the tool alerts stored over a period.
 *
 * @param changesByTool change count per tool name, most active first
 */
public record AlertDigest(
        Duration period,
        Instant generatedAt,
        int totalAlerts,
        int totalChanges,
        int toolsAffected,
        Map<AlertSeverity, Integer> alertsBySeverity,
        int highImpactChanges,
        int versionChanges,
        int pricingChanges,
        int featureChanges,
        Map<String, Integer> changesByTool
) {
    public AlertDigest {
        alertsBySeverity = Map.copyOf(alertsBySeverity);
        changesByTool = Collections.unmodifiableMap(new LinkedHashMap<>(changesByTool));
    }
}
