package io.toolwatch.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable notification produced by the rule engine or by the integration layer.
 *
 * <p>{@code toolId} is {@code null} for alerts that cover several tools (batch summaries, digests).
 */
public record Alert(
        String id,
        String toolId,
        String toolName,
        String alertType,
        AlertSeverity severity,
        String title,
        String message,
        List<ChangeSummary> changes,
        Map<String, Object> metadata,
        Instant createdAt,
        Set<AlertChannel> channels
) {
    public Alert {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(alertType, "alertType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        changes = changes == null ? List.of() : List.copyOf(changes);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        channels = channels == null ? Set.of() : Set.copyOf(channels);
    }
}
