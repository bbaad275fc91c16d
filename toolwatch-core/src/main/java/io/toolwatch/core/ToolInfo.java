package io.toolwatch.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tool metadata as seen by the scheduler and by alert rule filters.
 */
public record ToolInfo(
        String id,
        String name,
        String category,
        int priorityLevel,
        boolean openSource,
        boolean activelyMonitored,
        Duration monitoringFrequency,
        Instant nextProcessAt,
        Instant lastProcessedAt,
        boolean lastProcessingFailed
) {
    public ToolInfo {
        Objects.requireNonNull(id, "id must not be null");
        name = (name == null || name.isBlank()) ? "Tool " + id : name;
        monitoringFrequency = monitoringFrequency == null ? Duration.ofDays(7) : monitoringFrequency;
    }

    public ProcessingPriority tier() {
        return ProcessingPriority.forLevel(priorityLevel);
    }

    public ToolInfo withMonitoring(boolean active, Instant nextProcessAt) {
        return new ToolInfo(id, name, category, priorityLevel, openSource, active,
                monitoringFrequency, nextProcessAt, lastProcessedAt, lastProcessingFailed);
    }

    public ToolInfo withProcessed(Instant processedAt, boolean failed) {
        return new ToolInfo(id, name, category, priorityLevel, openSource, activelyMonitored,
                monitoringFrequency, processedAt.plus(monitoringFrequency), processedAt, failed);
    }
}
