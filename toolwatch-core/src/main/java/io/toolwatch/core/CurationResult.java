package io.toolwatch.core;

import java.util.List;
import java.util.Objects;

/**
 * What one analysis run of a tool produced.
 */
public record CurationResult(
        String toolId,
        boolean versionCreated,
        List<ChangeDetection> changesDetected,
        double dataQualityScore,
        double confidenceScore,
        List<String> issuesFound,
        List<String> recommendations
) {
    public CurationResult {
        Objects.requireNonNull(toolId, "toolId must not be null");
        changesDetected = changesDetected == null ? List.of() : List.copyOf(changesDetected);
        issuesFound = issuesFound == null ? List.of() : List.copyOf(issuesFound);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static CurationResult of(String toolId, List<ChangeDetection> changes) {
        return new CurationResult(toolId, false, changes, 0.0, 0.0, List.of(), List.of());
    }

    public boolean hasChanges() {
        return !changesDetected.isEmpty();
    }
}
