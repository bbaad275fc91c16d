package io.toolwatch.core;

import java.util.Objects;

/**
 * A single difference detected for a tool by one analysis run.
 */
public record ChangeDetection(
        ChangeType changeType,
        String fieldName,
        Object oldValue,
        Object newValue,
        double confidence,
        String summary,
        int impactScore
) {
    public ChangeDetection {
        Objects.requireNonNull(changeType, "changeType must not be null");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        summary = summary == null ? "" : summary;
    }
}
