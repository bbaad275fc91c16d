package io.toolwatch.core;

/**
 * Alert-facing view of a {@link ChangeDetection}, carrying the severity the engine derived for it.
 */
public record ChangeSummary(
        ChangeType changeType,
        String fieldName,
        String oldValue,
        String newValue,
        String summary,
        int impactScore,
        double confidence,
        AlertSeverity severity
) {
    public static ChangeSummary from(ChangeDetection change, AlertSeverity severity) {
        return new ChangeSummary(
                change.changeType(),
                change.fieldName(),
                change.oldValue() == null ? null : String.valueOf(change.oldValue()),
                change.newValue() == null ? null : String.valueOf(change.newValue()),
                change.summary(),
                change.impactScore(),
                change.confidence(),
                severity
        );
    }
}
