package io.toolwatch.core;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of processing one tool inside a batch job. Failures are recorded here instead of being thrown.
 */
public record ToolOutcome(
        String toolId,
        boolean success,
        CurationResult result,
        String error,
        Duration elapsed
) {
    public ToolOutcome {
        Objects.requireNonNull(toolId, "toolId must not be null");
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static ToolOutcome success(String toolId, CurationResult result, Duration elapsed) {
        return new ToolOutcome(toolId, true, Objects.requireNonNull(result, "result must not be null"), null, elapsed);
    }

    public static ToolOutcome failure(String toolId, String error, Duration elapsed) {
        return new ToolOutcome(toolId, false, null, error, elapsed);
    }

    public List<ChangeDetection> changes() {
        return result == null ? List.of() : result.changesDetected();
    }
}
