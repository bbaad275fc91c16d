package io.toolwatch.core;

import java.time.Duration;

/**
 * Input for bulk tool import. Existing tools are matched by GitHub URL, website URL, then name.
 */
public record ToolRegistration(
        String name,
        String description,
        String websiteUrl,
        String githubUrl,
        String category,
        Integer priorityLevel,
        Duration monitoringFrequency,
        Boolean openSource
) {
    public ToolRegistration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
    }

    public static ToolRegistration named(String name) {
        return new ToolRegistration(name, null, null, null, null, null, null, null);
    }

    public int priorityLevelOrDefault() {
        return priorityLevel == null ? ProcessingPriority.NORMAL.value() : priorityLevel;
    }

    public Duration monitoringFrequencyOrDefault() {
        return monitoringFrequency == null ? Duration.ofDays(7) : monitoringFrequency;
    }
}
