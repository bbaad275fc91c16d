package io.toolwatch.alert;

import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertRule;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.ChangeType;
import io.toolwatch.core.ToolFilter;

import java.time.Duration;
import java.util.List;

/**
 * Rules installed when none are configured.
 */
public final class DefaultAlertRules {

    private DefaultAlertRules() {
    }

    public static List<AlertRule> rules() {
        return List.of(
                AlertRule.builder("version_releases", "Version Releases")
                        .description("New version released for a tracked tool")
                        .changeTypes(ChangeType.VERSION_BUMP)
                        .severityThreshold(AlertSeverity.HIGH)
                        .cooldown(Duration.ofMinutes(60))
                        .channels(AlertChannel.EMAIL, AlertChannel.SLACK, AlertChannel.DATABASE)
                        .build(),
                AlertRule.builder("pricing_changes", "Pricing Changes")
                        .description("Pricing model or price points changed")
                        .changeTypes(ChangeType.PRICE_CHANGE)
                        .severityThreshold(AlertSeverity.CRITICAL)
                        .cooldown(Duration.ofMinutes(30))
                        .channels(AlertChannel.EMAIL, AlertChannel.SLACK, AlertChannel.DATABASE)
                        .build(),
                AlertRule.builder("major_features", "Major Feature Changes")
                        .description("Features added to or removed from a tool")
                        .changeTypes(ChangeType.ADDED, ChangeType.REMOVED)
                        .severityThreshold(AlertSeverity.HIGH)
                        .cooldown(Duration.ofMinutes(120))
                        .channels(AlertChannel.SLACK, AlertChannel.DATABASE)
                        .build(),
                AlertRule.builder("priority_tools", "Priority Tool Changes")
                        .description("Any notable change on priority 1 and 2 tools")
                        .allChangeTypes()
                        .severityThreshold(AlertSeverity.MEDIUM)
                        .toolFilter(ToolFilter.priorityLevels(1, 2))
                        .cooldown(Duration.ofMinutes(30))
                        .channels(AlertChannel.EMAIL, AlertChannel.DATABASE)
                        .build()
        );
    }
}
