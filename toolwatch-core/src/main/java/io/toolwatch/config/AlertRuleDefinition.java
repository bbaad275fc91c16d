package io.toolwatch.config;

import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertRule;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.ChangeType;
import io.toolwatch.core.ToolFilter;
import io.toolwatch.utils.IntervalParser;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Alert rule as written in configuration, using string codes:
 *
 * <pre>
 * toolwatch.alerts.rules[0].id=pricing_changes
 * toolwatch.alerts.rules[0].name=Pricing Changes
 * toolwatch.alerts.rules[0].change-types=price_change
 * toolwatch.alerts.rules[0].severity-threshold=critical
 * toolwatch.alerts.rules[0].cooldown=30 minutes
 * toolwatch.alerts.rules[0].channels=email,slack,database
 * </pre>
 */
public class AlertRuleDefinition {
    private String id;
    private String name;
    private String description;
    private List<String> changeTypes = new ArrayList<>();
    private String severityThreshold = "medium";
    private String cooldown = "60 minutes";
    private List<String> channels = new ArrayList<>();
    private boolean active = true;
    private final Filter toolFilter = new Filter();

    /**
     * Convert into a validated rule.
     *
     * @throws IllegalArgumentException naming the rule and the offending value
     */
    public AlertRule toRule() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("alert rule id must not be blank");
        }
        if (changeTypes == null || changeTypes.isEmpty()) {
            throw new IllegalArgumentException("alert rule " + id + " must list at least one change type");
        }
        if (channels == null || channels.isEmpty()) {
            throw new IllegalArgumentException("alert rule " + id + " must list at least one channel");
        }

        List<ChangeType> types = new ArrayList<>();
        List<AlertChannel> targets = new ArrayList<>();
        AlertSeverity threshold;
        Duration cooldownDuration;
        ToolFilter filter;
        try {
            for (String code : changeTypes) {
                types.add(ChangeType.fromCode(code));
            }
            for (String code : channels) {
                targets.add(AlertChannel.fromCode(code));
            }
            threshold = AlertSeverity.fromCode(severityThreshold);
            cooldownDuration = (cooldown == null || cooldown.isBlank())
                    ? Duration.ZERO
                    : IntervalParser.parseHumanDuration(cooldown);
            filter = toolFilter.toFilter();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("alert rule " + id + ": " + e.getMessage(), e);
        }

        return AlertRule.builder(id, name)
                .description(description)
                .changeTypes(types)
                .severityThreshold(threshold)
                .cooldown(cooldownDuration)
                .channels(targets)
                .toolFilter(filter)
                .active(active)
                .build();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getChangeTypes() {
        return changeTypes;
    }

    public void setChangeTypes(List<String> changeTypes) {
        this.changeTypes = changeTypes;
    }

    public String getSeverityThreshold() {
        return severityThreshold;
    }

    public void setSeverityThreshold(String severityThreshold) {
        this.severityThreshold = severityThreshold;
    }

    public String getCooldown() {
        return cooldown;
    }

    public void setCooldown(String cooldown) {
        this.cooldown = cooldown;
    }

    public List<String> getChannels() {
        return channels;
    }

    public void setChannels(List<String> channels) {
        this.channels = channels;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Filter getToolFilter() {
        return toolFilter;
    }

    public static class Filter {
        private List<Integer> priorityLevels = new ArrayList<>();
        private List<String> categories = new ArrayList<>();
        private Boolean openSource;
        private List<String> namePatterns = new ArrayList<>();

        ToolFilter toFilter() {
            try {
                return ToolFilter.of(
                        priorityLevels == null ? null : new HashSet<>(priorityLevels),
                        categories == null ? null : new HashSet<>(categories),
                        openSource,
                        namePatterns
                );
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid name pattern " + e.getPattern(), e);
            }
        }

        public List<Integer> getPriorityLevels() {
            return priorityLevels;
        }

        public void setPriorityLevels(List<Integer> priorityLevels) {
            this.priorityLevels = priorityLevels;
        }

        public List<String> getCategories() {
            return categories;
        }

        public void setCategories(List<String> categories) {
            this.categories = categories;
        }

        public Boolean getOpenSource() {
            return openSource;
        }

        public void setOpenSource(Boolean openSource) {
            this.openSource = openSource;
        }

        public List<String> getNamePatterns() {
            return namePatterns;
        }

        public void setNamePatterns(List<String> namePatterns) {
            this.namePatterns = namePatterns;
        }
    }
}
