package io.toolwatch.core;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Configured mapping from detected changes to notifications.
 *
 * <p>Instances are validated on construction; use {@link #builder(String, String)}.
 */
public final class AlertRule {

    private final String ruleId;
    private final String name;
    private final String description;
    private final Set<ChangeType> changeTypes;
    private final AlertSeverity severityThreshold;
    private final ToolFilter toolFilter;
    private final Duration cooldown;
    private final Set<AlertChannel> channels;
    private final boolean active;

    private AlertRule(Builder b) {
        this.ruleId = b.ruleId;
        this.name = b.name;
        this.description = b.description == null ? "" : b.description;
        this.changeTypes = Set.copyOf(b.changeTypes);
        this.severityThreshold = b.severityThreshold;
        this.toolFilter = b.toolFilter;
        this.cooldown = b.cooldown;
        this.channels = Set.copyOf(b.channels);
        this.active = b.active;
    }

    public String ruleId() {
        return ruleId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Set<ChangeType> changeTypes() {
        return changeTypes;
    }

    /**
     * Minimum derived severity a change must have to count towards this rule.
     */
    public AlertSeverity severityThreshold() {
        return severityThreshold;
    }

    public ToolFilter toolFilter() {
        return toolFilter;
    }

    /**
     * Minimum time between two alerts of this rule for the same tool.
     */
    public Duration cooldown() {
        return cooldown;
    }

    public Set<AlertChannel> channels() {
        return channels;
    }

    public boolean isActive() {
        return active;
    }

    public boolean admits(ChangeDetection change, AlertSeverity severity) {
        return changeTypes.contains(change.changeType()) && severity.isAtLeast(severityThreshold);
    }

    public Builder toBuilder() {
        return builder(ruleId, name)
                .description(description)
                .changeTypes(changeTypes)
                .severityThreshold(severityThreshold)
                .toolFilter(toolFilter)
                .cooldown(cooldown)
                .channels(channels)
                .active(active);
    }

    public static Builder builder(String ruleId, String name) {
        return new Builder(ruleId, name);
    }

    @Override
    public String toString() {
        return "AlertRule{" + ruleId + ", threshold=" + severityThreshold.code()
                + ", cooldown=" + cooldown + ", active=" + active + "}";
    }

    public static final class Builder {
        private final String ruleId;
        private final String name;
        private String description;
        private final Set<ChangeType> changeTypes = EnumSet.noneOf(ChangeType.class);
        private AlertSeverity severityThreshold = AlertSeverity.MEDIUM;
        private ToolFilter toolFilter = ToolFilter.any();
        private Duration cooldown = Duration.ofMinutes(60);
        private final Set<AlertChannel> channels = EnumSet.noneOf(AlertChannel.class);
        private boolean active = true;

        private Builder(String ruleId, String name) {
            this.ruleId = ruleId;
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder changeTypes(Collection<ChangeType> types) {
            Objects.requireNonNull(types, "changeTypes must not be null");
            this.changeTypes.clear();
            this.changeTypes.addAll(types);
            return this;
        }

        public Builder changeTypes(ChangeType... types) {
            return changeTypes(Set.of(types));
        }

        public Builder allChangeTypes() {
            return changeTypes(EnumSet.allOf(ChangeType.class));
        }

        public Builder severityThreshold(AlertSeverity threshold) {
            this.severityThreshold = Objects.requireNonNull(threshold, "severityThreshold must not be null");
            return this;
        }

        public Builder toolFilter(ToolFilter filter) {
            this.toolFilter = filter == null ? ToolFilter.any() : filter;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = Objects.requireNonNull(cooldown, "cooldown must not be null");
            return this;
        }

        public Builder channels(Collection<AlertChannel> channels) {
            Objects.requireNonNull(channels, "channels must not be null");
            this.channels.clear();
            this.channels.addAll(channels);
            return this;
        }

        public Builder channels(AlertChannel... channels) {
            return channels(Set.of(channels));
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public AlertRule build() {
            if (ruleId == null || ruleId.isBlank()) {
                throw new IllegalArgumentException("ruleId must not be blank");
            }
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("rule name must not be blank: " + ruleId);
            }
            if (changeTypes.isEmpty()) {
                throw new IllegalArgumentException("rule " + ruleId + " must select at least one change type");
            }
            if (channels.isEmpty()) {
                throw new IllegalArgumentException("rule " + ruleId + " must declare at least one channel");
            }
            if (cooldown.isNegative()) {
                throw new IllegalArgumentException("rule " + ruleId + " cooldown must not be negative: " + cooldown);
            }
            return new AlertRule(this);
        }
    }
}
