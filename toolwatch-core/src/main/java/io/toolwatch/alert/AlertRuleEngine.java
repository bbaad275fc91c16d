package io.toolwatch.alert;

import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertRule;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.ChangeDetection;
import io.toolwatch.core.ChangeSummary;
import io.toolwatch.core.ToolInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Turns detected changes into alerts.
 *
 * <p>Every active rule whose tool filter matches is evaluated on its own: a rule fires when at least one change has
 * one of its change types and a derived severity at or above its threshold, and when its cooldown for the tool has
 * elapsed. A firing rule emits one alert aggregating all of its matching changes. Suppressed alerts are dropped,
 * and several rules may fire for the same changes.
 */
public class AlertRuleEngine {
    private static final Logger log = LoggerFactory.getLogger(AlertRuleEngine.class);

    private final ImpactSeverityClassifier classifier;
    private final Clock clock;
    private final Map<String, AlertRule> rules = new LinkedHashMap<>();
    private final ConcurrentHashMap<CooldownKey, Instant> lastAlertAt = new ConcurrentHashMap<>();

    private record CooldownKey(String ruleId, String toolId) {
    }

    public AlertRuleEngine(ImpactSeverityClassifier classifier, Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public AlertRuleEngine(ImpactSeverityClassifier classifier, Clock clock, List<AlertRule> initialRules) {
        this(classifier, clock);
        Objects.requireNonNull(initialRules, "initialRules must not be null").forEach(this::addRule);
    }

    /**
     * @throws IllegalArgumentException if a rule with the same id exists
     */
    public void addRule(AlertRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        synchronized (rules) {
            if (rules.containsKey(rule.ruleId())) {
                throw new IllegalArgumentException("Duplicate alert rule id: " + rule.ruleId());
            }
            rules.put(rule.ruleId(), rule);
        }
        log.info("Alert rule added id={} threshold={} cooldown={} channels={}",
                rule.ruleId(), rule.severityThreshold(), rule.cooldown(), rule.channels());
    }

    public boolean removeRule(String ruleId) {
        AlertRule removed;
        synchronized (rules) {
            removed = rules.remove(ruleId);
        }
        if (removed == null) {
            return false;
        }
        lastAlertAt.keySet().removeIf(k -> k.ruleId().equals(ruleId));
        log.info("Alert rule removed id={}", ruleId);
        return true;
    }

    public List<AlertRule> listRules() {
        synchronized (rules) {
            return List.copyOf(rules.values());
        }
    }

    public void resetCooldowns() {
        lastAlertAt.clear();
    }

    public AlertSeverity severityOf(ChangeDetection change) {
        return classifier.classify(change);
    }

    /**
     * Evaluate all rules against one tool's changes.
     *
     * @return the alerts to dispatch, possibly empty
     */
    public List<Alert> evaluate(ToolInfo tool, List<ChangeDetection> changes) {
        Objects.requireNonNull(tool, "tool must not be null");
        if (changes == null || changes.isEmpty()) {
            return List.of();
        }

        Map<ChangeDetection, AlertSeverity> severities = new LinkedHashMap<>();
        for (ChangeDetection change : changes) {
            severities.put(change, classifier.classify(change));
        }

        List<Alert> alerts = new ArrayList<>();
        for (AlertRule rule : listRules()) {
            if (!rule.isActive() || !rule.toolFilter().matches(tool)) {
                continue;
            }

            List<ChangeSummary> matching = new ArrayList<>();
            for (ChangeDetection change : changes) {
                AlertSeverity severity = severities.get(change);
                if (rule.admits(change, severity)) {
                    matching.add(ChangeSummary.from(change, severity));
                }
            }
            if (matching.isEmpty()) {
                continue;
            }

            Instant now = clock.instant();
            if (!tryAcquireCooldown(rule, tool.id(), now)) {
                log.debug("Alert suppressed by cooldown ruleId={} toolId={}", rule.ruleId(), tool.id());
                continue;
            }

            Alert alert = buildAlert(rule, tool, matching, now);
            log.info("Alert created id={} ruleId={} toolId={} severity={} changes={}",
                    alert.id(), rule.ruleId(), tool.id(), alert.severity(), matching.size());
            alerts.add(alert);
        }
        return alerts;
    }

    // Atomic per (rule, tool): the timestamp only moves when an alert is emitted.
    private boolean tryAcquireCooldown(AlertRule rule, String toolId, Instant now) {
        boolean[] acquired = {false};
        lastAlertAt.compute(new CooldownKey(rule.ruleId(), toolId), (key, last) -> {
            if (last == null || Duration.between(last, now).compareTo(rule.cooldown()) >= 0) {
                acquired[0] = true;
                return now;
            }
            return last;
        });
        return acquired[0];
    }

    private Alert buildAlert(AlertRule rule, ToolInfo tool, List<ChangeSummary> matching, Instant now) {
        AlertSeverity severity = AlertSeverity.INFO;
        for (ChangeSummary c : matching) {
            severity = AlertSeverity.max(severity, c.severity());
        }

        String title;
        String message;
        if (matching.size() == 1) {
            ChangeSummary only = matching.get(0);
            title = tool.name() + ": " + only.changeType().label();
            message = only.summary();
        } else {
            Set<String> types = new LinkedHashSet<>();
            matching.forEach(c -> types.add(c.changeType().code()));
            title = tool.name() + ": " + matching.size() + " changes detected";
            message = "Multiple changes detected: " + String.join(", ", types);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rule_id", rule.ruleId());
        metadata.put("rule_name", rule.name());
        if (tool.category() != null) {
            metadata.put("tool_category", tool.category());
        }
        metadata.put("tool_priority", tool.priorityLevel());
        metadata.put("change_count", matching.size());

        return new Alert(
                "alert_" + UUID.randomUUID(),
                tool.id(),
                tool.name(),
                rule.ruleId(),
                severity,
                title,
                message,
                matching,
                metadata,
                now,
                rule.channels()
        );
    }

    @Override
    public String toString() {
        return "AlertRuleEngine{rules=" + listRules().stream().map(AlertRule::ruleId).collect(Collectors.joining(",")) + "}";
    }
}
