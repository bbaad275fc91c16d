package io.toolwatch.alert;

import io.toolwatch.AlertStore;
import io.toolwatch.JobCompletionListener;
import io.toolwatch.ToolCatalog;
import io.toolwatch.config.ToolwatchProperties;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertRule;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.BatchJob;
import io.toolwatch.core.ChangeDetection;
import io.toolwatch.core.ChangeSummary;
import io.toolwatch.core.ChangeType;
import io.toolwatch.core.ToolInfo;
import io.toolwatch.core.ToolOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connects finished batch jobs and ad-hoc change events to the rule engine and the dispatcher.
 *
 * <p>Per-tool events are debounced: the first event for a tool opens a window and is evaluated at once; events
 * arriving while the window is open are merged and evaluated by {@link #flushPending()} after it closes. A background
 * timer started by {@link #start()} calls {@code flushPending} every {@code flushEvery}.
 *
 * <p>When a job finishes with at least {@code batchAlertThreshold} changed tools, a single {@code batch_summary} alert
 * replaces the per-tool alerts.
 */
public class AlertIntegrationManager implements JobCompletionListener {
    private static final Logger log = LoggerFactory.getLogger(AlertIntegrationManager.class);

    public static final String BATCH_SUMMARY = "batch_summary";
    public static final String DIGEST = "digest";

    private final ToolwatchProperties.Integration props;
    private final AlertRuleEngine engine;
    private final AlertDispatcher dispatcher;
    private final ToolCatalog catalog;
    private final AlertStore alertStore;
    private final Clock clock;

    private final ConcurrentHashMap<String, DebounceWindow> windows = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService flushTimer;

    private static final class DebounceWindow {
        private final Instant openedAt;
        private final List<ChangeDetection> pending;

        private DebounceWindow(Instant openedAt, List<ChangeDetection> pending) {
            this.openedAt = openedAt;
            this.pending = pending;
        }
    }

    public AlertIntegrationManager(ToolwatchProperties.Integration props,
                                   AlertRuleEngine engine,
                                   AlertDispatcher dispatcher,
                                   ToolCatalog catalog,
                                   AlertStore alertStore,
                                   Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.alertStore = Objects.requireNonNull(alertStore, "alertStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getBatchAlertThreshold() <= 0) {
            throw new IllegalArgumentException("toolwatch.alerts.integration.batchAlertThreshold must be positive");
        }
    }

    /**
     * Start the pending-alert flush timer. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Duration every = props.getFlushEvery();
        if (every == null || every.isZero() || every.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("toolwatch.alerts.integration.flushEvery must be a positive duration");
        }
        flushTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("toolwatch.alert-flush");
            t.setDaemon(true);
            return t;
        });
        flushTimer.scheduleWithFixedDelay(this::flushSafely, every.toMillis(), every.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Alert integration started debounceWindow={} flushEvery={} batchAlertThreshold={}",
                props.getDebounceWindow(), every, props.getBatchAlertThreshold());
    }

    /**
     * Stop the flush timer and flush whatever is still pending. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (flushTimer != null) {
            flushTimer.shutdownNow();
            flushTimer = null;
        }
        int remaining = drainAll();
        log.info("Alert integration stopped, flushed tools={}", remaining);
    }

    @Override
    public void onJobCompleted(BatchJob job) {
        List<ToolOutcome> changed = new ArrayList<>();
        for (ToolOutcome outcome : job.getResults()) {
            if (outcome.success() && !outcome.changes().isEmpty()) {
                changed.add(outcome);
            }
        }
        if (changed.isEmpty()) {
            return;
        }

        if (props.isBatchAlerts() && changed.size() >= props.getBatchAlertThreshold()) {
            dispatcher.dispatch(batchSummary(job, changed));
            log.info("Batch summary alert sent jobId={} toolsChanged={}", job.getJobId(), changed.size());
            return;
        }
        if (!props.isRealTimeAlerts()) {
            log.debug("Real-time alerts disabled, ignoring changes jobId={} tools={}", job.getJobId(), changed.size());
            return;
        }
        for (ToolOutcome outcome : changed) {
            try {
                submitChanges(outcome.toolId(), outcome.changes());
            } catch (Exception e) {
                log.error("Alert processing failed jobId={} toolId={} msg={}", job.getJobId(), outcome.toolId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Feed one tool's changes through the debounce window.
     *
     * @return alerts dispatched now; empty when the changes were deferred or no rule fired
     */
    public List<Alert> submitChanges(String toolId, List<ChangeDetection> changes) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        if (changes == null || changes.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        Duration window = props.getDebounceWindow();
        List<List<ChangeDetection>> evaluateNow = new ArrayList<>(1);

        windows.compute(toolId, (id, current) -> {
            if (current == null || isClosed(current, now, window)) {
                List<ChangeDetection> batch = new ArrayList<>();
                if (current != null) {
                    batch.addAll(current.pending);
                }
                batch.addAll(changes);
                evaluateNow.add(batch);
                return new DebounceWindow(now, new ArrayList<>());
            }
            current.pending.addAll(changes);
            return current;
        });

        if (evaluateNow.isEmpty()) {
            log.debug("Alert debounced toolId={} changes={}", toolId, changes.size());
            return List.of();
        }
        return evaluateAndDispatch(toolId, evaluateNow.get(0));
    }

    /**
     * Evaluate deferred changes of every tool whose debounce window has closed.
     *
     * @return number of tools whose pending changes were evaluated
     */
    public int flushPending() {
        Instant now = clock.instant();
        Duration window = props.getDebounceWindow();
        int flushed = 0;

        for (String toolId : List.copyOf(windows.keySet())) {
            List<List<ChangeDetection>> due = new ArrayList<>(1);
            windows.computeIfPresent(toolId, (id, current) -> {
                if (!isClosed(current, now, window)) {
                    return current;
                }
                if (!current.pending.isEmpty()) {
                    due.add(current.pending);
                }
                return null;
            });
            if (!due.isEmpty()) {
                evaluateAndDispatch(toolId, due.get(0));
                flushed++;
            }
        }
        if (flushed > 0) {
            log.info("Flushed pending alerts tools={}", flushed);
        }
        return flushed;
    }

    public int pendingToolCount() {
        AtomicInteger count = new AtomicInteger();
        for (String toolId : windows.keySet()) {
            windows.computeIfPresent(toolId, (key, w) -> {
                if (!w.pending.isEmpty()) {
                    count.incrementAndGet();
                }
                return w;
            });
        }
        return count.get();
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Send an operator-triggered alert for one tool, bypassing rules and cooldowns.
     *
     * @return the dispatch report, or empty if the tool is unknown
     */
    public Optional<DispatchReport> triggerImmediateAlert(String toolId, String alertType, String message, AlertSeverity severity) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        if (alertType == null || alertType.isBlank()) {
            throw new IllegalArgumentException("alertType must not be blank");
        }
        Optional<ToolInfo> tool = catalog.findTool(toolId);
        if (tool.isEmpty()) {
            log.warn("Immediate alert skipped, unknown toolId={}", toolId);
            return Optional.empty();
        }

        Instant now = clock.instant();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("triggered_by", "manual");
        metadata.put("immediate_alert", true);

        Alert alert = new Alert(
                "immediate_" + UUID.randomUUID(),
                toolId,
                tool.get().name(),
                alertType,
                severity == null ? AlertSeverity.HIGH : severity,
                tool.get().name() + ": " + titleCase(alertType),
                message == null ? "" : message,
                List.of(),
                metadata,
                now,
                Set.copyOf(props.getSummaryChannels())
        );
        DispatchReport report = dispatcher.dispatch(alert);
        log.info("Immediate alert sent toolId={} alertId={}", toolId, alert.id());
        return Optional.of(report);
    }

    /**
     * Digest over the configured {@code digestPeriod}.
     */
    public AlertDigest createAlertDigest() {
        return createAlertDigest(props.getDigestPeriod());
    }

    /**
     * Summarize the tool alerts stored during the last {@code period}. Batch summaries and digests are not counted.
     */
    public AlertDigest createAlertDigest(Duration period) {
        Objects.requireNonNull(period, "period must not be null");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("digest period must be positive");
        }
        Instant now = clock.instant();

        int totalAlerts = 0;
        int totalChanges = 0;
        int highImpact = 0;
        int versions = 0;
        int pricing = 0;
        int features = 0;
        Map<AlertSeverity, Integer> bySeverity = new EnumMap<>(AlertSeverity.class);
        Map<String, Integer> byTool = new LinkedHashMap<>();

        for (Alert alert : alertStore.findSince(now.minus(period))) {
            if (alert.toolId() == null) {
                continue;
            }
            totalAlerts++;
            bySeverity.merge(alert.severity(), 1, Integer::sum);
            String toolName = alert.toolName() != null ? alert.toolName() : "Tool " + alert.toolId();
            byTool.merge(toolName, alert.changes().size(), Integer::sum);
            for (ChangeSummary c : alert.changes()) {
                totalChanges++;
                if (c.impactScore() >= 4) {
                    highImpact++;
                }
                if (c.changeType() == ChangeType.VERSION_BUMP) {
                    versions++;
                } else if (c.changeType() == ChangeType.PRICE_CHANGE) {
                    pricing++;
                } else if (c.changeType() == ChangeType.ADDED || c.changeType() == ChangeType.REMOVED) {
                    features++;
                }
            }
        }

        Map<String, Integer> ranked = new LinkedHashMap<>();
        byTool.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(e -> ranked.put(e.getKey(), e.getValue()));

        return new AlertDigest(period, now, totalAlerts, totalChanges, byTool.size(), bySeverity,
                highImpact, versions, pricing, features, ranked);
    }

    public DispatchReport sendDigest(AlertDigest digest) {
        Objects.requireNonNull(digest, "digest must not be null");
        long hours = digest.period().toHours();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("digest", true);
        metadata.put("period_hours", hours);
        metadata.put("tools_affected", digest.toolsAffected());
        metadata.put("total_alerts", digest.totalAlerts());

        Alert alert = new Alert(
                "digest_" + UUID.randomUUID(),
                null,
                "Multiple Tools",
                DIGEST,
                AlertSeverity.INFO,
                "Tool Digest - " + digest.totalChanges() + " changes in " + hours + "h",
                formatDigest(digest),
                List.of(),
                metadata,
                clock.instant(),
                Set.copyOf(props.getDigestChannels())
        );
        DispatchReport report = dispatcher.dispatch(alert);
        log.info("Digest alert sent alertId={} changes={} tools={}", alert.id(), digest.totalChanges(), digest.toolsAffected());
        return report;
    }

    public boolean acknowledgeAlert(String alertId, String acknowledgedBy) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        if (acknowledgedBy == null || acknowledgedBy.isBlank()) {
            throw new IllegalArgumentException("acknowledgedBy must not be blank");
        }
        boolean found = alertStore.acknowledge(alertId, acknowledgedBy, clock.instant());
        if (found) {
            log.info("Alert acknowledged alertId={} by={}", alertId, acknowledgedBy);
        } else {
            log.warn("Cannot acknowledge unknown alertId={}", alertId);
        }
        return found;
    }

    public void createAlertRule(AlertRule rule) {
        engine.addRule(rule);
    }

    public List<AlertRule> listAlertRules() {
        return engine.listRules();
    }

    private List<Alert> evaluateAndDispatch(String toolId, List<ChangeDetection> changes) {
        ToolInfo tool = catalog.findTool(toolId)
                .orElseGet(() -> new ToolInfo(toolId, null, null, 3, false, false, null, null, null, false));
        List<Alert> alerts = engine.evaluate(tool, changes);
        for (Alert alert : alerts) {
            dispatcher.dispatch(alert);
        }
        return alerts;
    }

    private Alert batchSummary(BatchJob job, List<ToolOutcome> changed) {
        int totalChanges = 0;
        AlertSeverity severity = AlertSeverity.MEDIUM;
        List<String> toolIds = new ArrayList<>();
        for (ToolOutcome outcome : changed) {
            toolIds.add(outcome.toolId());
            for (ChangeDetection c : outcome.changes()) {
                totalChanges++;
                severity = AlertSeverity.max(severity, engine.severityOf(c));
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("job_id", job.getJobId());
        metadata.put("job_type", job.getJobType().name());
        metadata.put("tools_affected", changed.size());
        metadata.put("total_changes", totalChanges);
        metadata.put("tool_ids", List.copyOf(toolIds));

        return new Alert(
                "batch_" + job.getJobId() + "_" + UUID.randomUUID(),
                null,
                changed.size() + " Tools",
                BATCH_SUMMARY,
                severity,
                "Batch Processing Complete - " + changed.size() + " tools updated",
                "Batch job " + job.getJobId() + " completed with " + totalChanges + " changes across "
                        + changed.size() + " tools",
                List.of(),
                metadata,
                clock.instant(),
                Set.copyOf(props.getSummaryChannels())
        );
    }

    private void flushSafely() {
        try {
            flushPending();
        } catch (Exception e) {
            log.error("Pending alert flush failed msg={}", e.getMessage(), e);
        }
    }

    private int drainAll() {
        int drained = 0;
        for (String toolId : List.copyOf(windows.keySet())) {
            DebounceWindow w = windows.remove(toolId);
            if (w != null && !w.pending.isEmpty()) {
                try {
                    evaluateAndDispatch(toolId, w.pending);
                    drained++;
                } catch (Exception e) {
                    log.error("Pending alert drain failed toolId={} msg={}", toolId, e.getMessage(), e);
                }
            }
        }
        return drained;
    }

    private static boolean isClosed(DebounceWindow w, Instant now, Duration window) {
        return !now.isBefore(w.openedAt.plus(window));
    }

    private static String titleCase(String code) {
        StringBuilder sb = new StringBuilder();
        for (String word : code.split("[_\\s]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String formatDigest(AlertDigest digest) {
        StringBuilder sb = new StringBuilder();
        sb.append("Tool Activity Digest (").append(digest.period().toHours()).append(" hours)\n\n");
        sb.append("Summary:\n");
        sb.append("- Total changes: ").append(digest.totalChanges()).append('\n');
        sb.append("- Tools affected: ").append(digest.toolsAffected()).append('\n');
        sb.append("- High impact changes: ").append(digest.highImpactChanges()).append('\n');
        sb.append("- Version updates: ").append(digest.versionChanges()).append('\n');
        sb.append("- Pricing changes: ").append(digest.pricingChanges()).append('\n');
        sb.append("- Feature changes: ").append(digest.featureChanges()).append('\n');

        if (!digest.changesByTool().isEmpty()) {
            sb.append("\nMost Active Tools:\n");
            digest.changesByTool().entrySet().stream().limit(5).forEach(e ->
                    sb.append("- ").append(e.getKey()).append(": ").append(e.getValue()).append(" changes\n"));
        }
        return sb.toString();
    }
}
