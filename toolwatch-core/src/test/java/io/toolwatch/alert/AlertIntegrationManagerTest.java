package io.toolwatch.alert;

import io.toolwatch.config.ToolwatchProperties;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertRule;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.BatchJob;
import io.toolwatch.core.ChangeDetection;
import io.toolwatch.core.ChangeType;
import io.toolwatch.core.CurationResult;
import io.toolwatch.core.JobType;
import io.toolwatch.core.ProcessingPriority;
import io.toolwatch.core.ToolInfo;
import io.toolwatch.core.ToolOutcome;
import io.toolwatch.internal.InMemoryAlertStore;
import io.toolwatch.internal.InMemoryToolCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertIntegrationManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-05-01T09:00:00Z"));
    private final InMemoryToolCatalog catalog = new InMemoryToolCatalog();
    private final InMemoryAlertStore store = new InMemoryAlertStore();
    private final List<Alert> sent = Collections.synchronizedList(new ArrayList<>());
    private final ToolwatchProperties.Integration props = new ToolwatchProperties.Integration();

    private AlertRuleEngine engine;
    private AlertIntegrationManager manager;

    @BeforeEach
    void setUp() {
        props.setBatchAlertThreshold(3);
        props.setDebounceWindow(Duration.ofMinutes(5));
        engine = new AlertRuleEngine(new ImpactSeverityClassifier(), clock, List.of(AlertRule.builder("all", "All Changes")
                .allChangeTypes()
                .severityThreshold(AlertSeverity.LOW)
                .cooldown(Duration.ZERO)
                .channels(AlertChannel.SLACK, AlertChannel.DATABASE)
                .build()));
        AlertSender slack = new AlertSender() {
            @Override
            public AlertChannel channel() {
                return AlertChannel.SLACK;
            }

            @Override
            public DeliveryResult send(Alert alert) {
                sent.add(alert);
                return DeliveryResult.ok(AlertChannel.SLACK);
            }
        };
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(slack), store);
        manager = new AlertIntegrationManager(props, engine, dispatcher, catalog, store, clock);

        for (int i = 1; i <= 4; i++) {
            catalog.put(new ToolInfo("t" + i, "Tool " + i, "ide", 3, false, true, null, null, null, false));
        }
    }

    @Test
    void changesWithinDebounceWindowShouldBeDeferredAndFlushed() {
        assertEquals(1, manager.submitChanges("t1", List.of(change(ChangeType.MODIFIED, 2))).size());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(manager.submitChanges("t1", List.of(change(ChangeType.ADDED, 2))).isEmpty());
        assertTrue(manager.submitChanges("t1", List.of(change(ChangeType.REMOVED, 2))).isEmpty());
        assertEquals(1, manager.pendingToolCount());
        assertEquals(0, manager.flushPending());

        clock.advance(Duration.ofMinutes(5));
        assertEquals(1, manager.flushPending());
        assertEquals(0, manager.pendingToolCount());

        assertEquals(2, sent.size());
        assertEquals(2, sent.get(1).changes().size());
    }

    @Test
    void pendingCountShouldStayConsistentUnderConcurrentSubmits() throws Exception {
        CountDownLatch go = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger maxSeen = new AtomicInteger();
        List<Thread> writers = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            String toolId = "t" + i;
            Thread writer = new Thread(() -> {
                awaitQuietly(go);
                for (int n = 0; n < 50; n++) {
                    manager.submitChanges(toolId, List.of(change(ChangeType.MODIFIED, 2)));
                }
            });
            writers.add(writer);
            writer.start();
        }
        Thread reader = new Thread(() -> {
            awaitQuietly(go);
            while (writing.get()) {
                maxSeen.accumulateAndGet(manager.pendingToolCount(), Math::max);
            }
        });
        reader.start();

        go.countDown();
        for (Thread writer : writers) {
            writer.join(5_000);
        }
        writing.set(false);
        reader.join(5_000);

        assertTrue(maxSeen.get() <= 4);
        assertEquals(4, manager.pendingToolCount());
        clock.advance(Duration.ofMinutes(6));
        assertEquals(4, manager.flushPending());
        assertEquals(8, sent.size());
        assertEquals(200, sent.stream().mapToInt(alert -> alert.changes().size()).sum());
    }

    @Test
    void stopShouldDrainPendingChanges() {
        props.setFlushEvery(Duration.ofHours(1));
        manager.start();
        manager.submitChanges("t1", List.of(change(ChangeType.MODIFIED, 2)));
        manager.submitChanges("t1", List.of(change(ChangeType.ADDED, 2)));
        assertEquals(1, sent.size());

        manager.stop();

        assertEquals(2, sent.size());
        assertEquals(0, manager.pendingToolCount());
    }

    @Test
    void largeBatchShouldProduceSingleSummary() {
        BatchJob job = completedJob("t1", "t2", "t3");

        manager.onJobCompleted(job);

        assertEquals(1, sent.size());
        Alert summary = sent.get(0);
        assertEquals(AlertIntegrationManager.BATCH_SUMMARY, summary.alertType());
        assertEquals("Batch Processing Complete - 3 tools updated", summary.title());
        assertEquals("Batch job " + job.getJobId() + " completed with 3 changes across 3 tools", summary.message());
        assertEquals(AlertSeverity.MEDIUM, summary.severity());
        assertEquals(3, summary.metadata().get("tools_affected"));
        assertEquals(1, store.size());
    }

    @Test
    void smallBatchShouldAlertPerTool() {
        manager.onJobCompleted(completedJob("t1", "t2"));

        assertEquals(2, sent.size());
        assertEquals("t1", sent.get(0).toolId());
        assertEquals("t2", sent.get(1).toolId());
    }

    @Test
    void disabledRealTimeAlertsShouldIgnoreSmallBatches() {
        props.setRealTimeAlerts(false);
        manager.onJobCompleted(completedJob("t1"));
        assertTrue(sent.isEmpty());
    }

    @Test
    void immediateAlertShouldBypassRules() {
        Optional<DispatchReport> report = manager.triggerImmediateAlert("t2", "security_issue", "CVE published", null);

        assertTrue(report.isPresent());
        assertEquals(1, sent.size());
        Alert alert = sent.get(0);
        assertEquals("Tool 2: Security Issue", alert.title());
        assertEquals(AlertSeverity.HIGH, alert.severity());
        assertEquals("manual", alert.metadata().get("triggered_by"));
        assertTrue(alert.id().startsWith("immediate_"));

        assertTrue(manager.triggerImmediateAlert("missing", "x", "y", AlertSeverity.LOW).isEmpty());
    }

    @Test
    void digestShouldSummarizeStoredToolAlerts() {
        manager.submitChanges("t1", List.of(
                change(ChangeType.VERSION_BUMP, 4),
                change(ChangeType.PRICE_CHANGE, 3)));
        manager.submitChanges("t2", List.of(change(ChangeType.ADDED, 2)));
        manager.onJobCompleted(completedJob("t1", "t3", "t4"));

        AlertDigest digest = manager.createAlertDigest();

        assertEquals(2, digest.totalAlerts());
        assertEquals(3, digest.totalChanges());
        assertEquals(2, digest.toolsAffected());
        assertEquals(1, digest.highImpactChanges());
        assertEquals(1, digest.versionChanges());
        assertEquals(1, digest.pricingChanges());
        assertEquals(1, digest.featureChanges());
        assertEquals("Tool 1", digest.changesByTool().keySet().iterator().next());

        props.setDigestChannels(List.of(AlertChannel.SLACK));
        DispatchReport report = manager.sendDigest(digest);
        assertTrue(report.delivered(AlertChannel.SLACK));
        assertEquals(AlertIntegrationManager.DIGEST, sent.get(sent.size() - 1).alertType());
    }

    @Test
    void acknowledgeShouldMarkStoredAlert() {
        Alert alert = manager.submitChanges("t1", List.of(change(ChangeType.MODIFIED, 2))).get(0);

        assertTrue(manager.acknowledgeAlert(alert.id(), "alice"));
        assertEquals("alice", store.acknowledgedBy(alert.id()).orElseThrow());
        assertEquals(clock.instant(), store.acknowledgedAt(alert.id()).orElseThrow());
        assertFalse(manager.acknowledgeAlert("missing", "alice"));
    }

    private BatchJob completedJob(String... toolIds) {
        BatchJob job = new BatchJob("job_1_1", List.of(toolIds), ProcessingPriority.NORMAL, JobType.SCHEDULED, clock.instant());
        job.markRunning(clock.instant());
        for (String id : toolIds) {
            job.recordOutcome(ToolOutcome.success(id, CurationResult.of(id, List.of(change(ChangeType.MODIFIED, 2))), Duration.ofMillis(5)));
        }
        job.markCompleted(clock.instant());
        return job;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ChangeDetection change(ChangeType type, int impact) {
        return new ChangeDetection(type, "field", "old", "new", 0.9, type.code() + " change", impact);
    }
}
