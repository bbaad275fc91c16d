package io.toolwatch.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.client.MongoClients;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.BatchJob;
import io.toolwatch.core.ChangeDetection;
import io.toolwatch.core.ChangeSummary;
import io.toolwatch.core.ChangeType;
import io.toolwatch.core.CurationResult;
import io.toolwatch.core.JobType;
import io.toolwatch.core.ProcessingPriority;
import io.toolwatch.core.ToolInfo;
import io.toolwatch.core.ToolOutcome;
import io.toolwatch.core.ToolRegistration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoToolCatalog catalog;
    private MongoJobStore jobStore;
    private MongoAlertStore alertStore;

    private final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "toolwatch_test");
        dropAll();
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        catalog = new MongoToolCatalog(mongoTemplate);
        jobStore = new MongoJobStore(mongoTemplate, objectMapper);
        alertStore = new MongoAlertStore(mongoTemplate, objectMapper);
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    private void dropAll() {
        mongoTemplate.dropCollection(ToolDocument.class);
        mongoTemplate.dropCollection(BatchJobDocument.class);
        mongoTemplate.dropCollection(AlertDocument.class);
    }

    @Test
    void findDueToolsShouldFilterByTierAndDueTime() {
        insertTool("a", 2, now.minusSeconds(60), false, true);
        insertTool("b", 2, now.plusSeconds(3600), false, true);
        insertTool("c", 2, null, false, true);
        insertTool("d", 2, now.minusSeconds(60), false, false);
        insertTool("e", 3, now.minusSeconds(60), false, true);

        List<ToolInfo> due = catalog.findDueTools(ProcessingPriority.HIGH, now);

        assertEquals(2, due.size());
        assertTrue(due.stream().anyMatch(t -> t.id().equals("a")));
        assertTrue(due.stream().anyMatch(t -> t.id().equals("c")));
    }

    @Test
    void urgentTierShouldAlsoPickUpFailedTools() {
        insertTool("u1", 1, now.plusSeconds(3600), true, true);
        insertTool("u2", 1, now.plusSeconds(3600), false, true);
        insertTool("m1", 7, now.minusSeconds(1), false, true);

        List<ToolInfo> urgent = catalog.findDueTools(ProcessingPriority.URGENT, now);
        assertEquals(1, urgent.size());
        assertEquals("u1", urgent.get(0).id());

        List<ToolInfo> maintenance = catalog.findDueTools(ProcessingPriority.MAINTENANCE, now);
        assertEquals(1, maintenance.size());
        assertEquals("m1", maintenance.get(0).id());
    }

    @Test
    void registerShouldMatchExistingToolByGithubUrl() {
        ToolInfo first = catalog.register(new ToolRegistration(
                "Acme", "desc", "https://acme.dev", "https://github.com/acme/acme",
                "ide", 2, Duration.ofDays(1), true), now);

        ToolInfo second = catalog.register(new ToolRegistration(
                "Acme Renamed", null, null, "https://github.com/acme/acme",
                null, null, null, null), now.plusSeconds(10));

        assertEquals(first.id(), second.id());
        assertEquals("Acme Renamed", second.name());
        assertEquals(1, catalog.countTools());

        ToolInfo other = catalog.register(ToolRegistration.named("Other"), now);
        assertNotEquals(first.id(), other.id());
        assertEquals(2, catalog.countTools());
    }

    @Test
    void setMonitoringShouldKeepNextProcessAtWhenNull() {
        Instant next = now.plusSeconds(120);
        insertTool("t1", 3, next, false, true);

        assertTrue(catalog.setMonitoring("t1", false, null));
        ToolInfo paused = catalog.findTool("t1").orElseThrow();
        assertFalse(paused.activelyMonitored());
        assertEquals(next, paused.nextProcessAt());
        assertEquals(0, catalog.countMonitored());

        assertFalse(catalog.setMonitoring("missing", true, now));
    }

    @Test
    void recordProcessedShouldRescheduleByMonitoringFrequency() {
        insertTool("t1", 3, now.minusSeconds(10), false, true);

        catalog.recordProcessed("t1", now, false);

        ToolInfo tool = catalog.findTool("t1").orElseThrow();
        assertEquals(now, tool.lastProcessedAt());
        assertEquals(now.plus(Duration.ofDays(7)), tool.nextProcessAt());
        assertEquals(1, catalog.countProcessedSince(now.minusSeconds(1)));
    }

    @Test
    void jobStoreShouldPersistOutcomesAndReplaceBySameId() {
        BatchJob job = new BatchJob("job_1_1", List.of("t1", "t2"), ProcessingPriority.HIGH, JobType.MANUAL, now);
        job.markRunning(now);
        ChangeDetection change = new ChangeDetection(ChangeType.VERSION_BUMP, "version", "1.0", "2.0", 0.9, "bumped", 4);
        job.recordOutcome(ToolOutcome.success("t1", CurationResult.of("t1", List.of(change)), Duration.ofMillis(1500)));
        job.recordOutcome(ToolOutcome.failure("t2", "boom", Duration.ofMillis(10)));
        job.markCompleted(now.plusSeconds(2));

        jobStore.save(job);
        jobStore.save(job);

        BatchJobDocument doc = jobStore.findById("job_1_1").orElseThrow();
        assertEquals("COMPLETED", doc.getStatus());
        assertEquals("HIGH", doc.getPriority());
        assertEquals(1, doc.getSuccessCount());
        assertEquals(2, doc.getResults().size());
        assertEquals("t1", doc.getResults().get(0).get("toolId"));
        assertEquals("boom", doc.getResults().get(1).get("error"));
        assertEquals(1, jobStore.findRecent(10).size());
    }

    @Test
    void alertStoreShouldRoundTripAndAcknowledge() {
        ChangeSummary summary = new ChangeSummary(ChangeType.PRICE_CHANGE, "pricing", "$10", "$20",
                "price doubled", 5, 0.95, AlertSeverity.CRITICAL);
        Alert older = new Alert("alert_old", "t1", "Acme", "pricing_changes", AlertSeverity.CRITICAL,
                "Acme: Pricing Changes", "price doubled", List.of(summary),
                Map.of("rule_name", "Pricing Changes"), now.minusSeconds(60),
                Set.of(AlertChannel.EMAIL, AlertChannel.DATABASE));
        Alert newer = new Alert("alert_new", null, "3 Tools", "batch_summary", AlertSeverity.MEDIUM,
                "Batch Processing Complete - 3 tools updated", "msg", List.of(),
                Map.of("tool_ids", List.of("a", "b", "c")), now, Set.of(AlertChannel.SLACK));

        alertStore.save(older);
        alertStore.save(newer);

        List<Alert> found = alertStore.findSince(now.minusSeconds(120));
        assertEquals(2, found.size());
        assertEquals("alert_new", found.get(0).id());

        Alert restored = found.get(1);
        assertEquals(AlertSeverity.CRITICAL, restored.severity());
        assertEquals(Set.of(AlertChannel.EMAIL, AlertChannel.DATABASE), restored.channels());
        assertEquals(summary, restored.changes().get(0));
        assertEquals("Pricing Changes", restored.metadata().get("rule_name"));

        assertEquals(1, alertStore.findSince(now.minusSeconds(30)).size());

        assertTrue(alertStore.acknowledge("alert_old", "alice", now));
        AlertDocument doc = alertStore.findById("alert_old").orElseThrow();
        assertTrue(doc.isAcknowledged());
        assertEquals("alice", doc.getAcknowledgedBy());
        assertNotNull(doc.getAcknowledgedAt());

        assertFalse(alertStore.acknowledge("missing", "alice", now));
    }

    private void insertTool(String id, int level, Instant nextProcessAt, boolean failed, boolean active) {
        ToolDocument doc = new ToolDocument();
        doc.setId(id);
        doc.setName("tool-" + id);
        doc.setPriorityLevel(level);
        doc.setNextProcessAt(nextProcessAt);
        doc.setLastProcessingFailed(failed);
        doc.setActivelyMonitored(active);
        mongoTemplate.insert(doc);
    }
}
