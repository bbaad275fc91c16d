package io.toolwatch.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BatchJobTest {

    private static final Instant T0 = Instant.parse("2026-05-01T09:00:00Z");

    @Test
    void progressShouldTrackRecordedOutcomes() {
        BatchJob job = new BatchJob("job_1_1", List.of("a", "b", "c", "d"), ProcessingPriority.HIGH, JobType.MANUAL, T0);
        job.markRunning(T0);

        job.recordOutcome(ToolOutcome.success("a", CurationResult.of("a", List.of()), Duration.ZERO));
        assertEquals(25.0, job.getProgress(), 0.001);
        job.recordOutcome(ToolOutcome.failure("b", "timeout", Duration.ZERO));
        assertEquals(50.0, job.getProgress(), 0.001);
        assertEquals(1, job.successCount());

        job.markFailed(T0.plusSeconds(1), "interrupted");
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(2, job.getResults().size());
    }

    @Test
    void jobShouldOnlyStartFromPending() {
        BatchJob job = new BatchJob("job_1_1", List.of("a"), ProcessingPriority.LOW, JobType.SCHEDULED, T0);
        job.markRunning(T0);
        assertThrows(IllegalStateException.class, () -> job.markRunning(T0));
    }

    @Test
    void confidenceOutsideUnitIntervalShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChangeDetection(ChangeType.MODIFIED, "f", null, null, 1.5, "x", 1));
    }
}
