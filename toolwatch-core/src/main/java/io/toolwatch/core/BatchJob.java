package io.toolwatch.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A unit of scheduled work: an ordered list of tools analyzed sequentially by one worker.
 *
 * <p>The tool list is fixed at creation. State transitions are driven by the worker running the job
 * ({@code PENDING -> RUNNING -> COMPLETED | FAILED}); readers on other threads see a consistent view of
 * each field but not an atomic snapshot of all of them.
 */
public final class BatchJob {

    private final String jobId;
    private final List<String> toolIds;
    private final ProcessingPriority priority;
    private final JobType jobType;
    private final Instant createdAt;

    private final List<ToolOutcome> results = Collections.synchronizedList(new ArrayList<>());

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile String error;
    private volatile double progress;

    public BatchJob(String jobId, List<String> toolIds, ProcessingPriority priority, JobType jobType, Instant createdAt) {
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.toolIds = List.copyOf(Objects.requireNonNull(toolIds, "toolIds must not be null"));
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.jobType = Objects.requireNonNull(jobType, "jobType must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public String getJobId() {
        return jobId;
    }

    public List<String> getToolIds() {
        return toolIds;
    }

    public ProcessingPriority getPriority() {
        return priority;
    }

    public JobType getJobType() {
        return jobType;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getError() {
        return error;
    }

    /**
     * Percentage of tools processed so far, 0..100.
     */
    public double getProgress() {
        return progress;
    }

    /**
     * Copy of the per-tool outcomes recorded so far, in processing order.
     */
    public List<ToolOutcome> getResults() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    public long successCount() {
        return getResults().stream().filter(ToolOutcome::success).count();
    }

    public void markRunning(Instant at) {
        if (status != JobStatus.PENDING) {
            throw new IllegalStateException("job " + jobId + " cannot start from status " + status);
        }
        this.startedAt = at;
        this.status = JobStatus.RUNNING;
    }

    public void recordOutcome(ToolOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        int done;
        synchronized (results) {
            results.add(outcome);
            done = results.size();
        }
        this.progress = toolIds.isEmpty() ? 100.0 : done * 100.0 / toolIds.size();
    }

    public void markCompleted(Instant at) {
        this.completedAt = at;
        this.progress = 100.0;
        this.status = JobStatus.COMPLETED;
    }

    public void markFailed(Instant at, String error) {
        this.completedAt = at;
        this.error = error;
        this.status = JobStatus.FAILED;
    }

    @Override
    public String toString() {
        return "BatchJob{" + jobId + ", " + priority + ", " + jobType + ", tools=" + toolIds.size()
                + ", status=" + status + ", progress=" + progress + "}";
    }
}
