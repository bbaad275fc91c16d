package io.toolwatch;

import io.toolwatch.core.BatchJob;
import io.toolwatch.core.JobType;
import io.toolwatch.core.MonitoringStats;
import io.toolwatch.core.ProcessingPriority;
import io.toolwatch.core.ToolRegistration;

import java.util.List;
import java.util.Optional;

/**
 * Main monitoring API.
 *
 * <p>Tools are analyzed in batch jobs. Jobs wait in a priority queue (lower {@link ProcessingPriority} value first,
 * FIFO among equals) and are promoted to a bounded worker pool by a periodic control loop, which also discovers
 * tools that are due for re-analysis.
 *
 * <pre>{@code
 * monitor.addJobListener(alertIntegration);
 * monitor.start();
 *
 * String jobId = monitor.queueToolAnalysis(List.of("17", "42"), ProcessingPriority.HIGH);
 * monitor.getJobStatus(jobId).map(BatchJob::getStatus);
 *
 * monitor.stop();
 * }</pre>
 */
public interface CompetitiveMonitor {

    /**
     * Start the control loop and the worker pool. Idempotent.
     */
    void start();

    /**
     * Stop ticking, give in-flight jobs a grace period, then force the workers down. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Queue one job analyzing {@code toolIds} in order.
     *
     * @return the new job id, {@code job_<counter>_<epochSeconds>}
     * @throws IllegalArgumentException if the list is empty or contains a blank id
     */
    String queueToolAnalysis(List<String> toolIds, ProcessingPriority priority, JobType jobType);

    default String queueToolAnalysis(List<String> toolIds, ProcessingPriority priority) {
        return queueToolAnalysis(toolIds, priority, JobType.MANUAL);
    }

    /**
     * Queue scheduled jobs for every tool due for re-analysis, chunked per priority tier.
     *
     * @return ids of the queued jobs, possibly empty
     */
    List<String> queueScheduledAnalysis();

    /**
     * Register or update the given tools in the catalog and queue one job analyzing all of them.
     *
     * @return the id of the queued job
     */
    String importTools(List<ToolRegistration> tools, ProcessingPriority priority);

    Optional<BatchJob> getJobStatus(String jobId);

    MonitoringStats getMonitoringStats();

    /**
     * Exclude a tool from scheduled discovery. Explicitly queued jobs still analyze it.
     *
     * @return {@code false} if the tool is unknown
     */
    boolean pauseToolMonitoring(String toolId);

    /**
     * Re-enable scheduled discovery for a tool; it becomes due after the configured resume delay.
     *
     * @return {@code false} if the tool is unknown
     */
    boolean resumeToolMonitoring(String toolId);

    /**
     * Queue a single-tool URGENT job.
     */
    String triggerImmediateAnalysis(String toolId);

    void addJobListener(JobCompletionListener listener);
}
