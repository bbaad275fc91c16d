package io.toolwatch.core;

import java.time.Duration;

/**
 * Point-in-time view of the monitor for dashboards and the status API.
 *
 * @param successRate percentage of successfully processed tools across retained jobs, 0..100
 */
public record MonitoringStats(
        long totalTools,
        long toolsMonitored,
        long toolsProcessedToday,
        long changesDetectedToday,
        Duration averageProcessingTime,
        int queueSize,
        int activeJobs,
        int completedJobs,
        double successRate
) {
}
