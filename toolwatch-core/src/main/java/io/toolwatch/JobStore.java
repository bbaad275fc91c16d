package io.toolwatch;

import io.toolwatch.core.BatchJob;

/**
 * Durable audit record of finished jobs.
 */
public interface JobStore {

    void save(BatchJob job);
}
