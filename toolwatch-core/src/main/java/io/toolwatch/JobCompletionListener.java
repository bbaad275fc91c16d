package io.toolwatch;

import io.toolwatch.core.BatchJob;

/**
 * Notified once per job after it reaches a terminal status. Listeners run on the worker thread and must not block
 * for long; exceptions are logged and ignored.
 */
@FunctionalInterface
public interface JobCompletionListener {

    void onJobCompleted(BatchJob job);
}
