package io.toolwatch.internal;

import io.toolwatch.JobStore;
import io.toolwatch.core.BatchJob;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps finished jobs in memory. Only the most recent {@code capacity} jobs are retained.
 */
public class InMemoryJobStore implements JobStore {

    private final int capacity;
    private final List<BatchJob> saved = new ArrayList<>();

    public InMemoryJobStore() {
        this(1000);
    }

    public InMemoryJobStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void save(BatchJob job) {
        Objects.requireNonNull(job, "job must not be null");
        saved.removeIf(j -> j.getJobId().equals(job.getJobId()));
        saved.add(job);
        if (saved.size() > capacity) {
            saved.remove(0);
        }
    }

    public synchronized Optional<BatchJob> find(String jobId) {
        return saved.stream().filter(j -> j.getJobId().equals(jobId)).findFirst();
    }

    public synchronized List<BatchJob> findAll() {
        return List.copyOf(saved);
    }
}
