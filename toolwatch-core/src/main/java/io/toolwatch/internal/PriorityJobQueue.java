package io.toolwatch.internal;

import io.toolwatch.core.BatchJob;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pending jobs ordered by priority value, then by enqueue order.
 *
 * <p>Safe for concurrent producers and consumers.
 */
public final class PriorityJobQueue {

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.job.getPriority().value())
            .thenComparingLong(e -> e.sequence);

    private final PriorityBlockingQueue<Entry> heap = new PriorityBlockingQueue<>(16, ORDER);
    private final AtomicLong sequence = new AtomicLong();

    private static final class Entry {
        private final BatchJob job;
        private final long sequence;

        private Entry(BatchJob job, long sequence) {
            this.job = job;
            this.sequence = sequence;
        }
    }

    public void enqueue(BatchJob job) {
        Objects.requireNonNull(job, "job must not be null");
        heap.offer(new Entry(job, sequence.getAndIncrement()));
    }

    /**
     * Remove and return the most urgent job, or empty if none is pending.
     */
    public Optional<BatchJob> poll() {
        Entry e = heap.poll();
        return e == null ? Optional.empty() : Optional.of(e.job);
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public void clear() {
        heap.clear();
    }
}
