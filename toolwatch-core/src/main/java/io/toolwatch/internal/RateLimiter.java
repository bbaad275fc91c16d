package io.toolwatch.internal;

import io.toolwatch.core.ProcessingPriority;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed per-priority pause taken before each tool a job processes, to stay polite towards scraped sites and
 * upstream APIs.
 */
public final class RateLimiter {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Map<ProcessingPriority, Duration> delays;
    private final Sleeper sleeper;

    public RateLimiter(Map<ProcessingPriority, Duration> delays) {
        this(delays, d -> Thread.sleep(d.toMillis()));
    }

    public RateLimiter(Map<ProcessingPriority, Duration> delays, Sleeper sleeper) {
        Objects.requireNonNull(delays, "delays must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.delays = new EnumMap<>(ProcessingPriority.class);
        for (ProcessingPriority p : ProcessingPriority.values()) {
            Duration d = delays.get(p);
            if (d != null && d.isNegative()) {
                throw new IllegalArgumentException("rate limit for " + p + " must not be negative: " + d);
            }
            this.delays.put(p, d == null ? Duration.ZERO : d);
        }
    }

    public Duration delayFor(ProcessingPriority priority) {
        return delays.get(Objects.requireNonNull(priority, "priority must not be null"));
    }

    /**
     * Block the calling worker for the configured delay of {@code priority}. Zero delays return immediately.
     */
    public void throttle(ProcessingPriority priority) throws InterruptedException {
        Duration delay = delayFor(priority);
        if (!delay.isZero()) {
            sleeper.sleep(delay);
        }
    }
}
