package io.toolwatch.internal;

import io.toolwatch.CompetitiveMonitor;
import io.toolwatch.JobCompletionListener;
import io.toolwatch.JobStore;
import io.toolwatch.ToolAnalyzer;
import io.toolwatch.ToolCatalog;
import io.toolwatch.config.ToolwatchProperties;
import io.toolwatch.core.BatchJob;
import io.toolwatch.core.CurationResult;
import io.toolwatch.core.JobStatus;
import io.toolwatch.core.JobType;
import io.toolwatch.core.MonitoringStats;
import io.toolwatch.core.ProcessingPriority;
import io.toolwatch.core.ToolInfo;
import io.toolwatch.core.ToolOutcome;
import io.toolwatch.core.ToolRegistration;
import io.toolwatch.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process batch scheduler for tool analysis.
 *
 * <p>Threads:
 * <ul>
 *   <li>one control thread ({@code toolwatch.monitor}) that discovers due tools, promotes pending jobs while
 *   fewer than {@code maxConcurrentJobs} are running, and prunes the completed-job history</li>
 *   <li>a fixed worker pool running one job per thread; each job processes its tools sequentially</li>
 * </ul>
 *
 * <p>The control thread ticks every {@code tickInterval} and is woken early when a job is queued or finishes.
 * Failures inside a tick are logged and retried after an exponential backoff; the loop only ends on {@link #stop()}.
 */
public class DefaultCompetitiveMonitor implements CompetitiveMonitor {
    private static final Logger log = LoggerFactory.getLogger(DefaultCompetitiveMonitor.class);

    private final ToolwatchProperties.Monitor props;
    private final ToolCatalog catalog;
    private final ToolAnalyzer analyzer;
    private final JobStore jobStore;
    private final Clock clock;
    private final RateLimiter rateLimiter;

    private final PriorityJobQueue queue = new PriorityJobQueue();
    private final ConcurrentHashMap<String, BatchJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, BatchJob> activeJobs = new ConcurrentHashMap<>();
    private final Deque<BatchJob> completedJobs = new ArrayDeque<>();
    private final Object completedLock = new Object();
    private final List<JobCompletionListener> listeners = new CopyOnWriteArrayList<>();
    // Jobs whose body was picked up by a worker, or claimed by stop() before a worker got to them.
    private final Set<String> claimedJobs = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong jobCounter = new AtomicLong();
    private final Semaphore wakeSignal = new Semaphore(0);

    private volatile ExecutorService workerPool;
    private Thread controlThread;
    private AtomicBoolean controlRun;

    private volatile Instant nextDiscoveryAt;
    private int consecutiveErrors = 0;

    public DefaultCompetitiveMonitor(ToolwatchProperties.Monitor props, ToolCatalog catalog, ToolAnalyzer analyzer,
                                     JobStore jobStore) {
        this(props, catalog, analyzer, jobStore, Clock.systemUTC());
    }

    public DefaultCompetitiveMonitor(ToolwatchProperties.Monitor props, ToolCatalog catalog, ToolAnalyzer analyzer,
                                     JobStore jobStore, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        if (props.getMaxWorkers() <= 0) {
            throw new IllegalArgumentException("toolwatch.monitor.maxWorkers must be positive");
        }
        if (props.getMaxConcurrentJobs() <= 0) {
            throw new IllegalArgumentException("toolwatch.monitor.maxConcurrentJobs must be positive");
        }
        if (props.getMaxCompletedJobs() < 0) {
            throw new IllegalArgumentException("toolwatch.monitor.maxCompletedJobs must not be negative");
        }
        this.rateLimiter = new RateLimiter(props.getRateLimits());
    }

    /**
     * Start the control thread and the worker pool. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration tick = Objects.requireNonNull(props.getTickInterval(), "toolwatch.monitor.tickInterval must not be null");
        if (tick.isZero() || tick.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("toolwatch.monitor.tickInterval must be a positive duration");
        }
        Instant now = clock.instant();
        try {
            IntervalParser.nextRunAt(props.getDiscoverEvery(), props.getDiscoveryTimezone(), now);
        } catch (IllegalArgumentException e) {
            started.set(false);
            throw new IllegalArgumentException("toolwatch.monitor.discoverEvery is invalid: " + e.getMessage(), e);
        }

        log.info("Monitor starting with maxWorkers={}, maxConcurrentJobs={}, tickInterval={}, discoverEvery={}, maxCompletedJobs={}",
                props.getMaxWorkers(),
                props.getMaxConcurrentJobs(),
                tick,
                props.getDiscoverEvery(),
                props.getMaxCompletedJobs());

        if (workerPool == null) {
            AtomicInteger threadIndex = new AtomicInteger();
            workerPool = Executors.newFixedThreadPool(props.getMaxWorkers(), r -> {
                Thread t = new Thread(r);
                t.setName("toolwatch.worker-" + threadIndex.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        nextDiscoveryAt = now;
        consecutiveErrors = 0;

        if (controlThread == null) {
            AtomicBoolean run = new AtomicBoolean(true);
            controlRun = run;
            controlThread = new Thread(() -> controlLoop(run));
            controlThread.setName("toolwatch.monitor");
            controlThread.setDaemon(true);
            controlThread.start();
        }
        log.info("Monitor started successfully.");
    }

    /**
     * Stop ticking, wait up to the shutdown grace period for running jobs, then interrupt them.
     * Pending jobs stay queued and are picked up by a later {@link #start()}. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Monitor stopping...");

        Thread control = controlThread;
        controlThread = null;
        if (controlRun != null) {
            controlRun.set(false);
            controlRun = null;
        }
        if (control != null) {
            control.interrupt();
            try {
                control.join(Math.max(1L, props.getShutdownGracePeriod().toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Monitor grace period elapsed; interrupting running jobs count={}", activeJobs.size());
                    workerPool.shutdownNow();
                    failUnstartedJobs();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
                failUnstartedJobs();
            } finally {
                workerPool = null;
            }
        }

        wakeSignal.drainPermits();
        log.info("Monitor stopped successfully. pendingJobs={}", queue.size());
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public String queueToolAnalysis(List<String> toolIds, ProcessingPriority priority, JobType jobType) {
        Objects.requireNonNull(toolIds, "toolIds must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(jobType, "jobType must not be null");
        if (toolIds.isEmpty()) {
            throw new IllegalArgumentException("toolIds must not be empty");
        }
        for (String id : toolIds) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("toolIds must not contain blank ids: " + toolIds);
            }
        }

        Instant now = clock.instant();
        String jobId = "job_" + jobCounter.incrementAndGet() + "_" + now.getEpochSecond();
        BatchJob job = new BatchJob(jobId, toolIds, priority, jobType, now);

        jobs.put(jobId, job);
        queue.enqueue(job);
        log.info("Queued job id={} priority={} type={} tools={}", jobId, priority, jobType, toolIds.size());

        wakeSignal.release();
        return jobId;
    }

    /**
     * Queue SCHEDULED jobs for all due tools, one job per priority-sized chunk. Tools already part of a pending
     * or running job are skipped.
     */
    @Override
    public List<String> queueScheduledAnalysis() {
        Instant now = clock.instant();
        Set<String> inFlight = toolsInFlight();
        List<String> jobIds = new ArrayList<>();

        for (ProcessingPriority tier : ProcessingPriority.values()) {
            List<String> due = new ArrayList<>();
            for (ToolInfo tool : catalog.findDueTools(tier, now)) {
                if (!inFlight.contains(tool.id())) {
                    due.add(tool.id());
                }
            }
            if (due.isEmpty()) {
                continue;
            }

            int chunk = props.batchSizeFor(tier);
            for (int i = 0; i < due.size(); i += chunk) {
                List<String> slice = due.subList(i, Math.min(i + chunk, due.size()));
                jobIds.add(queueToolAnalysis(slice, tier, JobType.SCHEDULED));
            }
        }

        if (!jobIds.isEmpty()) {
            log.info("Queued scheduled analysis jobs count={}", jobIds.size());
        }
        return jobIds;
    }

    @Override
    public String importTools(List<ToolRegistration> tools, ProcessingPriority priority) {
        Objects.requireNonNull(tools, "tools must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        if (tools.isEmpty()) {
            throw new IllegalArgumentException("tools must not be empty");
        }

        Instant processSoon = clock.instant().plus(props.getResumeDelay());
        List<String> ids = new ArrayList<>(tools.size());
        for (ToolRegistration registration : tools) {
            ToolInfo tool = catalog.register(Objects.requireNonNull(registration, "registration must not be null"), processSoon);
            ids.add(tool.id());
        }

        String jobId = queueToolAnalysis(ids, priority, JobType.BULK_IMPORT);
        log.info("Imported tools count={} jobId={}", ids.size(), jobId);
        return jobId;
    }

    @Override
    public Optional<BatchJob> getJobStatus(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public MonitoringStats getMonitoringStats() {
        Instant startOfDay = clock.instant().truncatedTo(ChronoUnit.DAYS);

        long totalTools = 0;
        long monitored = 0;
        long processedToday = 0;
        try {
            totalTools = catalog.countTools();
            monitored = catalog.countMonitored();
            processedToday = catalog.countProcessedSince(startOfDay);
        } catch (RuntimeException e) {
            log.error("Monitor stats catalog query failed msg={}", e.getMessage(), e);
        }

        List<BatchJob> history = completedSnapshot();
        long changesToday = 0;
        long outcomes = 0;
        long successes = 0;
        Duration totalElapsed = Duration.ZERO;
        for (BatchJob job : history) {
            boolean today = job.getCompletedAt() != null && !job.getCompletedAt().isBefore(startOfDay);
            for (ToolOutcome outcome : job.getResults()) {
                outcomes++;
                totalElapsed = totalElapsed.plus(outcome.elapsed());
                if (outcome.success()) {
                    successes++;
                    if (today) {
                        changesToday += outcome.changes().size();
                    }
                }
            }
        }

        return new MonitoringStats(
                totalTools,
                monitored,
                processedToday,
                changesToday,
                outcomes == 0 ? Duration.ZERO : totalElapsed.dividedBy(outcomes),
                queue.size(),
                activeJobs.size(),
                history.size(),
                outcomes == 0 ? 0.0 : successes * 100.0 / outcomes
        );
    }

    @Override
    public boolean pauseToolMonitoring(String toolId) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        boolean found = catalog.setMonitoring(toolId, false, null);
        if (found) {
            log.info("Paused monitoring toolId={}", toolId);
        } else {
            log.warn("Cannot pause monitoring, unknown toolId={}", toolId);
        }
        return found;
    }

    @Override
    public boolean resumeToolMonitoring(String toolId) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        Instant next = clock.instant().plus(props.getResumeDelay());
        boolean found = catalog.setMonitoring(toolId, true, next);
        if (found) {
            log.info("Resumed monitoring toolId={} nextProcessAt={}", toolId, next);
        } else {
            log.warn("Cannot resume monitoring, unknown toolId={}", toolId);
        }
        return found;
    }

    @Override
    public String triggerImmediateAnalysis(String toolId) {
        return queueToolAnalysis(List.of(Objects.requireNonNull(toolId, "toolId must not be null")),
                ProcessingPriority.URGENT, JobType.TRIGGERED);
    }

    @Override
    public void addJobListener(JobCompletionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    private void controlLoop(AtomicBoolean run) {
        while (run.get()) {
            try {
                tick(run);
                consecutiveErrors = 0;
            } catch (Exception e) {
                consecutiveErrors++;
                Duration sleep = backoff(consecutiveErrors);
                log.error("Monitor tick failed errors={} retryIn={} msg={}", consecutiveErrors, sleep, e.getMessage(), e);
                try {
                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                if (wakeSignal.tryAcquire(props.getTickInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    wakeSignal.drainPermits();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures, capped by errorBackoff.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), props.getErrorBackoff().toMillis());
        return Duration.ofMillis(Math.max(ms, 1L));
    }

    void tick(AtomicBoolean run) {
        Instant now = clock.instant();
        Instant due = nextDiscoveryAt;
        if (due == null || !now.isBefore(due)) {
            queueScheduledAnalysis();
            nextDiscoveryAt = IntervalParser.nextRunAt(props.getDiscoverEvery(), props.getDiscoveryTimezone(), now);
            log.debug("Monitor discovery done nextDiscoveryAt={}", nextDiscoveryAt);
        }

        promotePending(run);
        pruneHistory();
    }

    private synchronized void promotePending(AtomicBoolean run) {
        while (run.get() && activeJobs.size() < props.getMaxConcurrentJobs()) {
            Optional<BatchJob> next = queue.poll();
            if (next.isEmpty()) {
                return;
            }
            startJob(next.get());
        }
    }

    private void startJob(BatchJob job) {
        job.markRunning(clock.instant());
        activeJobs.put(job.getJobId(), job);
        log.debug("Monitor job started id={} priority={} tools={}", job.getJobId(), job.getPriority(), job.getToolIds().size());

        ExecutorService pool = workerPool;
        try {
            if (pool == null) {
                throw new RejectedExecutionException("worker pool is shut down");
            }
            pool.submit(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            log.warn("Monitor could not start job id={} msg={}", job.getJobId(), e.getMessage());
            job.markFailed(clock.instant(), "worker pool unavailable");
            onJobFinished(job);
        }
    }

    private void runJob(BatchJob job) {
        if (!claimedJobs.add(job.getJobId())) {
            return;
        }
        try {
            for (String toolId : job.getToolIds()) {
                rateLimiter.throttle(job.getPriority());
                ToolOutcome outcome = analyzeTool(job, toolId);
                job.recordOutcome(outcome);
                recordProcessed(toolId, !outcome.success());
            }
            job.markCompleted(clock.instant());
            log.info("Monitor job completed id={} succeeded={} total={}", job.getJobId(), job.successCount(), job.getToolIds().size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.markFailed(clock.instant(), "interrupted");
            log.warn("Monitor job interrupted id={} progress={}", job.getJobId(), job.getProgress());
        } catch (Exception e) {
            job.markFailed(clock.instant(), e.getMessage() == null ? e.getClass().getName() : e.getMessage());
            log.error("Monitor job failed id={} msg={}", job.getJobId(), e.getMessage(), e);
        } finally {
            if (!job.getStatus().isTerminal()) {
                job.markFailed(clock.instant(), "aborted");
            }
            onJobFinished(job);
        }
    }

    private ToolOutcome analyzeTool(BatchJob job, String toolId) throws InterruptedException {
        long startNanos = System.nanoTime();
        try {
            CurationResult result = analyzer.analyze(toolId);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (result == null) {
                return ToolOutcome.failure(toolId, "analyzer returned no result", elapsed);
            }
            return ToolOutcome.success(toolId, result, elapsed);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Monitor tool analysis failed jobId={} toolId={} msg={}", job.getJobId(), toolId, e.getMessage(), e);
            String message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
            return ToolOutcome.failure(toolId, message, Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private void recordProcessed(String toolId, boolean failed) {
        try {
            catalog.recordProcessed(toolId, clock.instant(), failed);
        } catch (Exception e) {
            log.error("Monitor recordProcessed failed toolId={} msg={}", toolId, e.getMessage(), e);
        }
    }

    // Jobs promoted to RUNNING but still waiting in the worker queue when the pool was forced down.
    private void failUnstartedJobs() {
        for (BatchJob job : new ArrayList<>(activeJobs.values())) {
            if (claimedJobs.add(job.getJobId())) {
                log.warn("Monitor job never started before shutdown id={}", job.getJobId());
                job.markFailed(clock.instant(), "shutdown before start");
                onJobFinished(job);
            }
        }
    }

    private void onJobFinished(BatchJob job) {
        activeJobs.remove(job.getJobId());
        claimedJobs.remove(job.getJobId());
        synchronized (completedLock) {
            completedJobs.addLast(job);
        }

        try {
            jobStore.save(job);
        } catch (Exception e) {
            log.error("Monitor job persist failed id={} msg={}", job.getJobId(), e.getMessage(), e);
        }

        for (JobCompletionListener listener : listeners) {
            try {
                listener.onJobCompleted(job);
            } catch (Exception e) {
                log.error("Monitor job listener failed id={} listener={} msg={}",
                        job.getJobId(), listener.getClass().getName(), e.getMessage(), e);
            }
        }

        wakeSignal.release();
    }

    private void pruneHistory() {
        List<BatchJob> evicted = new ArrayList<>();
        synchronized (completedLock) {
            int excess = completedJobs.size() - props.getMaxCompletedJobs();
            if (excess <= 0) {
                return;
            }
            List<BatchJob> ordered = new ArrayList<>(completedJobs);
            ordered.sort(Comparator.comparing(BatchJob::getCompletedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
            evicted.addAll(ordered.subList(0, excess));
            completedJobs.clear();
            completedJobs.addAll(ordered.subList(excess, ordered.size()));
        }
        for (BatchJob job : evicted) {
            jobs.remove(job.getJobId());
        }
        log.debug("Monitor pruned completed jobs count={}", evicted.size());
    }

    private List<BatchJob> completedSnapshot() {
        synchronized (completedLock) {
            return new ArrayList<>(completedJobs);
        }
    }

    private Set<String> toolsInFlight() {
        Set<String> ids = new HashSet<>();
        for (BatchJob job : jobs.values()) {
            if (job.getStatus() == JobStatus.PENDING || job.getStatus() == JobStatus.RUNNING) {
                ids.addAll(job.getToolIds());
            }
        }
        return ids;
    }
}
