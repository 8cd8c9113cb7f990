package io.ingest4j.orchestrator;

import io.ingest4j.IngestionContext;
import io.ingest4j.IngestionJob;
import io.ingest4j.core.ConfigurationException;
import io.ingest4j.core.DispatchMode;
import io.ingest4j.core.JobRegistry;
import io.ingest4j.core.JobResult;
import io.ingest4j.history.HistoryDetails;
import io.ingest4j.history.HistoryEvent;
import io.ingest4j.history.HistoryLedger;
import io.ingest4j.schedule.ScheduleStore;
import io.ingest4j.schedule.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs one dispatch cycle: claim due jobs, resolve their callables, run them with history bookkeeping.
 *
 * <p>Per job: a {@code job_start} event, then {@code job_end} on success or {@code job_error} on failure.
 * Job failures are contained here and never abort sibling jobs. A job name missing from the registry
 * is a {@link ConfigurationException} and is thrown before any job of the cycle runs.
 *
 * <p>{@link DispatchMode#CONCURRENT} runs the cycle on a fixed pool of {@code maxConcurrency} workers;
 * a job starts only after its dependencies due in the same cycle have finished.
 */
public class JobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final ScheduleStore scheduleStore;
    private final JobRegistry registry;
    private final HistoryLedger ledger;
    private final HistoryDetails historyDetails;
    private final IngestionContext context;
    private final Clock clock;
    private final DispatchMode mode;
    private final int maxConcurrency;

    private ExecutorService workerPool;

    public JobOrchestrator(ScheduleStore scheduleStore,
                           JobRegistry registry,
                           HistoryLedger ledger,
                           HistoryDetails historyDetails,
                           IngestionContext context,
                           Clock clock,
                           DispatchMode mode,
                           int maxConcurrency) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.historyDetails = Objects.requireNonNull(historyDetails, "historyDetails must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Check that every scheduled job name resolves to a registered job.
     *
     * @throws ConfigurationException listing the unresolved names
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        for (ScheduledJob job : scheduleStore.jobs()) {
            if (!registry.contains(job.getName())) {
                missing.add(job.getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Scheduled jobs without a registered IngestionJob: " + missing);
        }
    }

    /**
     * Claim and run every job due at {@code now}; returns once all of them finished.
     */
    public List<JobOutcome> runCycle(Instant now) {
        List<ScheduledJob> due = scheduleStore.dueJobs(now);
        if (due.isEmpty()) {
            log.info("No jobs due at {}", now);
            return List.of();
        }

        Map<ScheduledJob, IngestionJob> resolved = new LinkedHashMap<>();
        for (ScheduledJob job : due) {
            resolved.put(job, registry.getRequired(job.getName()));
        }

        log.info("Dispatching due jobs count={} mode={} at={}", due.size(), mode, now);
        return mode == DispatchMode.CONCURRENT ? runConcurrent(resolved) : runSequential(resolved);
    }

    public ScheduleStore scheduleStore() {
        return scheduleStore;
    }

    public DispatchMode mode() {
        return mode;
    }

    /**
     * Stop the concurrent worker pool, waiting up to {@code await} for running jobs.
     */
    public synchronized void shutdown(Duration await) {
        if (workerPool == null) {
            return;
        }
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        } finally {
            workerPool = null;
        }
    }

    private List<JobOutcome> runSequential(Map<ScheduledJob, IngestionJob> resolved) {
        List<JobOutcome> outcomes = new ArrayList<>(resolved.size());
        for (var e : resolved.entrySet()) {
            outcomes.add(runJob(e.getKey(), e.getValue()));
        }
        return outcomes;
    }

    private List<JobOutcome> runConcurrent(Map<ScheduledJob, IngestionJob> resolved) {
        ExecutorService pool = workerPool();
        Map<String, CompletableFuture<JobOutcome>> futures = new LinkedHashMap<>();

        // due jobs arrive dependencies-first, so every in-cycle dependency is already in the map
        for (var e : resolved.entrySet()) {
            ScheduledJob job = e.getKey();
            IngestionJob callable = e.getValue();

            List<CompletableFuture<JobOutcome>> deps = new ArrayList<>();
            for (String dep : job.getDependsOn()) {
                CompletableFuture<JobOutcome> f = futures.get(dep);
                if (f != null) {
                    deps.add(f);
                }
            }

            CompletableFuture<Void> gate = deps.isEmpty()
                    ? CompletableFuture.completedFuture(null)
                    : CompletableFuture.allOf(deps.toArray(new CompletableFuture[0]));

            CompletableFuture<JobOutcome> run = gate
                    .handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> runJob(job, callable), pool);
            futures.put(job.getId(), run);
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }

        List<JobOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<JobOutcome> f : futures.values()) {
            outcomes.add(f.join());
        }
        return outcomes;
    }

    private JobOutcome runJob(ScheduledJob job, IngestionJob callable) {
        final String name = job.getName();
        long start = System.nanoTime();
        Instant startedAt = clock.instant();

        ledger.append(HistoryEvent.builder(name, HistoryEvent.JOB_START, HistoryEvent.STATUS_STARTED)
                .startedAt(startedAt)
                .details(historyDetails.write(Map.of("args", job.getArgs())))
                .build());
        log.debug("job started name={} id={} at={}", name, job.getId(), startedAt);

        try {
            JobResult result = callable.run(context, job.getArgs());
            long durationMs = elapsedMs(start);
            Integer rowCount = result == null ? null : result.rowCount();

            ledger.append(HistoryEvent.builder(name, HistoryEvent.JOB_END, HistoryEvent.STATUS_SUCCESS)
                    .startedAt(startedAt)
                    .endedAt(clock.instant())
                    .durationMs(durationMs)
                    .rowCount(rowCount)
                    .details(result == null ? null : historyDetails.write(result.details()))
                    .build());
            log.info("job succeeded name={} id={} durationMs={} rowCount={}", name, job.getId(), durationMs, rowCount);
            return JobOutcome.success(job.getId(), name, durationMs, rowCount);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            long durationMs = elapsedMs(start);
            String error = describe(e);
            log.error("job failed name={} id={} durationMs={} msg={}", name, job.getId(), durationMs, error, e);

            ledger.append(HistoryEvent.builder(name, HistoryEvent.JOB_ERROR, HistoryEvent.STATUS_FAILED)
                    .startedAt(startedAt)
                    .endedAt(clock.instant())
                    .durationMs(durationMs)
                    .details(historyDetails.write(Map.of("error", error)))
                    .build());
            return JobOutcome.failure(job.getId(), name, durationMs, error);
        }
    }

    private synchronized ExecutorService workerPool() {
        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(maxConcurrency, r -> {
                Thread t = new Thread(r);
                t.setName("ingest.worker");
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getName() : message;
    }
}
