package io.ingest4j.orchestrator;

import io.ingest4j.Ingestion;
import io.ingest4j.core.ConfigurationException;
import io.ingest4j.core.StorageException;
import io.ingest4j.schedule.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polling loop around a {@link JobOrchestrator}: run a cycle, sleep {@code pollInterval}, repeat.
 *
 * <p>The loop stops on a {@link ConfigurationException} or {@link StorageException} escaping a cycle.
 * Other failures are retried with exponential back-off; 30 failures in a row stop the loop too.
 */
public class IngestionRunner implements Ingestion {
    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    static final int MAX_SYSTEM_ERRORS = 30;
    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final JobOrchestrator orchestrator;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Thread pollerThread;
    private volatile Throwable fatalError;
    private int systemErrorCount = 0;

    public IngestionRunner(JobOrchestrator orchestrator, Duration pollInterval, Clock clock) {
        this(orchestrator, pollInterval, DEFAULT_SHUTDOWN_TIMEOUT, clock);
    }

    public IngestionRunner(JobOrchestrator orchestrator, Duration pollInterval, Duration shutdownTimeout, Clock clock) {
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be a positive duration");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void validate() {
        orchestrator.validate();
    }

    @Override
    public void start() {
        validate();
        if (!started.compareAndSet(false, true)) {
            return;
        }
        fatalError = null;
        systemErrorCount = 0;

        log.info("Ingestion starting with pollInterval={}, mode={}, jobs={}",
                pollInterval, orchestrator.mode(), orchestrator.scheduleStore().jobs().size());

        Thread t = new Thread(this::pollerLoop);
        t.setName("ingest.poller");
        t.setDaemon(true);
        pollerThread = t;
        t.start();
        log.info("Ingestion started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Ingestion stopping...");

        Thread t = pollerThread;
        pollerThread = null;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
        orchestrator.shutdown(shutdownTimeout);
        log.info("Ingestion stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public List<JobOutcome> runOnce() {
        return orchestrator.runCycle(clock.instant());
    }

    @Override
    public List<ScheduledJob> jobs() {
        return orchestrator.scheduleStore().jobs();
    }

    /**
     * The error that stopped the loop, if any.
     */
    public Optional<Throwable> fatalError() {
        return Optional.ofNullable(fatalError);
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                orchestrator.runCycle(clock.instant());
                systemErrorCount = 0;
            } catch (ConfigurationException | StorageException e) {
                fatalError = e;
                log.error("Ingestion stopped on fatal error msg={}", e.getMessage(), e);
                stop();
                break;
            } catch (RuntimeException e) {
                systemErrorCount++;
                log.error("ingestion cycle failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    fatalError = e;
                    log.error("Ingestion stopped due to repeated system failures...");
                    stop();
                    break;
                }
                if (!sleep(backoff(systemErrorCount))) {
                    break;
                }
                continue;
            }

            if (!started.get() || !sleep(pollInterval)) {
                break;
            }
        }
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Exponential backoff for repeated cycle failures.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
