package io.ingest4j;

import io.ingest4j.orchestrator.JobOutcome;
import io.ingest4j.schedule.ScheduledJob;

import java.util.List;

/**
 * Main runtime API: a polling loop that dispatches due scheduled jobs.
 */
public interface Ingestion {

    /**
     * Check that every scheduled job name has a registered implementation.
     *
     * @throws io.ingest4j.core.ConfigurationException listing the missing names
     */
    void validate();

    /**
     * Start the polling loop. Idempotent.
     */
    void start();

    /**
     * Stop the polling loop and wait for running jobs. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Run a single dispatch cycle on the calling thread.
     */
    List<JobOutcome> runOnce();

    /**
     * Enabled jobs, in declaration order.
     */
    List<ScheduledJob> jobs();
}
