package io.ingest4j.config;

import io.ingest4j.Ingestion;
import io.ingest4j.schedule.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the ingestion loop with the Spring container lifecycle.
 *
 * <ul>
 *   <li>{@code ingest.dry-run=true}: check job registrations, log the validated schedule, run nothing</li>
 *   <li>{@code ingest.run-once=true}: run a single dispatch cycle at start-up</li>
 *   <li>otherwise: start the polling loop</li>
 * </ul>
 */
public class IngestionLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(IngestionLifecycle.class);

    private final Ingestion ingestion;
    private final IngestionProperties props;
    private volatile boolean running = false;

    public IngestionLifecycle(Ingestion ingestion, IngestionProperties props) {
        this.ingestion = ingestion;
        this.props = props;
    }

    @Override
    public void start() {
        if (props.isDryRun()) {
            ingestion.validate();
            log.info("Dry run mode - schedule validated successfully.");
            log.info("Loaded {} enabled jobs:", ingestion.jobs().size());
            for (ScheduledJob job : ingestion.jobs()) {
                log.info("  - {}: {}", job.getId(), job.getDescription().isEmpty() ? "(no description)" : job.getDescription());
            }
        } else if (props.isRunOnce()) {
            ingestion.runOnce();
        } else {
            ingestion.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        ingestion.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
