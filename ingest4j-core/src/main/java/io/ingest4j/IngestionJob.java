package io.ingest4j;

import io.ingest4j.core.JobResult;

import java.util.Map;

/**
 * A named data-collection job. Implementations are registered once in a
 * {@link io.ingest4j.core.JobRegistry} and looked up by the {@code name} of a schedule entry.
 */
public interface IngestionJob {
    String name();

    /**
     * @param context storage callbacks (temporal upsert, history, queries)
     * @param args    the {@code args} map of the schedule entry
     * @return the run result; may be null
     */
    JobResult run(IngestionContext context, Map<String, Object> args) throws Exception;
}
