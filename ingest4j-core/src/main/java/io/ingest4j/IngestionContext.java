package io.ingest4j;

import io.ingest4j.history.HistoryEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Storage callbacks handed to every {@link IngestionJob} run.
 */
public interface IngestionContext {

    /**
     * Apply SCD2 versioning to a batch of records.
     *
     * @param table           versioned table name
     * @param records         incoming records, applied in order
     * @param keyFields       natural-key fields
     * @param attributeFields hashed attribute fields; null or empty means "all non-key fields of the first record"
     * @return number of records that produced a new version
     */
    int upsert(String table,
               List<? extends Map<String, ?>> records,
               List<String> keyFields,
               List<String> attributeFields);

    /**
     * Append a job-defined history event (e.g. {@code data_load}, {@code scd2_upsert}).
     *
     * @return the event sequence id
     */
    long appendHistory(String jobName, String eventType, String status, Integer rowCount, Map<String, Object> details);

    List<HistoryEvent> recentHistory(int limit);

    /**
     * Run a storage-native filter against a versioned table.
     *
     * @param filterJson Mongo-style JSON filter, e.g. {@code {"is_current": true}}; null matches everything
     */
    List<Map<String, Object>> runQuery(String table, String filterJson);

    Instant now();
}
