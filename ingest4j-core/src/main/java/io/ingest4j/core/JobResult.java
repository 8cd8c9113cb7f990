package io.ingest4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value returned by an {@link io.ingest4j.IngestionJob}.
 *
 * @param rowCount number of rows the job produced, or null when it does not report one
 * @param details  structured details recorded on the {@code job_end} history event
 */
public record JobResult(
        Integer rowCount,
        Map<String, Object> details
) {
    public JobResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static JobResult empty() {
        return new JobResult(null, Map.of());
    }

    public static JobResult of(int rowCount) {
        return new JobResult(rowCount, Map.of("row_count", rowCount));
    }

    public static JobResult of(int rowCount, Map<String, Object> details) {
        return new JobResult(rowCount, details);
    }
}
