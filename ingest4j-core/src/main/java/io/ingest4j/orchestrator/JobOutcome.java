package io.ingest4j.orchestrator;

/**
 * Result of one job run within a dispatch cycle.
 *
 * @param error failure description; null on success
 */
public record JobOutcome(
        String jobId,
        String jobName,
        boolean succeeded,
        long durationMs,
        Integer rowCount,
        String error
) {
    public static JobOutcome success(String jobId, String jobName, long durationMs, Integer rowCount) {
        return new JobOutcome(jobId, jobName, true, durationMs, rowCount, null);
    }

    public static JobOutcome failure(String jobId, String jobName, long durationMs, String error) {
        return new JobOutcome(jobId, jobName, false, durationMs, null, error);
    }
}
