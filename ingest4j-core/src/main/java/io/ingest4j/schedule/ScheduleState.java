package io.ingest4j.schedule;

import java.time.Instant;

/**
 * Persisted next-run of one schedule entry.
 *
 * @param policy {@link RecurrencePolicy#describe()} of the policy that produced {@code nextRunAt}
 */
public record ScheduleState(
        String jobId,
        String policy,
        Instant nextRunAt,
        Instant updatedAt
) {
}
