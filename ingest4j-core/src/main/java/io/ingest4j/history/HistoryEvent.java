package io.ingest4j.history;

import java.time.Instant;
import java.util.Objects;

/**
 * One append-only entry of the job history ledger.
 *
 * @param id      sequence id assigned by the ledger; null before {@link HistoryLedger#append}
 * @param details JSON text (see {@link HistoryDetails}); may be null
 */
public record HistoryEvent(
        Long id,
        String jobName,
        String eventType,
        String status,
        Instant startedAt,
        Instant endedAt,
        Long durationMs,
        Integer rowCount,
        String details
) {
    public static final String JOB_START = "job_start";
    public static final String JOB_END = "job_end";
    public static final String JOB_ERROR = "job_error";

    public static final String STATUS_STARTED = "started";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    public HistoryEvent {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public HistoryEvent withId(long id) {
        return new HistoryEvent(id, jobName, eventType, status, startedAt, endedAt, durationMs, rowCount, details);
    }

    public static Builder builder(String jobName, String eventType, String status) {
        return new Builder(jobName, eventType, status);
    }

    public static final class Builder {
        private final String jobName;
        private final String eventType;
        private final String status;
        private Instant startedAt;
        private Instant endedAt;
        private Long durationMs;
        private Integer rowCount;
        private String details;

        private Builder(String jobName, String eventType, String status) {
            this.jobName = jobName;
            this.eventType = eventType;
            this.status = status;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder endedAt(Instant endedAt) {
            this.endedAt = endedAt;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder rowCount(Integer rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public HistoryEvent build() {
            return new HistoryEvent(null, jobName, eventType, status, startedAt, endedAt, durationMs, rowCount, details);
        }
    }
}
