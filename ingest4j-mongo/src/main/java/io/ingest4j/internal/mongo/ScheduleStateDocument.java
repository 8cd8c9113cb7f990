package io.ingest4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for the persisted next-run of a schedule entry.
 */
@Document(collection = ScheduleStateDocument.COLLECTION)
public class ScheduleStateDocument {

    public static final String COLLECTION = "schedule_state";

    @Id
    private String jobId;

    private String policy;
    private Instant nextRunAt;
    private Instant updatedAt;

    public ScheduleStateDocument() {
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getPolicy() {
        return policy;
    }

    public void setPolicy(String policy) {
        this.policy = policy;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
