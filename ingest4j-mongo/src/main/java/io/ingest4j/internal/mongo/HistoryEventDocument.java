package io.ingest4j.internal.mongo;

import io.ingest4j.history.HistoryEvent;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for the append-only job history.
 */
@Document(collection = HistoryEventDocument.COLLECTION)
public class HistoryEventDocument {

    public static final String COLLECTION = "ingestion_history";

    @Id
    private Long id;

    @Field("job_name")
    private String jobName;

    @Field("event_type")
    private String eventType;

    private String status;

    @Field("started_at")
    private Instant startedAt;

    @Field("ended_at")
    private Instant endedAt;

    @Field("duration_ms")
    private Long durationMs;

    @Field("row_count")
    private Integer rowCount;

    private String details;

    public HistoryEventDocument() {
    }

    static HistoryEventDocument from(long id, HistoryEvent event, Instant defaultStartedAt) {
        HistoryEventDocument doc = new HistoryEventDocument();
        doc.setId(id);
        doc.setJobName(event.jobName());
        doc.setEventType(event.eventType());
        doc.setStatus(event.status());
        doc.setStartedAt(event.startedAt() != null ? event.startedAt() : defaultStartedAt);
        doc.setEndedAt(event.endedAt());
        doc.setDurationMs(event.durationMs());
        doc.setRowCount(event.rowCount());
        doc.setDetails(event.details());
        return doc;
    }

    HistoryEvent toEvent() {
        return new HistoryEvent(id, jobName, eventType, status, startedAt, endedAt, durationMs, rowCount, details);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(Instant endedAt) {
        this.endedAt = endedAt;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public Integer getRowCount() {
        return rowCount;
    }

    public void setRowCount(Integer rowCount) {
        this.rowCount = rowCount;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }
}
