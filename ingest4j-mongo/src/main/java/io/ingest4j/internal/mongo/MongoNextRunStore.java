package io.ingest4j.internal.mongo;

import io.ingest4j.core.StorageException;
import io.ingest4j.schedule.NextRunStore;
import io.ingest4j.schedule.ScheduleState;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Objects;
import java.util.Optional;

/**
 * Persists next-run times in {@code schedule_state}, one document per schedule entry id.
 */
public class MongoNextRunStore implements NextRunStore {

    private final MongoTemplate mongoTemplate;

    public MongoNextRunStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<ScheduleState> load(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        try {
            ScheduleStateDocument doc = mongoTemplate.findById(jobId, ScheduleStateDocument.class);
            if (doc == null) {
                return Optional.empty();
            }
            return Optional.of(new ScheduleState(doc.getJobId(), doc.getPolicy(), doc.getNextRunAt(), doc.getUpdatedAt()));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load schedule state id=" + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(ScheduleState state) {
        Objects.requireNonNull(state, "state must not be null");
        Query q = new Query(Criteria.where("_id").is(state.jobId()));
        Update u = new Update()
                .set("policy", state.policy())
                .set("nextRunAt", state.nextRunAt())
                .set("updatedAt", state.updatedAt());
        try {
            mongoTemplate.upsert(q, u, ScheduleStateDocument.class);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save schedule state id=" + state.jobId() + ": " + e.getMessage(), e);
        }
    }
}
