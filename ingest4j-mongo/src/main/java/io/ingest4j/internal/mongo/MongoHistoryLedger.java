package io.ingest4j.internal.mongo;

import io.ingest4j.core.StorageException;
import io.ingest4j.history.HistoryEvent;
import io.ingest4j.history.HistoryLedger;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB history ledger.
 *
 * <p>Ids come from a counter document in {@code ingestion_counters}, incremented with
 * {@code findAndModify}, so they increase monotonically across processes.
 */
public class MongoHistoryLedger implements HistoryLedger {

    public static final String COUNTERS_COLLECTION = "ingestion_counters";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoHistoryLedger(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public long append(HistoryEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        try {
            long id = nextSequence();
            mongoTemplate.insert(HistoryEventDocument.from(id, event, clock.instant()));
            return id;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to append history event job=" + event.jobName()
                    + " type=" + event.eventType() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<HistoryEvent> recent(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query().with(Sort.by(Sort.Order.desc("_id"))).limit(limit);
        try {
            List<HistoryEventDocument> docs = mongoTemplate.find(q, HistoryEventDocument.class);
            List<HistoryEvent> events = new ArrayList<>(docs.size());
            for (HistoryEventDocument d : docs) {
                events.add(d.toEvent());
            }
            return events;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read history: " + e.getMessage(), e);
        }
    }

    private long nextSequence() {
        Query q = new Query(Criteria.where("_id").is(HistoryEventDocument.COLLECTION));
        Update u = new Update().inc("seq", 1L);
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true).upsert(true);

        Document counter = mongoTemplate.findAndModify(q, u, options, Document.class, COUNTERS_COLLECTION);
        if (counter == null || !(counter.get("seq") instanceof Number seq)) {
            throw new StorageException("History sequence counter could not be incremented");
        }
        return seq.longValue();
    }
}
