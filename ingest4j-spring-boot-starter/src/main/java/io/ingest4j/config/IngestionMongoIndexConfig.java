package io.ingest4j.config;

import io.ingest4j.internal.mongo.HistoryEventDocument;
import io.ingest4j.internal.mongo.ScheduleStateDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the fixed ingestion collections.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created automatically unless
 * {@code ingest.ensure-indexes-on-startup=true}. SCD2 collections are different: their indexes are
 * created on first upsert, since their names and keys are only known at runtime.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_history_job</b> (collection {@code ingestion_history}): { job_name: 1, _id: -1 }
 *       <br/>Used to read the latest events of one job.</li>
 *   <li><b>idx_schedule_state_next_run</b> (collection {@code schedule_state}): { nextRunAt: 1 }
 *       <br/>Used by operators to list upcoming runs.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.ingestion_history.createIndex({ job_name: 1, _id: -1 }, { name: "idx_history_job" });
 * db.schedule_state.createIndex({ nextRunAt: 1 }, { name: "idx_schedule_state_next_run" });
 * </pre>
 */
public class IngestionMongoIndexConfig {

    public static final String IDX_HISTORY_JOB = "idx_history_job";
    public static final String IDX_SCHEDULE_STATE_NEXT_RUN = "idx_schedule_state_next_run";

    private final MongoTemplate mongoTemplate;

    public IngestionMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Manually ensure the indexes above.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(HistoryEventDocument.class).createIndex(historyJobIndex());
        mongoTemplate.indexOps(ScheduleStateDocument.class).createIndex(scheduleStateNextRunIndex());
    }

    public static Index historyJobIndex() {
        return new Index()
                .on("job_name", Sort.Direction.ASC)
                .on("_id", Sort.Direction.DESC)
                .named(IDX_HISTORY_JOB);
    }

    public static Index scheduleStateNextRunIndex() {
        return new Index()
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_SCHEDULE_STATE_NEXT_RUN);
    }
}
