package io.ingest4j.internal;

import io.ingest4j.IngestionContext;
import io.ingest4j.history.HistoryDetails;
import io.ingest4j.history.HistoryEvent;
import io.ingest4j.history.HistoryLedger;
import io.ingest4j.temporal.TemporalUpsertEngine;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link IngestionContext} over a {@link TemporalUpsertEngine} and a {@link HistoryLedger}.
 */
public class DefaultIngestionContext implements IngestionContext {

    private final TemporalUpsertEngine upsertEngine;
    private final HistoryLedger ledger;
    private final HistoryDetails historyDetails;
    private final Clock clock;

    public DefaultIngestionContext(TemporalUpsertEngine upsertEngine,
                                   HistoryLedger ledger,
                                   HistoryDetails historyDetails,
                                   Clock clock) {
        this.upsertEngine = Objects.requireNonNull(upsertEngine, "upsertEngine must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.historyDetails = Objects.requireNonNull(historyDetails, "historyDetails must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public int upsert(String table,
                      List<? extends Map<String, ?>> records,
                      List<String> keyFields,
                      List<String> attributeFields) {
        return upsertEngine.upsert(table, records, keyFields, attributeFields);
    }

    @Override
    public long appendHistory(String jobName, String eventType, String status, Integer rowCount, Map<String, Object> details) {
        return ledger.append(HistoryEvent.builder(jobName, eventType, status)
                .startedAt(clock.instant())
                .rowCount(rowCount)
                .details(historyDetails.write(details))
                .build());
    }

    @Override
    public List<HistoryEvent> recentHistory(int limit) {
        return ledger.recent(limit);
    }

    @Override
    public List<Map<String, Object>> runQuery(String table, String filterJson) {
        return upsertEngine.query(table, filterJson);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
