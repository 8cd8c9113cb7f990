package io.ingest4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ingest4j.MutableClock;
import io.ingest4j.history.HistoryDetails;
import io.ingest4j.history.HistoryEvent;
import io.ingest4j.history.InMemoryHistoryLedger;
import io.ingest4j.temporal.InMemoryVersionedTableStore;
import io.ingest4j.temporal.TemporalUpsertEngine;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DefaultIngestionContextTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T12:00:00Z"));
    private final InMemoryHistoryLedger ledger = new InMemoryHistoryLedger();
    private final HistoryDetails details = new HistoryDetails(new ObjectMapper());
    private final DefaultIngestionContext context = new DefaultIngestionContext(
            new TemporalUpsertEngine(new InMemoryVersionedTableStore(), clock), ledger, details, clock);

    @Test
    void appendHistoryStampsEventWithClock() {
        long first = context.appendHistory("fx_rates", "data_load", "success", 12, Map.of("source", "ecb"));
        long second = context.appendHistory("fx_rates", "data_load", "success", null, null);

        assertEquals(first + 1, second);
        HistoryEvent event = ledger.events().get(0);
        assertEquals(clock.instant(), event.startedAt());
        assertEquals(12, event.rowCount());
        assertEquals(Map.of("source", "ecb"), details.read(event));
    }

    @Test
    void recentHistoryIsMostRecentFirst() {
        context.appendHistory("a", "data_load", "success", null, null);
        context.appendHistory("b", "data_load", "success", null, null);
        context.appendHistory("c", "data_load", "success", null, null);

        assertEquals(List.of("c", "b"), context.recentHistory(2).stream().map(HistoryEvent::jobName).toList());
    }

    @Test
    void nowComesFromClock() {
        assertEquals(clock.instant(), context.now());
    }
}
