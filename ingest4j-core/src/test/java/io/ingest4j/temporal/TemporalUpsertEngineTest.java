package io.ingest4j.temporal;

import io.ingest4j.MutableClock;
import io.ingest4j.core.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemporalUpsertEngineTest {

    private static final List<String> KEYS = List.of("region_code");
    private static final List<String> ATTRS = List.of("name", "population");

    private MutableClock clock;
    private InMemoryVersionedTableStore store;
    private TemporalUpsertEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryVersionedTableStore();
        engine = new TemporalUpsertEngine(store, clock);
    }

    @Test
    void firstSightingInsertsOpenEndedCurrentRow() {
        int changed = engine.upsert("regions", List.of(region("FI-01", "Uusimaa", 1_700_000)), KEYS, ATTRS);

        assertEquals(1, changed);
        List<TemporalRow> versions = engine.versions("regions", KEYS, List.of("FI-01"));
        assertEquals(1, versions.size());
        TemporalRow row = versions.get(0);
        assertTrue(row.current());
        assertEquals(clock.instant(), row.validFrom());
        assertEquals(VersionedTable.OPEN_END, row.validTo());
        assertEquals("Uusimaa", row.attributes().get("name"));
        assertEquals("1700000", row.attributes().get("population"));
        assertEquals(ContentHasher.hash(region("FI-01", "Uusimaa", 1_700_000), ATTRS), row.rowHash());
    }

    @Test
    void unchangedRecordIsIdempotent() {
        List<Map<String, Object>> batch = List.of(region("FI-01", "Uusimaa", 1_700_000), region("FI-02", "Varsinais-Suomi", 480_000));

        assertEquals(2, engine.upsert("regions", batch, KEYS, ATTRS));
        clock.advance(Duration.ofHours(1));
        assertEquals(0, engine.upsert("regions", batch, KEYS, ATTRS));

        assertEquals(2, store.allRows("regions").size());
    }

    @Test
    void changedAttributeClosesOldVersionAndOpensNewOne() {
        engine.upsert("regions", List.of(region("FI-01", "Uusimaa", 1_700_000)), KEYS, ATTRS);
        Instant first = clock.instant();
        clock.advance(Duration.ofDays(1));
        Instant second = clock.instant();

        int changed = engine.upsert("regions", List.of(region("FI-01", "Uusimaa", 1_710_000)), KEYS, ATTRS);

        assertEquals(1, changed);
        List<TemporalRow> versions = engine.versions("regions", KEYS, List.of("FI-01"));
        assertEquals(2, versions.size());

        TemporalRow old = versions.get(0);
        assertFalse(old.current());
        assertEquals(first, old.validFrom());
        assertEquals(second, old.validTo());

        TemporalRow current = versions.get(1);
        assertTrue(current.current());
        assertEquals(second, current.validFrom());
        assertEquals(VersionedTable.OPEN_END, current.validTo());
        assertEquals("1710000", current.attributes().get("population"));
    }

    @Test
    void changeBackToEarlierValuesStillVersions() {
        engine.upsert("regions", List.of(region("FI-01", "A", 1)), KEYS, ATTRS);
        clock.advance(Duration.ofMinutes(1));
        engine.upsert("regions", List.of(region("FI-01", "B", 1)), KEYS, ATTRS);
        clock.advance(Duration.ofMinutes(1));
        engine.upsert("regions", List.of(region("FI-01", "A", 1)), KEYS, ATTRS);

        assertEquals(3, engine.versions("regions", KEYS, List.of("FI-01")).size());
    }

    @Test
    void recordsOfOneBatchShareTimestampAndApplyInOrder() {
        clock.set(Instant.parse("2026-01-01T00:00:00.123456789Z"));

        int changed = engine.upsert("regions", List.of(
                region("FI-01", "A", 1),
                region("FI-01", "B", 1)
        ), KEYS, ATTRS);

        assertEquals(2, changed);
        List<TemporalRow> versions = engine.versions("regions", KEYS, List.of("FI-01"));
        Instant truncated = Instant.parse("2026-01-01T00:00:00.123Z");
        assertEquals(truncated, versions.get(0).validFrom());
        assertEquals(truncated, versions.get(0).validTo());
        assertEquals(truncated, versions.get(1).validFrom());
        assertEquals("B", currentRow("FI-01").attributes().get("name"));
    }

    @Test
    void nullAttributeIsHashedAsEmptyString() {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("region_code", "FI-01");
        withNull.put("name", null);
        withNull.put("population", 5);

        engine.upsert("regions", List.of(withNull), KEYS, ATTRS);
        clock.advance(Duration.ofMinutes(1));
        int changed = engine.upsert("regions", List.of(Map.of("region_code", "FI-01", "name", "", "population", 5)), KEYS, ATTRS);

        assertEquals(0, changed);
        assertNull(currentRow("FI-01").attributes().get("name"));
    }

    @Test
    void compositeKeysAreSupported() {
        List<String> keys = List.of("country", "code");
        engine.upsert("cities", List.of(
                Map.of("country", "FI", "code", "HEL", "name", "Helsinki"),
                Map.of("country", "SE", "code", "HEL", "name", "Helsingborg")
        ), keys, List.of("name"));

        assertEquals(1, engine.versions("cities", keys, List.of("FI", "HEL")).size());
        assertEquals(1, engine.versions("cities", keys, List.of("SE", "HEL")).size());
    }

    @Test
    void attributeFieldsDefaultToNonKeyFieldsOfFirstRecord() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("region_code", "FI-01");
        first.put("name", "Uusimaa");
        first.put("population", 1);
        engine.upsert("regions", List.of(first), KEYS, null);

        TemporalRow row = currentRow("FI-01");
        assertEquals(ContentHasher.hash(first, ATTRS), row.rowHash());
    }

    @Test
    void emptyBatchChangesNothing() {
        assertEquals(0, engine.upsert("regions", List.of(), KEYS, ATTRS));
        assertEquals(0, engine.upsert("regions", null, KEYS, ATTRS));
    }

    @Test
    void missingKeyFieldIsRejected() {
        List<Map<String, Object>> batch = List.of(Map.of("name", "nameless"));

        assertThrows(IllegalArgumentException.class, () -> engine.upsert("regions", batch, KEYS, ATTRS));
    }

    @Test
    void invalidTableNameIsRejected() {
        List<Map<String, Object>> batch = List.of(region("FI-01", "A", 1));

        assertThrows(IllegalArgumentException.class, () -> engine.upsert("regions; drop", batch, KEYS, ATTRS));
    }

    @Test
    void persistentConflictsGiveUpWithStorageException() {
        VersionedTableStore conflicting = new InMemoryVersionedTableStore() {
            @Override
            public TemporalRow insertCurrent(VersionedTable table, NaturalKey key, Map<String, String> attributes,
                                             Instant validFrom, String rowHash) {
                throw new VersionConflictException("always");
            }
        };
        TemporalUpsertEngine flaky = new TemporalUpsertEngine(conflicting, clock);

        assertThrows(StorageException.class,
                () -> flaky.upsert("regions", List.of(region("FI-01", "A", 1)), KEYS, ATTRS));
    }

    @Test
    void failedInsertAfterCloseReopensPreviousVersion() {
        AtomicInteger failures = new AtomicInteger();
        InMemoryVersionedTableStore failing = new InMemoryVersionedTableStore() {
            @Override
            public synchronized TemporalRow insertCurrent(VersionedTable table, NaturalKey key, Map<String, String> attributes,
                                                          Instant validFrom, String rowHash) {
                if (findCurrent(table, key) == null && failures.getAndDecrement() > 0) {
                    throw new StorageException("insert failed");
                }
                return super.insertCurrent(table, key, attributes, validFrom, rowHash);
            }
        };
        TemporalUpsertEngine flaky = new TemporalUpsertEngine(failing, clock);
        flaky.upsert("regions", List.of(region("FI-01", "A", 1)), KEYS, ATTRS);

        failures.set(1);
        clock.advance(Duration.ofHours(1));
        assertThrows(StorageException.class,
                () -> flaky.upsert("regions", List.of(region("FI-01", "B", 1)), KEYS, ATTRS));

        List<TemporalRow> afterFailure = flaky.versions("regions", KEYS, List.of("FI-01"));
        assertEquals(1, afterFailure.size());
        assertTrue(afterFailure.get(0).current());
        assertEquals(VersionedTable.OPEN_END, afterFailure.get(0).validTo());
        assertEquals("A", afterFailure.get(0).attributes().get("name"));

        clock.advance(Duration.ofHours(1));
        assertEquals(1, flaky.upsert("regions", List.of(region("FI-01", "B", 1)), KEYS, ATTRS));

        List<TemporalRow> versions = flaky.versions("regions", KEYS, List.of("FI-01"));
        assertEquals(2, versions.size());
        assertEquals(Instant.parse("2026-01-01T02:00:00Z"), versions.get(0).validTo());
        assertContiguous(versions);
    }

    @Test
    void randomizedBatchesKeepAtMostOneCurrentRowPerKey() {
        Random random = new Random(42);
        for (int batch = 0; batch < 50; batch++) {
            List<Map<String, Object>> records = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                records.add(region("K" + random.nextInt(8), "N" + random.nextInt(3), random.nextInt(2)));
            }
            engine.upsert("regions", records, KEYS, ATTRS);
            clock.advance(Duration.ofSeconds(1 + random.nextInt(60)));
        }

        assertAtMostOneCurrentPerKey();
        for (int k = 0; k < 8; k++) {
            assertContiguous(engine.versions("regions", KEYS, List.of("K" + k)));
        }
    }

    @Test
    void concurrentWritersKeepAtMostOneCurrentRowPerKey() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int w = 0; w < 8; w++) {
            int writer = w;
            futures.add(pool.submit(() -> {
                startGate.await();
                int changed = 0;
                for (int i = 0; i < 50; i++) {
                    changed += engine.upsert("regions", List.of(region("K" + (i % 4), "W" + writer, i)), KEYS, ATTRS);
                }
                return changed;
            }));
        }
        startGate.countDown();
        for (Future<Integer> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdownNow();

        assertAtMostOneCurrentPerKey();
    }

    @Test
    void queryDelegatesToStore() {
        engine.upsert("regions", List.of(region("FI-01", "A", 1)), KEYS, ATTRS);
        clock.advance(Duration.ofMinutes(1));
        engine.upsert("regions", List.of(region("FI-01", "B", 1)), KEYS, ATTRS);

        assertEquals(2, engine.query("regions", null).size());
        assertEquals(1, engine.query("regions", "{\"is_current\": true}").size());
    }

    private TemporalRow currentRow(String key) {
        return engine.versions("regions", KEYS, List.of(key)).stream()
                .filter(TemporalRow::current)
                .findFirst()
                .orElseThrow();
    }

    private void assertAtMostOneCurrentPerKey() {
        Map<NaturalKey, Integer> current = new HashMap<>();
        for (TemporalRow row : store.allRows("regions")) {
            if (row.current()) {
                current.merge(row.key(), 1, Integer::sum);
            }
        }
        current.forEach((key, count) -> assertEquals(1, count, "current rows for " + key));
    }

    private static void assertContiguous(List<TemporalRow> versions) {
        for (int i = 1; i < versions.size(); i++) {
            TemporalRow prev = versions.get(i - 1);
            TemporalRow next = versions.get(i);
            assertFalse(prev.current());
            assertEquals(prev.validTo(), next.validFrom());
            assertNotEquals(prev.rowHash(), next.rowHash());
        }
    }

    private static Map<String, Object> region(String code, String name, int population) {
        return Map.of("region_code", code, "name", name, "population", population);
    }
}
