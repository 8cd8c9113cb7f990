package io.ingest4j.temporal;

import io.ingest4j.core.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies SCD2 versioning to record batches.
 *
 * <p>For each record, in the order given:
 * <ol>
 *   <li>hash the attribute fields ({@link ContentHasher})</li>
 *   <li>read the current row of the record's natural key</li>
 *   <li>no current row: insert one (valid_from = now, valid_to = {@link VersionedTable#OPEN_END})</li>
 *   <li>same hash: nothing to do</li>
 *   <li>different hash: close the current row at now, then insert the new one</li>
 * </ol>
 *
 * <p>Steps 2-5 for one key run under a key-scoped lock; across processes the store's conditional
 * writes detect lost races and the record is re-evaluated. If the insert fails for any other reason
 * after the close, the closed row is reopened before the failure propagates.
 */
public class TemporalUpsertEngine {
    private static final Logger log = LoggerFactory.getLogger(TemporalUpsertEngine.class);

    static final int MAX_ATTEMPTS = 5;

    private final VersionedTableStore store;
    private final Clock clock;
    private final KeyLocks locks = new KeyLocks(64);
    private final Set<VersionedTable> ensuredTables = ConcurrentHashMap.newKeySet();

    public TemporalUpsertEngine(VersionedTableStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param attributeFields null or empty means every field of the first record that is not a key field;
     *                        pass an explicit list to keep hashes stable between batches
     * @return number of records that produced a new current row
     */
    public int upsert(String table,
                      List<? extends Map<String, ?>> records,
                      List<String> keyFields,
                      List<String> attributeFields) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        Objects.requireNonNull(keyFields, "keyFields must not be null");

        List<String> attributes = resolveAttributeFields(records.get(0), keyFields, attributeFields);
        VersionedTable schema = new VersionedTable(table, keyFields, attributes);
        ensureTable(schema);

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        int changed = 0;
        for (Map<String, ?> record : records) {
            if (apply(schema, record, now)) {
                changed++;
            }
        }

        log.debug("scd2 upsert table={} records={} changed={}", table, records.size(), changed);
        return changed;
    }

    public List<TemporalRow> versions(String table, List<String> keyFields, List<String> keyValues) {
        VersionedTable schema = new VersionedTable(table, keyFields, List.of());
        if (keyValues.size() != keyFields.size()) {
            throw new IllegalArgumentException("expected " + keyFields.size() + " key values, got " + keyValues.size());
        }
        return store.versions(schema, new NaturalKey(keyValues));
    }

    public List<Map<String, Object>> query(String table, String filter) {
        return store.query(table, filter);
    }

    private void ensureTable(VersionedTable schema) {
        if (ensuredTables.contains(schema)) {
            return;
        }
        store.ensureTable(schema);
        ensuredTables.add(schema);
    }

    private boolean apply(VersionedTable schema, Map<String, ?> record, Instant now) {
        NaturalKey key = NaturalKey.from(record, schema.keyFields());
        String hash = ContentHasher.hash(record, schema.attributeFields());
        Map<String, String> values = attributeValues(record, schema.attributeFields());

        ReentrantLock lock = locks.lockFor(schema.name(), key);
        lock.lock();
        try {
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                TemporalRow current = store.findCurrent(schema, key);
                if (current != null && hash.equals(current.rowHash())) {
                    return false;
                }
                if (current != null && !store.closeCurrent(schema, current.id(), now)) {
                    log.debug("scd2 close lost race table={} key={} attempt={}", schema.name(), key, attempt);
                    continue;
                }
                try {
                    store.insertCurrent(schema, key, values, now, hash);
                    return true;
                } catch (VersionConflictException e) {
                    log.debug("scd2 insert lost race table={} key={} attempt={}", schema.name(), key, attempt);
                } catch (RuntimeException e) {
                    if (current != null) {
                        restore(schema, key, current, now, e);
                    }
                    throw e;
                }
            }
        } finally {
            lock.unlock();
        }
        throw new StorageException("scd2 upsert gave up after " + MAX_ATTEMPTS
                + " conflicting attempts table=" + schema.name() + " key=" + key);
    }

    private void restore(VersionedTable schema, NaturalKey key, TemporalRow closed, Instant closedAt, RuntimeException cause) {
        try {
            if (!store.reopen(schema, closed.id(), closedAt)) {
                log.warn("scd2 reopen found row changed table={} key={} row={}", schema.name(), key, closed.id());
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("scd2 reopen failed, key left without current row table={} key={} row={}",
                    schema.name(), key, closed.id(), e);
        }
    }

    private static List<String> resolveAttributeFields(Map<String, ?> first,
                                                       List<String> keyFields,
                                                       List<String> attributeFields) {
        if (attributeFields != null && !attributeFields.isEmpty()) {
            return attributeFields;
        }
        List<String> derived = new ArrayList<>();
        for (String field : first.keySet()) {
            if (!keyFields.contains(field)) {
                derived.add(field);
            }
        }
        return derived;
    }

    private static Map<String, String> attributeValues(Map<String, ?> record, List<String> fields) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String field : fields) {
            Object v = record.get(field);
            values.put(field, v == null ? null : String.valueOf(v));
        }
        return values;
    }
}
