package io.ingest4j.internal.mongo;

import io.ingest4j.core.StorageException;
import io.ingest4j.temporal.NaturalKey;
import io.ingest4j.temporal.TemporalRow;
import io.ingest4j.temporal.VersionConflictException;
import io.ingest4j.temporal.VersionedTable;
import io.ingest4j.temporal.VersionedTableStore;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * MongoDB storage for SCD2 tables: one collection per table.
 *
 * <p>Document layout:
 * <pre>
 * { _id, &lt;key fields&gt;, &lt;attribute fields&gt;, valid_from, valid_to, is_current, row_hash }
 * </pre>
 *
 * <p>Indexes per collection:
 * <ul>
 *   <li><b>idx_&lt;table&gt;_&lt;keys&gt;</b>: natural key, used by current-row lookup and version listing</li>
 *   <li><b>idx_&lt;table&gt;_current</b>: { is_current: 1 }</li>
 *   <li><b>ux_&lt;table&gt;_current_key</b> (unique + partial on { is_current: true }): natural key.
 *       <br/>Rejects a second current row per key, which makes {@link #insertCurrent} a conditional write.</li>
 * </ul>
 */
public class MongoVersionedTableStore implements VersionedTableStore {
    private static final Logger log = LoggerFactory.getLogger(MongoVersionedTableStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoVersionedTableStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void ensureTable(VersionedTable table) {
        storage("ensure table " + table.name(), () -> {
            IndexOperations ops = mongoTemplate.indexOps(table.name());
            ops.createIndex(keyIndex(table));
            ops.createIndex(new Index()
                    .on(VersionedTable.IS_CURRENT, Sort.Direction.ASC)
                    .named("idx_" + table.name() + "_current"));
            ops.createIndex(currentKeyUniqueIndex(table));
            log.debug("ensured scd2 collection table={} keys={}", table.name(), table.keyFields());
            return null;
        });
    }

    static Index keyIndex(VersionedTable table) {
        Index idx = new Index();
        for (String k : table.keyFields()) {
            idx = idx.on(k, Sort.Direction.ASC);
        }
        return idx.named("idx_" + table.name() + "_" + String.join("_", table.keyFields()));
    }

    static Index currentKeyUniqueIndex(VersionedTable table) {
        Index idx = new Index();
        for (String k : table.keyFields()) {
            idx = idx.on(k, Sort.Direction.ASC);
        }
        return idx.unique()
                .partial(PartialIndexFilter.of(new Document(VersionedTable.IS_CURRENT, true)))
                .named("ux_" + table.name() + "_current_key");
    }

    @Override
    public TemporalRow findCurrent(VersionedTable table, NaturalKey key) {
        Query q = new Query(keyCriteria(table, key).and(VersionedTable.IS_CURRENT).is(true));
        q.with(Sort.by(Sort.Order.desc("_id"))).limit(1);

        Document doc = storage("find current row in " + table.name(),
                () -> mongoTemplate.findOne(q, Document.class, table.name()));
        return doc == null ? null : toRow(table, doc);
    }

    @Override
    public boolean closeCurrent(VersionedTable table, String rowId, Instant closedAt) {
        Query q = new Query(Criteria.where("_id").is(toObjectId(rowId))
                .and(VersionedTable.IS_CURRENT).is(true));
        Update u = new Update()
                .set(VersionedTable.VALID_TO, Date.from(closedAt))
                .set(VersionedTable.IS_CURRENT, false);

        long modified = storage("close row in " + table.name(),
                () -> mongoTemplate.updateFirst(q, u, table.name()).getModifiedCount());
        return modified == 1;
    }

    @Override
    public boolean reopen(VersionedTable table, String rowId, Instant closedAt) {
        Query q = new Query(Criteria.where("_id").is(toObjectId(rowId))
                .and(VersionedTable.IS_CURRENT).is(false)
                .and(VersionedTable.VALID_TO).is(Date.from(closedAt)));
        Update u = new Update()
                .set(VersionedTable.VALID_TO, Date.from(VersionedTable.OPEN_END))
                .set(VersionedTable.IS_CURRENT, true);

        try {
            return mongoTemplate.updateFirst(q, u, table.name()).getModifiedCount() == 1;
        } catch (DuplicateKeyException e) {
            // another writer already holds the current row
            return false;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to reopen row in " + table.name() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public TemporalRow insertCurrent(VersionedTable table,
                                     NaturalKey key,
                                     Map<String, String> attributes,
                                     Instant validFrom,
                                     String rowHash) {
        Document doc = new Document();
        List<String> keyFields = table.keyFields();
        for (int i = 0; i < keyFields.size(); i++) {
            doc.put(keyFields.get(i), key.values().get(i));
        }
        for (String field : table.attributeFields()) {
            doc.put(field, attributes.get(field));
        }
        doc.put(VersionedTable.VALID_FROM, Date.from(validFrom));
        doc.put(VersionedTable.VALID_TO, Date.from(VersionedTable.OPEN_END));
        doc.put(VersionedTable.IS_CURRENT, true);
        doc.put(VersionedTable.ROW_HASH, rowHash);

        try {
            Document saved = mongoTemplate.insert(doc, table.name());
            return toRow(table, saved);
        } catch (DuplicateKeyException e) {
            throw new VersionConflictException("current row already exists table=" + table.name() + " key=" + key, e);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to insert row in " + table.name() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<TemporalRow> versions(VersionedTable table, NaturalKey key) {
        Query q = new Query(keyCriteria(table, key));
        q.with(Sort.by(Sort.Order.asc(VersionedTable.VALID_FROM), Sort.Order.asc("_id")));

        List<Document> docs = storage("list versions in " + table.name(),
                () -> mongoTemplate.find(q, Document.class, table.name()));
        List<TemporalRow> rows = new ArrayList<>(docs.size());
        for (Document d : docs) {
            rows.add(toRow(table, d));
        }
        return rows;
    }

    @Override
    public List<Map<String, Object>> query(String table, String filter) {
        if (!VersionedTable.isValidName(table)) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        Query q;
        try {
            q = new BasicQuery(filter == null || filter.isBlank() ? "{}" : filter);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("filter is not valid JSON: " + filter, e);
        }

        List<Document> docs = storage("query " + table, () -> mongoTemplate.find(q, Document.class, table));
        List<Map<String, Object>> rows = new ArrayList<>(docs.size());
        for (Document d : docs) {
            rows.add(new LinkedHashMap<>(d));
        }
        return rows;
    }

    private static Criteria keyCriteria(VersionedTable table, NaturalKey key) {
        List<String> keyFields = table.keyFields();
        if (key.values().size() != keyFields.size()) {
            throw new IllegalArgumentException("expected " + keyFields.size() + " key values, got " + key.values().size());
        }
        Criteria c = Criteria.where(keyFields.get(0)).is(key.values().get(0));
        for (int i = 1; i < keyFields.size(); i++) {
            c = c.and(keyFields.get(i)).is(key.values().get(i));
        }
        return c;
    }

    private static TemporalRow toRow(VersionedTable table, Document doc) {
        List<String> keyValues = new ArrayList<>(table.keyFields().size());
        for (String k : table.keyFields()) {
            keyValues.add(asString(doc.get(k)));
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        if (!table.attributeFields().isEmpty()) {
            for (String field : table.attributeFields()) {
                attributes.put(field, asString(doc.get(field)));
            }
        } else {
            for (var e : doc.entrySet()) {
                String field = e.getKey();
                if (table.isMetaField(field) || table.keyFields().contains(field)) {
                    continue;
                }
                attributes.put(field, asString(e.getValue()));
            }
        }

        return new TemporalRow(
                asString(doc.get("_id")),
                new NaturalKey(keyValues),
                attributes,
                toInstant(doc.get(VersionedTable.VALID_FROM)),
                toInstant(doc.get(VersionedTable.VALID_TO)),
                Boolean.TRUE.equals(doc.get(VersionedTable.IS_CURRENT)),
                doc.getString(VersionedTable.ROW_HASH)
        );
    }

    private static ObjectId toObjectId(String rowId) {
        if (!ObjectId.isValid(rowId)) {
            throw new IllegalArgumentException("Invalid row id: " + rowId);
        }
        return new ObjectId(rowId);
    }

    private static String asString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof ObjectId oid) {
            return oid.toHexString();
        }
        return String.valueOf(value);
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date d) {
            return d.toInstant();
        }
        if (value instanceof Instant i) {
            return i;
        }
        return null;
    }

    private static <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
