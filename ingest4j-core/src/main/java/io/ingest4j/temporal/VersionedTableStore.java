package io.ingest4j.temporal;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Storage operations behind {@link TemporalUpsertEngine}.
 *
 * <p>Writes are conditional so that at most one row per natural key is current, even when several
 * processes share the store:
 * <ul>
 *   <li>{@link #closeCurrent} only closes a row that is still current</li>
 *   <li>{@link #insertCurrent} fails with {@link VersionConflictException} when a current row already exists</li>
 * </ul>
 * Implementations wrap backend failures in {@link io.ingest4j.core.StorageException}.
 */
public interface VersionedTableStore {

    /**
     * Create the table and its indexes (natural key, {@code is_current}, unique current-per-key) if absent.
     */
    void ensureTable(VersionedTable table);

    /**
     * @return the current row for {@code key}, or null
     */
    TemporalRow findCurrent(VersionedTable table, NaturalKey key);

    /**
     * Set {@code is_current=false, valid_to=closedAt} on row {@code rowId} if it is still current.
     *
     * @return false when the row was no longer current
     */
    boolean closeCurrent(VersionedTable table, String rowId, Instant closedAt);

    /**
     * Undo {@link #closeCurrent}: set {@code is_current=true, valid_to=OPEN_END} on row {@code rowId}
     * if it is still closed at exactly {@code closedAt}.
     *
     * @return false when the row no longer matches
     */
    boolean reopen(VersionedTable table, String rowId, Instant closedAt);

    /**
     * Insert a new current row valid from {@code validFrom} to {@link VersionedTable#OPEN_END}.
     *
     * @throws VersionConflictException if the key already has a current row
     */
    TemporalRow insertCurrent(VersionedTable table, NaturalKey key, Map<String, String> attributes, Instant validFrom, String rowHash);

    /**
     * All versions of {@code key}, ordered by {@code valid_from}.
     */
    List<TemporalRow> versions(VersionedTable table, NaturalKey key);

    /**
     * Raw rows of {@code table} matching a storage-native filter; null matches everything.
     */
    List<Map<String, Object>> query(String table, String filter);
}
