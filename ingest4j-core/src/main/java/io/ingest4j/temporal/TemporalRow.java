package io.ingest4j.temporal;

import java.time.Instant;
import java.util.Map;

/**
 * One stored version of an entity.
 *
 * @param id         storage row id
 * @param attributes attribute values; a value may be null
 * @param validTo    {@link VersionedTable#OPEN_END} while current
 */
public record TemporalRow(
        String id,
        NaturalKey key,
        Map<String, String> attributes,
        Instant validFrom,
        Instant validTo,
        boolean current,
        String rowHash
) {
}
