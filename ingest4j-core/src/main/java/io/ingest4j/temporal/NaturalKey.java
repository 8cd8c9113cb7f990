package io.ingest4j.temporal;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Values of the natural-key fields of one record, in key-field order.
 */
public record NaturalKey(List<String> values) {

    public NaturalKey {
        values = List.copyOf(values);
    }

    public static NaturalKey of(String... values) {
        return new NaturalKey(List.of(values));
    }

    /**
     * @throws IllegalArgumentException if a key field is missing or null
     */
    public static NaturalKey from(Map<String, ?> record, List<String> keyFields) {
        List<String> values = new ArrayList<>(keyFields.size());
        for (String field : keyFields) {
            Object v = record.get(field);
            if (v == null) {
                throw new IllegalArgumentException("record is missing natural-key field '" + field + "': " + record);
            }
            values.add(String.valueOf(v));
        }
        return new NaturalKey(values);
    }

    @Override
    public String toString() {
        return String.join("|", values);
    }
}
