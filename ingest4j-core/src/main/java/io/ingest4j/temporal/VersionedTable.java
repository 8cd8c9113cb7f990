package io.ingest4j.temporal;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Schema of one SCD2 table: its natural-key fields and hashed attribute fields.
 * Every table also carries {@code valid_from}, {@code valid_to}, {@code is_current} and {@code row_hash}.
 */
public record VersionedTable(
        String name,
        List<String> keyFields,
        List<String> attributeFields
) {
    public static final String VALID_FROM = "valid_from";
    public static final String VALID_TO = "valid_to";
    public static final String IS_CURRENT = "is_current";
    public static final String ROW_HASH = "row_hash";

    /**
     * {@code valid_to} of a row that is still current.
     */
    public static final Instant OPEN_END = Instant.parse("9999-12-31T00:00:00Z");

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Set<String> RESERVED = Set.of("_id", "id", VALID_FROM, VALID_TO, IS_CURRENT, ROW_HASH);

    public VersionedTable {
        requireIdentifier(name, "table");
        Objects.requireNonNull(keyFields, "keyFields must not be null");
        if (keyFields.isEmpty()) {
            throw new IllegalArgumentException("keyFields must not be empty");
        }
        keyFields = List.copyOf(keyFields);
        attributeFields = attributeFields == null ? List.of() : List.copyOf(attributeFields);

        Set<String> seen = new HashSet<>();
        for (String f : keyFields) {
            requireField(f, seen);
        }
        for (String f : attributeFields) {
            requireField(f, seen);
        }
    }

    /**
     * True when {@code name} can be used as a table or field name.
     */
    public static boolean isValidName(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public boolean isMetaField(String field) {
        return RESERVED.contains(field);
    }

    private static void requireField(String field, Set<String> seen) {
        requireIdentifier(field, "field");
        if (RESERVED.contains(field)) {
            throw new IllegalArgumentException("field name is reserved: " + field);
        }
        if (!seen.add(field)) {
            throw new IllegalArgumentException("field listed twice: " + field);
        }
    }

    private static void requireIdentifier(String value, String what) {
        if (!isValidName(value)) {
            throw new IllegalArgumentException("Invalid " + what + " name: " + value);
        }
    }
}
