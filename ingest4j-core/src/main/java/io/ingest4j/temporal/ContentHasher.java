package io.ingest4j.temporal;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * SHA-256 over the attribute values of a record, in declared field order.
 * Null renders as the empty string; values are separated by U+001F so that
 * ("ab", "c") and ("a", "bc") hash differently.
 */
public final class ContentHasher {
    private static final byte SEPARATOR = 0x1f;

    private ContentHasher() {
    }

    public static String hash(Map<String, ?> record, List<String> fields) {
        MessageDigest digest = sha256();
        boolean first = true;
        for (String field : fields) {
            if (!first) {
                digest.update(SEPARATOR);
            }
            first = false;
            Object value = record.get(field);
            String text = value == null ? "" : String.valueOf(value);
            digest.update(text.getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
