package io.ingest4j.temporal;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentHasherTest {

    @Test
    void hashIsLowercaseSha256Hex() {
        String hash = ContentHasher.hash(Map.of("a", "x"), List.of("a"));

        assertEquals(64, hash.length());
        assertTrue(hash.matches("[0-9a-f]{64}"));
        // sha256("x")
        assertEquals("2d711642b726b04401627ca9fbac32f5c8530fb1903cc4db02258717921a4881", hash);
    }

    @Test
    void fieldOrderMatters() {
        Map<String, Object> record = Map.of("a", "1", "b", "2");

        assertNotEquals(ContentHasher.hash(record, List.of("a", "b")), ContentHasher.hash(record, List.of("b", "a")));
    }

    @Test
    void fieldBoundariesAreSignificant() {
        String ab = ContentHasher.hash(Map.of("x", "ab", "y", "c"), List.of("x", "y"));
        String bc = ContentHasher.hash(Map.of("x", "a", "y", "bc"), List.of("x", "y"));

        assertNotEquals(ab, bc);
    }

    @Test
    void nullAndMissingHashLikeEmptyString() {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("a", null);

        String empty = ContentHasher.hash(Map.of("a", ""), List.of("a"));
        assertEquals(empty, ContentHasher.hash(withNull, List.of("a")));
        assertEquals(empty, ContentHasher.hash(Map.of(), List.of("a")));
    }

    @Test
    void valuesAreComparedByTextForm() {
        assertEquals(ContentHasher.hash(Map.of("n", 42), List.of("n")), ContentHasher.hash(Map.of("n", "42"), List.of("n")));
    }

    @Test
    void fieldsOutsideAttributeListAreIgnored() {
        assertEquals(
                ContentHasher.hash(Map.of("a", "1", "noise", "x"), List.of("a")),
                ContentHasher.hash(Map.of("a", "1", "noise", "y"), List.of("a"))
        );
    }
}
