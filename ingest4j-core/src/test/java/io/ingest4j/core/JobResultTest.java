package io.ingest4j.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobResultTest {

    @Test
    void nullDetailValuesAreKept() {
        Map<String, Object> details = new HashMap<>();
        details.put("row_count", 3);
        details.put("next_page", null);

        JobResult result = JobResult.of(3, details);

        assertEquals(3, result.rowCount());
        assertTrue(result.details().containsKey("next_page"));
        assertNull(result.details().get("next_page"));
    }

    @Test
    void detailsAreCopiedInOrderAndReadOnly() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", "api");
        details.put("pages", 2);
        details.put("cursor", "abc");

        JobResult result = JobResult.of(5, details);
        details.put("late", true);

        assertEquals(List.of("source", "pages", "cursor"), List.copyOf(result.details().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> result.details().put("x", 1));
    }

    @Test
    void nullDetailsBecomeEmpty() {
        assertTrue(new JobResult(null, null).details().isEmpty());
        assertTrue(JobResult.empty().details().isEmpty());
    }
}
