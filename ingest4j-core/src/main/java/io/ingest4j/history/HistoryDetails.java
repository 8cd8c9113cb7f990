package io.ingest4j.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;

/**
 * JSON encoding of the free-form {@code details} of a {@link HistoryEvent}.
 * Details are stored as text and only parsed back when a caller asks for them.
 */
public class HistoryDetails {

    private final ObjectMapper objectMapper;

    public HistoryDetails(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @return JSON text, the string itself when {@code details} is already a string, or null
     */
    public String write(Object details) {
        if (details == null) {
            return null;
        }
        if (details instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("history details are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse the details of {@code event}. Text that is not a JSON object is returned under the key {@code raw}.
     */
    public Map<String, Object> read(HistoryEvent event) {
        String text = event.details();
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(text, new TypeReference<>() {
            });
        } catch (JsonProcessingException e) {
            return Map.of("raw", text);
        }
    }
}
