package com.example.quorum.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts metadata maps to the JSON text the entities store.
 */
@Component
@RequiredArgsConstructor
public class MetadataJson {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String write(Map<String, ?> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored metadata is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    /** Stored JSON with {@code extra} entries merged over it. */
    public String merge(String json, Map<String, ?> extra) {
        Map<String, Object> merged = read(json);
        if (extra != null) merged.putAll(extra);
        return write(merged);
    }
}
