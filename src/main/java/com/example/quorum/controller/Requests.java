package com.example.quorum.controller;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Function;

/**
 * Typed reads from loosely-typed JSON request bodies. Wrong types are a 400.
 */
final class Requests {

    private Requests() {
    }

    static String string(Map<String, Object> body, String field) {
        Object value = body == null ? null : body.get(field);
        if (value == null) return null;
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException("Field '" + field + "' must be a string");
        }
        return s.isBlank() ? null : s;
    }

    static boolean has(Map<String, Object> body, String field) {
        return body != null && body.containsKey(field);
    }

    static Boolean bool(Map<String, Object> body, String field) {
        Object value = body == null ? null : body.get(field);
        if (value == null) return null;
        if (!(value instanceof Boolean b)) {
            throw new IllegalArgumentException("Field '" + field + "' must be a boolean");
        }
        return b;
    }

    static Instant instant(Map<String, Object> body, String field) {
        String value = string(body, field);
        if (value == null) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Field '" + field + "' must be an ISO-8601 timestamp");
        }
    }

    static Set<String> stringSet(Map<String, Object> body, String field) {
        Object value = body == null ? null : body.get(field);
        if (value == null) return Set.of();
        if (!(value instanceof Collection<?> items)) {
            throw new IllegalArgumentException("Field '" + field + "' must be an array");
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : items) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Map<String, Object> body, String field) {
        Object value = body == null ? null : body.get(field);
        if (value == null) return null;
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Field '" + field + "' must be an object");
        }
        return (Map<String, Object>) value;
    }

    /** Parse an optional enum-like parameter; blank means absent. */
    static <T> T optional(String value, Function<String, T> parser) {
        return value == null || value.isBlank() ? null : parser.apply(value);
    }
}
