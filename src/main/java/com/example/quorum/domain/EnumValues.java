package com.example.quorum.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Parses the lowercase wire form of the domain enums ("in_progress", "risk")
 * and rejects unknown values with a message listing the accepted ones.
 */
final class EnumValues {

    private EnumValues() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing " + label);
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            String accepted = Arrays.stream(type.getEnumConstants())
                    .map(c -> c.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException(
                    "Invalid " + label + " '" + value + "'. Must be one of: " + accepted);
        }
    }
}
