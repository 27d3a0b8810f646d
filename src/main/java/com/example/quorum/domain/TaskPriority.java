package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskPriority {
    CRITICAL(0), HIGH(1), MEDIUM(2), LOW(3);

    /** Sort key: lower ranks list first. */
    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskPriority fromValue(String value) {
        return EnumValues.parse(TaskPriority.class, value, "task priority");
    }
}
