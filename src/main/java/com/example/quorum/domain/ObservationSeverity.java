package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ObservationSeverity {
    INFO, LOW, MEDIUM, HIGH, CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ObservationSeverity fromValue(String value) {
        return EnumValues.parse(ObservationSeverity.class, value, "observation severity");
    }
}
