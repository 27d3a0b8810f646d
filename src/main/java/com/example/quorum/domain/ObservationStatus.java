package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ObservationStatus {
    OPEN, ACKNOWLEDGED, ADDRESSED, DISMISSED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ObservationStatus fromValue(String value) {
        return EnumValues.parse(ObservationStatus.class, value, "observation status");
    }
}
