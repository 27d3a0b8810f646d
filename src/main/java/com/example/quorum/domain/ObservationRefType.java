package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ObservationRefType {
    DOCUMENT, TASK, EVENT, AGENT_RUN, OBSERVATION;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ObservationRefType fromValue(String value) {
        return EnumValues.parse(ObservationRefType.class, value, "reference type");
    }
}
