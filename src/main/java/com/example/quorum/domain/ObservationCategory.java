package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ObservationCategory {
    CRITIQUE, RISK, INSIGHT, RECOMMENDATION, ISSUE, IMPROVEMENT, OTHER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ObservationCategory fromValue(String value) {
        return EnumValues.parse(ObservationCategory.class, value, "observation category");
    }
}
