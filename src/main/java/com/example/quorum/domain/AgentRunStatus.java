package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentRunStatus {
    RUNNING, COMPLETED, FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
