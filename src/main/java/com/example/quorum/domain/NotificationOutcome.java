package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** What happened to the notification an agent run wanted to send. */
public enum NotificationOutcome {
    NONE, DELIVERED, SUPPRESSED, FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
