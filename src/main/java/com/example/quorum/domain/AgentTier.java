package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Scheduling class of an agent. The tier bounds which kinds of records the
 * agent's findings may contain.
 */
public enum AgentTier {
    /** Pulls raw material in: documents and events. */
    OBSERVE,
    /** Turns material into work: tasks, observations, events. */
    ACT,
    /** Looks back over the store: events, observations, reflection documents. */
    REFLECT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentTier fromValue(String value) {
        return EnumValues.parse(AgentTier.class, value, "agent tier");
    }
}
