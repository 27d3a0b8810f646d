package com.example.quorum.orchestrator;

import java.util.Locale;

/**
 * How a reasoning run ended.
 */
public enum OrchestrationOutcome {
    COMPLETED,
    TIMED_OUT,
    /** Nonzero exit or a broken output stream. */
    FAILED,
    SPAWN_FAILED,
    CANCELLED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
