package com.example.quorum.orchestrator;

/**
 * Persists the final transcript of a reasoning run. Called exactly once per
 * run, with non-empty text.
 */
@FunctionalInterface
public interface TranscriptSink {

    void persist(String transcript, OrchestrationOutcome outcome);
}
