package com.example.quorum.orchestrator;

import com.example.quorum.domain.MemoryContext;

import java.time.Duration;

/**
 * @param payload       message passed to the reasoning process
 * @param sessionId     conversation key; the process keeps context per session
 * @param timeout       hard bound on the run
 * @param context       who the run is for
 * @param fallbackLabel name used in synthesized fragments ("OpenClaw")
 * @param sink          receives the final transcript
 */
public record OrchestrationRequest(String payload, String sessionId, Duration timeout, MemoryContext context,
                                   String fallbackLabel, TranscriptSink sink) {

    public OrchestrationRequest {
        if (payload == null || payload.isBlank()) throw new IllegalArgumentException("payload is required");
        if (sessionId == null || sessionId.isBlank()) throw new IllegalArgumentException("sessionId is required");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (context == null) throw new IllegalArgumentException("context is required");
        if (sink == null) throw new IllegalArgumentException("sink is required");
        if (fallbackLabel == null || fallbackLabel.isBlank()) fallbackLabel = "The reasoning agent";
    }
}
