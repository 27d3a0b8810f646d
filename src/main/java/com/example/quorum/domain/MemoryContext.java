package com.example.quorum.domain;

/**
 * Identifies who is writing to the memory store. Passed explicitly to every
 * write and every orchestrator call instead of living in request-scoped state.
 *
 * @param actor agent name for scheduled work, "user" for API callers
 */
public record MemoryContext(String actor) {

    public static final String USER = "user";

    public MemoryContext {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("MemoryContext actor must not be blank");
        }
    }

    public static MemoryContext user() {
        return new MemoryContext(USER);
    }

    public static MemoryContext agent(String agentName) {
        return new MemoryContext(agentName);
    }
}
