package com.example.quorum.scheduling;

import com.example.quorum.domain.MemoryContext;

/**
 * Does the work of one agent run and reports what it found. Workers never
 * write to the store themselves and never invoke other agents.
 */
public interface AgentWorker {

    AgentFindings run(AgentDefinition agent, MemoryContext context);
}
