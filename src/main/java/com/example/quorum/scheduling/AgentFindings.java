package com.example.quorum.scheduling;

import com.example.quorum.memory.DocumentService.NewDocument;
import com.example.quorum.memory.EventService.NewEvent;
import com.example.quorum.memory.ObservationService.NewObservation;
import com.example.quorum.memory.TaskService.NewTask;

import java.util.List;

/**
 * Everything one agent run produced. Persisted by {@link AgentRunService}
 * subject to the agent's tier.
 *
 * @param notification may be null
 */
public record AgentFindings(String summary,
                            List<NewDocument> documents,
                            List<NewEvent> events,
                            List<NewTask> tasks,
                            List<NewObservation> observations,
                            AgentNotification notification) {

    public AgentFindings {
        documents = documents == null ? List.of() : List.copyOf(documents);
        events = events == null ? List.of() : List.copyOf(events);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static AgentFindings empty(String summary) {
        return new AgentFindings(summary, List.of(), List.of(), List.of(), List.of(), null);
    }
}
