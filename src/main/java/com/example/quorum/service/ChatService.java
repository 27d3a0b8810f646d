package com.example.quorum.service;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.Event;
import com.example.quorum.domain.MemoryContext;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.EventService.NewEvent;
import com.example.quorum.orchestrator.OrchestrationRequest;
import com.example.quorum.orchestrator.ReasoningOrchestrator;
import com.example.quorum.scheduling.AgentCatalog;
import com.example.quorum.scheduling.AgentDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One-to-one chat with a catalog agent through the reasoning process. The
 * user turn is stored before the process starts; the reply is stored once
 * the stream ends, whatever way it ends.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    public static final String PROCESS_LABEL = "OpenClaw";

    private final AgentCatalog catalog;
    private final EventService eventService;
    private final ReasoningOrchestrator orchestrator;
    private final QuorumProperties properties;

    public Flux<String> chat(String agentName, String message) {
        AgentDefinition agent = catalog.require(agentName);
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Missing or invalid message");
        }
        MemoryContext ctx = MemoryContext.user();
        eventService.append(ctx, new NewEvent(Event.CHAT_MESSAGE, "Chat to " + agent.getName(), message,
                Map.of("target_agent", agent.getName(), "sender", "user"), agent.getName(), null, null, null));

        OrchestrationRequest request = new OrchestrationRequest(message, sessionId(agent.getName()),
                Duration.ofSeconds(properties.getReasoning().getChatTimeoutSeconds()), ctx, PROCESS_LABEL,
                (transcript, outcome) -> eventService.append(ctx, new NewEvent(Event.CHAT_RESPONSE,
                        "Chat from " + agent.getName(), transcript,
                        Map.of("target_agent", agent.getName(), "sender", "agent", "outcome", outcome.value()),
                        agent.getName(), null, null, null)));
        log.info("Chat with {} started", agent.getName());
        return orchestrator.run(request);
    }

    public List<Event> history(String agentName) {
        AgentDefinition agent = catalog.require(agentName);
        return eventService.chatHistory(agent.getName());
    }

    static String sessionId(String agentName) {
        return "quorum-chat-" + agentName;
    }
}
