package com.example.quorum.service;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.Event;
import com.example.quorum.domain.MemoryContext;
import com.example.quorum.domain.ThreadSummary;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.EventService.NewEvent;
import com.example.quorum.orchestrator.OrchestrationRequest;
import com.example.quorum.orchestrator.ReasoningOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Chat with the whole council in named threads. Each thread is its own
 * reasoning session, so conversations don't bleed into each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CouncilChatService {

    static final String COUNCIL_PROMPT = """
            You are The Quorum - a council of 7 AI agents working together. When responding to queries, \
            structure your response to show the perspectives of relevant agents:

            - **The Connector** (patterns & connections)
            - **The Executor** (action items & deadlines)
            - **The Strategist** (big picture & priorities)
            - **The Devil's Advocate** (risks & challenges)
            - **The Opportunist** (quick wins & hidden value)
            - **The Data Collector** (facts & evidence)
            - **The Closer** (verifies completion, closes tasks, updates status from evidence)

            Search the database for relevant context. After showing relevant agent perspectives, provide a \
            **Council Summary** that synthesizes the key takeaway and recommended action.

            Format each agent section with their name as a bold header (e.g. **The Connector**). Only include \
            agents whose perspective is relevant - don't force all 7 for every query.""";

    static final String NEW_THREAD_TITLE = "New Conversation";

    private final EventService eventService;
    private final ReasoningOrchestrator orchestrator;
    private final QuorumProperties properties;

    /**
     * Stream the council's answer. A missing thread id means the default
     * thread; a new thread without a title keeps whatever title it already has.
     */
    public Flux<String> chat(String message, String threadId, String threadTitle) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Missing or invalid message");
        }
        boolean defaultThread = threadId == null || threadId.isBlank();
        String effectiveThreadId = defaultThread ? EventService.DEFAULT_THREAD_ID : threadId.trim();
        String effectiveTitle = threadTitle != null && !threadTitle.isBlank() ? threadTitle.trim()
                : defaultThread ? EventService.DEFAULT_THREAD_TITLE : eventService.threadTitle(effectiveThreadId);

        MemoryContext ctx = MemoryContext.user();
        eventService.append(ctx, new NewEvent(Event.COUNCIL_MESSAGE, "Chat to The Quorum", message,
                Map.of("target_agent", "quorum", "sender", "user"), null, null, effectiveThreadId, effectiveTitle));

        OrchestrationRequest request = new OrchestrationRequest(
                COUNCIL_PROMPT + "\n\nUser query: " + message,
                sessionId(effectiveThreadId),
                Duration.ofSeconds(properties.getReasoning().getCouncilTimeoutSeconds()),
                ctx, ChatService.PROCESS_LABEL,
                (transcript, outcome) -> eventService.append(ctx, new NewEvent(Event.COUNCIL_RESPONSE,
                        "Response from The Quorum", transcript,
                        Map.of("target_agent", "quorum", "sender", "council", "outcome", outcome.value()),
                        null, null, effectiveThreadId, effectiveTitle)));
        log.info("Council chat started in thread {}", effectiveThreadId);
        return orchestrator.run(request);
    }

    public List<ThreadSummary> listThreads() {
        return eventService.listThreads();
    }

    public List<Event> messages(String threadId) {
        return eventService.threadMessages(threadId);
    }

    /**
     * Allocate a thread id. Nothing is stored until the first message.
     */
    public ThreadSummary createThread(String title) {
        String threadId = "thread-" + UUID.randomUUID();
        String effectiveTitle = title == null || title.isBlank() ? NEW_THREAD_TITLE : title.trim();
        return new ThreadSummary(threadId, effectiveTitle, 0L, null);
    }

    public int renameThread(String threadId, String title) {
        return eventService.renameThread(MemoryContext.user(), threadId, title);
    }

    public int deleteThread(String threadId) {
        return eventService.deleteThread(MemoryContext.user(), threadId);
    }

    static String sessionId(String threadId) {
        return "quorum-council-" + threadId;
    }
}
