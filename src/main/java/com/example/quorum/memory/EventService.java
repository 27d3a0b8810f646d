package com.example.quorum.memory;

import com.example.quorum.domain.Event;
import com.example.quorum.domain.MemoryContext;
import com.example.quorum.domain.ThreadSummary;
import com.example.quorum.embedding.EmbeddingRefTypes;
import com.example.quorum.embedding.EmbeddingService;
import com.example.quorum.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only event log, including the chat and council conversation threads.
 * Events are embedded in the background after they commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventService {

    public static final String DEFAULT_THREAD_ID = "default";
    public static final String DEFAULT_THREAD_TITLE = "Default Conversation";

    static final List<String> CHAT_TYPES = List.of(Event.CHAT_MESSAGE, Event.CHAT_RESPONSE);
    static final List<String> COUNCIL_TYPES = List.of(Event.COUNCIL_MESSAGE, Event.COUNCIL_RESPONSE);

    private final EventRepository eventRepository;
    private final EmbeddingService embeddingService;
    private final MetadataJson metadataJson;

    public Event append(MemoryContext ctx, NewEvent request) {
        if (request.eventType() == null || request.eventType().isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("Event title is required");
        }
        Event saved = eventRepository.save(Event.builder()
                .eventType(request.eventType().trim())
                .title(request.title())
                .description(request.description())
                .metadata(metadataJson.write(request.metadata()))
                .agentName(request.agentName())
                .refId(request.refId())
                .threadId(request.threadId())
                .threadTitle(request.threadTitle())
                .build());
        log.debug("Event {} ({}) appended by {}", saved.getId(), saved.getEventType(), ctx.actor());
        embeddingService.embedEventAsync(saved);
        return saved;
    }

    public Event get(String id) {
        return eventRepository.findById(id).orElseThrow(() -> NotFound.of("Event", id));
    }

    public List<Event> list(String eventType, String agentName, Instant since, int limit) {
        return eventRepository.findFiltered(DocumentService.blankToNull(eventType),
                DocumentService.blankToNull(agentName), since, PageRequest.of(0, DocumentService.clampLimit(limit)));
    }

    /** User turns and replies of one agent's chat, oldest first. */
    public List<Event> chatHistory(String agentName) {
        return eventRepository.findByAgentNameAndEventTypeInOrderByCreatedAtAsc(agentName, CHAT_TYPES);
    }

    /** Analyses stored against a document, newest first. */
    public List<Event> analyses(String documentId) {
        return eventRepository.findByEventTypeAndRefIdOrderByCreatedAtDesc(Event.AGENT_ANALYSIS, documentId);
    }

    // ── Council threads ──

    public List<ThreadSummary> listThreads() {
        List<ThreadSummary> threads = new ArrayList<>(eventRepository.summarizeThreads(COUNCIL_TYPES));
        if (threads.stream().noneMatch(t -> DEFAULT_THREAD_ID.equals(t.threadId()))) {
            threads.add(new ThreadSummary(DEFAULT_THREAD_ID, DEFAULT_THREAD_TITLE, 0L, null));
        }
        return threads;
    }

    public List<Event> threadMessages(String threadId) {
        return eventRepository.findByThreadIdAndEventTypeInOrderByCreatedAtAsc(threadId, COUNCIL_TYPES);
    }

    /** Current title of a thread, or null when it has no messages yet. */
    public String threadTitle(String threadId) {
        return eventRepository.summarizeThreads(COUNCIL_TYPES).stream()
                .filter(t -> t.threadId().equals(threadId))
                .map(ThreadSummary::title)
                .findFirst()
                .orElse(null);
    }

    @Transactional
    public int renameThread(MemoryContext ctx, String threadId, String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Thread title is required");
        }
        int updated = eventRepository.renameThread(threadId, title.trim());
        if (updated == 0) {
            throw NotFound.of("Thread", threadId);
        }
        log.info("Thread {} renamed to '{}' by {} ({} events)", threadId, title, ctx.actor(), updated);
        return updated;
    }

    public int deleteThread(MemoryContext ctx, String threadId) {
        if (DEFAULT_THREAD_ID.equals(threadId)) {
            throw new IllegalArgumentException("The default thread cannot be deleted");
        }
        List<Event> events = eventRepository.findByThreadId(threadId);
        if (events.isEmpty()) {
            throw NotFound.of("Thread", threadId);
        }
        eventRepository.deleteAllInBatch(events);
        events.forEach(e -> embeddingService.removeFamily(e.getId(), EmbeddingRefTypes.EVENT));
        log.info("Thread {} deleted by {} ({} events)", threadId, ctx.actor(), events.size());
        return events.size();
    }

    public Map<String, Object> metadata(Event event) {
        return metadataJson.read(event.getMetadata());
    }

    public record NewEvent(String eventType, String title, String description, Map<String, Object> metadata,
                           String agentName, String refId, String threadId, String threadTitle) {

        public static NewEvent of(String eventType, String title, String description, Map<String, Object> metadata) {
            return new NewEvent(eventType, title, description, metadata, null, null, null, null);
        }
    }
}
