package com.example.quorum.scheduling;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.*;
import com.example.quorum.memory.DocumentService;
import com.example.quorum.memory.DocumentService.NewDocument;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.EventService.NewEvent;
import com.example.quorum.memory.ObservationService;
import com.example.quorum.memory.ObservationService.NewObservation;
import com.example.quorum.memory.ObservationService.ObservationFilter;
import com.example.quorum.memory.TaskService;
import com.example.quorum.memory.TaskService.NewTask;
import com.example.quorum.provider.ChatMessage;
import com.example.quorum.provider.ChatOptions;
import com.example.quorum.provider.ChatProvider;
import com.example.quorum.provider.ChatResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Function;

/**
 * Default {@link AgentWorker}: shows the language model a snapshot of recent
 * store contents along with the agent's role prompt, and parses the JSON
 * findings document it answers with.
 */
@Slf4j
@Component
public class LlmAgentWorker implements AgentWorker {

    private static final int SNAPSHOT_LIMIT = 20;
    private static final int SNIPPET_LENGTH = 300;

    private final ChatProvider chatProvider;
    private final ObjectMapper objectMapper;
    private final QuorumProperties properties;
    private final DocumentService documentService;
    private final EventService eventService;
    private final TaskService taskService;
    private final ObservationService observationService;
    private final Clock clock;

    public LlmAgentWorker(@Lazy ChatProvider chatProvider,
                          ObjectMapper objectMapper,
                          QuorumProperties properties,
                          DocumentService documentService,
                          EventService eventService,
                          TaskService taskService,
                          ObservationService observationService,
                          Clock clock) {
        this.chatProvider = chatProvider;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.documentService = documentService;
        this.eventService = eventService;
        this.taskService = taskService;
        this.observationService = observationService;
        this.clock = clock;
    }

    @Override
    public AgentFindings run(AgentDefinition agent, MemoryContext context) {
        String snapshot = buildSnapshot();
        List<ChatMessage> messages = List.of(
                ChatMessage.system(buildSystemPrompt(agent)),
                ChatMessage.user("Current state of the shared memory:\n\n" + snapshot)
        );
        ChatResult result = chatProvider.chat(messages, ChatOptions.defaults());
        log.debug("Agent {} used {} prompt / {} completion tokens", agent.getName(),
                result.promptTokens(), result.completionTokens());
        return parseFindings(agent, result.content());
    }

    String buildSystemPrompt(AgentDefinition agent) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(agent.getDisplayName()).append(", one of the agents of the Quorum.\n");
        if (agent.getDescription() != null) {
            sb.append(agent.getDescription()).append(".\n");
        }
        if (agent.getPrompt() != null) {
            sb.append('\n').append(agent.getPrompt().trim()).append('\n');
        }
        sb.append("""

                Respond ONLY with a JSON object (no markdown) of this shape, omitting empty lists:
                {
                  "summary": "one or two sentences on what you did",
                  "documents": [{"doc_type": "note|report|reflection", "title": "...", "content": "...", "tags": ["..."]}],
                  "events": [{"event_type": "...", "title": "...", "description": "..."}],
                  "tasks": [{"title": "...", "description": "...", "priority": "critical|high|medium|low", "owner": "...", "due_at": "ISO-8601"}],
                  "observations": [{"category": "critique|risk|insight|recommendation|issue|improvement|other", "severity": "info|low|medium|high|critical", "content": "...", "ref_id": "...", "ref_type": "document|task|event"}],
                  "notification": {"title": "...", "message": "..."}
                }
                Only notify the user about something that needs their attention today.
                """);
        sb.append("Your tier is '").append(agent.getTier().value()).append("'; you may only write ");
        sb.append(TierPolicy.allowed(agent.getTier()).stream()
                .map(k -> k.name().toLowerCase(Locale.ROOT) + "s")
                .reduce((a, b) -> a + ", " + b).orElse("nothing"));
        sb.append(".\n");
        return sb.toString();
    }

    String buildSnapshot() {
        Instant since = clock.instant().minus(Duration.ofHours(properties.getScheduler().getLookbackHours()));
        StringBuilder sb = new StringBuilder();

        List<Event> events = eventService.list(null, null, since, SNAPSHOT_LIMIT);
        sb.append("## Recent Events\n");
        if (events.isEmpty()) {
            sb.append("None.\n");
        }
        for (Event e : events) {
            sb.append(String.format("- [%s] %s (%s%s)\n", e.getEventType(), e.getTitle(), e.getCreatedAt(),
                    e.getAgentName() != null ? ", " + e.getAgentName() : ""));
        }

        List<Task> tasks = new ArrayList<>(taskService.list(TaskStatus.OPEN, null, null, SNAPSHOT_LIMIT));
        tasks.addAll(taskService.list(TaskStatus.IN_PROGRESS, null, null, SNAPSHOT_LIMIT));
        sb.append("\n## Open Tasks\n");
        if (tasks.isEmpty()) {
            sb.append("None.\n");
        }
        for (Task t : tasks) {
            sb.append(String.format("- %s [id=%s, status=%s, priority=%s, owner=%s, due=%s]\n", t.getTitle(), t.getId(),
                    t.getStatus().value(), t.getPriority().value(),
                    t.getOwner() != null ? t.getOwner() : "unassigned",
                    t.getDueAt() != null ? t.getDueAt() : "none"));
        }

        List<Document> documents = documentService.list(null, null, since, SNAPSHOT_LIMIT);
        sb.append("\n## Recent Documents\n");
        if (documents.isEmpty()) {
            sb.append("None.\n");
        }
        for (Document d : documents) {
            sb.append(String.format("- %s [id=%s, type=%s]: %s\n", d.getTitle(), d.getId(), d.getDocType().value(),
                    abbreviate(d.getContent())));
        }

        ObservationFilter open = new ObservationFilter(null, null, ObservationStatus.OPEN, null, null, null);
        List<Observation> observations = observationService.list(open, 0, SNAPSHOT_LIMIT).getContent();
        sb.append("\n## Open Observations\n");
        if (observations.isEmpty()) {
            sb.append("None.\n");
        }
        for (Observation o : observations) {
            sb.append(String.format("- [%s/%s] %s (by %s)\n", o.getCategory().value(), o.getSeverity().value(),
                    abbreviate(o.getContent()), o.getSourceAgent()));
        }
        return sb.toString();
    }

    /**
     * Parse the model's answer. Entries that fail validation are dropped with
     * a warning; an answer that is not JSON at all becomes a run with no findings.
     */
    AgentFindings parseFindings(AgentDefinition agent, String content) {
        if (content == null || content.isBlank()) {
            return AgentFindings.empty("No response from the model");
        }
        content = content.trim();
        if (content.startsWith("```")) {
            content = content.replaceFirst("```(?:json)?\\s*", "").replaceFirst("\\s*```$", "");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("Agent {} returned unparseable findings: {}", agent.getName(), e.getOriginalMessage());
            return AgentFindings.empty("Unparseable response");
        }
        if (root == null || !root.isObject()) {
            log.warn("Agent {} returned findings that are not a JSON object", agent.getName());
            return AgentFindings.empty("Unparseable response");
        }

        AgentNotification notification = null;
        JsonNode n = root.path("notification");
        if (n.isObject() && !text(n, "title").isEmpty()) {
            notification = new AgentNotification(text(n, "title"), text(n, "message"));
        }

        return new AgentFindings(
                root.hasNonNull("summary") ? root.get("summary").asText() : null,
                entries(agent, root.path("documents"), this::toDocument),
                entries(agent, root.path("events"), this::toEvent),
                entries(agent, root.path("tasks"), this::toTask),
                entries(agent, root.path("observations"), this::toObservation),
                notification);
    }

    private <T> List<T> entries(AgentDefinition agent, JsonNode array, Function<JsonNode, T> mapper) {
        if (!array.isArray()) return List.of();
        List<T> result = new ArrayList<>();
        for (JsonNode node : array) {
            try {
                result.add(mapper.apply(node));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.warn("Agent {} produced an unusable entry: {}", agent.getName(), e.getMessage());
            }
        }
        return result;
    }

    private NewDocument toDocument(JsonNode node) {
        Set<String> tags = new LinkedHashSet<>();
        node.path("tags").forEach(t -> tags.add(t.asText()));
        String type = text(node, "doc_type");
        return new NewDocument(type.isEmpty() ? DocumentType.NOTE : DocumentType.fromValue(type),
                text(node, "title"), text(node, "content"), tags, map(node.path("metadata")));
    }

    private NewEvent toEvent(JsonNode node) {
        return NewEvent.of(text(node, "event_type"), text(node, "title"), text(node, "description"),
                map(node.path("metadata")));
    }

    private NewTask toTask(JsonNode node) {
        String priority = text(node, "priority");
        String dueAt = text(node, "due_at");
        return new NewTask(text(node, "title"), text(node, "description"), TaskStatus.OPEN,
                priority.isEmpty() ? TaskPriority.MEDIUM : TaskPriority.fromValue(priority),
                text(node, "owner").isEmpty() ? null : text(node, "owner"),
                dueAt.isEmpty() ? null : Instant.parse(dueAt),
                map(node.path("metadata")));
    }

    private NewObservation toObservation(JsonNode node) {
        String severity = text(node, "severity");
        String refId = text(node, "ref_id");
        String refType = text(node, "ref_type");
        return new NewObservation(ObservationCategory.fromValue(text(node, "category")),
                severity.isEmpty() ? ObservationSeverity.INFO : ObservationSeverity.fromValue(severity),
                ObservationStatus.OPEN, text(node, "content"), null,
                refId.isEmpty() ? null : refId,
                refType.isEmpty() ? null : ObservationRefType.fromValue(refType),
                map(node.path("metadata")));
    }

    private Map<String, Object> map(JsonNode node) {
        if (!node.isObject()) return Map.of();
        return objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText().trim();
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= SNIPPET_LENGTH ? flat : flat.substring(0, SNIPPET_LENGTH) + "...";
    }
}
