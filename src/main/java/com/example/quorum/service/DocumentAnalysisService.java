package com.example.quorum.service;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.Document;
import com.example.quorum.domain.Event;
import com.example.quorum.domain.MemoryContext;
import com.example.quorum.memory.DocumentService;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.EventService.NewEvent;
import com.example.quorum.orchestrator.OrchestrationOutcome;
import com.example.quorum.orchestrator.OrchestrationRequest;
import com.example.quorum.orchestrator.ReasoningOrchestrator;
import com.example.quorum.scheduling.AgentCatalog;
import com.example.quorum.scheduling.AgentDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Has one agent review a stored document through the reasoning process and
 * keeps the review as an {@code agent_analysis} event on the document.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentAnalysisService {

    private final AgentCatalog catalog;
    private final DocumentService documentService;
    private final EventService eventService;
    private final ReasoningOrchestrator orchestrator;
    private final QuorumProperties properties;
    private final Clock clock;

    public AnalysisResult analyzeDocument(String documentId, String agentName) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Missing or invalid document_id");
        }
        AgentDefinition agent = catalog.require(agentName);
        Document document = documentService.get(documentId);

        String prompt = "Review this document and provide your analysis as " + agent.getDisplayName()
                + ": Title: " + document.getTitle() + "\n\nContent: " + document.getContent();
        Duration timeout = Duration.ofSeconds(properties.getReasoning().getAnalysisTimeoutSeconds());
        AtomicReference<Event> stored = new AtomicReference<>();
        AtomicReference<OrchestrationOutcome> finished = new AtomicReference<>();

        OrchestrationRequest request = new OrchestrationRequest(prompt,
                "doc-analysis-" + clock.millis(), timeout, MemoryContext.agent(agent.getName()),
                ChatService.PROCESS_LABEL,
                (transcript, outcome) -> {
                    finished.set(outcome);
                    stored.set(eventService.append(MemoryContext.agent(agent.getName()), new NewEvent(
                            Event.AGENT_ANALYSIS,
                            agent.getDisplayName() + " analysis of \"" + document.getTitle() + "\"",
                            transcript.trim(),
                            Map.of("source", agent.getName(), "document_id", document.getId(),
                                    "outcome", outcome.value()),
                            agent.getName(), document.getId(), null, null)));
                });

        // the orchestrator enforces the timeout; the margin covers process teardown
        String analysis = orchestrator.run(request)
                .collect(Collectors.joining())
                .block(timeout.plusSeconds(30));
        log.info("{} analysed document {}: {}", agent.getName(), document.getId(), finished.get());
        return new AnalysisResult(stored.get() != null ? stored.get().getId() : null,
                analysis != null ? analysis.trim() : "", finished.get());
    }

    public List<Event> analyses(String documentId) {
        return eventService.analyses(documentId);
    }

    public record AnalysisResult(String eventId, String analysis, OrchestrationOutcome outcome) {
    }
}
