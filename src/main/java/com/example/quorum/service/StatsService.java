package com.example.quorum.service;

import com.example.quorum.domain.DocumentType;
import com.example.quorum.domain.ObservationStatus;
import com.example.quorum.domain.TaskStatus;
import com.example.quorum.embedding.VectorStore;
import com.example.quorum.repository.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Store-wide counts for the dashboard summary.
 */
@Service
@RequiredArgsConstructor
public class StatsService {

    private final DocumentRepository documentRepository;
    private final EventRepository eventRepository;
    private final TaskRepository taskRepository;
    private final ObservationRepository observationRepository;
    private final EmbeddingRecordRepository embeddingRepository;
    private final AgentRunRepository agentRunRepository;
    private final VectorStore vectorStore;
    private final Clock clock;

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();

        Map<String, Long> docsByType = new LinkedHashMap<>();
        for (DocumentType type : DocumentType.values()) {
            docsByType.put(type.value(), documentRepository.countByDocType(type));
        }
        stats.put("documents", Map.of(
                "total", documentRepository.count(),
                "byType", docsByType,
                "unembedded", documentRepository.countUnembedded()));

        Instant dayAgo = Instant.now(clock).minus(Duration.ofHours(24));
        stats.put("events", Map.of(
                "total", eventRepository.count(),
                "last24h", eventRepository.countByCreatedAtAfter(dayAgo),
                "unembedded", eventRepository.countUnembedded()));

        Map<String, Long> tasksByStatus = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            tasksByStatus.put(status.value(), taskRepository.countByStatus(status));
        }
        stats.put("tasks", Map.of("total", taskRepository.count(), "byStatus", tasksByStatus));

        Map<String, Long> observationsByStatus = new LinkedHashMap<>();
        for (ObservationStatus status : ObservationStatus.values()) {
            observationsByStatus.put(status.value(), observationRepository.countByStatus(status));
        }
        stats.put("observations", Map.of("total", observationRepository.count(), "byStatus", observationsByStatus));

        stats.put("embeddings", Map.of(
                "stored", embeddingRepository.count(),
                "indexed", vectorStore.size(),
                "dimensions", vectorStore.dimensions()));
        stats.put("agentRuns", agentRunRepository.count());
        return stats;
    }
}
