package com.example.quorum.embedding;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.Document;
import com.example.quorum.domain.Event;
import com.example.quorum.repository.DocumentRepository;
import com.example.quorum.repository.EmbeddingRecordRepository;
import com.example.quorum.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * On application startup, embeds documents and events that have no embedding
 * family yet. Also provides the reindex operation, which re-runs the pipeline
 * over everything (optionally purging the index first, after an embedding
 * model switch).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingMigrationService {

    private final QuorumProperties properties;
    private final EmbeddingService embeddingService;
    private final EmbeddingRecordRepository embeddingRepository;
    private final DocumentRepository documentRepository;
    private final EventRepository eventRepository;
    private final VectorStore vectorStore;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastRunAt;
    private volatile MigrationResult lastResult;

    @EventListener(ApplicationReadyEvent.class)
    @Async("embeddingExecutor")
    public void onStartup() {
        QuorumProperties.EmbeddingConfig cfg = properties.getEmbedding();
        if (!cfg.isEnabled() || !cfg.isBackfillOnStartup()) {
            log.info("Embedding backfill skipped (enabled={}, backfillOnStartup={})",
                    cfg.isEnabled(), cfg.isBackfillOnStartup());
            return;
        }
        log.info("Starting embedding backfill for unembedded documents and events...");
        MigrationResult result = backfill();
        log.info("Embedding backfill complete: {}", result);
    }

    /**
     * Embed every document and event that has no embedding family.
     */
    public MigrationResult backfill() {
        return runExclusive(() -> {
            List<Document> documents = documentRepository.findUnembedded();
            List<Event> events = eventRepository.findUnembedded();
            return embedAll(documents, events);
        });
    }

    /**
     * Re-run the pipeline over every document and event. Unchanged rows are
     * reused unless {@code purge} drops the whole index first.
     */
    public MigrationResult reindex(boolean purge) {
        return runExclusive(() -> {
            if (purge) {
                long removed = embeddingRepository.count();
                embeddingRepository.deleteAllInBatch();
                vectorStore.clearMemory();
                embeddingService.clearCache();
                log.info("Purged {} embedding rows before reindex", removed);
            }
            return embedAll(documentRepository.findAll(), eventRepository.findAll());
        });
    }

    @Async("embeddingExecutor")
    public void reindexAsync(boolean purge) {
        MigrationResult result = reindex(purge);
        log.info("Reindex complete: {}", result);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("enabled", properties.getEmbedding().isEnabled());
        status.put("provider", embeddingService.describeProvider());
        status.put("migrationRunning", running.get());
        status.put("lastRunAt", lastRunAt != null ? lastRunAt.toString() : "never");
        status.put("lastResult", lastResult);
        status.put("totalEmbeddings", embeddingRepository.count());
        status.put("embeddedDocuments", embeddingRepository.countReferences(
                EmbeddingRefTypes.DOCUMENT, EmbeddingRefTypes.chunkPattern(EmbeddingRefTypes.DOCUMENT)));
        status.put("embeddedEvents", embeddingRepository.countReferences(
                EmbeddingRefTypes.EVENT, EmbeddingRefTypes.chunkPattern(EmbeddingRefTypes.EVENT)));
        status.put("unembeddedDocuments", documentRepository.countUnembedded());
        status.put("unembeddedEvents", eventRepository.countUnembedded());
        status.put("indexSize", vectorStore.size());
        status.put("dimensions", vectorStore.dimensions());
        return status;
    }

    // ── Internal ──

    private MigrationResult runExclusive(Supplier<MigrationResult> work) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Embedding migration already running, skipping");
            return MigrationResult.SKIPPED;
        }
        try {
            MigrationResult result = work.get();
            lastResult = result;
            return result;
        } finally {
            running.set(false);
            lastRunAt = Instant.now();
        }
    }

    private MigrationResult embedAll(List<Document> documents, List<Event> events) {
        int docs = 0, evts = 0, failed = 0;
        for (Document document : documents) {
            if (embeddingService.embedAndStore(document.getId(), EmbeddingRefTypes.DOCUMENT, document.getContent())) {
                docs++;
            } else {
                failed++;
            }
        }
        for (Event event : events) {
            if (embeddingService.embedAndStore(event.getId(), EmbeddingRefTypes.EVENT, EmbeddingService.eventText(event))) {
                evts++;
            } else {
                failed++;
            }
        }
        return new MigrationResult(docs, evts, failed);
    }

    /**
     * Outcome of a backfill or reindex pass.
     */
    public record MigrationResult(int documents, int events, int failed) {
        static final MigrationResult SKIPPED = new MigrationResult(0, 0, 0);
    }
}
