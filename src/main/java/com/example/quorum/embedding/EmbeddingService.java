package com.example.quorum.embedding;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.EmbeddingRecord;
import com.example.quorum.domain.Event;
import com.example.quorum.repository.EmbeddingRecordRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Ingestion pipeline: chunk, hash, embed and persist the embedding family of a
 * document or event, then publish it to the {@link VectorStore}.
 * <p>
 * Vectors are cached in Caffeine by content hash, and rows whose stored hash
 * matches the current chunk text are reused without calling the provider.
 */
@Slf4j
@Service
public class EmbeddingService {

    private final QuorumProperties properties;
    private final EmbeddingProvider provider;
    private final TextChunker chunker;
    private final EmbeddingRecordRepository embeddingRepository;
    private final VectorStore vectorStore;
    private final TransactionTemplate transactionTemplate;
    private final Counter failureCounter;

    /** In-process cache keyed by SHA-256 of input text → float[] vector */
    private final Cache<String, float[]> embeddingCache;

    public EmbeddingService(QuorumProperties properties,
                            EmbeddingProvider provider,
                            TextChunker chunker,
                            EmbeddingRecordRepository embeddingRepository,
                            VectorStore vectorStore,
                            PlatformTransactionManager transactionManager,
                            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.provider = provider;
        this.chunker = chunker;
        this.embeddingRepository = embeddingRepository;
        this.vectorStore = vectorStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.failureCounter = Counter.builder("quorum.embedding.failures")
                .description("Embedding requests abandoned because the provider failed")
                .register(meterRegistry);

        this.embeddingCache = Caffeine.newBuilder()
                .maximumSize(properties.getEmbedding().getCacheSize())
                .expireAfterWrite(1, TimeUnit.HOURS)
                .build();
    }

    // ── Public API ──

    public boolean isEnabled() {
        return properties.getEmbedding().isEnabled();
    }

    public String describeProvider() {
        return provider.describe();
    }

    /**
     * Embed a single piece of text, going through the cache.
     */
    public float[] embed(String text) throws EmbeddingProviderException {
        if (!isEnabled()) {
            throw new EmbeddingProviderException("Embeddings are disabled");
        }
        String hash = Fingerprints.sha256(text);
        float[] cached = embeddingCache.getIfPresent(hash);
        if (cached != null) return cached;

        float[] vector = provider.embed(text);
        embeddingCache.put(hash, vector);
        return vector;
    }

    /**
     * Make the stored embedding family of {@code (refId, base)} reflect
     * {@code content}.
     *
     * @param base "document" or "event"
     * @return true when the family is stored and indexed, false when the
     *         provider failed (the family is then removed) or there was nothing to embed
     * @throws EmbeddingDimensionMismatchException if the provider returns vectors of a new length
     */
    public boolean embedAndStore(String refId, String base, String content) {
        EmbeddingRefTypes.requireBase(base);
        if (!isEnabled()) return false;
        if (content == null || content.isBlank()) {
            removeFamily(refId, base);
            return false;
        }

        List<String> chunks = chunker.chunk(content);
        Map<String, EmbeddingRecord> existing = new HashMap<>();
        for (EmbeddingRecord rec : embeddingRepository.findFamily(refId, base, EmbeddingRefTypes.chunkPattern(base))) {
            existing.put(rec.getRefType(), rec);
        }

        List<PendingRow> rows = new ArrayList<>(chunks.size());
        boolean unchanged = existing.size() == chunks.size();
        for (int i = 0; i < chunks.size(); i++) {
            String refType = chunks.size() == 1 ? base : EmbeddingRefTypes.chunk(base, i);
            String hash = Fingerprints.sha256(chunks.get(i));
            EmbeddingRecord previous = existing.get(refType);
            float[] reused = null;
            if (previous != null && hash.equals(previous.getContentHash())) {
                reused = EmbeddingVectors.parse(previous.getEmbedding());
            }
            if (reused == null) unchanged = false;
            rows.add(new PendingRow(refType, chunks.get(i), hash, reused));
        }

        if (unchanged) {
            if (!vectorStore.containsFamily(refId, base)) {
                vectorStore.replaceFamily(refId, base, toVectorMap(rows));
            }
            log.debug("Embedding family {}:{} unchanged ({} rows)", base, refId, rows.size());
            return true;
        }

        for (PendingRow row : rows) {
            if (row.vector != null) continue;
            try {
                row.vector = embed(row.text);
            } catch (EmbeddingProviderException e) {
                log.warn("Embedding failed for {}:{} ({}), removing family: {}",
                        row.refType, refId, provider.describe(), e.getMessage());
                failureCounter.increment();
                removeFamily(refId, base);
                return false;
            }
            vectorStore.checkDimensions(row.vector);
        }

        try {
            replaceFamily(refId, base, rows);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent write to embedding family {}:{}, retrying once", base, refId);
            replaceFamily(refId, base, rows);
        }
        vectorStore.replaceFamily(refId, base, toVectorMap(rows));
        log.debug("Stored {} embedding rows for {}:{}", rows.size(), base, refId);
        return true;
    }

    /**
     * Delete every embedding row of a reference, persisted and in memory.
     */
    public void removeFamily(String refId, String base) {
        Integer deleted = transactionTemplate.execute(status ->
                embeddingRepository.deleteFamily(refId, base, EmbeddingRefTypes.chunkPattern(base)));
        vectorStore.removeFamily(refId, base);
        if (deleted != null && deleted > 0) {
            log.debug("Removed {} embedding rows for {}:{}", deleted, base, refId);
        }
    }

    /**
     * Text an event is embedded with.
     */
    public static String eventText(Event event) {
        StringBuilder sb = new StringBuilder();
        if (event.getTitle() != null) sb.append(event.getTitle()).append(". ");
        if (event.getDescription() != null) sb.append(event.getDescription());
        return sb.toString().trim();
    }

    @Async("embeddingExecutor")
    public void embedEventAsync(Event event) {
        if (!isEnabled() || event == null) return;
        try {
            embedAndStore(event.getId(), EmbeddingRefTypes.EVENT, eventText(event));
        } catch (RuntimeException e) {
            log.error("Failed to embed event {}: {}", event.getId(), e.getMessage(), e);
        }
    }

    public void clearCache() {
        embeddingCache.invalidateAll();
    }

    // ── Internal ──

    private void replaceFamily(String refId, String base, List<PendingRow> rows) {
        transactionTemplate.executeWithoutResult(status -> {
            embeddingRepository.deleteFamily(refId, base, EmbeddingRefTypes.chunkPattern(base));
            List<EmbeddingRecord> records = new ArrayList<>(rows.size());
            for (PendingRow row : rows) {
                records.add(EmbeddingRecord.builder()
                        .refId(refId)
                        .refType(row.refType)
                        .contentHash(row.hash)
                        .dimensions(row.vector.length)
                        .embedding(EmbeddingVectors.serialize(row.vector))
                        .build());
            }
            embeddingRepository.saveAll(records);
            embeddingRepository.flush();
        });
    }

    private static Map<String, float[]> toVectorMap(List<PendingRow> rows) {
        Map<String, float[]> vectors = new LinkedHashMap<>();
        for (PendingRow row : rows) {
            vectors.put(row.refType, row.vector);
        }
        return vectors;
    }

    private static final class PendingRow {
        final String refType;
        final String text;
        final String hash;
        float[] vector;

        PendingRow(String refType, String text, String hash, float[] vector) {
            this.refType = refType;
            this.text = text;
            this.hash = hash;
            this.vector = vector;
        }
    }
}
