package com.example.quorum.embedding;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.EmbeddingRecord;
import com.example.quorum.repository.EmbeddingRecordRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory vector index backed by the embedding_records table.
 * <p>
 * On startup, loads all persisted embeddings into a {@link ConcurrentHashMap}
 * keyed by {@code refType:refId}. The first vector seen (or the configured
 * dimensionality) fixes the index dimensionality; any later vector or query of
 * another length raises {@link EmbeddingDimensionMismatchException}.
 */
@Slf4j
@Component
public class VectorStore {

    private final EmbeddingRecordRepository embeddingRepository;
    private final QuorumProperties properties;

    /** key = "document_chunk_2:abc-123", value = float[] vector */
    private final ConcurrentHashMap<String, float[]> index = new ConcurrentHashMap<>();

    /** 0 until established */
    private final AtomicInteger dimensions = new AtomicInteger();

    public VectorStore(EmbeddingRecordRepository embeddingRepository,
                       QuorumProperties properties) {
        this.embeddingRepository = embeddingRepository;
        this.properties = properties;
        this.dimensions.set(Math.max(0, properties.getEmbedding().getDimensions()));
    }

    @PostConstruct
    public void loadFromDatabase() {
        if (!properties.getEmbedding().isEnabled()) {
            log.info("Embeddings disabled, VectorStore not loading");
            return;
        }

        List<EmbeddingRecord> all = embeddingRepository.findAll();
        int loaded = 0;
        for (EmbeddingRecord rec : all) {
            float[] vec;
            try {
                vec = EmbeddingVectors.parse(rec.getEmbedding());
            } catch (NumberFormatException e) {
                log.warn("Unparseable embedding for {}:{}, skipping", rec.getRefType(), rec.getRefId());
                continue;
            }
            if (vec == null) continue;
            if (!dimensions.compareAndSet(0, vec.length) && dimensions.get() != vec.length) {
                log.warn("Stored embedding {}:{} has {} dimensions, index has {}; skipping until reindex",
                        rec.getRefType(), rec.getRefId(), vec.length, dimensions.get());
                continue;
            }
            index.put(key(rec.getRefType(), rec.getRefId()), vec);
            loaded++;
        }
        log.info("VectorStore loaded {} embeddings from DB (of {} records, {} dimensions)",
                loaded, all.size(), dimensions.get());
    }

    // ── Mutation ──

    /**
     * Verify a vector against the index dimensionality, establishing it if this
     * is the first vector.
     */
    public void checkDimensions(float[] vector) {
        int expected = dimensions.get();
        if (expected == 0 && dimensions.compareAndSet(0, vector.length)) {
            log.info("VectorStore dimensionality established at {}", vector.length);
            return;
        }
        expected = dimensions.get();
        if (expected != vector.length) {
            throw new EmbeddingDimensionMismatchException(expected, vector.length);
        }
    }

    public void put(String refType, String refId, float[] vector) {
        checkDimensions(vector);
        index.put(key(refType, refId), vector);
    }

    /**
     * Swap the in-memory family of one reference for the given rows
     * (ref type to vector).
     */
    public void replaceFamily(String refId, String base, Map<String, float[]> vectors) {
        vectors.values().forEach(this::checkDimensions);
        removeFamily(refId, base);
        vectors.forEach((refType, vec) -> index.put(key(refType, refId), vec));
    }

    public void removeFamily(String refId, String base) {
        String suffix = ":" + refId;
        index.keySet().removeIf(k -> k.endsWith(suffix)
                && EmbeddingRefTypes.baseOf(k.substring(0, k.length() - suffix.length())).equals(base));
    }

    public boolean containsFamily(String refId, String base) {
        String suffix = ":" + refId;
        return index.keySet().stream().anyMatch(k -> k.endsWith(suffix)
                && EmbeddingRefTypes.baseOf(k.substring(0, k.length() - suffix.length())).equals(base));
    }

    // ── Query ──

    /**
     * Find the top-K entries most similar to the query vector that pass the
     * filter.
     *
     * @return results sorted by descending cosine similarity
     * @throws EmbeddingDimensionMismatchException if the query length differs from the index
     */
    public List<ScoredResult> search(float[] query, SearchFilter filter, int topK) {
        if (query == null) return List.of();
        int expected = dimensions.get();
        if (expected != 0 && expected != query.length) {
            throw new EmbeddingDimensionMismatchException(expected, query.length);
        }
        if (index.isEmpty()) return List.of();

        return index.entrySet().parallelStream()
                .map(e -> {
                    String[] parts = e.getKey().split(":", 2);
                    return Map.entry(parts, e.getValue());
                })
                .filter(e -> filter.accepts(e.getKey()[0], e.getKey()[1]))
                .map(e -> new ScoredResult(e.getKey()[1], e.getKey()[0],
                        EmbeddingVectors.cosineSimilarity(query, e.getValue())))
                .filter(r -> r.score() >= filter.minScore())
                .sorted(Comparator.comparingDouble(ScoredResult::score).reversed())
                .limit(topK)
                .collect(Collectors.toList());
    }

    /**
     * Get total number of embeddings in the in-memory index.
     */
    public int size() {
        return index.size();
    }

    public int dimensions() {
        return dimensions.get();
    }

    /**
     * Count of index rows per reference-type base.
     */
    public Map<String, Long> countByBase() {
        return index.keySet().stream()
                .map(k -> EmbeddingRefTypes.baseOf(k.split(":", 2)[0]))
                .collect(Collectors.groupingBy(t -> t, TreeMap::new, Collectors.counting()));
    }

    /**
     * Clear all in-memory entries and forget the dimensionality (does NOT clear
     * the database).
     */
    public void clearMemory() {
        index.clear();
        dimensions.set(Math.max(0, properties.getEmbedding().getDimensions()));
    }

    private static String key(String refType, String refId) {
        return refType + ":" + refId;
    }

    /**
     * A search hit: reference id, the ref type of the matching row, and cosine
     * similarity.
     */
    public record ScoredResult(String refId, String refType, double score) {

        public String base() {
            return EmbeddingRefTypes.baseOf(refType);
        }

        /** Chunk index of the matching row, or -1 when the reference was embedded whole. */
        public int chunkIndex() {
            return EmbeddingRefTypes.chunkIndex(refType);
        }
    }
}
