package com.example.quorum.embedding;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.EmbeddingRecord;
import com.example.quorum.repository.EmbeddingRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VectorStoreTest {

    private EmbeddingRecordRepository repository;
    private VectorStore store;

    @BeforeEach
    void setUp() {
        repository = mock(EmbeddingRecordRepository.class);
        store = new VectorStore(repository, new QuorumProperties());
    }

    @Test
    void firstVectorEstablishesDimensions() {
        store.put("document", "d1", new float[]{1, 0, 0});

        assertEquals(3, store.dimensions());
        EmbeddingDimensionMismatchException e = assertThrows(EmbeddingDimensionMismatchException.class,
                () -> store.put("document", "d2", new float[]{1, 0}));
        assertEquals(3, e.getExpected());
        assertEquals(2, e.getActual());
    }

    @Test
    void queryOfWrongLengthIsRejected() {
        store.put("document", "d1", new float[]{1, 0, 0});

        assertThrows(EmbeddingDimensionMismatchException.class,
                () -> store.search(new float[]{1, 0}, SearchFilter.documents(), 5));
    }

    @Test
    void configuredDimensionsRejectWrongQueryOnEmptyIndex() {
        QuorumProperties properties = new QuorumProperties();
        properties.getEmbedding().setDimensions(3);
        VectorStore configured = new VectorStore(repository, properties);

        assertEquals(0, configured.size());
        assertThrows(EmbeddingDimensionMismatchException.class,
                () -> configured.search(new float[]{1, 0, 0, 0, 0}, SearchFilter.documents(), 5));
        assertTrue(configured.search(new float[]{1, 0, 0}, SearchFilter.documents(), 5).isEmpty());
    }

    @Test
    void searchRanksByCosineSimilarity() {
        store.put("document", "near", new float[]{1, 0.1f, 0});
        store.put("document", "far", new float[]{0, 1, 0});
        store.put("event", "e1", new float[]{1, 0, 0});

        List<VectorStore.ScoredResult> results = store.search(new float[]{1, 0, 0}, SearchFilter.documents(), 5);

        assertEquals(2, results.size());
        assertEquals("near", results.get(0).refId());
        assertEquals("far", results.get(1).refId());
        assertTrue(results.get(0).score() > results.get(1).score());
    }

    @Test
    void filterRestrictsChunksAndIds() {
        store.replaceFamily("d1", "document", Map.of(
                "document_chunk_0", new float[]{1, 0},
                "document_chunk_1", new float[]{0, 1}));
        store.put("document", "d2", new float[]{1, 0});

        assertEquals(1, store.search(new float[]{1, 0}, SearchFilter.documents().withoutChunks(), 10).size());

        List<VectorStore.ScoredResult> onlyD1 = store.search(new float[]{1, 0},
                SearchFilter.documents().withAllowedRefIds(Set.of("d1")), 10);
        assertEquals(2, onlyD1.size());
        assertEquals(0, onlyD1.get(0).chunkIndex());
        assertEquals("document", onlyD1.get(0).base());
    }

    @Test
    void minScoreDropsWeakMatches() {
        store.put("document", "d1", new float[]{1, 0});
        store.put("document", "d2", new float[]{0, 1});

        List<VectorStore.ScoredResult> results = store.search(new float[]{1, 0},
                SearchFilter.documents().withMinScore(0.5), 10);

        assertEquals(1, results.size());
        assertEquals("d1", results.get(0).refId());
    }

    @Test
    void replaceFamilyDropsStaleRows() {
        store.put("document", "d1", new float[]{1, 0});
        store.replaceFamily("d1", "document", Map.of(
                "document_chunk_0", new float[]{1, 0},
                "document_chunk_1", new float[]{0, 1}));

        assertEquals(2, store.size());
        assertTrue(store.containsFamily("d1", "document"));

        store.removeFamily("d1", "document");
        assertEquals(0, store.size());
        assertFalse(store.containsFamily("d1", "document"));
    }

    @Test
    void removeFamilyLeavesOtherBasesAlone() {
        store.put("document", "x", new float[]{1, 0});
        store.put("event", "x", new float[]{1, 0});

        store.removeFamily("x", "document");

        assertEquals(Map.of("event", 1L), store.countByBase());
    }

    @Test
    void loadSkipsRowsWithMismatchedDimensions() {
        when(repository.findAll()).thenReturn(List.of(
                record("d1", "document", "1.0,0.0,0.0"),
                record("d2", "document", "1.0,0.0"),
                record("d3", "document", "not-a-number")));

        store.loadFromDatabase();

        assertEquals(1, store.size());
        assertEquals(3, store.dimensions());
    }

    @Test
    void clearMemoryForgetsDimensions() {
        store.put("document", "d1", new float[]{1, 0, 0});
        store.clearMemory();

        assertEquals(0, store.size());
        assertEquals(0, store.dimensions());
        store.put("document", "d1", new float[]{1, 0});
        assertEquals(2, store.dimensions());
    }

    private static EmbeddingRecord record(String refId, String refType, String csv) {
        return EmbeddingRecord.builder().refId(refId).refType(refType).embedding(csv).build();
    }
}
