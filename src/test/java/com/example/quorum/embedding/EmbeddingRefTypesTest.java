package com.example.quorum.embedding;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingRefTypesTest {

    @Test
    void chunkRefTypesEncodeBaseAndIndex() {
        String refType = EmbeddingRefTypes.chunk(EmbeddingRefTypes.DOCUMENT, 3);

        assertEquals("document_chunk_3", refType);
        assertTrue(EmbeddingRefTypes.isChunk(refType));
        assertEquals("document", EmbeddingRefTypes.baseOf(refType));
        assertEquals(3, EmbeddingRefTypes.chunkIndex(refType));
    }

    @Test
    void baseRefTypeHasNoChunkIndex() {
        assertFalse(EmbeddingRefTypes.isChunk("event"));
        assertEquals("event", EmbeddingRefTypes.baseOf("event"));
        assertEquals(-1, EmbeddingRefTypes.chunkIndex("event"));
    }

    @Test
    void chunkPatternEscapesUnderscores() {
        assertEquals("document!_chunk!_%", EmbeddingRefTypes.chunkPattern("document"));
    }

    @Test
    void requireBaseRejectsUnknownTypes() {
        EmbeddingRefTypes.requireBase("document");
        assertThrows(IllegalArgumentException.class, () -> EmbeddingRefTypes.requireBase("task"));
    }
}
