package com.example.quorum.embedding;

import com.example.quorum.config.QuorumConfigurationException;

/**
 * A vector's length differs from the dimensionality the index was built with.
 * Usually means the embedding model was switched without a reindex.
 */
public class EmbeddingDimensionMismatchException extends QuorumConfigurationException {

    private final int expected;
    private final int actual;

    public EmbeddingDimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: index has " + expected + " dimensions, got " + actual
                + ". Reindex after switching embedding models.");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
