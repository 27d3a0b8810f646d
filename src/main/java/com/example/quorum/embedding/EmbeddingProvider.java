package com.example.quorum.embedding;

/**
 * Turns text into a fixed-length vector.
 */
public interface EmbeddingProvider {

    float[] embed(String text) throws EmbeddingProviderException;

    /** Short label for logs and status output, e.g. "ollama/mxbai-embed-large". */
    String describe();
}
