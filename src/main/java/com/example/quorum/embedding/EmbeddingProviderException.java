package com.example.quorum.embedding;

/**
 * The embedding provider could not produce a vector (unreachable, non-2xx,
 * malformed response).
 */
public class EmbeddingProviderException extends Exception {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
