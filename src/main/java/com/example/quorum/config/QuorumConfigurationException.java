package com.example.quorum.config;

/**
 * The engine is configured in a way it cannot run with: a missing reasoning
 * binary, an embedding model that changed dimensionality. Never caught by the
 * engine itself.
 */
public class QuorumConfigurationException extends RuntimeException {

    public QuorumConfigurationException(String message) {
        super(message);
    }

    public QuorumConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
