package com.example.quorum.embedding;

public enum EmbeddingProviderType {
    /** Local Ollama server, POST /api/embeddings */
    OLLAMA,
    /** OpenAI or any server speaking POST /v1/embeddings */
    OPENAI
}
