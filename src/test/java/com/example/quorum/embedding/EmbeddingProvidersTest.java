package com.example.quorum.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingProvidersTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OkHttpClient httpClient = new OkHttpClient();
    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String baseUrl() {
        return server.url("/").toString();
    }

    @Test
    void ollamaPostsThePrompt() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"embedding\": [0.5, -1.0, 2.25]}"));
        EmbeddingProvider provider = new OllamaEmbeddingProvider(httpClient, objectMapper, baseUrl(),
                "mxbai-embed-large");

        float[] vector = provider.embed("quarterly plan");

        assertArrayEquals(new float[]{0.5f, -1.0f, 2.25f}, vector);
        RecordedRequest request = server.takeRequest();
        assertEquals("/api/embeddings", request.getPath());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("mxbai-embed-large", body.get("model").asText());
        assertEquals("quarterly plan", body.get("prompt").asText());
        assertEquals("ollama/mxbai-embed-large", provider.describe());
    }

    @Test
    void ollamaErrorsAreProviderExceptions() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("model not found"));
        EmbeddingProvider provider = new OllamaEmbeddingProvider(httpClient, objectMapper, baseUrl(), "missing");

        EmbeddingProviderException e = assertThrows(EmbeddingProviderException.class, () -> provider.embed("x"));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    void ollamaResponseWithoutVectorIsRejected() {
        server.enqueue(new MockResponse().setBody("{\"embedding\": []}"));
        EmbeddingProvider provider = new OllamaEmbeddingProvider(httpClient, objectMapper, baseUrl(), "m");

        assertThrows(EmbeddingProviderException.class, () -> provider.embed("x"));
    }

    @Test
    void openAiSendsKeyAndDimensions() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"data": [{"index": 0, "embedding": [0.1, 0.2]}], "model": "text-embedding-3-small"}
                """));
        EmbeddingProvider provider = new OpenAiEmbeddingProvider(httpClient, objectMapper, baseUrl(),
                "text-embedding-3-small", "sk-embed", 2);

        assertArrayEquals(new float[]{0.1f, 0.2f}, provider.embed("hello"));
        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/embeddings", request.getPath());
        assertEquals("Bearer sk-embed", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("hello", body.get("input").asText());
        assertEquals(2, body.get("dimensions").asInt());
    }

    @Test
    void openAiWithoutKeyFailsBeforeCalling() {
        EmbeddingProvider provider = new OpenAiEmbeddingProvider(httpClient, objectMapper, baseUrl(),
                "text-embedding-3-small", "", 0);

        assertThrows(EmbeddingProviderException.class, () -> provider.embed("hello"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void openAiEmptyDataIsRejected() {
        server.enqueue(new MockResponse().setBody("{\"data\": []}"));
        EmbeddingProvider provider = new OpenAiEmbeddingProvider(httpClient, objectMapper, baseUrl(),
                "text-embedding-3-small", "sk", 0);

        assertThrows(EmbeddingProviderException.class, () -> provider.embed("hello"));
    }
}
