package com.example.quorum.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;

/**
 * Embeddings from a local Ollama server via {@code POST /api/embeddings}.
 */
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final MediaType JSON_MEDIA = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;

    public OllamaEmbeddingProvider(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String model) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
        this.model = model;
    }

    @Override
    public float[] embed(String text) throws EmbeddingProviderException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("prompt", text);

        try {
            Request request = new Request.Builder()
                    .url(baseUrl + "/api/embeddings")
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON_MEDIA))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                String responseBody = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    throw new EmbeddingProviderException(
                            "Ollama embedding failed with HTTP " + response.code() + ": " + responseBody);
                }
                JsonNode embedding = objectMapper.readTree(responseBody).path("embedding");
                return EmbeddingVectors.fromJson(embedding, "Ollama");
            }
        } catch (IOException e) {
            throw new EmbeddingProviderException("Ollama unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "ollama/" + model;
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
