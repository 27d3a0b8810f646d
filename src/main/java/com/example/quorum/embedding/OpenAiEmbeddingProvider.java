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
 * Calls the OpenAI {@code /v1/embeddings} endpoint, or any server compatible
 * with it.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    private static final MediaType JSON_MEDIA = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final int dimensions;

    public OpenAiEmbeddingProvider(OkHttpClient httpClient, ObjectMapper objectMapper,
                                   String baseUrl, String model, String apiKey, int dimensions) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = OllamaEmbeddingProvider.stripTrailingSlash(
                baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
        this.model = model;
        this.apiKey = apiKey;
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) throws EmbeddingProviderException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new EmbeddingProviderException("No API key configured for OpenAI embeddings");
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("input", text);
        if (dimensions > 0) {
            body.put("dimensions", dimensions);
        }

        try {
            Request request = new Request.Builder()
                    .url(baseUrl + "/v1/embeddings")
                    .addHeader("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON_MEDIA))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                String responseBody = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    throw new EmbeddingProviderException(
                            "Embedding API error " + response.code() + ": " + responseBody);
                }
                JsonNode data = objectMapper.readTree(responseBody).path("data");
                if (!data.isArray() || data.isEmpty()) {
                    throw new EmbeddingProviderException("Embedding API returned no data");
                }
                return EmbeddingVectors.fromJson(data.get(0).path("embedding"), "OpenAI");
            }
        } catch (IOException e) {
            throw new EmbeddingProviderException("Embedding API call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "openai/" + model;
    }
}
