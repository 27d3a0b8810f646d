package com.example.quorum.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.util.List;

/**
 * Google Gemini generateContent API. Assistant turns map to the "model" role.
 */
public class GoogleChatProvider extends AbstractHttpChatProvider {

    public GoogleChatProvider(ProviderSettings settings, OkHttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
    }

    @Override
    protected Request buildRequest(List<ChatMessage> messages, ChatOptions options, boolean stream) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();

        String system = systemPrompt(messages);
        if (system != null) {
            root.putObject("systemInstruction").putArray("parts").addObject().put("text", system);
        }

        ArrayNode contents = root.putArray("contents");
        for (ChatMessage msg : messages) {
            if (msg.role() == ChatMessage.Role.SYSTEM) continue;
            ObjectNode content = contents.addObject();
            content.put("role", msg.role() == ChatMessage.Role.ASSISTANT ? "model" : "user");
            content.putArray("parts").addObject().put("text", msg.content());
        }

        ObjectNode generation = root.putObject("generationConfig");
        generation.put("temperature", options.temperatureOr(settings.temperature()));
        generation.put("maxOutputTokens", options.maxTokensOr(settings.maxTokens()));
        if (options.topP() != null) generation.put("topP", options.topP());

        String method = stream ? ":streamGenerateContent" : ":generateContent";
        HttpUrl.Builder url = HttpUrl.get(baseUrl + "/models/" + settings.model() + method).newBuilder()
                .addQueryParameter("key", settings.apiKey() != null ? settings.apiKey() : "");
        if (stream) url.addQueryParameter("alt", "sse");

        return new Request.Builder()
                .url(url.build())
                .post(jsonBody(root))
                .build();
    }

    @Override
    protected ChatResult parseResponse(JsonNode root) {
        JsonNode usage = root.path("usageMetadata");
        return new ChatResult(candidateText(root),
                usage.path("promptTokenCount").asInt(), usage.path("candidatesTokenCount").asInt());
    }

    @Override
    protected String parseStreamData(JsonNode data) {
        return candidateText(data);
    }

    private static String candidateText(JsonNode root) {
        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) return "";
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            text.append(part.path("text").asText());
        }
        return text.toString();
    }
}
