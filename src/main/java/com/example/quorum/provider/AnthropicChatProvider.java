package com.example.quorum.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.util.List;

/**
 * Anthropic Messages API. System turns go into the top-level "system" field.
 */
public class AnthropicChatProvider extends AbstractHttpChatProvider {

    static final String API_VERSION = "2023-06-01";

    public AnthropicChatProvider(ProviderSettings settings, OkHttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
    }

    @Override
    protected Request buildRequest(List<ChatMessage> messages, ChatOptions options, boolean stream) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", settings.model());
        root.put("temperature", options.temperatureOr(settings.temperature()));
        root.put("max_tokens", options.maxTokensOr(settings.maxTokens()));
        if (options.topP() != null) root.put("top_p", options.topP());
        if (stream) root.put("stream", true);

        String system = systemPrompt(messages);
        if (system != null) root.put("system", system);

        ArrayNode messagesArray = root.putArray("messages");
        for (ChatMessage msg : messages) {
            if (msg.role() == ChatMessage.Role.SYSTEM) continue;
            ObjectNode msgNode = messagesArray.addObject();
            msgNode.put("role", msg.role().value());
            msgNode.put("content", msg.content());
        }

        return new Request.Builder()
                .url(baseUrl + "/messages")
                .addHeader("x-api-key", settings.apiKey() != null ? settings.apiKey() : "")
                .addHeader("anthropic-version", API_VERSION)
                .post(jsonBody(root))
                .build();
    }

    @Override
    protected ChatResult parseResponse(JsonNode root) {
        StringBuilder content = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                content.append(block.path("text").asText());
            }
        }
        JsonNode usage = root.path("usage");
        return new ChatResult(content.toString(),
                usage.path("input_tokens").asInt(), usage.path("output_tokens").asInt());
    }

    @Override
    protected String parseStreamData(JsonNode data) {
        if (!"content_block_delta".equals(data.path("type").asText())) return null;
        JsonNode delta = data.path("delta");
        return "text_delta".equals(delta.path("type").asText()) ? delta.path("text").asText() : null;
    }
}
