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
 * OpenAI chat completions. Also serves OpenRouter and any OpenAI-compatible
 * server (LM Studio, vLLM) through the base URL.
 */
public class OpenAiChatProvider extends AbstractHttpChatProvider {

    public OpenAiChatProvider(ProviderSettings settings, OkHttpClient httpClient, ObjectMapper objectMapper) {
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

        ArrayNode messagesArray = root.putArray("messages");
        for (ChatMessage msg : messages) {
            ObjectNode msgNode = messagesArray.addObject();
            msgNode.put("role", msg.role().value());
            msgNode.put("content", msg.content());
        }

        Request.Builder builder = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .post(jsonBody(root));
        if (settings.apiKey() != null && !settings.apiKey().isBlank()) {
            builder.addHeader("Authorization", "Bearer " + settings.apiKey());
        }
        return builder.build();
    }

    @Override
    protected ChatResult parseResponse(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ChatProviderException("No choices in " + type().value() + " response");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        JsonNode usage = root.path("usage");
        return new ChatResult(content.isNull() || content.isMissingNode() ? "" : content.asText(),
                usage.path("prompt_tokens").asInt(), usage.path("completion_tokens").asInt());
    }

    @Override
    protected String parseStreamData(JsonNode data) {
        JsonNode choices = data.path("choices");
        if (!choices.isArray() || choices.isEmpty()) return null;
        JsonNode content = choices.get(0).path("delta").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
