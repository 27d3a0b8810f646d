package com.example.quorum.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import okio.BufferedSource;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp plumbing shared by the provider variants: JSON POST for one-shot
 * completions and server-sent-event parsing for streams. Subclasses supply
 * the request shape and pick text out of responses.
 */
@Slf4j
abstract class AbstractHttpChatProvider implements ChatProvider {

    protected static final MediaType JSON = MediaType.get("application/json");

    protected final ProviderSettings settings;
    protected final ObjectMapper objectMapper;
    protected final String baseUrl;
    private final OkHttpClient httpClient;

    protected AbstractHttpChatProvider(ProviderSettings settings, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.baseUrl = settings.effectiveBaseUrl();
        this.httpClient = httpClient.newBuilder()
                .readTimeout(settings.timeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public ProviderType type() {
        return settings.type();
    }

    protected abstract Request buildRequest(List<ChatMessage> messages, ChatOptions options, boolean stream)
            throws IOException;

    protected abstract ChatResult parseResponse(JsonNode root);

    /** Text delta carried by one SSE data payload, or null if it carries none. */
    protected abstract String parseStreamData(JsonNode data);

    @Override
    public ChatResult chat(List<ChatMessage> messages, ChatOptions options) {
        try {
            Request request = buildRequest(messages, options, false);
            try (Response response = httpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    log.error("{} API error: {} - {}", type().value(), response.code(), body);
                    throw new ChatProviderException(type().value() + " API error " + response.code(),
                            response.code(), null);
                }
                return parseResponse(objectMapper.readTree(body));
            }
        } catch (IOException e) {
            throw new ChatProviderException("Failed to communicate with " + type().value() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Flux<String> chatStream(List<ChatMessage> messages, ChatOptions options) {
        return Flux.<String>create(sink -> {
            Call call;
            try {
                call = httpClient.newCall(buildRequest(messages, options, true));
            } catch (IOException e) {
                sink.error(new ChatProviderException("Failed to build " + type().value() + " request", e));
                return;
            }
            sink.onCancel(call::cancel);

            try (Response response = call.execute()) {
                if (!response.isSuccessful()) {
                    String body = response.body() != null ? response.body().string() : "";
                    sink.error(new ChatProviderException(type().value() + " API error " + response.code()
                            + ": " + body, response.code(), null));
                    return;
                }
                BufferedSource source = response.body().source();
                String line;
                while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
                    if (!line.startsWith("data:")) continue;
                    String data = line.substring(5).trim();
                    if (data.isEmpty()) continue;
                    if ("[DONE]".equals(data)) break;
                    String delta = parseStreamData(objectMapper.readTree(data));
                    if (delta != null && !delta.isEmpty()) {
                        sink.next(delta);
                    }
                }
                sink.complete();
            } catch (IOException e) {
                if (!sink.isCancelled()) {
                    sink.error(new ChatProviderException(type().value() + " stream failed: " + e.getMessage(), e));
                }
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public boolean test() {
        try {
            chat(List.of(ChatMessage.user("Hello")), ChatOptions.maxTokens(5));
            return true;
        } catch (ChatProviderException e) {
            log.warn("{} connection test failed: {}", type().value(), e.getMessage());
            return false;
        }
    }

    protected RequestBody jsonBody(JsonNode node) throws IOException {
        return RequestBody.create(objectMapper.writeValueAsString(node), JSON);
    }

    protected static String systemPrompt(List<ChatMessage> messages) {
        StringBuilder sb = new StringBuilder();
        for (ChatMessage m : messages) {
            if (m.role() == ChatMessage.Role.SYSTEM) {
                if (sb.length() > 0) sb.append("\n\n");
                sb.append(m.content());
            }
        }
        return sb.length() > 0 ? sb.toString() : null;
    }
}
