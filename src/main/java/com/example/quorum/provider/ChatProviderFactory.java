package com.example.quorum.provider;

import com.example.quorum.config.QuorumProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link ChatProvider} variant for a {@link ProviderType}. The only
 * place that switches on the type.
 */
@Component
@RequiredArgsConstructor
public class ChatProviderFactory {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ChatProvider create(QuorumProperties.LlmConfig cfg) {
        return create(new ProviderSettings(cfg.getProvider(), cfg.getBaseUrl(), cfg.getModel(), cfg.getApiKey(),
                cfg.getTemperature(), cfg.getMaxTokens(), cfg.getTimeoutSeconds()));
    }

    public ChatProvider create(ProviderSettings settings) {
        return switch (settings.type()) {
            case OPENAI, OPENROUTER, CUSTOM -> new OpenAiChatProvider(settings, httpClient, objectMapper);
            case ANTHROPIC -> new AnthropicChatProvider(settings, httpClient, objectMapper);
            case GOOGLE -> new GoogleChatProvider(settings, httpClient, objectMapper);
        };
    }
}
