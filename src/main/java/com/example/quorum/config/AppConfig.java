package com.example.quorum.config;

import com.example.quorum.embedding.EmbeddingProvider;
import com.example.quorum.embedding.OllamaEmbeddingProvider;
import com.example.quorum.embedding.OpenAiEmbeddingProvider;
import com.example.quorum.provider.ChatProvider;
import com.example.quorum.provider.ChatProviderFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EmbeddingProvider embeddingProvider(QuorumProperties properties, OkHttpClient httpClient,
                                               ObjectMapper objectMapper) {
        QuorumProperties.EmbeddingConfig cfg = properties.getEmbedding();
        OkHttpClient client = httpClient.newBuilder()
                .readTimeout(cfg.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        EmbeddingProvider provider = switch (cfg.getProvider()) {
            case OLLAMA -> new OllamaEmbeddingProvider(client, objectMapper, cfg.getBaseUrl(), cfg.getModel());
            case OPENAI -> new OpenAiEmbeddingProvider(client, objectMapper, cfg.getBaseUrl(), cfg.getModel(),
                    cfg.getApiKey(), cfg.getDimensions());
        };
        log.info("Embedding provider: {}", provider.describe());
        return provider;
    }

    @Bean
    public ChatProvider chatProvider(ChatProviderFactory factory, QuorumProperties properties) {
        return factory.create(properties.getLlm());
    }
}
