package com.example.quorum.config;

import com.example.quorum.embedding.EmbeddingProviderType;
import com.example.quorum.provider.ProviderType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Central configuration for the Quorum engine.
 * Maps to the 'quorum' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "quorum")
public class QuorumProperties {

    private EmbeddingConfig embedding = new EmbeddingConfig();
    private ReasoningConfig reasoning = new ReasoningConfig();
    private LlmConfig llm = new LlmConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private WebhookConfig webhooks = new WebhookConfig();

    @Data
    public static class EmbeddingConfig {
        private boolean enabled = true;
        private EmbeddingProviderType provider = EmbeddingProviderType.OLLAMA;
        /** Blank means the provider's default (local Ollama, or api.openai.com). */
        private String baseUrl = "";
        private String model = "mxbai-embed-large";
        private String apiKey = "";
        /** Expected vector length; 0 means "whatever the first stored vector has". */
        private int dimensions = 0;
        private int timeoutSeconds = 30;
        private int cacheSize = 2000;
        private boolean backfillOnStartup = true;
        private ChunkingConfig chunking = new ChunkingConfig();

        @Data
        public static class ChunkingConfig {
            private int targetSize = 500;
            private int overlap = 50;
            /** Content at or below this length embeds as a single vector. */
            private int threshold = 2000;
        }
    }

    @Data
    public static class ReasoningConfig {
        /** Explicit path to the reasoning binary. Blank triggers discovery at startup. */
        private String binaryPath = "";
        private boolean failFast = false;
        private int chatTimeoutSeconds = 120;
        private int councilTimeoutSeconds = 180;
        private int analysisTimeoutSeconds = 120;
        private boolean terminateOnDisconnect = true;
        /**
         * Sessions that may run at once. Each holds two orchestrator threads;
         * requests beyond the limit get the stream-failed reply.
         */
        private int maxConcurrentSessions = 32;
    }

    @Data
    public static class LlmConfig {
        private ProviderType provider = ProviderType.OPENAI;
        private String baseUrl = "";
        private String model = "gpt-4o";
        private String apiKey = "";
        private double temperature = 0.7;
        private int maxTokens = 4096;
        private int timeoutSeconds = 120;
    }

    @Data
    public static class SchedulerConfig {
        private boolean enabled = false;
        private String zone = "UTC";
        private String catalog = "classpath:agents.yml";
        private int lookbackHours = 24;
        private QuietHoursConfig quietHours = new QuietHoursConfig();
        private Map<String, AgentOverride> agents = new HashMap<>();

        @Data
        public static class QuietHoursConfig {
            private boolean enabled = true;
            private int startHour = 22;
            private int endHour = 7;
        }

        @Data
        public static class AgentOverride {
            private String cron;
            private Boolean enabled;
        }
    }

    @Data
    public static class NotificationConfig {
        private SlackConfig slack = new SlackConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }
    }

    @Data
    public static class WebhookConfig {
        /** Shared secret for the n8n webhook. Blank accepts unsigned deliveries. */
        private String n8nSecret = "";
    }
}
