package com.example.quorum.notification;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.NotificationOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;

/**
 * Delivers agent notifications to Slack through an incoming webhook. Only
 * called through the notification gate, which applies quiet hours.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final QuorumProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    private static final MediaType JSON = MediaType.get("application/json");

    public boolean isConfigured() {
        QuorumProperties.NotificationConfig.SlackConfig slack = properties.getNotifications().getSlack();
        return slack.isEnabled() && slack.getWebhookUrl() != null && !slack.getWebhookUrl().isBlank();
    }

    /**
     * Post one message for an agent.
     *
     * @return NONE when no channel is configured
     */
    public NotificationOutcome send(String agentDisplayName, String title, String message) {
        if (!isConfigured()) {
            log.debug("No notification channel configured, dropping '{}' from {}", title, agentDisplayName);
            return NotificationOutcome.NONE;
        }

        try {
            Map<String, Object> payload = Map.of(
                    "text", String.format(":speech_balloon: *%s: %s*\n%s", agentDisplayName, title,
                            message != null ? message : ""),
                    "username", "The Quorum",
                    "icon_emoji", ":robot_face:"
            );

            String json = objectMapper.writeValueAsString(payload);
            Request request = new Request.Builder()
                    .url(properties.getNotifications().getSlack().getWebhookUrl())
                    .post(RequestBody.create(json, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.info("Slack notification sent for {}: {}", agentDisplayName, title);
                    return NotificationOutcome.DELIVERED;
                }
                log.error("Slack notification failed: {}", response.code());
                return NotificationOutcome.FAILED;
            }
        } catch (IOException e) {
            log.error("Failed to send Slack notification: {}", e.getMessage());
            return NotificationOutcome.FAILED;
        }
    }
}
