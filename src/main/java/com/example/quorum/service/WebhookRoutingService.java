package com.example.quorum.service;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.*;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.EventService.NewEvent;
import com.example.quorum.memory.ObservationService;
import com.example.quorum.memory.ObservationService.NewObservation;
import com.example.quorum.memory.ObservationService.UpsertResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Routes n8n workflow deliveries into the memory store. Observations go
 * through the fingerprint upsert; everything else lands in a council thread
 * as a council response so it shows up next to the conversation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookRoutingService {

    public static final List<String> SUPPORTED_EVENTS = List.of(
            "observation", "chat", "agent_trigger", "workflow_complete", "workflow_error");

    private final ObservationService observationService;
    private final EventService eventService;
    private final ObjectMapper objectMapper;
    private final QuorumProperties properties;

    public WebhookReceipt route(WebhookEvent event) {
        if (event.eventType() == null || event.eventType().isBlank()) {
            throw new IllegalArgumentException("event_type is required and must be a string");
        }
        if (event.sourceWorkflow() == null || event.sourceWorkflow().isBlank()) {
            throw new IllegalArgumentException("source_workflow is required and must be a string");
        }
        Map<String, Object> data = event.data() != null ? event.data() : Map.of();
        String workflow = event.sourceWorkflow().trim();
        log.info("n8n webhook '{}' from workflow {}", event.eventType(), workflow);

        return switch (event.eventType()) {
            case "observation" -> storeObservation(workflow, data, event.metadata());
            case "chat" -> storeCouncilEvent(event, textOr(data, "message"),
                    stringOrNull(data, "thread_id"), stringOrNull(data, "thread_title"), "Chat message stored");
            case "agent_trigger" -> storeCouncilEvent(event,
                    "Agent trigger request from " + workflow + ": " + json(data),
                    null, null, "Agent trigger queued");
            case "workflow_complete" -> storeCouncilEvent(event,
                    "Workflow " + workflow + " completed: " + json(data),
                    null, null, "Workflow completion recorded");
            case "workflow_error" -> storeCouncilEvent(event,
                    "Workflow " + workflow + " error: " + textOr(data, "error"),
                    null, null, "Workflow error recorded");
            default -> storeCouncilEvent(event,
                    "Unknown webhook event from " + workflow + ": " + json(data),
                    null, null, "Generic event stored");
        };
    }

    /**
     * Check a delivery against the configured secret. The signature is the hex
     * HMAC-SHA256 of the raw request body. Without a secret every delivery passes.
     */
    public boolean verifySignature(String rawBody, String signature) {
        String secret = properties.getWebhooks().getN8nSecret();
        if (secret == null || secret.isBlank()) {
            return true;
        }
        if (signature == null || signature.isBlank()) {
            return false;
        }
        String expected = sign(secret, rawBody);
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    static String sign(String secret, String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    private WebhookReceipt storeObservation(String workflow, Map<String, Object> data, Map<String, Object> metadata) {
        String category = stringOrNull(data, "category");
        String severity = stringOrNull(data, "severity");
        String status = stringOrNull(data, "status");
        String refType = stringOrNull(data, "ref_type");
        String sourceAgent = stringOrNull(data, "source_agent");
        NewObservation request = new NewObservation(
                category != null ? ObservationCategory.fromValue(category) : ObservationCategory.INSIGHT,
                severity != null ? ObservationSeverity.fromValue(severity) : null,
                status != null ? ObservationStatus.fromValue(status) : null,
                textOr(data, "content"),
                sourceAgent != null ? sourceAgent : workflow,
                stringOrNull(data, "ref_id"),
                refType != null ? ObservationRefType.fromValue(refType) : null,
                metadata);
        UpsertResult result = observationService.create(MemoryContext.agent(workflow), request);
        return new WebhookReceipt(result.created() ? "Observation stored" : "Observation refreshed",
                Map.of("observation_id", result.observation().getId(), "created", result.created()));
    }

    private WebhookReceipt storeCouncilEvent(WebhookEvent event, String description, String threadId,
                                             String threadTitle, String message) {
        boolean defaultThread = threadId == null;
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (event.metadata() != null) {
            metadata.putAll(event.metadata());
        }
        metadata.put("target_agent", "quorum");
        metadata.put("sender", "council");
        metadata.put("source", "n8n");
        metadata.put("source_workflow", event.sourceWorkflow().trim());
        metadata.put("webhook_event", event.eventType());
        Event saved = eventService.append(MemoryContext.agent(event.sourceWorkflow().trim()), new NewEvent(
                Event.COUNCIL_RESPONSE, "Response from The Quorum", description, metadata, null, null,
                defaultThread ? EventService.DEFAULT_THREAD_ID : threadId,
                threadTitle != null ? threadTitle
                        : defaultThread ? EventService.DEFAULT_THREAD_TITLE : eventService.threadTitle(threadId)));
        return new WebhookReceipt(message, Map.of("event_id", saved.getId()));
    }

    /** The field as text, or the whole payload as JSON when it is missing. */
    private String textOr(Map<String, Object> data, String field) {
        Object value = data.get(field);
        return value != null ? String.valueOf(value) : json(data);
    }

    private static String stringOrNull(Map<String, Object> data, String field) {
        Object value = data.get(field);
        if (value == null) return null;
        String s = String.valueOf(value);
        return s.isBlank() ? null : s.trim();
    }

    private String json(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook data is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public record WebhookEvent(String eventType, String sourceWorkflow, Map<String, Object> data,
                               Map<String, Object> metadata) {
    }

    /**
     * @param data ids of what was stored, keyed {@code observation_id} or {@code event_id}
     */
    public record WebhookReceipt(String message, Map<String, Object> data) {
    }
}
