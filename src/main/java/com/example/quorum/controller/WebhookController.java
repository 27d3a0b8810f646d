package com.example.quorum.controller;

import com.example.quorum.service.WebhookRoutingService;
import com.example.quorum.service.WebhookRoutingService.WebhookEvent;
import com.example.quorum.service.WebhookRoutingService.WebhookReceipt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound deliveries from n8n workflows.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks/n8n")
@RequiredArgsConstructor
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-N8n-Signature";

    private final WebhookRoutingService routingService;
    private final ObjectMapper objectMapper;

    @GetMapping
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("message", "N8n webhook endpoint is active");
        body.put("supported_events", WebhookRoutingService.SUPPORTED_EVENTS);
        return ResponseEntity.ok(body);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> receive(@RequestBody String rawBody,
                                                       @RequestHeader(value = SIGNATURE_HEADER, required = false)
                                                       String signature) {
        if (!routingService.verifySignature(rawBody, signature)) {
            log.warn("Rejected n8n delivery with a missing or invalid signature");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid webhook signature");
        }
        Map<String, Object> body = parse(rawBody);
        WebhookReceipt receipt = routingService.route(new WebhookEvent(
                Requests.string(body, "event_type"),
                Requests.string(body, "source_workflow"),
                Requests.map(body, "data"),
                Requests.map(body, "metadata")));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", receipt.message());
        response.put("data", receipt.data());
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> parse(String rawBody) {
        try {
            Map<String, Object> body = objectMapper.readValue(rawBody, new TypeReference<>() {
            });
            if (body == null) {
                throw new IllegalArgumentException("Request body must be a JSON object");
            }
            return body;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
    }
}
