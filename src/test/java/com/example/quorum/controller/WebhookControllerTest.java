package com.example.quorum.controller;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.Event;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.ObservationService;
import com.example.quorum.service.WebhookRoutingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WebhookControllerTest {

    private static final String SECRET = "s3cret";
    private static final String BODY =
            "{\"event_type\":\"workflow_complete\",\"source_workflow\":\"nightly-digest\",\"data\":{\"items\":3}}";

    private final EventService eventService = mock(EventService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        QuorumProperties properties = new QuorumProperties();
        properties.getWebhooks().setN8nSecret(SECRET);
        ObjectMapper objectMapper = new ObjectMapper();
        WebhookRoutingService routing = new WebhookRoutingService(mock(ObservationService.class), eventService,
                objectMapper, properties);
        when(eventService.append(any(), any())).thenReturn(Event.builder().id("evt-9").build());
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookController(routing, objectMapper))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void signedDeliveryIsAccepted() throws Exception {
        mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(WebhookController.SIGNATURE_HEADER, hmac(SECRET, BODY))
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.event_id").value("evt-9"));
    }

    @Test
    void unsignedDeliveryIsRejectedWhenASecretIsSet() throws Exception {
        mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid webhook signature"));

        mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(WebhookController.SIGNATURE_HEADER, hmac("wrong", BODY))
                        .content(BODY))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(eventService);
    }

    private static String hmac(String secret, String body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    }
}
