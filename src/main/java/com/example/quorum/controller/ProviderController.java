package com.example.quorum.controller;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.provider.ChatProvider;
import com.example.quorum.provider.ChatProviderFactory;
import com.example.quorum.provider.ProviderSettings;
import com.example.quorum.provider.ProviderType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection tests for language model providers.
 */
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderController {

    private final ChatProviderFactory providerFactory;
    private final ChatProvider chatProvider;
    private final QuorumProperties properties;

    /**
     * Test the provider the agents are configured with.
     */
    @GetMapping("/test")
    public ResponseEntity<Map<String, Object>> testConfigured() {
        return ResponseEntity.ok(result(chatProvider.type(), properties.getLlm().getModel(), chatProvider.test()));
    }

    /**
     * Test unsaved connection settings, e.g. before switching providers.
     */
    @PostMapping("/test")
    public ResponseEntity<Map<String, Object>> test(@RequestBody Map<String, Object> body) {
        ProviderType type = ProviderType.fromValue(Requests.string(body, "provider"));
        String model = Requests.string(body, "model");
        if (model == null) {
            throw new IllegalArgumentException("Field 'model' is required");
        }
        ProviderSettings settings = new ProviderSettings(type, Requests.string(body, "base_url"), model,
                Requests.string(body, "api_key"), 0.0, 5, 30);
        settings.effectiveBaseUrl();
        return ResponseEntity.ok(result(type, model, providerFactory.create(settings).test()));
    }

    private static Map<String, Object> result(ProviderType type, String model, boolean ok) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("provider", type.value());
        body.put("model", model);
        body.put("success", ok);
        return body;
    }
}
