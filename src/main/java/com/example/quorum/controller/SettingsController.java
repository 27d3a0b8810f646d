package com.example.quorum.controller;

import com.example.quorum.domain.MemoryContext;
import com.example.quorum.domain.Setting;
import com.example.quorum.memory.SettingsService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Key/value settings and integration enable flags.
 */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping
    public ResponseEntity<List<Setting>> list(@RequestParam(required = false) String prefix) {
        return ResponseEntity.ok(settingsService.list(prefix));
    }

    @GetMapping("/{key}")
    public ResponseEntity<Setting> get(@PathVariable String key) {
        return ResponseEntity.ok(settingsService.getSetting(key));
    }

    /**
     * Body: {"value": any JSON, "description": "..."}.
     */
    @PutMapping("/{key}")
    public ResponseEntity<Setting> put(@PathVariable String key, @RequestBody JsonNode body) {
        JsonNode description = body.get("description");
        return ResponseEntity.ok(settingsService.put(MemoryContext.user(), key, body.get("value"),
                description != null && !description.isNull() ? description.asText() : null));
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String key) {
        settingsService.delete(MemoryContext.user(), key);
        return ResponseEntity.ok(Map.of("deleted", key));
    }

    @GetMapping("/integrations")
    public ResponseEntity<Map<String, Boolean>> integrations() {
        return ResponseEntity.ok(settingsService.integrations());
    }

    @PutMapping("/integrations/{name}")
    public ResponseEntity<Map<String, Object>> setIntegration(@PathVariable String name,
                                                              @RequestBody Map<String, Object> body) {
        Boolean enabled = Requests.bool(body, "enabled");
        if (enabled == null) {
            throw new IllegalArgumentException("Field 'enabled' is required");
        }
        settingsService.setIntegrationEnabled(MemoryContext.user(), name, enabled);
        return ResponseEntity.ok(Map.of("integration", name, "enabled", enabled));
    }
}
