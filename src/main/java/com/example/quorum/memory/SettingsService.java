package com.example.quorum.memory;

import com.example.quorum.domain.MemoryContext;
import com.example.quorum.domain.Setting;
import com.example.quorum.repository.SettingRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value settings. Integration and agent enable flags are ordinary keys
 * ({@code integrations.<name>}, {@code agents.<name>}) holding
 * {@code {"enabled": true|false}}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    static final String INTEGRATION_PREFIX = "integrations.";
    static final String AGENT_PREFIX = "agents.";

    private final SettingRepository settingRepository;
    private final ObjectMapper objectMapper;

    public List<Setting> list(String prefix) {
        return settingRepository.findByKeyStartingWithOrderByKeyAsc(prefix == null ? "" : prefix);
    }

    public Optional<JsonNode> get(String key) {
        return settingRepository.findById(key).map(s -> parse(s.getValue()));
    }

    public Setting getSetting(String key) {
        return settingRepository.findById(key).orElseThrow(() -> NotFound.of("Setting", key));
    }

    public Setting put(MemoryContext ctx, String key, JsonNode value, String description) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Setting key is required");
        }
        if (value == null || value.isMissingNode()) {
            throw new IllegalArgumentException("Setting value is required");
        }
        Setting setting = settingRepository.findById(key).orElseGet(() -> Setting.builder().key(key).build());
        setting.setValue(value.toString());
        if (description != null) setting.setDescription(description);
        Setting saved = settingRepository.save(setting);
        log.info("Setting {} updated by {}", key, ctx.actor());
        return saved;
    }

    public void delete(MemoryContext ctx, String key) {
        settingRepository.delete(getSetting(key));
        log.info("Setting {} deleted by {}", key, ctx.actor());
    }

    // ── Enable flags ──

    public Map<String, Boolean> integrations() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (Setting s : list(INTEGRATION_PREFIX)) {
            flags.put(s.getKey().substring(INTEGRATION_PREFIX.length()), parse(s.getValue()).path("enabled").asBoolean(false));
        }
        return flags;
    }

    public boolean isIntegrationEnabled(String name) {
        return get(INTEGRATION_PREFIX + name).map(v -> v.path("enabled").asBoolean(false)).orElse(false);
    }

    public Setting setIntegrationEnabled(MemoryContext ctx, String name, boolean enabled) {
        return put(ctx, INTEGRATION_PREFIX + name, objectMapper.createObjectNode().put("enabled", enabled),
                "Integration " + name + " enabled flag");
    }

    /** Stored enable override for an agent, empty when none was set. */
    public Optional<Boolean> agentEnabledOverride(String agentName) {
        return get(AGENT_PREFIX + agentName)
                .filter(v -> v.has("enabled"))
                .map(v -> v.get("enabled").asBoolean());
    }

    public Setting setAgentEnabled(MemoryContext ctx, String agentName, boolean enabled) {
        return put(ctx, AGENT_PREFIX + agentName, objectMapper.createObjectNode().put("enabled", enabled),
                "Agent " + agentName + " enabled flag");
    }

    private JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored setting is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
