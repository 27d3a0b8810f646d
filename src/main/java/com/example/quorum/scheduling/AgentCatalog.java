package com.example.quorum.scheduling;

import com.example.quorum.config.QuorumConfigurationException;
import com.example.quorum.config.QuorumProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * The built-in agents, loaded from the YAML catalog with per-agent cron and
 * enablement overrides from {@code quorum.scheduler.agents.<name>}.
 */
@Slf4j
@Component
public class AgentCatalog {

    private final QuorumProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private volatile Map<String, AgentDefinition> agents = Map.of();

    public AgentCatalog(QuorumProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void load() {
        String location = properties.getScheduler().getCatalog();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new QuorumConfigurationException("Agent catalog not found: " + location);
        }
        CatalogFile file;
        try (InputStream in = resource.getInputStream()) {
            file = yamlMapper.readValue(in, CatalogFile.class);
        } catch (IOException e) {
            throw new QuorumConfigurationException("Failed to parse agent catalog " + location, e);
        }

        Map<String, AgentDefinition> loaded = new LinkedHashMap<>();
        for (AgentDefinition agent : file.getAgents()) {
            AgentDefinition effective = applyOverride(agent);
            validate(effective, location);
            if (loaded.put(effective.getName(), effective) != null) {
                throw new QuorumConfigurationException("Duplicate agent '" + effective.getName() + "' in " + location);
            }
        }
        this.agents = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} agents from {}", loaded.size(), location);
    }

    public List<AgentDefinition> all() {
        return List.copyOf(agents.values());
    }

    public Optional<AgentDefinition> find(String name) {
        return Optional.ofNullable(name).map(agents::get);
    }

    /**
     * @throws IllegalArgumentException for a name not in the catalog
     */
    public AgentDefinition require(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Missing agent name");
        }
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + name));
    }

    private AgentDefinition applyOverride(AgentDefinition agent) {
        QuorumProperties.SchedulerConfig.AgentOverride override = properties.getScheduler().getAgents().get(agent.getName());
        if (override == null) return agent;
        AgentDefinition.AgentDefinitionBuilder builder = agent.toBuilder();
        if (override.getCron() != null) builder.cron(override.getCron());
        if (override.getEnabled() != null) builder.enabled(override.getEnabled());
        return builder.build();
    }

    private static void validate(AgentDefinition agent, String location) {
        if (agent.getName() == null || agent.getName().isBlank()) {
            throw new QuorumConfigurationException("Agent without a name in " + location);
        }
        if (agent.getTier() == null) {
            throw new QuorumConfigurationException("Agent '" + agent.getName() + "' has no tier");
        }
        if (agent.getDisplayName() == null) {
            agent.setDisplayName(agent.getName());
        }
        if (agent.isScheduled() && !CronExpression.isValidExpression(agent.springCron())) {
            throw new QuorumConfigurationException("Agent '" + agent.getName() + "' has invalid cron '"
                    + agent.getCron() + "'");
        }
    }

    @Data
    static class CatalogFile {
        private List<AgentDefinition> agents = new ArrayList<>();
    }
}
