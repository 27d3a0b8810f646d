package com.example.quorum.scheduling;

import com.example.quorum.domain.AgentTier;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One scheduled agent as declared in the agent catalog.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentDefinition {

    private String name;
    private String displayName;
    private AgentTier tier;
    /** Five-field unix cron ("0 6 * * *"), or blank for agents that only run on demand. */
    private String cron;
    private String description;
    /** Role instructions handed to the language model when the agent runs. */
    private String prompt;
    @Builder.Default
    private boolean enabled = true;

    public boolean isScheduled() {
        return cron != null && !cron.isBlank();
    }

    /**
     * The cron expression in Spring's six-field form (seconds first).
     */
    public String springCron() {
        String trimmed = cron.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }
}
