package com.example.quorum.scheduling;

import com.example.quorum.config.QuorumProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Registers one cron trigger per scheduled catalog agent once the application
 * is ready. Enablement is re-checked at fire time so a settings toggle takes
 * effect without a restart.
 */
@Slf4j
@Component
public class AgentScheduler {

    private final QuorumProperties properties;
    private final AgentCatalog catalog;
    private final AgentRunService agentRunService;
    private final TaskScheduler taskScheduler;
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public AgentScheduler(QuorumProperties properties,
                          AgentCatalog catalog,
                          AgentRunService agentRunService,
                          @Qualifier("agentTriggerScheduler") TaskScheduler taskScheduler) {
        this.properties = properties;
        this.catalog = catalog;
        this.agentRunService = agentRunService;
        this.taskScheduler = taskScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Agent scheduler disabled");
            return;
        }
        ZoneId zone = ZoneId.of(properties.getScheduler().getZone());
        for (AgentDefinition agent : catalog.all()) {
            if (!agent.isScheduled()) continue;
            ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(agent),
                    new CronTrigger(agent.springCron(), zone));
            scheduled.add(future);
            log.info("Scheduled {} ({}) at '{}' {}", agent.getName(), agent.getTier().value(), agent.getCron(), zone);
        }
    }

    void fire(AgentDefinition agent) {
        if (!agentRunService.isEnabled(agent)) {
            log.debug("Skipping disabled agent {}", agent.getName());
            return;
        }
        try {
            agentRunService.execute(agent, agentRunService.defaultWorker());
        } catch (Exception e) {
            log.error("Scheduled run of {} failed: {}", agent.getName(), e.getMessage(), e);
        }
    }

    int scheduledCount() {
        return scheduled.size();
    }

    @PreDestroy
    public synchronized void stop() {
        scheduled.forEach(f -> f.cancel(false));
        scheduled.clear();
    }
}
