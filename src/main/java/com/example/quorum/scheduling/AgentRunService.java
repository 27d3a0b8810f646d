package com.example.quorum.scheduling;

import com.example.quorum.config.QuorumConfigurationException;
import com.example.quorum.domain.*;
import com.example.quorum.memory.DocumentService;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.ObservationService;
import com.example.quorum.memory.SettingsService;
import com.example.quorum.memory.TaskService;
import com.example.quorum.repository.AgentRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.function.Consumer;

/**
 * Runs one agent: records the run, persists its findings through the memory
 * services within the agent's tier, then offers the notification to the
 * gate. Findings are always written before any notification decision, so
 * quiet hours never lose data.
 */
@Slf4j
@Service
public class AgentRunService {

    private final AgentRunRepository agentRunRepository;
    private final DocumentService documentService;
    private final EventService eventService;
    private final TaskService taskService;
    private final ObservationService observationService;
    private final SettingsService settingsService;
    private final NotificationGate notificationGate;
    private final AgentCatalog catalog;
    private final AgentWorker defaultWorker;
    private final Clock clock;

    public AgentRunService(AgentRunRepository agentRunRepository,
                           DocumentService documentService,
                           EventService eventService,
                           TaskService taskService,
                           ObservationService observationService,
                           SettingsService settingsService,
                           NotificationGate notificationGate,
                           AgentCatalog catalog,
                           AgentWorker defaultWorker,
                           Clock clock) {
        this.agentRunRepository = agentRunRepository;
        this.documentService = documentService;
        this.eventService = eventService;
        this.taskService = taskService;
        this.observationService = observationService;
        this.settingsService = settingsService;
        this.notificationGate = notificationGate;
        this.catalog = catalog;
        this.defaultWorker = defaultWorker;
        this.clock = clock;
    }

    public AgentRun execute(AgentDefinition agent, AgentWorker worker) {
        MemoryContext ctx = MemoryContext.agent(agent.getName());
        AgentRun run = agentRunRepository.save(AgentRun.builder()
                .agentName(agent.getName())
                .tier(agent.getTier())
                .status(AgentRunStatus.RUNNING)
                .startedAt(clock.instant())
                .build());
        log.info("Agent run {} started: {} ({})", run.getId(), agent.getName(), agent.getTier().value());

        AgentFindings findings;
        try {
            findings = worker.run(agent, ctx);
        } catch (RuntimeException e) {
            log.error("Agent {} failed: {}", agent.getName(), e.getMessage(), e);
            run.setStatus(AgentRunStatus.FAILED);
            run.setErrorMessage(truncate(e.getMessage(), 2000));
            run.setCompletedAt(clock.instant());
            return agentRunRepository.save(run);
        }
        if (findings == null) {
            findings = AgentFindings.empty(null);
        }

        Tally tally = new Tally();
        NotificationOutcome notification;
        try {
            persist(agent, RecordKind.DOCUMENT, findings.documents(), d -> documentService.create(ctx, d), tally);
            persist(agent, RecordKind.EVENT, findings.events(), e -> eventService.append(ctx, e), tally);
            persist(agent, RecordKind.TASK, findings.tasks(), t -> taskService.create(ctx, t), tally);
            persist(agent, RecordKind.OBSERVATION, findings.observations(), o -> observationService.create(ctx, o), tally);

            notification = notificationGate.offer(agent, findings.notification());
        } catch (RuntimeException e) {
            log.error("Agent {} failed while storing findings after {} records: {}",
                    agent.getName(), tally.written, e.getMessage(), e);
            run.setStatus(AgentRunStatus.FAILED);
            run.setSummary(findings.summary());
            run.setRecordsWritten(tally.written);
            run.setRecordsRejected(tally.rejected);
            run.setErrorMessage(truncate(e.getMessage(), 2000));
            run.setCompletedAt(clock.instant());
            AgentRun failed = agentRunRepository.save(run);
            if (e instanceof QuorumConfigurationException) {
                throw e;
            }
            return failed;
        }

        run.setStatus(AgentRunStatus.COMPLETED);
        run.setSummary(findings.summary());
        run.setRecordsWritten(tally.written);
        run.setRecordsRejected(tally.rejected);
        run.setNotification(notification);
        run.setCompletedAt(clock.instant());
        AgentRun saved = agentRunRepository.save(run);
        log.info("Agent run {} completed: {} wrote {} records, rejected {}, notification {}",
                saved.getId(), agent.getName(), tally.written, tally.rejected, notification.value());
        return saved;
    }

    /**
     * Run an agent from the catalog with the default worker, in the background.
     */
    @Async("agentExecutor")
    public void triggerAsync(String agentName) {
        AgentDefinition agent = catalog.require(agentName);
        execute(agent, defaultWorker);
    }

    /**
     * Catalog enablement, overridden by the agent's settings flag when one is stored.
     */
    public boolean isEnabled(AgentDefinition agent) {
        return settingsService.agentEnabledOverride(agent.getName()).orElse(agent.isEnabled());
    }

    public AgentWorker defaultWorker() {
        return defaultWorker;
    }

    public List<AgentRun> recentRuns(String agentName, int limit) {
        PageRequest page = PageRequest.of(0, limit <= 0 ? 20 : Math.min(limit, 200));
        return agentName == null || agentName.isBlank()
                ? agentRunRepository.findAllByOrderByStartedAtDesc(page)
                : agentRunRepository.findByAgentNameOrderByStartedAtDesc(agentName, page);
    }

    public Map<String, AgentRun> latestRuns() {
        Map<String, AgentRun> latest = new LinkedHashMap<>();
        for (AgentDefinition agent : catalog.all()) {
            agentRunRepository.findFirstByAgentNameOrderByStartedAtDesc(agent.getName())
                    .ifPresent(r -> latest.put(agent.getName(), r));
        }
        return latest;
    }

    private <T> void persist(AgentDefinition agent, RecordKind kind, List<T> records, Consumer<T> writer, Tally tally) {
        if (records.isEmpty()) return;
        if (!TierPolicy.allows(agent.getTier(), kind)) {
            log.warn("Agent {} ({}) may not write {} records; rejected {}", agent.getName(),
                    agent.getTier().value(), kind, records.size());
            tally.rejected += records.size();
            return;
        }
        for (T record : records) {
            try {
                writer.accept(record);
                tally.written++;
            } catch (IllegalArgumentException e) {
                log.warn("Agent {} produced an invalid {} record: {}", agent.getName(), kind, e.getMessage());
                tally.rejected++;
            }
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) return null;
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static final class Tally {
        int written;
        int rejected;
    }
}
