package com.example.quorum.scheduling;

import com.example.quorum.domain.*;
import com.example.quorum.embedding.EmbeddingDimensionMismatchException;
import com.example.quorum.memory.DocumentService;
import com.example.quorum.memory.DocumentService.NewDocument;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.EventService.NewEvent;
import com.example.quorum.memory.ObservationService;
import com.example.quorum.memory.ObservationService.NewObservation;
import com.example.quorum.memory.SettingsService;
import com.example.quorum.memory.TaskService;
import com.example.quorum.memory.TaskService.NewTask;
import com.example.quorum.notification.NotificationService;
import com.example.quorum.repository.AgentRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AgentRunServiceTest {

    private static final Instant NIGHT = Instant.parse("2026-03-10T23:00:00Z");
    private static final Instant NOON = Instant.parse("2026-03-10T12:00:00Z");

    private final AgentRunRepository runRepository = mock(AgentRunRepository.class);
    private final DocumentService documentService = mock(DocumentService.class);
    private final EventService eventService = mock(EventService.class);
    private final TaskService taskService = mock(TaskService.class);
    private final ObservationService observationService = mock(ObservationService.class);
    private final SettingsService settingsService = mock(SettingsService.class);
    private final NotificationService notificationService = mock(NotificationService.class);
    private final AgentCatalog catalog = mock(AgentCatalog.class);

    private final AgentDefinition closer = AgentDefinition.builder()
            .name("closer").displayName("The Closer").tier(AgentTier.ACT).cron("*/10 * * * *").build();
    private final AgentDefinition dataCollector = AgentDefinition.builder()
            .name("data-collector").displayName("Data Collector").tier(AgentTier.OBSERVE).build();

    private final NewTask task = new NewTask("Follow up with vendor", null, TaskStatus.OPEN, TaskPriority.HIGH,
            null, null, Map.of());
    private final NewObservation observation = new NewObservation(ObservationCategory.RISK,
            ObservationSeverity.HIGH, ObservationStatus.OPEN, "Contract renewal is at risk", null, null, null,
            Map.of());
    private final NewEvent event = NewEvent.of("task_overdue", "Overdue", "One task is overdue", Map.of());
    private final NewDocument document = new NewDocument(DocumentType.NOTE, "Digest", "Daily digest", Set.of(),
            Map.of());

    @BeforeEach
    void setUp() {
        when(runRepository.save(any(AgentRun.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private AgentRunService service(Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        NotificationGate gate = new NotificationGate(notificationService,
                new QuietHours(true, 22, 7, ZoneId.of("UTC")), clock);
        AgentWorker unused = (agent, ctx) -> AgentFindings.empty(null);
        return new AgentRunService(runRepository, documentService, eventService, taskService, observationService,
                settingsService, gate, catalog, unused, clock);
    }

    @Test
    void findingsArePersistedEvenWhenTheNotificationIsSuppressed() {
        AgentWorker worker = (agent, ctx) -> new AgentFindings("Found one overdue task", List.of(), List.of(event),
                List.of(task), List.of(observation), new AgentNotification("Overdue", "One task is overdue"));

        AgentRun run = service(NIGHT).execute(closer, worker);

        assertEquals(AgentRunStatus.COMPLETED, run.getStatus());
        assertEquals(NotificationOutcome.SUPPRESSED, run.getNotification());
        assertEquals(3, run.getRecordsWritten());
        assertEquals(0, run.getRecordsRejected());
        assertEquals("Found one overdue task", run.getSummary());
        assertEquals(NIGHT, run.getCompletedAt());
        MemoryContext asCloser = MemoryContext.agent("closer");
        verify(taskService).create(asCloser, task);
        verify(observationService).create(asCloser, observation);
        verify(eventService).append(asCloser, event);
        verifyNoInteractions(notificationService);
    }

    @Test
    void sameFindingsAnHourAfterQuietHoursAreNotified() {
        when(notificationService.send(any(), any(), any())).thenReturn(NotificationOutcome.DELIVERED);
        AgentWorker worker = (agent, ctx) -> new AgentFindings("Found one overdue task", List.of(), List.of(),
                List.of(task), List.of(observation), new AgentNotification("Overdue", "One task is overdue"));

        AgentRun quiet = service(Instant.parse("2026-03-10T06:30:00Z")).execute(closer, worker);
        AgentRun after = service(Instant.parse("2026-03-10T08:00:00Z")).execute(closer, worker);

        assertEquals(NotificationOutcome.SUPPRESSED, quiet.getNotification());
        assertEquals(NotificationOutcome.DELIVERED, after.getNotification());
        assertEquals(quiet.getRecordsWritten(), after.getRecordsWritten());
        verify(taskService, times(2)).create(MemoryContext.agent("closer"), task);
        verify(notificationService, times(1)).send("The Closer", "Overdue", "One task is overdue");
    }

    @Test
    void notificationIsSentOutsideQuietHours() {
        when(notificationService.send(any(), any(), any())).thenReturn(NotificationOutcome.DELIVERED);
        AgentWorker worker = (agent, ctx) -> new AgentFindings("ok", null, null, List.of(task), null,
                new AgentNotification("Overdue", "One task is overdue"));

        AgentRun run = service(NOON).execute(closer, worker);

        assertEquals(NotificationOutcome.DELIVERED, run.getNotification());
        verify(notificationService).send("The Closer", "Overdue", "One task is overdue");
    }

    @Test
    void recordsOutsideTheTierAreRejected() {
        AgentWorker worker = (agent, ctx) -> new AgentFindings("mixed", List.of(document), List.of(event),
                List.of(task), List.of(observation), null);

        AgentRun run = service(NOON).execute(dataCollector, worker);

        assertEquals(AgentRunStatus.COMPLETED, run.getStatus());
        assertEquals(2, run.getRecordsWritten());
        assertEquals(2, run.getRecordsRejected());
        verify(documentService).create(MemoryContext.agent("data-collector"), document);
        verify(eventService).append(MemoryContext.agent("data-collector"), event);
        verifyNoInteractions(taskService, observationService);
    }

    @Test
    void invalidRecordsAreCountedAsRejected() {
        when(taskService.create(any(), eq(task))).thenThrow(new IllegalArgumentException("Task title is required"));
        AgentWorker worker = (agent, ctx) -> new AgentFindings("one bad", null, List.of(event), List.of(task),
                null, null);

        AgentRun run = service(NOON).execute(closer, worker);

        assertEquals(AgentRunStatus.COMPLETED, run.getStatus());
        assertEquals(1, run.getRecordsWritten());
        assertEquals(1, run.getRecordsRejected());
    }

    @Test
    void workerFailureMarksTheRunFailed() {
        AgentWorker worker = (agent, ctx) -> {
            throw new IllegalStateException("model unreachable");
        };

        AgentRun run = service(NOON).execute(closer, worker);

        assertEquals(AgentRunStatus.FAILED, run.getStatus());
        assertEquals("model unreachable", run.getErrorMessage());
        assertNotNull(run.getCompletedAt());
        verifyNoInteractions(taskService, observationService, eventService, documentService, notificationService);
    }

    @Test
    void storageFailureFinishesTheRunBeforeRethrowing() {
        List<AgentRunStatus> savedStatuses = new ArrayList<>();
        when(runRepository.save(any(AgentRun.class))).thenAnswer(inv -> {
            AgentRun saved = inv.getArgument(0);
            savedStatuses.add(saved.getStatus());
            return saved;
        });
        when(observationService.create(any(), eq(observation)))
                .thenThrow(new EmbeddingDimensionMismatchException(3, 5));
        AgentWorker worker = (agent, ctx) -> new AgentFindings("risky", null, List.of(event), List.of(task),
                List.of(observation), null);

        assertThrows(EmbeddingDimensionMismatchException.class, () -> service(NOON).execute(closer, worker));

        assertEquals(List.of(AgentRunStatus.RUNNING, AgentRunStatus.FAILED), savedStatuses);
        ArgumentCaptor<AgentRun> captor = ArgumentCaptor.forClass(AgentRun.class);
        verify(runRepository, times(2)).save(captor.capture());
        AgentRun run = captor.getValue();
        assertEquals(2, run.getRecordsWritten());
        assertEquals(NOON, run.getCompletedAt());
        assertTrue(run.getErrorMessage().contains("5"));
    }

    @Test
    void notifierFailureMarksTheRunFailed() {
        when(notificationService.send(any(), any(), any()))
                .thenThrow(new IllegalStateException("webhook rejected"));
        AgentWorker worker = (agent, ctx) -> new AgentFindings("ok", null, null, List.of(task), null,
                new AgentNotification("Overdue", "One task is overdue"));

        AgentRun run = service(NOON).execute(closer, worker);

        assertEquals(AgentRunStatus.FAILED, run.getStatus());
        assertEquals("webhook rejected", run.getErrorMessage());
        assertEquals(1, run.getRecordsWritten());
        assertNotNull(run.getCompletedAt());
        verify(taskService).create(MemoryContext.agent("closer"), task);
    }

    @Test
    void workerReceivesTheAgentContext() {
        AgentWorker worker = (agent, ctx) -> {
            assertEquals("closer", ctx.actor());
            return null;
        };

        AgentRun run = service(NOON).execute(closer, worker);

        assertEquals(AgentRunStatus.COMPLETED, run.getStatus());
        assertEquals(NotificationOutcome.NONE, run.getNotification());
        assertEquals(0, run.getRecordsWritten());
    }

    @Test
    void settingsOverrideCatalogEnablement() {
        AgentRunService service = service(NOON);
        when(settingsService.agentEnabledOverride("closer")).thenReturn(Optional.of(false));
        when(settingsService.agentEnabledOverride("data-collector")).thenReturn(Optional.empty());

        assertFalse(service.isEnabled(closer));
        assertTrue(service.isEnabled(dataCollector));
    }
}
