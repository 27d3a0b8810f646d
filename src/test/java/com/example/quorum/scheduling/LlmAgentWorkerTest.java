package com.example.quorum.scheduling;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.*;
import com.example.quorum.memory.DocumentService;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.ObservationService;
import com.example.quorum.memory.TaskService;
import com.example.quorum.provider.ChatMessage;
import com.example.quorum.provider.ChatProvider;
import com.example.quorum.provider.ChatResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Page;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class LlmAgentWorkerTest {

    private final ChatProvider chatProvider = mock(ChatProvider.class);
    private final DocumentService documentService = mock(DocumentService.class);
    private final EventService eventService = mock(EventService.class);
    private final TaskService taskService = mock(TaskService.class);
    private final ObservationService observationService = mock(ObservationService.class);

    private final AgentDefinition connector = AgentDefinition.builder()
            .name("connector").displayName("The Connector").tier(AgentTier.ACT)
            .description("Finds links between people and projects")
            .prompt("Look for relationships the user has not noticed.")
            .build();

    private LlmAgentWorker worker;

    @BeforeEach
    void setUp() {
        when(observationService.list(any(), anyInt(), anyInt())).thenReturn(Page.empty());
        worker = new LlmAgentWorker(chatProvider, new ObjectMapper(), new QuorumProperties(), documentService,
                eventService, taskService, observationService,
                Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void parsesAllSectionsWithDefaults() {
        String answer = """
                ```json
                {
                  "summary": "Linked two threads",
                  "tasks": [{"title": "Introduce Ana to the vendor", "priority": "high", "due_at": "2026-03-12T09:00:00Z"},
                            {"title": "Draft the agenda"}],
                  "observations": [{"category": "insight", "content": "Both projects share a supplier"}],
                  "events": [{"event_type": "connection_found", "title": "Shared supplier"}],
                  "notification": {"title": "New connection", "message": "Two projects share a supplier"}
                }
                ```""";

        AgentFindings findings = worker.parseFindings(connector, answer);

        assertEquals("Linked two threads", findings.summary());
        assertEquals(2, findings.tasks().size());
        assertEquals(TaskPriority.HIGH, findings.tasks().get(0).priority());
        assertEquals(Instant.parse("2026-03-12T09:00:00Z"), findings.tasks().get(0).dueAt());
        assertEquals(TaskPriority.MEDIUM, findings.tasks().get(1).priority());
        assertEquals(TaskStatus.OPEN, findings.tasks().get(1).status());
        assertEquals(ObservationSeverity.INFO, findings.observations().get(0).severity());
        assertEquals(ObservationStatus.OPEN, findings.observations().get(0).status());
        assertEquals("connection_found", findings.events().get(0).eventType());
        assertTrue(findings.documents().isEmpty());
        assertEquals(new AgentNotification("New connection", "Two projects share a supplier"),
                findings.notification());
    }

    @Test
    void dropsEntriesThatFailValidation() {
        String answer = """
                {"observations": [{"category": "gossip", "content": "x"},
                                  {"category": "risk", "severity": "high", "content": "Deadline slipping"}],
                 "tasks": [{"title": "Bad date", "due_at": "next tuesday"}]}
                """;

        AgentFindings findings = worker.parseFindings(connector, answer);

        assertEquals(1, findings.observations().size());
        assertEquals(ObservationCategory.RISK, findings.observations().get(0).category());
        assertTrue(findings.tasks().isEmpty());
        assertNull(findings.notification());
    }

    @Test
    void notificationWithoutTitleIsIgnored() {
        AgentFindings findings = worker.parseFindings(connector, "{\"notification\": {\"message\": \"hi\"}}");

        assertNull(findings.notification());
    }

    @Test
    void unusableAnswersBecomeEmptyFindings() {
        assertEquals("No response from the model", worker.parseFindings(connector, "  ").summary());
        assertEquals("Unparseable response", worker.parseFindings(connector, "I could not decide.").summary());
        assertEquals("Unparseable response", worker.parseFindings(connector, "[1, 2]").summary());
    }

    @Test
    @SuppressWarnings("unchecked")
    void runSendsRoleAndSnapshotToTheModel() {
        when(chatProvider.chat(any(), any())).thenReturn(new ChatResult("{\"summary\": \"Nothing new\"}", 100, 5));

        AgentFindings findings = worker.run(connector, MemoryContext.agent("connector"));

        assertEquals("Nothing new", findings.summary());
        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(chatProvider).chat(messages.capture(), any());
        String system = messages.getValue().get(0).content();
        assertTrue(system.contains("The Connector"));
        assertTrue(system.contains("Look for relationships the user has not noticed."));
        assertTrue(system.contains("Your tier is 'act'"));
        String user = messages.getValue().get(1).content();
        assertTrue(user.contains("## Open Tasks\nNone."));
        assertTrue(user.contains("## Open Observations\nNone."));
    }
}
