package com.example.quorum;

import com.example.quorum.orchestrator.FallbackMessages;
import com.example.quorum.scheduling.AgentCatalog;
import com.example.quorum.service.ChatService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class QuorumApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AgentCatalog agentCatalog;

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString(StandardCharsets.UTF_8));
    }

    private String body(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    @Test
    void contextLoads() {
        assertEquals(7, agentCatalog.all().size());
    }

    @Test
    void documentIsStoredWhenTheEmbeddingProviderIsDown() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("title", "Vendor contract", "content", "Renewal due in April.",
                                "doc_type", "note", "tags", List.of("contracts")))))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode ingest = json(created);
        assertFalse(ingest.get("embedded").asBoolean());
        String id = ingest.get("document_id").asText();

        mockMvc.perform(get("/api/documents/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document.title").value("Vendor contract"))
                .andExpect(jsonPath("$.embedding.embedded").value(false));
    }

    @Test
    void invalidRequestsReportTheirStatus() throws Exception {
        mockMvc.perform(post("/api/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("title", "No content"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").exists());

        mockMvc.perform(get("/api/documents/{id}", "does-not-exist"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("title", "Bad priority", "priority", "urgent"))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void taskLifecycle() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("title", "Send the renewal terms", "priority", "high",
                                "owner", "ana"))))
                .andExpect(status().isCreated())
                .andReturn();
        String id = json(created).get("id").asText();

        Map<String, Object> patch = new HashMap<>();
        patch.put("status", "in_progress");
        patch.put("owner", null);
        mockMvc.perform(patch("/api/tasks/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(patch)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("in_progress"))
                .andExpect(jsonPath("$.priority").value("high"))
                .andExpect(jsonPath("$.title").value("Send the renewal terms"))
                .andExpect(jsonPath("$.owner").doesNotExist());
    }

    @Test
    void duplicateObservationIsRefreshedNotDuplicated() throws Exception {
        Map<String, Object> observation = Map.of("category", "risk", "severity", "high",
                "content", "The April renewal has no owner", "source_agent", "devils-advocate");

        mockMvc.perform(post("/api/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(observation)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.created").value(true));

        mockMvc.perform(post("/api/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(observation)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(false));
    }

    @Test
    void webhookObservationsAreDeduplicatedByFingerprint() throws Exception {
        Map<String, Object> delivery = Map.of("event_type", "observation", "source_workflow", "crm-sync",
                "data", Map.of("category", "risk", "severity", "high", "content", "Deal with Acme has stalled"));

        JsonNode first = json(mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(delivery)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Observation stored"))
                .andExpect(jsonPath("$.data.created").value(true))
                .andReturn());
        String id = first.at("/data/observation_id").asText();

        mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(delivery)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.observation_id").value(id))
                .andExpect(jsonPath("$.data.created").value(false));

        mockMvc.perform(get("/api/observations/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceAgent").value("crm-sync"))
                .andExpect(jsonPath("$.category").value("risk"));
    }

    @Test
    void webhookWorkflowEventsLandInTheDefaultCouncilThread() throws Exception {
        JsonNode receipt = json(mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("event_type", "workflow_complete",
                                "source_workflow", "nightly-digest", "data", Map.of("items", 3)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Workflow completion recorded"))
                .andReturn());

        mockMvc.perform(get("/api/events/{id}", receipt.at("/data/event_id").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eventType").value("quorum_response"))
                .andExpect(jsonPath("$.threadId").value("default"))
                .andExpect(jsonPath("$.description").value("Workflow nightly-digest completed: {\"items\":3}"))
                .andExpect(jsonPath("$.metadata.source_workflow").value("nightly-digest"));

        mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("event_type", "chat", "source_workflow", "slack-bridge",
                                "data", Map.of("message", "Standup moved to 10:00", "thread_id", "thread-ops",
                                        "thread_title", "Ops")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Chat message stored"));

        mockMvc.perform(get("/api/council/threads/{id}", "thread-ops"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].description").value("Standup moved to 10:00"))
                .andExpect(jsonPath("$[0].threadTitle").value("Ops"));
    }

    @Test
    void webhookRequiresEventTypeAndWorkflow() throws Exception {
        mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("event_type", "observation"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("source_workflow is required and must be a string"));

        mockMvc.perform(post("/api/webhooks/n8n")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/webhooks/n8n"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.supported_events.length()").value(5));
    }

    @Test
    void chatWithoutTheReasoningBinaryStreamsTheFallback() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("agent", "closer", "message", "What is overdue?"))))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(10_000);

        String reply = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        assertEquals(FallbackMessages.notAvailable(ChatService.PROCESS_LABEL), reply);

        MvcResult history = mockMvc.perform(get("/api/chat/{agent}/history", "closer"))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode events = json(history);
        assertEquals(2, events.size());
    }

    @Test
    void councilThreadLifecycle() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/council")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("message", "Where should we focus this week?",
                                "thread_id", "thread-planning", "thread_title", "Planning"))))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(10_000);
        assertEquals(FallbackMessages.notAvailable(ChatService.PROCESS_LABEL),
                result.getResponse().getContentAsString(StandardCharsets.UTF_8));

        mockMvc.perform(get("/api/council/threads/{id}", "thread-planning"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(patch("/api/council/threads/{id}", "thread-planning")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("title", "Weekly focus"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(2));

        MvcResult threads = mockMvc.perform(get("/api/council/threads"))
                .andExpect(status().isOk())
                .andReturn();
        boolean renamed = false;
        boolean hasDefault = false;
        for (JsonNode thread : json(threads)) {
            renamed |= "thread-planning".equals(thread.get("threadId").asText())
                    && "Weekly focus".equals(thread.get("title").asText());
            hasDefault |= "default".equals(thread.get("threadId").asText());
        }
        assertTrue(renamed);
        assertTrue(hasDefault);

        mockMvc.perform(delete("/api/council/threads/{id}", "thread-planning"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(2));
        mockMvc.perform(delete("/api/council/threads/{id}", "default"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void chatWithUnknownAgentIsRejected() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("agent", "oracle", "message", "hello"))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void agentsAreListedWithTheirTier() throws Exception {
        mockMvc.perform(get("/api/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(7))
                .andExpect(jsonPath("$[0].name").value("data-collector"))
                .andExpect(jsonPath("$[0].tier").value("observe"));
    }
}
