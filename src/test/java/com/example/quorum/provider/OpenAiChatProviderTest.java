package com.example.quorum.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiChatProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ChatProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ProviderSettings settings = new ProviderSettings(ProviderType.CUSTOM, server.url("/v1/").toString(),
                "llama-3", "sk-test", 0.2, 256, 5);
        provider = new ChatProviderFactory(new OkHttpClient(), objectMapper).create(settings);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void chatPostsCompletionRequest() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"choices": [{"message": {"role": "assistant", "content": "Three tasks are open."}}],
                         "usage": {"prompt_tokens": 42, "completion_tokens": 6}}
                        """));

        ChatResult result = provider.chat(List.of(ChatMessage.system("Be brief."), ChatMessage.user("Status?")),
                new ChatOptions(null, 64, null));

        assertEquals(new ChatResult("Three tasks are open.", 42, 6), result);
        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/chat/completions", request.getPath());
        assertEquals("Bearer sk-test", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("llama-3", body.get("model").asText());
        assertEquals(64, body.get("max_tokens").asInt());
        assertEquals(0.2, body.get("temperature").asDouble());
        assertFalse(body.has("stream"));
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals("Status?", body.get("messages").get(1).get("content").asText());
    }

    @Test
    void httpErrorCarriesTheStatus() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\": \"bad key\"}"));

        ChatProviderException e = assertThrows(ChatProviderException.class,
                () -> provider.chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults()));

        assertEquals(401, e.getStatusCode());
    }

    @Test
    void streamEmitsDeltasUntilDone() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("""
                        data: {"choices": [{"delta": {"role": "assistant"}}]}

                        data: {"choices": [{"delta": {"content": "Hel"}}]}

                        : keep-alive

                        data: {"choices": [{"delta": {"content": "lo"}}]}

                        data: [DONE]

                        """));

        StepVerifier.create(provider.chatStream(List.of(ChatMessage.user("hi")), ChatOptions.defaults()))
                .expectNext("Hel", "lo")
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertTrue(body.get("stream").asBoolean());
    }

    @Test
    void streamFailureIsAnError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));

        StepVerifier.create(provider.chatStream(List.of(ChatMessage.user("hi")), ChatOptions.defaults()))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ChatProviderException.class, e);
                    assertEquals(503, ((ChatProviderException) e).getStatusCode());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void connectionTestReportsTheOutcome() {
        server.enqueue(new MockResponse().setBody("{\"choices\": [{\"message\": {\"content\": \"Hi\"}}]}"));
        server.enqueue(new MockResponse().setResponseCode(403));

        assertTrue(provider.test());
        assertFalse(provider.test());
    }

    @Test
    void customProviderRequiresABaseUrl() {
        ChatProviderFactory factory = new ChatProviderFactory(new OkHttpClient(), objectMapper);
        ProviderSettings settings = new ProviderSettings(ProviderType.CUSTOM, "", "m", null, 0.0, 5, 5);

        assertThrows(IllegalArgumentException.class, () -> factory.create(settings));
    }
}
