package me.go_gradually.ceddy.infrastructure.assistant.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.ceddy.application.assistant.model.AssistantTimeoutException;
import me.go_gradually.ceddy.application.golf.usecase.GolfAdviceUseCase;
import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiAssistantGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private AppProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new AppProperties();
        AppProperties.OpenAi openai = properties.getIntegrations().getOpenai();
        openai.setApiKey("api-key");
        openai.setAssistantId("asst_1");
        openai.setPollInitialIntervalMs(1);
        openai.setPollMaxIntervalMs(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private OpenAiAssistantGateway gateway() {
        WebClient webClient = WebClient.builder().baseUrl(server.url("/").toString()).build();
        AssistantToolHandler toolHandler = new AssistantToolHandler(new GolfAdviceUseCase(), objectMapper);
        return new OpenAiAssistantGateway(webClient, properties, toolHandler, objectMapper);
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(body));
    }

    @Test
    void reply_runsThreadAndReturnsFirstAssistantMessage() throws Exception {
        enqueueJson("{\"id\":\"thread_1\"}");
        enqueueJson("{\"id\":\"msg_1\"}");
        enqueueJson("{\"id\":\"run_1\",\"status\":\"queued\"}");
        enqueueJson("{\"id\":\"run_1\",\"status\":\"completed\"}");
        enqueueJson("{\"data\":[{\"role\":\"assistant\",\"content\":[{\"type\":\"text\",\"text\":{\"value\":\"Take your 7 Iron.\"}}]},"
                + "{\"role\":\"user\",\"content\":[{\"type\":\"text\",\"text\":{\"value\":\"Hey Ceddy\"}}]}]}");

        Optional<String> reply = gateway().reply("Hey Ceddy 160 yards");

        assertEquals(Optional.of("Take your 7 Iron."), reply);

        RecordedRequest thread = server.takeRequest();
        assertEquals("/v1/threads", thread.getPath());
        assertEquals("assistants=v2", thread.getHeader("OpenAI-Beta"));
        assertEquals("Bearer api-key", thread.getHeader("Authorization"));

        RecordedRequest message = server.takeRequest();
        assertEquals("/v1/threads/thread_1/messages", message.getPath());
        JsonNode messageBody = objectMapper.readTree(message.getBody().readUtf8());
        assertEquals("user", messageBody.path("role").asText());
        assertEquals("Hey Ceddy 160 yards", messageBody.path("content").asText());

        RecordedRequest run = server.takeRequest();
        assertEquals("/v1/threads/thread_1/runs", run.getPath());
        assertEquals("asst_1", objectMapper.readTree(run.getBody().readUtf8()).path("assistant_id").asText());

        assertEquals("GET", server.takeRequest().getMethod());
        assertEquals("/v1/threads/thread_1/messages", server.takeRequest().getPath());
    }

    @Test
    void reply_createsAssistant_whenNoIdConfigured() throws Exception {
        properties.getIntegrations().getOpenai().setAssistantId(null);
        enqueueJson("{\"id\":\"asst_new\"}");
        enqueueJson("{\"id\":\"thread_1\"}");
        enqueueJson("{\"id\":\"msg_1\"}");
        enqueueJson("{\"id\":\"run_1\",\"status\":\"completed\"}");
        enqueueJson("{\"data\":[{\"role\":\"assistant\",\"content\":[{\"type\":\"text\",\"text\":{\"value\":\"Hi\"}}]}]}");

        gateway().reply("Hey Ceddy");

        RecordedRequest create = server.takeRequest();
        assertEquals("/v1/assistants", create.getPath());
        JsonNode definition = objectMapper.readTree(create.getBody().readUtf8());
        assertEquals("Ceddy Golf Assistant", definition.path("name").asText());
        assertEquals("gpt-4-turbo-preview", definition.path("model").asText());
        assertEquals(2, definition.path("tools").size());

        server.takeRequest();
        server.takeRequest();
        RecordedRequest run = server.takeRequest();
        assertEquals("asst_new", objectMapper.readTree(run.getBody().readUtf8()).path("assistant_id").asText());
    }

    @Test
    void reply_answersFunctionCalls_andKeepsPolling() throws Exception {
        enqueueJson("{\"id\":\"thread_1\"}");
        enqueueJson("{\"id\":\"msg_1\"}");
        enqueueJson("{\"id\":\"run_1\",\"status\":\"requires_action\",\"required_action\":{\"type\":\"submit_tool_outputs\","
                + "\"submit_tool_outputs\":{\"tool_calls\":[{\"id\":\"call_1\",\"type\":\"function\","
                + "\"function\":{\"name\":\"suggest_club\",\"arguments\":\"{\\\"distance\\\":200}\"}}]}}}");
        enqueueJson("{\"id\":\"run_1\",\"status\":\"in_progress\"}");
        enqueueJson("{\"id\":\"run_1\",\"status\":\"completed\"}");
        enqueueJson("{\"data\":[{\"role\":\"assistant\",\"content\":[{\"type\":\"text\",\"text\":{\"value\":\"5 Iron.\"}}]}]}");

        assertEquals(Optional.of("5 Iron."), gateway().reply("Hey Ceddy 200 yards"));

        server.takeRequest();
        server.takeRequest();
        server.takeRequest();
        RecordedRequest submit = server.takeRequest();
        assertEquals("/v1/threads/thread_1/runs/run_1/submit_tool_outputs", submit.getPath());
        JsonNode outputs = objectMapper.readTree(submit.getBody().readUtf8()).path("tool_outputs");
        assertEquals("call_1", outputs.get(0).path("tool_call_id").asText());
        JsonNode output = objectMapper.readTree(outputs.get(0).path("output").asText());
        assertEquals("5 Iron", output.path("club").asText());
    }

    @Test
    void reply_returnsEmpty_whenNoAssistantMessage() throws Exception {
        enqueueJson("{\"id\":\"thread_1\"}");
        enqueueJson("{\"id\":\"msg_1\"}");
        enqueueJson("{\"id\":\"run_1\",\"status\":\"failed\"}");
        enqueueJson("{\"data\":[{\"role\":\"user\",\"content\":[{\"type\":\"text\",\"text\":{\"value\":\"Hey Ceddy\"}}]}]}");

        assertTrue(gateway().reply("Hey Ceddy").isEmpty());
    }

    @Test
    void reply_throwsTimeout_whenRunNeverSettles() {
        properties.getIntegrations().getOpenai().setPollInitialIntervalMs(10);
        properties.getIntegrations().getOpenai().setPollMaxIntervalMs(10);
        properties.getIntegrations().getOpenai().setPollTimeoutMs(30);
        enqueueJson("{\"id\":\"thread_1\"}");
        enqueueJson("{\"id\":\"msg_1\"}");
        for (int i = 0; i < 10; i++) {
            enqueueJson("{\"id\":\"run_1\",\"status\":\"queued\"}");
        }

        assertThrows(AssistantTimeoutException.class, () -> gateway().reply("Hey Ceddy"));
    }

    @Test
    void reply_wrapsProviderErrors() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\":{\"message\":\"boom\"}}"));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> gateway().reply("Hey Ceddy"));
        assertTrue(error.getMessage().contains("boom"));
    }
}
