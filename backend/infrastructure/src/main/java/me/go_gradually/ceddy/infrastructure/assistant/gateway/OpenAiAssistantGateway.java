package me.go_gradually.ceddy.infrastructure.assistant.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.ceddy.application.assistant.model.AssistantTimeoutException;
import me.go_gradually.ceddy.application.assistant.port.AssistantGateway;
import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Assistants API (v2) client: one thread per query, run polled until it settles.
 */
@Component
public class OpenAiAssistantGateway implements AssistantGateway {
    static final String ASSISTANT_NAME = "Ceddy Golf Assistant";
    static final String INSTRUCTIONS = "You are Ceddy, an AI golf coach helping players during games. "
            + "Suggest golf clubs, analyze environmental conditions, and give concise golf tips. "
            + "Respond only when the player says \"Hey Ceddy.\"";

    private static final Logger log = Logger.getLogger(OpenAiAssistantGateway.class.getName());
    private static final String BETA_HEADER = "OpenAI-Beta";
    private static final String BETA_VALUE = "assistants=v2";

    private final WebClient webClient;
    private final AppProperties.OpenAi settings;
    private final AssistantToolHandler toolHandler;
    private final ObjectMapper objectMapper;

    public OpenAiAssistantGateway(@Qualifier("openAiWebClient") WebClient webClient,
                                  AppProperties properties,
                                  AssistantToolHandler toolHandler,
                                  ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.settings = properties.getIntegrations().getOpenai();
        this.toolHandler = toolHandler;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public Optional<String> reply(String query) throws Exception {
        try {
            String assistantId = resolveAssistantId();
            String threadId = post("/v1/threads", Map.of()).path("id").asText();
            post("/v1/threads/" + threadId + "/messages", Map.of("role", "user", "content", query == null ? "" : query));
            JsonNode run = post("/v1/threads/" + threadId + "/runs", Map.of("assistant_id", assistantId));
            JsonNode settled = awaitRun(threadId, run);
            String status = settled.path("status").asText("");
            if (!"completed".equals(status)) {
                log.warning("assistant.run settled status=" + status + " run=" + settled.path("id").asText());
            }
            return firstAssistantText(get("/v1/threads/" + threadId + "/messages"));
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("OpenAI assistant request failed: status=" + e.getStatusCode().value()
                    + " reason=" + resolveErrorMessage(e.getResponseBodyAsString()), e);
        }
    }

    private String resolveAssistantId() {
        String configured = settings.getAssistantId();
        if (configured != null && !configured.isBlank()) {
            log.fine(() -> "assistant.resolve existing id=" + configured);
            return configured;
        }
        JsonNode created = post("/v1/assistants", assistantDefinition());
        String id = created.path("id").asText();
        log.info(() -> "assistant.resolve created id=" + id);
        return id;
    }

    private Map<String, Object> assistantDefinition() {
        Map<String, Object> distance = Map.of("type", "number", "description", "Distance in yards");
        Map<String, Object> suggestClub = Map.of(
                "type", "function",
                "function", Map.of(
                        "name", AssistantToolHandler.SUGGEST_CLUB,
                        "description", "Suggest a golf club based on distance",
                        "parameters", Map.of(
                                "type", "object",
                                "properties", Map.of("distance", distance),
                                "required", List.of("distance")
                        )
                )
        );
        Map<String, Object> checkWind = Map.of(
                "type", "function",
                "function", Map.of(
                        "name", AssistantToolHandler.CHECK_WIND_CONDITIONS,
                        "description", "Check current wind conditions",
                        "parameters", Map.of("type", "object", "properties", Map.of())
                )
        );
        Map<String, Object> payload = new HashMap<>();
        payload.put("name", ASSISTANT_NAME);
        payload.put("instructions", INSTRUCTIONS);
        payload.put("model", settings.getAssistantModel());
        payload.put("tools", List.of(suggestClub, checkWind));
        return payload;
    }

    private JsonNode awaitRun(String threadId, JsonNode run) {
        String runId = run.path("id").asText();
        long deadline = System.nanoTime() + Duration.ofMillis(settings.getPollTimeoutMs()).toNanos();
        long interval = Math.max(1, settings.getPollInitialIntervalMs());
        JsonNode current = run;
        while (true) {
            String status = current.path("status").asText("");
            log.fine(() -> "assistant.run status=" + status + " run=" + runId);
            if ("requires_action".equals(status)) {
                current = submitToolOutputs(threadId, runId, current);
                continue;
            }
            if (!"queued".equals(status) && !"in_progress".equals(status)) {
                return current;
            }
            if (System.nanoTime() + Duration.ofMillis(interval).toNanos() > deadline) {
                throw new AssistantTimeoutException(runId, Duration.ofMillis(settings.getPollTimeoutMs()));
            }
            sleep(interval);
            interval = Math.min(settings.getPollMaxIntervalMs(), Math.max(interval + 1, (long) (interval * settings.getPollMultiplier())));
            current = get("/v1/threads/" + threadId + "/runs/" + runId);
        }
    }

    private JsonNode submitToolOutputs(String threadId, String runId, JsonNode run) {
        JsonNode calls = run.path("required_action").path("submit_tool_outputs").path("tool_calls");
        List<Map<String, Object>> outputs = new ArrayList<>();
        for (JsonNode call : calls) {
            String name = call.path("function").path("name").asText("");
            String arguments = call.path("function").path("arguments").asText("{}");
            outputs.add(Map.of(
                    "tool_call_id", call.path("id").asText(),
                    "output", toolHandler.handle(name, arguments)
            ));
        }
        log.fine(() -> "assistant.run submit_tool_outputs run=" + runId + " calls=" + outputs.size());
        return post("/v1/threads/" + threadId + "/runs/" + runId + "/submit_tool_outputs",
                Map.of("tool_outputs", outputs));
    }

    private Optional<String> firstAssistantText(JsonNode messages) {
        for (JsonNode message : messages.path("data")) {
            if (!"assistant".equals(message.path("role").asText())) {
                continue;
            }
            JsonNode content = message.path("content");
            if (!content.isArray() || content.isEmpty()) {
                return Optional.empty();
            }
            JsonNode text = content.get(0).path("text").path("value");
            return text.isTextual() ? Optional.of(text.asText()) : Optional.empty();
        }
        return Optional.empty();
    }

    private JsonNode post(String path, Object payload) {
        String body = webClient.post()
                .uri(path)
                .header("Authorization", "Bearer " + settings.getApiKey())
                .header(BETA_HEADER, BETA_VALUE)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(String.class)
                .block();
        return readTree(body);
    }

    private JsonNode get(String path) {
        String body = webClient.get()
                .uri(path)
                .header("Authorization", "Bearer " + settings.getApiKey())
                .header(BETA_HEADER, BETA_VALUE)
                .retrieve()
                .bodyToMono(String.class)
                .block();
        return readTree(body);
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (Exception e) {
            throw new IllegalStateException("OpenAI assistant returned malformed JSON", e);
        }
    }

    private String resolveErrorMessage(String body) {
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : "unknown";
        } catch (Exception e) {
            return "unknown";
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for assistant run", e);
        }
    }
}
