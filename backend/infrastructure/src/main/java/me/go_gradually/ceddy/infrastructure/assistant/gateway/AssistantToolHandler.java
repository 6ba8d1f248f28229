package me.go_gradually.ceddy.infrastructure.assistant.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.ceddy.application.golf.usecase.GolfAdviceUseCase;
import me.go_gradually.ceddy.domain.golf.ClubSuggestion;
import me.go_gradually.ceddy.domain.golf.WindConditions;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Answers the assistant's function calls locally. Output is always a JSON document, with an
 * {@code error} field when the call cannot be served.
 */
@Component
public class AssistantToolHandler {
    static final String SUGGEST_CLUB = "suggest_club";
    static final String CHECK_WIND_CONDITIONS = "check_wind_conditions";

    private static final Logger log = Logger.getLogger(AssistantToolHandler.class.getName());

    private final GolfAdviceUseCase golfAdvice;
    private final ObjectMapper objectMapper;

    public AssistantToolHandler(GolfAdviceUseCase golfAdvice, ObjectMapper objectMapper) {
        this.golfAdvice = golfAdvice;
        this.objectMapper = objectMapper;
    }

    public String handle(String functionName, String argumentsJson) {
        log.fine(() -> "assistant.tool call name=" + functionName);
        try {
            if (SUGGEST_CLUB.equals(functionName)) {
                return suggestClub(argumentsJson);
            }
            if (CHECK_WIND_CONDITIONS.equals(functionName)) {
                return windConditions();
            }
            return error("Unknown function: " + functionName);
        } catch (IllegalArgumentException e) {
            return error(e.getMessage());
        } catch (Exception e) {
            log.warning("assistant.tool failure name=" + functionName + " reason=" + e.getMessage());
            return error("Function call failed");
        }
    }

    private String suggestClub(String argumentsJson) throws Exception {
        JsonNode arguments = objectMapper.readTree(argumentsJson == null || argumentsJson.isBlank() ? "{}" : argumentsJson);
        JsonNode distance = arguments.path("distance");
        if (!distance.isNumber()) {
            throw new IllegalArgumentException("distance must be a number");
        }
        ClubSuggestion suggestion = golfAdvice.suggestClub(distance.asDouble());
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("club", suggestion.club().label());
        output.put("explanation", suggestion.explanation());
        return objectMapper.writeValueAsString(output);
    }

    private String windConditions() throws Exception {
        WindConditions wind = golfAdvice.windConditions();
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("speed", wind.speed());
        output.put("direction", wind.direction());
        output.put("recommendation", wind.recommendation());
        return objectMapper.writeValueAsString(output);
    }

    private String error(String message) {
        try {
            return objectMapper.writeValueAsString(Map.of("error", message == null ? "" : message));
        } catch (Exception e) {
            return "{\"error\":\"Function call failed\"}";
        }
    }
}
