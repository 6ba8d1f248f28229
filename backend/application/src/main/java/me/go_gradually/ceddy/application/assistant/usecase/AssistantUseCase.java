package me.go_gradually.ceddy.application.assistant.usecase;

import me.go_gradually.ceddy.application.assistant.model.AssistantTimeoutException;
import me.go_gradually.ceddy.application.assistant.port.AssistantGateway;
import me.go_gradually.ceddy.application.shared.model.ProviderFailure;
import me.go_gradually.ceddy.application.shared.model.ProviderResult;
import me.go_gradually.ceddy.application.shared.port.MetricsPort;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AssistantUseCase {
    public static final String NO_REPLY_MESSAGE = "I'm sorry, I couldn't process your request.";
    public static final String ERROR_MESSAGE = "I'm sorry, I encountered an error while processing your request.";

    private static final Logger log = Logger.getLogger(AssistantUseCase.class.getName());

    private final AssistantGateway assistantGateway;
    private final MetricsPort metrics;

    public AssistantUseCase(AssistantGateway assistantGateway, MetricsPort metrics) {
        this.assistantGateway = assistantGateway;
        this.metrics = metrics;
    }

    public ProviderResult<String> reply(String query) {
        if (!assistantGateway.isConfigured()) {
            log.warning("assistant.reply skipped reason=unconfigured");
            metrics.incrementAssistantError();
            return ProviderResult.failure(ProviderFailure.UNCONFIGURED, "Assistant provider is not configured");
        }
        Instant start = Instant.now();
        try {
            Optional<String> reply = assistantGateway.reply(query);
            metrics.recordAssistantLatency(Duration.between(start, Instant.now()));
            if (reply.isEmpty() || reply.get().isBlank()) {
                log.warning("assistant.reply empty");
                return ProviderResult.failure(ProviderFailure.EMPTY, "Assistant returned no reply");
            }
            return ProviderResult.success(reply.get());
        } catch (AssistantTimeoutException e) {
            metrics.recordAssistantLatency(Duration.between(start, Instant.now()));
            metrics.incrementAssistantTimeout();
            log.warning("assistant.reply timeout " + e.getMessage());
            return ProviderResult.failure(ProviderFailure.TIMEOUT, e.getMessage());
        } catch (Exception e) {
            metrics.recordAssistantLatency(Duration.between(start, Instant.now()));
            metrics.incrementAssistantError();
            log.log(Level.WARNING, "assistant.reply failure", e);
            return ProviderResult.failure(ProviderFailure.ERROR, e.getMessage());
        }
    }

    /**
     * Reply text for the caller, with a fixed apology in place of any failure.
     */
    public String replyOrApology(String query) {
        ProviderResult<String> result = reply(query);
        if (result.isSuccess()) {
            return result.orElse(ERROR_MESSAGE);
        }
        return result.failure() == ProviderFailure.EMPTY ? NO_REPLY_MESSAGE : ERROR_MESSAGE;
    }
}
