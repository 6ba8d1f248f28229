package me.go_gradually.ceddy.application.assistant.port;

import java.util.Optional;

public interface AssistantGateway {
    boolean isConfigured();

    /**
     * Returns the assistant's first reply text, or empty when the run produced none.
     * Throws {@link me.go_gradually.ceddy.application.assistant.model.AssistantTimeoutException}
     * when the run does not settle in time.
     */
    Optional<String> reply(String query) throws Exception;
}
