package me.go_gradually.ceddy.application.assistant.model;

import java.time.Duration;

public class AssistantTimeoutException extends RuntimeException {
    public AssistantTimeoutException(String runId, Duration waited) {
        super("Assistant run " + runId + " did not finish within " + waited.toMillis() + " ms");
    }
}
