package me.go_gradually.ceddy.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordSttLatency(Duration duration);

    void recordAssistantLatency(Duration duration);

    void recordTtsLatency(Duration duration);

    void recordTtsStreamLatency(Duration duration);

    void recordInteractionLatency(Duration duration);

    void incrementSttError();

    void incrementAssistantError();

    void incrementAssistantTimeout();

    void incrementTtsFallback();

    void incrementTtsError();

    void incrementWakeWord(boolean detected);
}
