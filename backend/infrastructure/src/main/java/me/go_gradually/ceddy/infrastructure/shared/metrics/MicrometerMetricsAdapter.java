package me.go_gradually.ceddy.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.ceddy.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordSttLatency(Duration duration) {
        record("stt.latency", duration);
    }

    @Override
    public void recordAssistantLatency(Duration duration) {
        record("assistant.latency", duration);
    }

    @Override
    public void recordTtsLatency(Duration duration) {
        record("tts.latency", duration);
    }

    @Override
    public void recordTtsStreamLatency(Duration duration) {
        record("tts.stream.latency", duration);
    }

    @Override
    public void recordInteractionLatency(Duration duration) {
        record("interaction.latency", duration);
    }

    @Override
    public void incrementSttError() {
        meterRegistry.counter("stt.errors").increment();
    }

    @Override
    public void incrementAssistantError() {
        meterRegistry.counter("assistant.errors").increment();
    }

    @Override
    public void incrementAssistantTimeout() {
        meterRegistry.counter("assistant.timeouts").increment();
    }

    @Override
    public void incrementTtsFallback() {
        meterRegistry.counter("tts.fallbacks").increment();
    }

    @Override
    public void incrementTtsError() {
        meterRegistry.counter("tts.errors").increment();
    }

    @Override
    public void incrementWakeWord(boolean detected) {
        meterRegistry.counter(detected ? "interaction.wake_word.detected" : "interaction.wake_word.absent").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
