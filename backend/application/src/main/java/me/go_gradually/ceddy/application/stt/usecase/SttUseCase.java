package me.go_gradually.ceddy.application.stt.usecase;

import me.go_gradually.ceddy.application.shared.model.ProviderFailure;
import me.go_gradually.ceddy.application.shared.model.ProviderResult;
import me.go_gradually.ceddy.application.shared.port.MetricsPort;
import me.go_gradually.ceddy.application.stt.model.SttCommand;
import me.go_gradually.ceddy.application.stt.port.SttGateway;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SttUseCase {
    private static final Logger log = Logger.getLogger(SttUseCase.class.getName());

    private final SttGateway sttGateway;
    private final MetricsPort metrics;

    public SttUseCase(SttGateway sttGateway, MetricsPort metrics) {
        this.sttGateway = sttGateway;
        this.metrics = metrics;
    }

    public ProviderResult<String> transcribe(SttCommand command) {
        if (!sttGateway.isConfigured()) {
            log.warning("stt.transcribe skipped reason=unconfigured");
            metrics.incrementSttError();
            return ProviderResult.failure(ProviderFailure.UNCONFIGURED, "Speech-to-text provider is not configured");
        }
        Instant start = Instant.now();
        try {
            String text = sttGateway.transcribe(command.getAudio(), command.getFilename());
            metrics.recordSttLatency(Duration.between(start, Instant.now()));
            return ProviderResult.success(text == null ? "" : text.trim());
        } catch (Exception e) {
            metrics.recordSttLatency(Duration.between(start, Instant.now()));
            metrics.incrementSttError();
            log.log(Level.WARNING, "stt.transcribe failure bytes=" + command.getAudio().length, e);
            return ProviderResult.failure(ProviderFailure.ERROR, e.getMessage());
        }
    }
}
