package me.go_gradually.ceddy.application.tts.usecase;

import me.go_gradually.ceddy.application.shared.model.ProviderFailure;
import me.go_gradually.ceddy.application.shared.model.ProviderResult;
import me.go_gradually.ceddy.application.shared.port.MetricsPort;
import me.go_gradually.ceddy.application.tts.model.AudioSink;
import me.go_gradually.ceddy.application.tts.model.AudioStream;
import me.go_gradually.ceddy.application.tts.port.TtsGateway;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SpeechUseCase {
    private static final Logger log = Logger.getLogger(SpeechUseCase.class.getName());

    private final TtsGateway primary;
    private final TtsGateway fallback;
    private final MetricsPort metrics;

    public SpeechUseCase(TtsGateway primary, TtsGateway fallback, MetricsPort metrics) {
        this.primary = primary;
        this.fallback = fallback;
        this.metrics = metrics;
    }

    /**
     * Tries the primary provider when it is configured, then the fallback once. The returned
     * stream already holds its first chunk, so a successful result always carries audio.
     */
    public ProviderResult<AudioStream> synthesize(String text) {
        if (text == null || text.isBlank()) {
            return ProviderResult.success(AudioStream.empty());
        }
        Instant start = Instant.now();
        if (primary.isConfigured()) {
            ProviderResult<AudioStream> result = attempt(primary, text);
            if (result.isSuccess()) {
                metrics.recordTtsLatency(Duration.between(start, Instant.now()));
                return result;
            }
            metrics.incrementTtsFallback();
            log.info(() -> "tts.fallback from=" + primary.provider() + " to=" + fallback.provider()
                    + " reason=" + result.failure());
        }
        if (!fallback.isConfigured()) {
            metrics.incrementTtsError();
            log.warning("tts.synthesize failure reason=no_configured_provider");
            return ProviderResult.failure(ProviderFailure.UNCONFIGURED, "No text-to-speech provider is configured");
        }
        ProviderResult<AudioStream> result = attempt(fallback, text);
        metrics.recordTtsLatency(Duration.between(start, Instant.now()));
        if (!result.isSuccess()) {
            metrics.incrementTtsError();
        }
        return result;
    }

    public void stream(AudioStream audio, AudioSink sink) throws IOException {
        Instant start = Instant.now();
        long bytes = 0;
        try {
            for (byte[] chunk : audio) {
                sink.write(chunk);
                bytes += chunk.length;
            }
        } catch (IOException e) {
            long written = bytes;
            log.fine(() -> "tts.stream aborted bytes=" + written + " reason=" + e.getMessage());
            throw e;
        } finally {
            metrics.recordTtsStreamLatency(Duration.between(start, Instant.now()));
        }
    }

    private ProviderResult<AudioStream> attempt(TtsGateway gateway, String text) {
        AudioStream audio = null;
        try {
            audio = gateway.stream(text);
            if (!audio.prefetch()) {
                audio.close();
                log.warning("tts.synthesize empty provider=" + gateway.provider());
                return ProviderResult.failure(ProviderFailure.EMPTY, gateway.provider() + " returned no audio");
            }
            return ProviderResult.success(audio);
        } catch (Exception e) {
            if (audio != null) {
                audio.close();
            }
            log.log(Level.WARNING, "tts.synthesize failure provider=" + gateway.provider(), e);
            return ProviderResult.failure(ProviderFailure.ERROR, e.getMessage());
        }
    }
}
