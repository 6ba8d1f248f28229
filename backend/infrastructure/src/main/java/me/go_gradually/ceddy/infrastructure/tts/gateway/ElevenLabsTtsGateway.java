package me.go_gradually.ceddy.infrastructure.tts.gateway;

import me.go_gradually.ceddy.application.tts.model.AudioStream;
import me.go_gradually.ceddy.application.tts.port.TtsGateway;
import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.Map;

@Component
public class ElevenLabsTtsGateway implements TtsGateway {
    private static final String SPEECH_PATH = "/v1/text-to-speech/{voiceId}";
    private static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

    private final WebClient webClient;
    private final AppProperties.ElevenLabs settings;

    public ElevenLabsTtsGateway(@Qualifier("elevenLabsWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getIntegrations().getElevenlabs();
    }

    @Override
    public String provider() {
        return "elevenlabs";
    }

    @Override
    public boolean isConfigured() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public AudioStream stream(String text) {
        Map<String, Object> payload = Map.of(
                "text", text,
                "model_id", settings.getModelId(),
                "voice_settings", Map.of(
                        "stability", settings.getStability(),
                        "similarity_boost", settings.getSimilarityBoost()
                )
        );

        Flux<DataBuffer> data = webClient.post()
                .uri(SPEECH_PATH, settings.getVoiceId())
                .header("xi-api-key", settings.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(AUDIO_MPEG)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(DataBuffer.class);

        return DataBufferChunks.toAudioStream(data);
    }
}
