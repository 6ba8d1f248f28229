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
public class OpenAiTtsGateway implements TtsGateway {
    private static final String SPEECH_PATH = "/v1/audio/speech";

    private final WebClient webClient;
    private final AppProperties.OpenAi settings;

    public OpenAiTtsGateway(@Qualifier("openAiWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getIntegrations().getOpenai();
    }

    @Override
    public String provider() {
        return "openai";
    }

    @Override
    public boolean isConfigured() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public AudioStream stream(String text) {
        Map<String, Object> payload = Map.of(
                "model", settings.getTtsModel(),
                "voice", settings.getTtsVoice(),
                "input", text,
                "response_format", "mp3"
        );

        Flux<DataBuffer> data = webClient.post()
                .uri(SPEECH_PATH)
                .header("Authorization", "Bearer " + settings.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(DataBuffer.class);

        return DataBufferChunks.toAudioStream(data);
    }
}
