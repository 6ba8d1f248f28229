package me.go_gradually.ceddy.infrastructure.stt.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.ceddy.application.stt.port.SttGateway;
import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Whisper transcription. The upload is sent from memory as a multipart part.
 */
@Component
public class OpenAiSttGateway implements SttGateway {
    private static final String TRANSCRIPTIONS_PATH = "/v1/audio/transcriptions";
    private static final String LANGUAGE = "en";
    private static final String DEFAULT_FILENAME = "audio.wav";

    private final WebClient webClient;
    private final AppProperties.OpenAi settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiSttGateway(@Qualifier("openAiWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getIntegrations().getOpenai();
    }

    @Override
    public boolean isConfigured() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public String transcribe(byte[] audio, String filename) throws Exception {
        String response = callOpenAi(audio, filename);
        JsonNode root = objectMapper.readTree(response == null ? "{}" : response);
        return root.path("text").asText("");
    }

    private String callOpenAi(byte[] audio, String filename) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", audio)
                .filename(filename == null || filename.isBlank() ? DEFAULT_FILENAME : filename)
                .contentType(MediaType.APPLICATION_OCTET_STREAM);
        builder.part("model", settings.getSttModel());
        builder.part("language", LANGUAGE);
        builder.part("response_format", "json");

        try {
            return webClient.post()
                    .uri(TRANSCRIPTIONS_PATH)
                    .header("Authorization", "Bearer " + settings.getApiKey())
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(builder.build()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("OpenAI transcription failed: status=" + e.getStatusCode().value(), e);
        }
    }
}
