package me.go_gradually.ceddy.presentation.interaction.controller;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import me.go_gradually.ceddy.application.interaction.model.InteractionCommand;
import me.go_gradually.ceddy.application.interaction.model.InteractionResult;
import me.go_gradually.ceddy.application.interaction.usecase.InteractionUseCase;
import me.go_gradually.ceddy.application.tts.model.AudioSink;
import me.go_gradually.ceddy.application.tts.model.AudioStream;
import me.go_gradually.ceddy.application.tts.usecase.SpeechUseCase;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Streams the spoken reply as {@code audio/mpeg}. A turn without the wake word answers 200 with
 * an empty body; the headers tell the client which transcript was recorded. A client that hangs
 * up mid-stream ends the turn quietly; closing the audio cancels the provider download.
 */
@RestController
@RequestMapping("/api/v1/golf-assistant")
public class InteractionController {
    private static final Logger log = Logger.getLogger(InteractionController.class.getName());

    static final String TRANSCRIPT_ID_HEADER = "X-Transcript-Id";
    static final String WAKE_WORD_HEADER = "X-Wake-Word";

    private final InteractionUseCase interactionUseCase;
    private final SpeechUseCase speechUseCase;

    public InteractionController(InteractionUseCase interactionUseCase, SpeechUseCase speechUseCase) {
        this.interactionUseCase = interactionUseCase;
        this.speechUseCase = speechUseCase;
    }

    @PostMapping(value = "/interaction", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public void interact(@RequestParam("session_id") String sessionId,
                         @RequestPart("audio_file") MultipartFile audioFile,
                         HttpServletResponse response) throws IOException {
        InteractionResult result = interactionUseCase.interact(
                new InteractionCommand(sessionId, audioFile.getBytes(), audioFile.getOriginalFilename()));
        try (AudioStream audio = result.getAudio()) {
            response.setStatus(HttpServletResponse.SC_OK);
            response.setContentType("audio/mpeg");
            response.setHeader(TRANSCRIPT_ID_HEADER, String.valueOf(result.getTranscriptId().value()));
            response.setHeader(WAKE_WORD_HEADER, String.valueOf(result.isWakeWordDetected()));
            ServletOutputStream out = response.getOutputStream();
            AudioSink sink = bytes -> {
                out.write(bytes);
                response.flushBuffer();
            };
            try {
                speechUseCase.stream(audio, sink);
            } catch (IOException e) {
                log.fine(() -> "interaction.stream client_disconnected transcript="
                        + result.getTranscriptId().value() + " reason=" + e.getMessage());
            }
        }
    }
}
