package me.go_gradually.ceddy.application.interaction.model;

import me.go_gradually.ceddy.application.tts.model.AudioStream;
import me.go_gradually.ceddy.domain.transcript.TranscriptId;

/**
 * Outcome of one turn. The caller owns {@link #getAudio()} and must close it.
 */
public class InteractionResult {
    private final TranscriptId transcriptId;
    private final String transcript;
    private final boolean wakeWordDetected;
    private final String response;
    private final AudioStream audio;
    private final InteractionStage terminalStage;

    private InteractionResult(TranscriptId transcriptId,
                              String transcript,
                              boolean wakeWordDetected,
                              String response,
                              AudioStream audio,
                              InteractionStage terminalStage) {
        this.transcriptId = transcriptId;
        this.transcript = transcript;
        this.wakeWordDetected = wakeWordDetected;
        this.response = response;
        this.audio = audio;
        this.terminalStage = terminalStage;
    }

    public static InteractionResult idle(TranscriptId transcriptId, String transcript) {
        return new InteractionResult(transcriptId, transcript, false, null, AudioStream.empty(),
                InteractionStage.IDLE_RETURN);
    }

    public static InteractionResult answered(TranscriptId transcriptId, String transcript, String response,
                                             AudioStream audio) {
        return new InteractionResult(transcriptId, transcript, true, response, audio,
                InteractionStage.STREAM_RETURN);
    }

    public TranscriptId getTranscriptId() {
        return transcriptId;
    }

    public String getTranscript() {
        return transcript;
    }

    public boolean isWakeWordDetected() {
        return wakeWordDetected;
    }

    public String getResponse() {
        return response;
    }

    public AudioStream getAudio() {
        return audio;
    }

    public InteractionStage getTerminalStage() {
        return terminalStage;
    }
}
