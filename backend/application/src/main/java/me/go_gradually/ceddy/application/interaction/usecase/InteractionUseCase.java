package me.go_gradually.ceddy.application.interaction.usecase;

import me.go_gradually.ceddy.application.assistant.usecase.AssistantUseCase;
import me.go_gradually.ceddy.application.interaction.model.InteractionCommand;
import me.go_gradually.ceddy.application.interaction.model.InteractionResult;
import me.go_gradually.ceddy.application.interaction.model.InteractionStage;
import me.go_gradually.ceddy.application.interaction.policy.InteractionPolicy;
import me.go_gradually.ceddy.application.session.usecase.SessionUseCase;
import me.go_gradually.ceddy.application.shared.port.MetricsPort;
import me.go_gradually.ceddy.application.stt.model.SttCommand;
import me.go_gradually.ceddy.application.stt.usecase.SttUseCase;
import me.go_gradually.ceddy.application.transcript.port.TranscriptStorePort;
import me.go_gradually.ceddy.application.tts.model.AudioStream;
import me.go_gradually.ceddy.application.tts.usecase.SpeechUseCase;
import me.go_gradually.ceddy.domain.session.GolfSession;
import me.go_gradually.ceddy.domain.transcript.Transcript;
import me.go_gradually.ceddy.domain.util.TextUtils;
import me.go_gradually.ceddy.domain.wakeword.WakeWord;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * One voice turn: transcribe, gate on the wake word, ask the assistant, synthesize the reply.
 * <p>
 * The turn is not transactional. The transcript is committed before the assistant is asked
 * and updated once the reply is known, so a crash in between leaves a transcript without a
 * response. Provider failures degrade to empty text, an apology or silence; only an unknown
 * session is reported as an error.
 */
public class InteractionUseCase {
    private static final Logger log = Logger.getLogger(InteractionUseCase.class.getName());

    private final SessionUseCase sessionUseCase;
    private final TranscriptStorePort transcriptStore;
    private final SttUseCase sttUseCase;
    private final AssistantUseCase assistantUseCase;
    private final SpeechUseCase speechUseCase;
    private final MetricsPort metrics;
    private final WakeWord wakeWord;
    private final SessionTurnLock turnLock;

    public InteractionUseCase(SessionUseCase sessionUseCase,
                              TranscriptStorePort transcriptStore,
                              SttUseCase sttUseCase,
                              AssistantUseCase assistantUseCase,
                              SpeechUseCase speechUseCase,
                              MetricsPort metrics,
                              InteractionPolicy policy) {
        this.sessionUseCase = sessionUseCase;
        this.transcriptStore = transcriptStore;
        this.sttUseCase = sttUseCase;
        this.assistantUseCase = assistantUseCase;
        this.speechUseCase = speechUseCase;
        this.metrics = metrics;
        this.wakeWord = WakeWord.of(policy.wakeWord());
        this.turnLock = new SessionTurnLock(policy.serializePerSession());
    }

    public InteractionResult interact(InteractionCommand command) {
        Instant start = Instant.now();
        try {
            return turnLock.withLock(command.getSessionKey(), () -> runTurn(command));
        } finally {
            metrics.recordInteractionLatency(Duration.between(start, Instant.now()));
        }
    }

    private InteractionResult runTurn(InteractionCommand command) {
        String sessionKey = command.getSessionKey();
        stage(InteractionStage.SESSION_LOOKUP, sessionKey);
        GolfSession session = sessionUseCase.get(sessionKey);

        stage(InteractionStage.TRANSCRIBING, sessionKey);
        String text = sttUseCase.transcribe(new SttCommand(command.getAudio(), command.getFilename())).orElse("");

        stage(InteractionStage.WAKE_WORD_CHECK, sessionKey);
        boolean detected = wakeWord.isContainedIn(text);
        metrics.incrementWakeWord(detected);

        Transcript transcript = transcriptStore.create(Transcript.recordQuery(session.getId(), text, detected));
        stage(InteractionStage.TRANSCRIPT_PERSISTED, sessionKey);
        log.fine(() -> "interaction.transcript id=" + transcript.getId().value()
                + " wake_word=" + detected + " text=\"" + TextUtils.preview(text, 80) + "\"");

        if (!detected) {
            stage(InteractionStage.IDLE_RETURN, sessionKey);
            return InteractionResult.idle(transcript.getId(), text);
        }

        stage(InteractionStage.ASSISTANT_QUERY, sessionKey);
        String reply = assistantUseCase.replyOrApology(text);

        stage(InteractionStage.SYNTHESIZING, sessionKey);
        AudioStream audio = speechUseCase.synthesize(reply).orElseGet(AudioStream::empty);

        Transcript updated;
        try {
            transcript.attachResponse(reply);
            updated = transcriptStore.update(transcript);
        } catch (RuntimeException e) {
            audio.close();
            throw e;
        }
        stage(InteractionStage.TRANSCRIPT_UPDATED, sessionKey);

        stage(InteractionStage.STREAM_RETURN, sessionKey);
        return InteractionResult.answered(updated.getId(), text, reply, audio);
    }

    private void stage(InteractionStage stage, String sessionKey) {
        log.fine(() -> "interaction.stage stage=" + stage + " session=" + sessionKey);
    }
}
