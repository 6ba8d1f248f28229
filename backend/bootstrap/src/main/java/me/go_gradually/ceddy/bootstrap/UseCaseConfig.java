package me.go_gradually.ceddy.bootstrap;

import me.go_gradually.ceddy.application.assistant.port.AssistantGateway;
import me.go_gradually.ceddy.application.assistant.usecase.AssistantUseCase;
import me.go_gradually.ceddy.application.golf.usecase.GolfAdviceUseCase;
import me.go_gradually.ceddy.application.interaction.policy.InteractionPolicy;
import me.go_gradually.ceddy.application.interaction.usecase.InteractionUseCase;
import me.go_gradually.ceddy.application.room.policy.RoomPolicy;
import me.go_gradually.ceddy.application.room.port.RoomGateway;
import me.go_gradually.ceddy.application.room.port.RoomTokenPort;
import me.go_gradually.ceddy.application.room.port.RoomWebhookPort;
import me.go_gradually.ceddy.application.room.usecase.RoomUseCase;
import me.go_gradually.ceddy.application.session.port.SessionStorePort;
import me.go_gradually.ceddy.application.session.usecase.SessionUseCase;
import me.go_gradually.ceddy.application.shared.port.MetricsPort;
import me.go_gradually.ceddy.application.stt.port.SttGateway;
import me.go_gradually.ceddy.application.stt.usecase.SttUseCase;
import me.go_gradually.ceddy.application.transcript.policy.TranscriptPolicy;
import me.go_gradually.ceddy.application.transcript.port.TranscriptStorePort;
import me.go_gradually.ceddy.application.transcript.usecase.TranscriptUseCase;
import me.go_gradually.ceddy.application.tts.port.TtsGateway;
import me.go_gradually.ceddy.application.tts.usecase.SpeechUseCase;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class UseCaseConfig {
    @Bean
    public SessionUseCase sessionUseCase(SessionStorePort sessionStore) {
        return new SessionUseCase(sessionStore);
    }

    @Bean
    public TranscriptUseCase transcriptUseCase(TranscriptStorePort transcriptStore,
                                               SessionUseCase sessionUseCase,
                                               TranscriptPolicy transcriptPolicy) {
        return new TranscriptUseCase(transcriptStore, sessionUseCase, transcriptPolicy);
    }

    @Bean
    public SttUseCase sttUseCase(SttGateway sttGateway, MetricsPort metricsPort) {
        return new SttUseCase(sttGateway, metricsPort);
    }

    @Bean
    public AssistantUseCase assistantUseCase(AssistantGateway assistantGateway, MetricsPort metricsPort) {
        return new AssistantUseCase(assistantGateway, metricsPort);
    }

    @Bean
    public SpeechUseCase speechUseCase(@Qualifier("elevenLabsTtsGateway") TtsGateway primary,
                                       @Qualifier("openAiTtsGateway") TtsGateway fallback,
                                       MetricsPort metricsPort) {
        return new SpeechUseCase(primary, fallback, metricsPort);
    }

    @Bean
    public InteractionUseCase interactionUseCase(SessionUseCase sessionUseCase,
                                                 TranscriptStorePort transcriptStore,
                                                 SttUseCase sttUseCase,
                                                 AssistantUseCase assistantUseCase,
                                                 SpeechUseCase speechUseCase,
                                                 MetricsPort metricsPort,
                                                 InteractionPolicy interactionPolicy) {
        return new InteractionUseCase(sessionUseCase, transcriptStore, sttUseCase, assistantUseCase,
                speechUseCase, metricsPort, interactionPolicy);
    }

    @Bean
    public RoomUseCase roomUseCase(RoomGateway roomGateway,
                                   RoomTokenPort roomTokenPort,
                                   RoomWebhookPort roomWebhookPort,
                                   RoomPolicy roomPolicy) {
        return new RoomUseCase(roomGateway, roomTokenPort, roomWebhookPort, roomPolicy);
    }

    @Bean
    public GolfAdviceUseCase golfAdviceUseCase() {
        return new GolfAdviceUseCase();
    }
}
