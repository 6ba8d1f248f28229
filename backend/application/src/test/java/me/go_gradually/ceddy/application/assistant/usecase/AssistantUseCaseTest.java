package me.go_gradually.ceddy.application.assistant.usecase;

import me.go_gradually.ceddy.application.assistant.model.AssistantTimeoutException;
import me.go_gradually.ceddy.application.assistant.port.AssistantGateway;
import me.go_gradually.ceddy.application.shared.model.ProviderFailure;
import me.go_gradually.ceddy.application.shared.model.ProviderResult;
import me.go_gradually.ceddy.application.shared.port.MetricsPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssistantUseCaseTest {

    @Mock
    private AssistantGateway assistantGateway;
    @Mock
    private MetricsPort metrics;

    private AssistantUseCase useCase;

    @BeforeEach
    void setUp() {
        useCase = new AssistantUseCase(assistantGateway, metrics);
    }

    @Test
    void reply_returnsAssistantText() throws Exception {
        when(assistantGateway.isConfigured()).thenReturn(true);
        when(assistantGateway.reply("Hey Ceddy 150 yards")).thenReturn(Optional.of("Use a 7 Iron."));

        ProviderResult<String> result = useCase.reply("Hey Ceddy 150 yards");

        assertTrue(result.isSuccess());
        assertEquals("Use a 7 Iron.", result.orElse(null));
    }

    @Test
    void replyOrApology_returnsNoReplyApology_whenAssistantSilent() throws Exception {
        when(assistantGateway.isConfigured()).thenReturn(true);
        when(assistantGateway.reply("q")).thenReturn(Optional.empty());

        assertEquals(AssistantUseCase.NO_REPLY_MESSAGE, useCase.replyOrApology("q"));
    }

    @Test
    void replyOrApology_returnsErrorApology_whenGatewayThrows() throws Exception {
        when(assistantGateway.isConfigured()).thenReturn(true);
        when(assistantGateway.reply("q")).thenThrow(new IllegalStateException("run failed"));

        assertEquals(AssistantUseCase.ERROR_MESSAGE, useCase.replyOrApology("q"));
        verify(metrics).incrementAssistantError();
    }

    @Test
    void reply_reportsTimeout_separately() throws Exception {
        when(assistantGateway.isConfigured()).thenReturn(true);
        when(assistantGateway.reply("q")).thenThrow(new AssistantTimeoutException("run_1", Duration.ofSeconds(60)));

        ProviderResult<String> result = useCase.reply("q");

        assertEquals(ProviderFailure.TIMEOUT, result.failure());
        verify(metrics).incrementAssistantTimeout();
        verify(metrics, never()).incrementAssistantError();
        assertEquals(AssistantUseCase.ERROR_MESSAGE, useCase.replyOrApology("q"));
    }

    @Test
    void reply_returnsUnconfigured_withoutCallingGateway() throws Exception {
        when(assistantGateway.isConfigured()).thenReturn(false);

        assertEquals(ProviderFailure.UNCONFIGURED, useCase.reply("q").failure());
        verify(assistantGateway, never()).reply("q");
    }
}
