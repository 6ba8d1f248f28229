package me.go_gradually.ceddy.presentation.transcript.controller;

import me.go_gradually.ceddy.application.session.model.SessionNotFoundException;
import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.application.shared.model.PageResult;
import me.go_gradually.ceddy.application.shared.policy.RuntimePolicy;
import me.go_gradually.ceddy.application.transcript.usecase.TranscriptUseCase;
import me.go_gradually.ceddy.domain.session.GolfSessionId;
import me.go_gradually.ceddy.domain.transcript.Transcript;
import me.go_gradually.ceddy.domain.transcript.TranscriptId;
import me.go_gradually.ceddy.presentation.TestBootApplication;
import me.go_gradually.ceddy.presentation.shared.error.ApiExceptionHandler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = {TestBootApplication.class, TranscriptController.class, ApiExceptionHandler.class})
@AutoConfigureMockMvc
class TranscriptControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TranscriptUseCase transcriptUseCase;

    @MockBean
    private RuntimePolicy runtimePolicy;

    @Test
    void list_returnsTranscriptsInSnakeCase() throws Exception {
        Instant now = Instant.parse("2026-05-01T08:00:00Z");
        Transcript transcript = Transcript.rehydrate(TranscriptId.of(3), GolfSessionId.of(7),
                "Hey Ceddy 150 yards", "Use a 7 Iron.", null, true, now, now);
        when(transcriptUseCase.list(PageQuery.of(10, 0), "round-1"))
                .thenReturn(PageResult.of(List.of(transcript), 1));

        mockMvc.perform(get("/api/v1/golf-assistant/transcripts").param("session_id", "round-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.items[0].id").value(3))
                .andExpect(jsonPath("$.items[0].session_id").value(7))
                .andExpect(jsonPath("$.items[0].user_query").value("Hey Ceddy 150 yards"))
                .andExpect(jsonPath("$.items[0].assistant_response").value("Use a 7 Iron."))
                .andExpect(jsonPath("$.items[0].contains_wake_word").value(true));
    }

    @Test
    void list_returnsNotFound_whenFilterSessionUnknown() throws Exception {
        when(transcriptUseCase.list(any(PageQuery.class), eq("missing")))
                .thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/golf-assistant/transcripts").param("session_id", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void list_returnsBadRequest_whenOffsetNegative() throws Exception {
        mockMvc.perform(get("/api/v1/golf-assistant/transcripts").param("offset", "-5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("offset must not be negative"));
    }
}
