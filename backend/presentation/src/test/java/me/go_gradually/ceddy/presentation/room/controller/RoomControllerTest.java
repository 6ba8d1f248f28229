package me.go_gradually.ceddy.presentation.room.controller;

import me.go_gradually.ceddy.application.room.model.InvalidWebhookException;
import me.go_gradually.ceddy.application.room.model.IssuedToken;
import me.go_gradually.ceddy.application.room.model.ParticipantInfo;
import me.go_gradually.ceddy.application.room.model.RoomCreateCommand;
import me.go_gradually.ceddy.application.room.model.RoomInfo;
import me.go_gradually.ceddy.application.room.model.RoomProviderException;
import me.go_gradually.ceddy.application.room.model.RoomServiceUnavailableException;
import me.go_gradually.ceddy.application.room.model.TokenGrantCommand;
import me.go_gradually.ceddy.application.room.usecase.RoomUseCase;
import me.go_gradually.ceddy.application.shared.policy.RuntimePolicy;
import me.go_gradually.ceddy.presentation.TestBootApplication;
import me.go_gradually.ceddy.presentation.shared.error.ApiExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = {TestBootApplication.class, RoomController.class, ApiExceptionHandler.class})
@AutoConfigureMockMvc
class RoomControllerTest {

    private static final String BASE = "/api/v1/golf-assistant/livekit";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RoomUseCase roomUseCase;

    @MockBean
    private RuntimePolicy runtimePolicy;

    @Test
    void createRoom_defaultsEmptyTimeout() throws Exception {
        when(roomUseCase.createRoom(any(RoomCreateCommand.class))).thenReturn(room("course-1"));

        mockMvc.perform(post(BASE + "/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_name\":\"course-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("course-1"))
                .andExpect(jsonPath("$.sid").value("RM_1"))
                .andExpect(jsonPath("$.empty_timeout").value(300))
                .andExpect(jsonPath("$.enabled_codecs[0]").value("audio/opus"));

        ArgumentCaptor<RoomCreateCommand> captor = ArgumentCaptor.forClass(RoomCreateCommand.class);
        verify(roomUseCase).createRoom(captor.capture());
        assertEquals("course-1", captor.getValue().getRoomName());
        assertEquals(RoomCreateCommand.DEFAULT_EMPTY_TIMEOUT_SECONDS, captor.getValue().getEmptyTimeout());
    }

    @Test
    void createRoom_returnsBadRequest_whenNameMissing() throws Exception {
        mockMvc.perform(post(BASE + "/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"empty_timeout\":10}"))
                .andExpect(status().isBadRequest());

        verify(roomUseCase, never()).createRoom(any());
    }

    @Test
    void createRoom_returnsServiceUnavailable_whenNotConfigured() throws Exception {
        when(roomUseCase.createRoom(any(RoomCreateCommand.class)))
                .thenThrow(new RoomServiceUnavailableException("LiveKit is not configured"));

        mockMvc.perform(post(BASE + "/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_name\":\"course-1\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("LiveKit is not configured"));
    }

    @Test
    void listRooms_returnsInternalError_onProviderFailure() throws Exception {
        when(roomUseCase.listRooms()).thenThrow(new RoomProviderException("LiveKit ListRooms failed"));

        mockMvc.perform(get(BASE + "/rooms"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("LiveKit ListRooms failed"));
    }

    @Test
    void deleteRoom_returnsNoContent() throws Exception {
        mockMvc.perform(delete(BASE + "/rooms/course-1"))
                .andExpect(status().isNoContent());

        verify(roomUseCase).deleteRoom("course-1");
    }

    @Test
    void listParticipants_mapsParticipants() throws Exception {
        when(roomUseCase.listParticipants("course-1")).thenReturn(List.of(
                new ParticipantInfo("golfer-1", "Golfer", "ACTIVE", null, Instant.parse("2026-05-01T08:00:00Z"))));

        mockMvc.perform(get(BASE + "/rooms/course-1/participants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].identity").value("golfer-1"))
                .andExpect(jsonPath("$[0].joined_at").exists());
    }

    @Test
    void issueToken_returnsTokenAndIdentity() throws Exception {
        when(roomUseCase.issueToken(any(TokenGrantCommand.class)))
                .thenReturn(new IssuedToken("jwt", "course-1", "generated-id"));

        mockMvc.perform(post(BASE + "/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_name\":\"course-1\",\"participant_name\":\"Golfer\",\"ttl\":600}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("jwt"))
                .andExpect(jsonPath("$.room_name").value("course-1"))
                .andExpect(jsonPath("$.participant_identity").value("generated-id"));

        ArgumentCaptor<TokenGrantCommand> captor = ArgumentCaptor.forClass(TokenGrantCommand.class);
        verify(roomUseCase).issueToken(captor.capture());
        assertEquals("Golfer", captor.getValue().getParticipantName());
        assertEquals(600, captor.getValue().getTtlSeconds());
        assertNull(captor.getValue().getParticipantIdentity());
    }

    @Test
    void issueToken_returnsBadRequest_whenTtlNotPositive() throws Exception {
        mockMvc.perform(post(BASE + "/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_name\":\"course-1\",\"participant_name\":\"Golfer\",\"ttl\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void webhook_passesRawBodyAndAuthorization() throws Exception {
        String body = "{\"event\":\"room_finished\"}";
        when(roomUseCase.receiveWebhook(body, "Bearer signed")).thenReturn(Map.of("event", "room_finished"));

        mockMvc.perform(post(BASE + "/webhook")
                        .contentType("application/webhook+json")
                        .header("Authorization", "Bearer signed")
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.event").value("room_finished"));
    }

    @Test
    void webhook_returnsUnauthorized_whenSignatureInvalid() throws Exception {
        when(roomUseCase.receiveWebhook(any(), eq(null)))
                .thenThrow(new InvalidWebhookException("Missing webhook authorization"));

        mockMvc.perform(post(BASE + "/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());
    }

    private RoomInfo room(String name) {
        return new RoomInfo(name, "RM_1", 300, 0, Instant.parse("2026-05-01T08:00:00Z"), "pw",
                List.of("audio/opus"), null);
    }
}
