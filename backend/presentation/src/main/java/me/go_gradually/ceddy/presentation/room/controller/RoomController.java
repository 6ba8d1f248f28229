package me.go_gradually.ceddy.presentation.room.controller;

import jakarta.validation.Valid;
import me.go_gradually.ceddy.application.room.model.RoomCreateCommand;
import me.go_gradually.ceddy.application.room.model.TokenGrantCommand;
import me.go_gradually.ceddy.application.room.usecase.RoomUseCase;
import me.go_gradually.ceddy.presentation.room.dto.ParticipantResponse;
import me.go_gradually.ceddy.presentation.room.dto.RoomCreateRequest;
import me.go_gradually.ceddy.presentation.room.dto.RoomResponse;
import me.go_gradually.ceddy.presentation.room.dto.TokenRequest;
import me.go_gradually.ceddy.presentation.room.dto.TokenResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/golf-assistant/livekit")
public class RoomController {
    private final RoomUseCase roomUseCase;

    public RoomController(RoomUseCase roomUseCase) {
        this.roomUseCase = roomUseCase;
    }

    @PostMapping("/rooms")
    public RoomResponse createRoom(@Valid @RequestBody RoomCreateRequest request) {
        RoomCreateCommand command = new RoomCreateCommand();
        command.setRoomName(request.getRoomName());
        command.setEmptyTimeout(request.getEmptyTimeout());
        return RoomResponse.from(roomUseCase.createRoom(command));
    }

    @GetMapping("/rooms")
    public List<RoomResponse> listRooms() {
        return roomUseCase.listRooms().stream().map(RoomResponse::from).collect(Collectors.toList());
    }

    @DeleteMapping("/rooms/{roomName}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteRoom(@PathVariable("roomName") String roomName) {
        roomUseCase.deleteRoom(roomName);
    }

    @GetMapping("/rooms/{roomName}/participants")
    public List<ParticipantResponse> listParticipants(@PathVariable("roomName") String roomName) {
        return roomUseCase.listParticipants(roomName).stream()
                .map(ParticipantResponse::from)
                .collect(Collectors.toList());
    }

    @PostMapping("/token")
    public TokenResponse issueToken(@Valid @RequestBody TokenRequest request) {
        TokenGrantCommand command = new TokenGrantCommand();
        command.setRoomName(request.getRoomName());
        command.setParticipantName(request.getParticipantName());
        command.setParticipantIdentity(request.getParticipantIdentity());
        command.setTtlSeconds(request.getTtl());
        command.setMetadata(request.getMetadata());
        return TokenResponse.from(roomUseCase.issueToken(command));
    }

    @PostMapping("/webhook")
    public Map<String, Object> webhook(@RequestBody(required = false) String body,
                                       @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return roomUseCase.receiveWebhook(body, authorization);
    }
}
