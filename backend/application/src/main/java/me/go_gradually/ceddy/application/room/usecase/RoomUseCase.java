package me.go_gradually.ceddy.application.room.usecase;

import me.go_gradually.ceddy.application.room.model.IssuedToken;
import me.go_gradually.ceddy.application.room.model.ParticipantInfo;
import me.go_gradually.ceddy.application.room.model.RoomCreateCommand;
import me.go_gradually.ceddy.application.room.model.RoomInfo;
import me.go_gradually.ceddy.application.room.model.RoomServiceUnavailableException;
import me.go_gradually.ceddy.application.room.model.TokenGrantCommand;
import me.go_gradually.ceddy.application.room.policy.RoomPolicy;
import me.go_gradually.ceddy.application.room.port.RoomGateway;
import me.go_gradually.ceddy.application.room.port.RoomTokenPort;
import me.go_gradually.ceddy.application.room.port.RoomWebhookPort;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

public class RoomUseCase {
    private static final Logger log = Logger.getLogger(RoomUseCase.class.getName());

    private final RoomGateway roomGateway;
    private final RoomTokenPort tokenPort;
    private final RoomWebhookPort webhookPort;
    private final RoomPolicy roomPolicy;

    public RoomUseCase(RoomGateway roomGateway,
                       RoomTokenPort tokenPort,
                       RoomWebhookPort webhookPort,
                       RoomPolicy roomPolicy) {
        this.roomGateway = roomGateway;
        this.tokenPort = tokenPort;
        this.webhookPort = webhookPort;
        this.roomPolicy = roomPolicy;
    }

    public RoomInfo createRoom(RoomCreateCommand command) {
        requireRoomService();
        String roomName = requireName(command.getRoomName(), "room_name");
        if (command.getEmptyTimeout() < 0) {
            throw new IllegalArgumentException("empty_timeout must be >= 0");
        }
        RoomInfo room = roomGateway.createRoom(roomName, command.getEmptyTimeout());
        log.info(() -> "room.created room=" + room.name() + " sid=" + room.sid());
        return room;
    }

    public List<RoomInfo> listRooms() {
        requireRoomService();
        return roomGateway.listRooms();
    }

    public void deleteRoom(String roomName) {
        requireRoomService();
        String name = requireName(roomName, "room_name");
        roomGateway.deleteRoom(name);
        log.info(() -> "room.deleted room=" + name);
    }

    public List<ParticipantInfo> listParticipants(String roomName) {
        requireRoomService();
        return roomGateway.listParticipants(requireName(roomName, "room_name"));
    }

    public IssuedToken issueToken(TokenGrantCommand command) {
        requireTokenService();
        String roomName = requireName(command.getRoomName(), "room_name");
        String participantName = requireName(command.getParticipantName(), "participant_name");
        if (command.getTtlSeconds() <= 0) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        String identity = command.getParticipantIdentity() == null || command.getParticipantIdentity().isBlank()
                ? UUID.randomUUID().toString()
                : command.getParticipantIdentity();
        String token = tokenPort.issueJoinToken(roomName, identity, participantName, command.getMetadata(),
                Duration.ofSeconds(command.getTtlSeconds()));
        return new IssuedToken(token, roomName, identity);
    }

    public Map<String, Object> receiveWebhook(String body, String authorization) {
        requireTokenService();
        Map<String, Object> event = webhookPort.receive(body == null ? "" : body, authorization);
        log.info(() -> "room.webhook event=" + event.get("event"));
        return event;
    }

    private void requireRoomService() {
        if (!roomPolicy.roomServiceConfigured()) {
            throw new RoomServiceUnavailableException("LiveKit is not configured");
        }
    }

    private void requireTokenService() {
        if (!roomPolicy.tokenServiceConfigured()) {
            throw new RoomServiceUnavailableException("LiveKit is not configured");
        }
    }

    private String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }
}
