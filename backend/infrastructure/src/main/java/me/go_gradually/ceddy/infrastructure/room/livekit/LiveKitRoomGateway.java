package me.go_gradually.ceddy.infrastructure.room.livekit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.ceddy.application.room.model.ParticipantInfo;
import me.go_gradually.ceddy.application.room.model.RoomInfo;
import me.go_gradually.ceddy.application.room.model.RoomProviderException;
import me.go_gradually.ceddy.application.room.port.RoomGateway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Room service over its Twirp JSON API. Field names are read in snake_case with a camelCase
 * fallback, and 64-bit integers may arrive as strings.
 */
@Component
public class LiveKitRoomGateway implements RoomGateway {
    private static final Logger log = Logger.getLogger(LiveKitRoomGateway.class.getName());
    private static final String SERVICE_PATH = "/twirp/livekit.RoomService/";

    private final WebClient webClient;
    private final LiveKitTokenIssuer tokenIssuer;
    private final ObjectMapper objectMapper;

    public LiveKitRoomGateway(@Qualifier("liveKitWebClient") WebClient webClient,
                              LiveKitTokenIssuer tokenIssuer,
                              ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.tokenIssuer = tokenIssuer;
        this.objectMapper = objectMapper;
    }

    @Override
    public RoomInfo createRoom(String roomName, int emptyTimeoutSeconds) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", roomName);
        payload.put("empty_timeout", emptyTimeoutSeconds);
        JsonNode room = call("CreateRoom", payload, Map.of("roomCreate", true));
        return toRoom(room);
    }

    @Override
    public List<RoomInfo> listRooms() {
        JsonNode response = call("ListRooms", Map.of(), Map.of("roomList", true));
        List<RoomInfo> rooms = new ArrayList<>();
        for (JsonNode room : response.path("rooms")) {
            rooms.add(toRoom(room));
        }
        return rooms;
    }

    @Override
    public void deleteRoom(String roomName) {
        call("DeleteRoom", Map.of("room", roomName), Map.of("roomCreate", true));
    }

    @Override
    public List<ParticipantInfo> listParticipants(String roomName) {
        JsonNode response = call("ListParticipants", Map.of("room", roomName),
                Map.of("roomAdmin", true, "room", roomName));
        List<ParticipantInfo> participants = new ArrayList<>();
        for (JsonNode participant : response.path("participants")) {
            participants.add(new ParticipantInfo(
                    text(participant, "identity", "identity"),
                    text(participant, "name", "name"),
                    text(participant, "state", "state"),
                    text(participant, "metadata", "metadata"),
                    epochSeconds(field(participant, "joined_at", "joinedAt"))
            ));
        }
        return participants;
    }

    private JsonNode call(String method, Map<String, ?> payload, Map<String, Object> grant) {
        try {
            String body = webClient.post()
                    .uri(SERVICE_PATH + method)
                    .header("Authorization", "Bearer " + tokenIssuer.issueServerToken(grant))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (WebClientResponseException e) {
            log.warning("livekit.room failure method=" + method + " status=" + e.getStatusCode().value());
            throw new RoomProviderException("LiveKit " + method + " failed with status " + e.getStatusCode().value(), e);
        } catch (WebClientException e) {
            log.warning("livekit.room failure method=" + method + " reason=" + e.getMessage());
            throw new RoomProviderException("LiveKit " + method + " failed", e);
        } catch (Exception e) {
            throw new RoomProviderException("LiveKit " + method + " failed: " + e.getMessage(), e);
        }
    }

    private RoomInfo toRoom(JsonNode room) {
        if (room == null || !room.isObject() || room.isEmpty()) {
            throw new RoomProviderException("LiveKit returned no room");
        }
        List<String> codecs = new ArrayList<>();
        for (JsonNode codec : field(room, "enabled_codecs", "enabledCodecs")) {
            String mime = codec.path("mime").asText("");
            if (!mime.isEmpty()) {
                codecs.add(mime);
            }
        }
        return new RoomInfo(
                text(room, "name", "name"),
                text(room, "sid", "sid"),
                (int) asLong(field(room, "empty_timeout", "emptyTimeout")),
                (int) asLong(field(room, "max_participants", "maxParticipants")),
                epochSeconds(field(room, "creation_time", "creationTime")),
                text(room, "turn_password", "turnPassword"),
                codecs,
                text(room, "metadata", "metadata")
        );
    }

    private JsonNode field(JsonNode node, String snake, String camel) {
        JsonNode value = node.path(snake);
        return value.isMissingNode() || value.isNull() ? node.path(camel) : value;
    }

    private String text(JsonNode node, String snake, String camel) {
        JsonNode value = field(node, snake, camel);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    static long asLong(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return 0L;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        try {
            return Long.parseLong(value.asText().trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private Instant epochSeconds(JsonNode value) {
        long seconds = asLong(value);
        return seconds > 0 ? Instant.ofEpochSecond(seconds) : null;
    }
}
