package me.go_gradually.ceddy.infrastructure.room.livekit;

import com.auth0.jwt.JWT;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.ceddy.application.room.model.ParticipantInfo;
import me.go_gradually.ceddy.application.room.model.RoomInfo;
import me.go_gradually.ceddy.application.room.model.RoomProviderException;
import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiveKitRoomGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private LiveKitRoomGateway gateway;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        AppProperties properties = new AppProperties();
        properties.getIntegrations().getLivekit().setApiKey("lk-key");
        properties.getIntegrations().getLivekit().setApiSecret("lk-secret-with-enough-length");
        gateway = new LiveKitRoomGateway(
                WebClient.builder().baseUrl(server.url("/").toString()).build(),
                new LiveKitTokenIssuer(properties),
                objectMapper);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void createRoom_postsTwirpRequestWithServerGrant() throws Exception {
        server.enqueue(json("{\"sid\":\"RM_1\",\"name\":\"course-1\",\"empty_timeout\":300,"
                + "\"max_participants\":0,\"creation_time\":\"1767261600\",\"turn_password\":\"pw\","
                + "\"enabled_codecs\":[{\"mime\":\"audio/opus\"},{\"mime\":\"video/VP8\"}]}"));

        RoomInfo room = gateway.createRoom("course-1", 300);

        assertEquals("course-1", room.name());
        assertEquals("RM_1", room.sid());
        assertEquals(300, room.emptyTimeout());
        assertEquals(Instant.ofEpochSecond(1767261600L), room.createdAt());
        assertEquals(List.of("audio/opus", "video/VP8"), room.enabledCodecs());

        RecordedRequest request = server.takeRequest();
        assertEquals("/twirp/livekit.RoomService/CreateRoom", request.getPath());
        JsonNode payload = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("course-1", payload.path("name").asText());
        assertEquals(300, payload.path("empty_timeout").asInt());

        String authorization = request.getHeader("Authorization");
        assertTrue(authorization.startsWith("Bearer "));
        DecodedJWT jwt = JWT.decode(authorization.substring("Bearer ".length()));
        assertEquals(Boolean.TRUE, jwt.getClaim("video").asMap().get("roomCreate"));
    }

    @Test
    void listRooms_readsCamelCaseFields() {
        server.enqueue(json("{\"rooms\":[{\"sid\":\"RM_2\",\"name\":\"range\",\"emptyTimeout\":60,"
                + "\"maxParticipants\":4,\"creationTime\":1767261600}]}"));

        List<RoomInfo> rooms = gateway.listRooms();

        assertEquals(1, rooms.size());
        assertEquals(60, rooms.get(0).emptyTimeout());
        assertEquals(4, rooms.get(0).maxParticipants());
        assertTrue(rooms.get(0).enabledCodecs().isEmpty());
    }

    @Test
    void listRooms_returnsEmpty_whenResponseHasNoRooms() {
        server.enqueue(json("{}"));

        assertTrue(gateway.listRooms().isEmpty());
    }

    @Test
    void listParticipants_mapsIdentityAndJoinTime() throws Exception {
        server.enqueue(json("{\"participants\":[{\"identity\":\"golfer-1\",\"name\":\"Golfer\","
                + "\"state\":\"ACTIVE\",\"joined_at\":\"1767261600\"}]}"));

        List<ParticipantInfo> participants = gateway.listParticipants("course-1");

        assertEquals("golfer-1", participants.get(0).identity());
        assertEquals("ACTIVE", participants.get(0).state());
        assertEquals(Instant.ofEpochSecond(1767261600L), participants.get(0).joinedAt());

        RecordedRequest request = server.takeRequest();
        assertEquals("/twirp/livekit.RoomService/ListParticipants", request.getPath());
        DecodedJWT jwt = JWT.decode(request.getHeader("Authorization").substring("Bearer ".length()));
        assertEquals("course-1", jwt.getClaim("video").asMap().get("room"));
    }

    @Test
    void deleteRoom_throwsProviderException_onServerError() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"msg\":\"boom\"}"));

        RoomProviderException error = assertThrows(RoomProviderException.class, () -> gateway.deleteRoom("course-1"));

        assertTrue(error.getMessage().contains("DeleteRoom"));
    }

    @Test
    void asLong_parsesStringNumbers() throws Exception {
        assertEquals(42L, LiveKitRoomGateway.asLong(objectMapper.readTree("\"42\"")));
        assertEquals(0L, LiveKitRoomGateway.asLong(objectMapper.readTree("\"abc\"")));
        assertEquals(0L, LiveKitRoomGateway.asLong(null));
    }

    private MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
