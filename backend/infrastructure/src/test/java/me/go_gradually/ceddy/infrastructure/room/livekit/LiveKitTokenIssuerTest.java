package me.go_gradually.ceddy.infrastructure.room.livekit;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LiveKitTokenIssuerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private AppProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getIntegrations().getLivekit().setApiKey("lk-key");
        properties.getIntegrations().getLivekit().setApiSecret("lk-secret-with-enough-length");
    }

    @Test
    void issueJoinToken_signsVideoGrantForRoomAndIdentity() {
        LiveKitTokenIssuer issuer = new LiveKitTokenIssuer(properties);

        String token = issuer.issueJoinToken("course-1", "golfer-1", "Golfer", "{\"hole\":3}", Duration.ofHours(1));

        DecodedJWT jwt = JWT.require(Algorithm.HMAC256("lk-secret-with-enough-length"))
                .withIssuer("lk-key")
                .build()
                .verify(token);
        assertEquals("golfer-1", jwt.getSubject());
        assertEquals("Golfer", jwt.getClaim("name").asString());
        assertEquals("{\"hole\":3}", jwt.getClaim("metadata").asString());
        Map<String, Object> video = jwt.getClaim("video").asMap();
        assertEquals(Boolean.TRUE, video.get("roomJoin"));
        assertEquals("course-1", video.get("room"));
        assertEquals(Boolean.TRUE, video.get("canPublish"));
        assertEquals(Boolean.TRUE, video.get("canSubscribe"));
        assertEquals(Boolean.TRUE, video.get("canPublishData"));
        assertNotNull(jwt.getId());
    }

    @Test
    void issueJoinToken_expiresAfterTtl() {
        LiveKitTokenIssuer issuer = new LiveKitTokenIssuer(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        DecodedJWT jwt = JWT.decode(issuer.issueJoinToken("course-1", "golfer-1", null, null, Duration.ofMinutes(5)));

        assertEquals(NOW, jwt.getNotBeforeAsInstant());
        assertEquals(NOW.plusSeconds(300), jwt.getExpiresAtAsInstant());
        assertTrue(jwt.getClaim("name").isMissing());
        assertTrue(jwt.getClaim("metadata").isMissing());
    }

    @Test
    void issueServerToken_hasNoSubjectAndUsesServerTtl() {
        properties.getIntegrations().getLivekit().setServerTokenTtlSeconds(120);
        LiveKitTokenIssuer issuer = new LiveKitTokenIssuer(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        DecodedJWT jwt = JWT.decode(issuer.issueServerToken(Map.of("roomList", true)));

        assertNull(jwt.getSubject());
        assertEquals("lk-key", jwt.getIssuer());
        assertEquals(NOW.plusSeconds(120), jwt.getExpiresAtAsInstant());
        assertEquals(Boolean.TRUE, jwt.getClaim("video").asMap().get("roomList"));
    }

    @Test
    void issueJoinToken_throws_whenSecretMissing() {
        properties.getIntegrations().getLivekit().setApiSecret(" ");
        LiveKitTokenIssuer issuer = new LiveKitTokenIssuer(properties);

        assertThrows(IllegalStateException.class,
                () -> issuer.issueJoinToken("course-1", "golfer-1", null, null, Duration.ofMinutes(1)));
    }
}
