package me.go_gradually.ceddy.infrastructure.room.livekit;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.algorithms.Algorithm;
import me.go_gradually.ceddy.application.room.port.RoomTokenPort;
import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Signs room access tokens (HS256, issuer = API key) carrying a {@code video} grant.
 */
@Component
public class LiveKitTokenIssuer implements RoomTokenPort {
    private final AppProperties.LiveKit settings;
    private final Clock clock;

    @Autowired
    public LiveKitTokenIssuer(AppProperties properties) {
        this(properties, Clock.systemUTC());
    }

    LiveKitTokenIssuer(AppProperties properties, Clock clock) {
        this.settings = properties.getIntegrations().getLivekit();
        this.clock = clock;
    }

    @Override
    public String issueJoinToken(String roomName, String identity, String name, String metadata, Duration ttl) {
        Map<String, Object> grant = new LinkedHashMap<>();
        grant.put("roomJoin", true);
        grant.put("room", roomName);
        grant.put("canPublish", true);
        grant.put("canSubscribe", true);
        grant.put("canPublishData", true);

        JWTCreator.Builder builder = base(identity, ttl).withClaim("video", grant);
        if (name != null && !name.isBlank()) {
            builder.withClaim("name", name);
        }
        if (metadata != null) {
            builder.withClaim("metadata", metadata);
        }
        return builder.sign(algorithm());
    }

    /**
     * Short-lived token for server-to-server room API calls.
     */
    String issueServerToken(Map<String, Object> videoGrant) {
        return base(null, Duration.ofSeconds(settings.getServerTokenTtlSeconds()))
                .withClaim("video", videoGrant)
                .sign(algorithm());
    }

    private JWTCreator.Builder base(String subject, Duration ttl) {
        Instant now = clock.instant();
        JWTCreator.Builder builder = JWT.create()
                .withIssuer(settings.getApiKey())
                .withNotBefore(Date.from(now))
                .withExpiresAt(Date.from(now.plus(ttl)))
                .withJWTId(UUID.randomUUID().toString());
        if (subject != null) {
            builder.withSubject(subject);
        }
        return builder;
    }

    private Algorithm algorithm() {
        String secret = settings.getApiSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("LiveKit API secret is not configured");
        }
        return Algorithm.HMAC256(secret);
    }
}
