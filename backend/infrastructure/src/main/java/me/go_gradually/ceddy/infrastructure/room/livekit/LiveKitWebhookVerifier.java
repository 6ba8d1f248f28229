package me.go_gradually.ceddy.infrastructure.room.livekit;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.ceddy.application.room.model.InvalidWebhookException;
import me.go_gradually.ceddy.application.room.port.RoomWebhookPort;
import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Map;

/**
 * Webhook requests carry a JWT signed with the API secret whose {@code sha256} claim is the
 * base64 SHA-256 digest of the raw body.
 */
@Component
public class LiveKitWebhookVerifier implements RoomWebhookPort {
    private static final String BEARER_PREFIX = "Bearer ";

    private final AppProperties.LiveKit settings;
    private final ObjectMapper objectMapper;

    public LiveKitWebhookVerifier(AppProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getIntegrations().getLivekit();
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, Object> receive(String body, String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw new InvalidWebhookException("Missing webhook authorization");
        }
        String token = authorization.startsWith(BEARER_PREFIX)
                ? authorization.substring(BEARER_PREFIX.length()).trim()
                : authorization.trim();
        DecodedJWT jwt;
        try {
            jwt = JWT.require(Algorithm.HMAC256(settings.getApiSecret()))
                    .withIssuer(settings.getApiKey())
                    .build()
                    .verify(token);
        } catch (JWTVerificationException e) {
            throw new InvalidWebhookException("Invalid webhook signature", e);
        }
        String expected = jwt.getClaim("sha256").asString();
        byte[] actual = sha256Base64(body).getBytes(StandardCharsets.UTF_8);
        if (expected == null || !MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual)) {
            throw new InvalidWebhookException("Webhook body digest mismatch");
        }
        try {
            return objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {
            });
        } catch (Exception e) {
            throw new InvalidWebhookException("Webhook body is not valid JSON", e);
        }
    }

    static String sha256Base64(String body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
