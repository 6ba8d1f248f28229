package me.go_gradually.ceddy.domain.session;

import java.util.UUID;

public record SessionKey(String value) {
    public static final int MAX_LENGTH = 255;

    public SessionKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionKey is required");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("SessionKey must be at most " + MAX_LENGTH + " characters");
        }
    }

    public static SessionKey of(String value) {
        return new SessionKey(value);
    }

    public static SessionKey newKey() {
        return new SessionKey(UUID.randomUUID().toString());
    }
}
