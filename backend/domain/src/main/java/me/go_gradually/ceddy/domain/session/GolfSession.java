package me.go_gradually.ceddy.domain.session;

import java.time.Instant;

/**
 * One conversational context with the assistant.
 * <p>
 * The internal id and timestamps are assigned by the store, so a freshly created session
 * has no id until it has been persisted. The session key never changes once created.
 */
public class GolfSession {
    private final GolfSessionId id;
    private final SessionKey key;
    private String userId;
    private boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;

    private GolfSession(GolfSessionId id,
                        SessionKey key,
                        String userId,
                        boolean active,
                        Instant createdAt,
                        Instant updatedAt) {
        if (key == null) {
            throw new IllegalArgumentException("GolfSession key is required");
        }
        this.id = id;
        this.key = key;
        this.userId = userId;
        this.active = active;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static GolfSession createNew(SessionKey key, String userId) {
        return new GolfSession(null, key, blankToNull(userId), true, null, null);
    }

    public static GolfSession rehydrate(GolfSessionId id,
                                        SessionKey key,
                                        String userId,
                                        boolean active,
                                        Instant createdAt,
                                        Instant updatedAt) {
        if (id == null) {
            throw new IllegalArgumentException("Persisted GolfSession requires an id");
        }
        return new GolfSession(id, key, userId, active, createdAt, updatedAt);
    }

    /**
     * Applies a partial update. A null argument leaves the field untouched.
     */
    public void applyUpdate(String userId, Boolean active) {
        if (userId != null) {
            this.userId = blankToNull(userId);
        }
        if (active != null) {
            this.active = active;
        }
    }

    public boolean isPersisted() {
        return id != null;
    }

    public GolfSessionId getId() {
        return id;
    }

    public SessionKey getKey() {
        return key;
    }

    public String getUserId() {
        return userId;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
