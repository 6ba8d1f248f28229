package me.go_gradually.ceddy.application.session.model;

public class DuplicateSessionException extends RuntimeException {
    private final String sessionKey;

    public DuplicateSessionException(String sessionKey) {
        super("Session already exists: " + sessionKey);
        this.sessionKey = sessionKey;
    }

    public DuplicateSessionException(String sessionKey, Throwable cause) {
        super("Session already exists: " + sessionKey, cause);
        this.sessionKey = sessionKey;
    }

    public String getSessionKey() {
        return sessionKey;
    }
}
