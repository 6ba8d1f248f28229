package me.go_gradually.ceddy.application.session.model;

import java.util.NoSuchElementException;

public class SessionNotFoundException extends NoSuchElementException {
    private final String sessionKey;

    public SessionNotFoundException(String sessionKey) {
        super("Session not found");
        this.sessionKey = sessionKey;
    }

    public String getSessionKey() {
        return sessionKey;
    }
}
