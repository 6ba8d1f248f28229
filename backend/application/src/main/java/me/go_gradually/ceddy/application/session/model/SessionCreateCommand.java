package me.go_gradually.ceddy.application.session.model;

public class SessionCreateCommand {
    private String sessionKey;
    private String userId;

    public String getSessionKey() {
        return sessionKey;
    }

    public void setSessionKey(String sessionKey) {
        this.sessionKey = sessionKey;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }
}
