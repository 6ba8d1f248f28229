package me.go_gradually.ceddy.presentation.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

public class SessionCreateRequest {
    @JsonProperty("user_id")
    @Size(max = 255)
    private String userId;

    @JsonProperty("session_id")
    @Size(max = 255)
    private String sessionId;

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }
}
