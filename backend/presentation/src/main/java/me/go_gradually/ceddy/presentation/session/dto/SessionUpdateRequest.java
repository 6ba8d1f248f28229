package me.go_gradually.ceddy.presentation.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

public class SessionUpdateRequest {
    @JsonProperty("user_id")
    @Size(max = 255)
    private String userId;

    @JsonProperty("is_active")
    private Boolean active;

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }
}
