package me.go_gradually.ceddy.presentation.room.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.go_gradually.ceddy.application.room.model.IssuedToken;

public class TokenResponse {
    private String token;
    @JsonProperty("room_name")
    private String roomName;
    @JsonProperty("participant_identity")
    private String participantIdentity;

    public static TokenResponse from(IssuedToken issued) {
        TokenResponse response = new TokenResponse();
        response.setToken(issued.token());
        response.setRoomName(issued.roomName());
        response.setParticipantIdentity(issued.participantIdentity());
        return response;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getRoomName() {
        return roomName;
    }

    public void setRoomName(String roomName) {
        this.roomName = roomName;
    }

    public String getParticipantIdentity() {
        return participantIdentity;
    }

    public void setParticipantIdentity(String participantIdentity) {
        this.participantIdentity = participantIdentity;
    }
}
