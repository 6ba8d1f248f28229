package me.go_gradually.ceddy.presentation.room.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.go_gradually.ceddy.application.room.model.ParticipantInfo;

import java.time.Instant;

public class ParticipantResponse {
    private String identity;
    private String name;
    private String state;
    private String metadata;
    @JsonProperty("joined_at")
    private Instant joinedAt;

    public static ParticipantResponse from(ParticipantInfo participant) {
        ParticipantResponse response = new ParticipantResponse();
        response.setIdentity(participant.identity());
        response.setName(participant.name());
        response.setState(participant.state());
        response.setMetadata(participant.metadata());
        response.setJoinedAt(participant.joinedAt());
        return response;
    }

    public String getIdentity() {
        return identity;
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getMetadata() {
        return metadata;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }
}
