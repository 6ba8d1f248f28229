package me.go_gradually.ceddy.presentation.room.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.go_gradually.ceddy.application.room.model.RoomInfo;

import java.time.Instant;
import java.util.List;

public class RoomResponse {
    private String name;
    private String sid;
    @JsonProperty("empty_timeout")
    private int emptyTimeout;
    @JsonProperty("max_participants")
    private int maxParticipants;
    @JsonProperty("creation_time")
    private Instant creationTime;
    @JsonProperty("turn_password")
    private String turnPassword;
    @JsonProperty("enabled_codecs")
    private List<String> enabledCodecs;
    private String metadata;

    public static RoomResponse from(RoomInfo room) {
        RoomResponse response = new RoomResponse();
        response.setName(room.name());
        response.setSid(room.sid());
        response.setEmptyTimeout(room.emptyTimeout());
        response.setMaxParticipants(room.maxParticipants());
        response.setCreationTime(room.createdAt());
        response.setTurnPassword(room.turnPassword());
        response.setEnabledCodecs(room.enabledCodecs());
        response.setMetadata(room.metadata());
        return response;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSid() {
        return sid;
    }

    public void setSid(String sid) {
        this.sid = sid;
    }

    public int getEmptyTimeout() {
        return emptyTimeout;
    }

    public void setEmptyTimeout(int emptyTimeout) {
        this.emptyTimeout = emptyTimeout;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }

    public void setMaxParticipants(int maxParticipants) {
        this.maxParticipants = maxParticipants;
    }

    public Instant getCreationTime() {
        return creationTime;
    }

    public void setCreationTime(Instant creationTime) {
        this.creationTime = creationTime;
    }

    public String getTurnPassword() {
        return turnPassword;
    }

    public void setTurnPassword(String turnPassword) {
        this.turnPassword = turnPassword;
    }

    public List<String> getEnabledCodecs() {
        return enabledCodecs;
    }

    public void setEnabledCodecs(List<String> enabledCodecs) {
        this.enabledCodecs = enabledCodecs;
    }

    public String getMetadata() {
        return metadata;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }
}
