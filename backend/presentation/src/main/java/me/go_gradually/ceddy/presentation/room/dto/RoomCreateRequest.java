package me.go_gradually.ceddy.presentation.room.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public class RoomCreateRequest {
    @JsonProperty("room_name")
    @NotBlank
    private String roomName;

    @JsonProperty("empty_timeout")
    @Min(0)
    private Integer emptyTimeout;

    public String getRoomName() {
        return roomName;
    }

    public void setRoomName(String roomName) {
        this.roomName = roomName;
    }

    public Integer getEmptyTimeout() {
        return emptyTimeout;
    }

    public void setEmptyTimeout(Integer emptyTimeout) {
        this.emptyTimeout = emptyTimeout;
    }
}
