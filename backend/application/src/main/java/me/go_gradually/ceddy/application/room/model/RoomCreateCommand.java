package me.go_gradually.ceddy.application.room.model;

public class RoomCreateCommand {
    public static final int DEFAULT_EMPTY_TIMEOUT_SECONDS = 300;

    private String roomName;
    private Integer emptyTimeout;

    public String getRoomName() {
        return roomName;
    }

    public void setRoomName(String roomName) {
        this.roomName = roomName;
    }

    public int getEmptyTimeout() {
        return emptyTimeout == null ? DEFAULT_EMPTY_TIMEOUT_SECONDS : emptyTimeout;
    }

    public void setEmptyTimeout(Integer emptyTimeout) {
        this.emptyTimeout = emptyTimeout;
    }
}
