package me.go_gradually.ceddy.application.room.model;

public class RoomServiceUnavailableException extends RuntimeException {
    public RoomServiceUnavailableException(String message) {
        super(message);
    }
}
