package me.go_gradually.ceddy.application.room.model;

public class RoomProviderException extends RuntimeException {
    public RoomProviderException(String message) {
        super(message);
    }

    public RoomProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
