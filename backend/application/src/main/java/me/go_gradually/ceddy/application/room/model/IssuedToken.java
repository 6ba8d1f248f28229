package me.go_gradually.ceddy.application.room.model;

public record IssuedToken(String token, String roomName, String participantIdentity) {
}
