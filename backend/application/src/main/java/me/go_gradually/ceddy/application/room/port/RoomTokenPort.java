package me.go_gradually.ceddy.application.room.port;

import java.time.Duration;

public interface RoomTokenPort {
    String issueJoinToken(String roomName, String identity, String name, String metadata, Duration ttl);
}
