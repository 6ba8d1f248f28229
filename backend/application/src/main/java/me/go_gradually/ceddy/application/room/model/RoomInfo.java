package me.go_gradually.ceddy.application.room.model;

import java.time.Instant;
import java.util.List;

public record RoomInfo(String name,
                       String sid,
                       int emptyTimeout,
                       int maxParticipants,
                       Instant createdAt,
                       String turnPassword,
                       List<String> enabledCodecs,
                       String metadata) {
    public RoomInfo {
        enabledCodecs = enabledCodecs == null ? List.of() : List.copyOf(enabledCodecs);
    }
}
