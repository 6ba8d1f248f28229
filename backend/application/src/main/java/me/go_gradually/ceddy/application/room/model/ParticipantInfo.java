package me.go_gradually.ceddy.application.room.model;

import java.time.Instant;

public record ParticipantInfo(String identity, String name, String state, String metadata, Instant joinedAt) {
}
