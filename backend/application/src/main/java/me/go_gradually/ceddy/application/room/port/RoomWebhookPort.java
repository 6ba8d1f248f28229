package me.go_gradually.ceddy.application.room.port;

import java.util.Map;

public interface RoomWebhookPort {
    /**
     * Verifies the signed authorization header against the raw body and returns the decoded event.
     *
     * @throws me.go_gradually.ceddy.application.room.model.InvalidWebhookException when verification fails
     */
    Map<String, Object> receive(String body, String authorization);
}
