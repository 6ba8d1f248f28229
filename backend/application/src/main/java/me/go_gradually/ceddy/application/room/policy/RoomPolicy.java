package me.go_gradually.ceddy.application.room.policy;

public interface RoomPolicy {
    /**
     * Key, secret and server URL are all present.
     */
    boolean roomServiceConfigured();

    /**
     * Key and secret are present.
     */
    boolean tokenServiceConfigured();
}
