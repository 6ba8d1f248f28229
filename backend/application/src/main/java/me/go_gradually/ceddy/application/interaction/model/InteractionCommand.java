package me.go_gradually.ceddy.application.interaction.model;

public class InteractionCommand {
    private final String sessionKey;
    private final byte[] audio;
    private final String filename;

    public InteractionCommand(String sessionKey, byte[] audio, String filename) {
        this.sessionKey = sessionKey;
        this.audio = audio;
        this.filename = filename;
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public byte[] getAudio() {
        return audio;
    }

    public String getFilename() {
        return filename;
    }
}
