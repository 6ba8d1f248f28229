package me.go_gradually.ceddy.application.stt.model;

public class SttCommand {
    private final byte[] audio;
    private final String filename;

    public SttCommand(byte[] audio, String filename) {
        this.audio = audio == null ? new byte[0] : audio;
        this.filename = filename == null || filename.isBlank() ? "audio.wav" : filename;
    }

    public byte[] getAudio() {
        return audio;
    }

    public String getFilename() {
        return filename;
    }
}
