package me.go_gradually.ceddy.application.tts.port;

import me.go_gradually.ceddy.application.tts.model.AudioStream;

public interface TtsGateway {
    String provider();

    boolean isConfigured();

    /**
     * Starts synthesis and returns the lazily consumed audio. Implementations do not read the
     * body before returning.
     */
    AudioStream stream(String text) throws Exception;
}
