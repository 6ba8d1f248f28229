package me.go_gradually.ceddy.application.tts.model;

import java.io.IOException;

public interface AudioSink {
    void write(byte[] chunk) throws IOException;
}
