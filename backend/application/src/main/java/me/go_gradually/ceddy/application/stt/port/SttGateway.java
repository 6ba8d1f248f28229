package me.go_gradually.ceddy.application.stt.port;

public interface SttGateway {
    boolean isConfigured();

    String transcribe(byte[] audio, String filename) throws Exception;
}
