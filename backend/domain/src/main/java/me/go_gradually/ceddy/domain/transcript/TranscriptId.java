package me.go_gradually.ceddy.domain.transcript;

public record TranscriptId(long value) {
    public TranscriptId {
        if (value <= 0) {
            throw new IllegalArgumentException("TranscriptId must be positive");
        }
    }

    public static TranscriptId of(long value) {
        return new TranscriptId(value);
    }
}
