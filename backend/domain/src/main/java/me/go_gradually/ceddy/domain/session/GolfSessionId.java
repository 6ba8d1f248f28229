package me.go_gradually.ceddy.domain.session;

public record GolfSessionId(long value) {
    public GolfSessionId {
        if (value <= 0) {
            throw new IllegalArgumentException("GolfSessionId must be positive");
        }
    }

    public static GolfSessionId of(long value) {
        return new GolfSessionId(value);
    }
}
