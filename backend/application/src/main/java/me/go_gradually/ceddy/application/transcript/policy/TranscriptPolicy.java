package me.go_gradually.ceddy.application.transcript.policy;

public interface TranscriptPolicy {
    int transcriptFilterLimit();
}
