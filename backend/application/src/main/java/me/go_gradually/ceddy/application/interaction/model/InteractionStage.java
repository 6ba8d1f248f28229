package me.go_gradually.ceddy.application.interaction.model;

public enum InteractionStage {
    SESSION_LOOKUP,
    TRANSCRIBING,
    WAKE_WORD_CHECK,
    TRANSCRIPT_PERSISTED,
    IDLE_RETURN,
    ASSISTANT_QUERY,
    SYNTHESIZING,
    TRANSCRIPT_UPDATED,
    STREAM_RETURN
}
