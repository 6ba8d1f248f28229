package me.go_gradually.ceddy.domain.transcript;

import me.go_gradually.ceddy.domain.session.GolfSessionId;

import java.time.Instant;

/**
 * One recorded utterance and the assistant reply attached to it, if any.
 * <p>
 * The wake-word flag reflects the query at transcription time and is never recomputed.
 * A reply can be attached at most once.
 */
public class Transcript {
    private final TranscriptId id;
    private final GolfSessionId sessionId;
    private final String userQuery;
    private String assistantResponse;
    private final String audioFilePath;
    private final boolean containsWakeWord;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Transcript(TranscriptId id,
                       GolfSessionId sessionId,
                       String userQuery,
                       String assistantResponse,
                       String audioFilePath,
                       boolean containsWakeWord,
                       Instant createdAt,
                       Instant updatedAt) {
        if (sessionId == null) {
            throw new IllegalArgumentException("Transcript sessionId is required");
        }
        this.id = id;
        this.sessionId = sessionId;
        this.userQuery = userQuery == null ? "" : userQuery;
        this.assistantResponse = assistantResponse;
        this.audioFilePath = audioFilePath;
        this.containsWakeWord = containsWakeWord;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Transcript recordQuery(GolfSessionId sessionId, String userQuery, boolean containsWakeWord) {
        return new Transcript(null, sessionId, userQuery, null, null, containsWakeWord, null, null);
    }

    public static Transcript rehydrate(TranscriptId id,
                                       GolfSessionId sessionId,
                                       String userQuery,
                                       String assistantResponse,
                                       String audioFilePath,
                                       boolean containsWakeWord,
                                       Instant createdAt,
                                       Instant updatedAt) {
        if (id == null) {
            throw new IllegalArgumentException("Persisted Transcript requires an id");
        }
        return new Transcript(id, sessionId, userQuery, assistantResponse, audioFilePath,
                containsWakeWord, createdAt, updatedAt);
    }

    public void attachResponse(String response) {
        if (response == null) {
            throw new IllegalArgumentException("Assistant response is required");
        }
        if (assistantResponse != null) {
            throw new IllegalStateException("Transcript " + describeId() + " already has a response");
        }
        this.assistantResponse = response;
    }

    public boolean hasResponse() {
        return assistantResponse != null;
    }

    public boolean isPersisted() {
        return id != null;
    }

    public TranscriptId getId() {
        return id;
    }

    public GolfSessionId getSessionId() {
        return sessionId;
    }

    public String getUserQuery() {
        return userQuery;
    }

    public String getAssistantResponse() {
        return assistantResponse;
    }

    public String getAudioFilePath() {
        return audioFilePath;
    }

    public boolean containsWakeWord() {
        return containsWakeWord;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    private String describeId() {
        return id == null ? "(new)" : String.valueOf(id.value());
    }
}
