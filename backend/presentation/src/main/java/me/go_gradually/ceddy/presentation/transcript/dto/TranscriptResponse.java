package me.go_gradually.ceddy.presentation.transcript.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.go_gradually.ceddy.domain.transcript.Transcript;

import java.time.Instant;

public class TranscriptResponse {
    private long id;
    @JsonProperty("session_id")
    private long sessionId;
    @JsonProperty("user_query")
    private String userQuery;
    @JsonProperty("assistant_response")
    private String assistantResponse;
    @JsonProperty("audio_file_path")
    private String audioFilePath;
    @JsonProperty("contains_wake_word")
    private boolean containsWakeWord;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("updated_at")
    private Instant updatedAt;

    public static TranscriptResponse from(Transcript transcript) {
        TranscriptResponse response = new TranscriptResponse();
        response.setId(transcript.getId().value());
        response.setSessionId(transcript.getSessionId().value());
        response.setUserQuery(transcript.getUserQuery());
        response.setAssistantResponse(transcript.getAssistantResponse());
        response.setAudioFilePath(transcript.getAudioFilePath());
        response.setContainsWakeWord(transcript.containsWakeWord());
        response.setCreatedAt(transcript.getCreatedAt());
        response.setUpdatedAt(transcript.getUpdatedAt());
        return response;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public long getSessionId() {
        return sessionId;
    }

    public void setSessionId(long sessionId) {
        this.sessionId = sessionId;
    }

    public String getUserQuery() {
        return userQuery;
    }

    public void setUserQuery(String userQuery) {
        this.userQuery = userQuery;
    }

    public String getAssistantResponse() {
        return assistantResponse;
    }

    public void setAssistantResponse(String assistantResponse) {
        this.assistantResponse = assistantResponse;
    }

    public String getAudioFilePath() {
        return audioFilePath;
    }

    public void setAudioFilePath(String audioFilePath) {
        this.audioFilePath = audioFilePath;
    }

    public boolean isContainsWakeWord() {
        return containsWakeWord;
    }

    public void setContainsWakeWord(boolean containsWakeWord) {
        this.containsWakeWord = containsWakeWord;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
