package me.go_gradually.ceddy.infrastructure.transcript.persistence.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import me.go_gradually.ceddy.infrastructure.session.persistence.jpa.GolfSessionEntity;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "golf_transcript", indexes = {
        @Index(name = "ix_golf_transcript_session_id", columnList = "session_id"),
        @Index(name = "ix_golf_transcript_created_at", columnList = "created_at")
})
public class TranscriptEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    private GolfSessionEntity session;

    @Column(name = "session_id", nullable = false, insertable = false, updatable = false)
    private Long sessionId;

    @Column(name = "user_query", nullable = false, columnDefinition = "TEXT")
    private String userQuery;

    @Column(name = "assistant_response", columnDefinition = "TEXT")
    private String assistantResponse;

    @Column(name = "audio_file_path", length = 255)
    private String audioFilePath;

    @Column(name = "contains_wake_word", nullable = false, updatable = false)
    private boolean containsWakeWord;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Long getId() {
        return id;
    }

    public GolfSessionEntity getSession() {
        return session;
    }

    public void setSession(GolfSessionEntity session) {
        this.session = session;
        this.sessionId = session == null ? null : session.getId();
    }

    public Long getSessionId() {
        return sessionId;
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

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
