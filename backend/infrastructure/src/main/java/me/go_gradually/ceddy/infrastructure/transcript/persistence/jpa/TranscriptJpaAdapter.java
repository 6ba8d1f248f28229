package me.go_gradually.ceddy.infrastructure.transcript.persistence.jpa;

import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.application.shared.model.PageResult;
import me.go_gradually.ceddy.application.transcript.port.TranscriptStorePort;
import me.go_gradually.ceddy.domain.session.GolfSessionId;
import me.go_gradually.ceddy.domain.transcript.Transcript;
import me.go_gradually.ceddy.domain.transcript.TranscriptId;
import me.go_gradually.ceddy.infrastructure.session.persistence.jpa.GolfSessionEntity;
import me.go_gradually.ceddy.infrastructure.session.persistence.jpa.GolfSessionJpaRepository;
import me.go_gradually.ceddy.infrastructure.shared.persistence.OffsetPageRequest;
import org.springframework.data.domain.Limit;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class TranscriptJpaAdapter implements TranscriptStorePort {
    static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final TranscriptJpaRepository repository;
    private final GolfSessionJpaRepository sessionRepository;

    public TranscriptJpaAdapter(TranscriptJpaRepository repository, GolfSessionJpaRepository sessionRepository) {
        this.repository = repository;
        this.sessionRepository = sessionRepository;
    }

    @Override
    public Transcript create(Transcript transcript) {
        if (transcript.isPersisted()) {
            throw new IllegalArgumentException("Transcript is already persisted");
        }
        TranscriptEntity entity = new TranscriptEntity();
        GolfSessionEntity session = sessionRepository.findById(transcript.getSessionId().value())
                .orElseThrow(() -> new NoSuchElementException("Session not found: " + transcript.getSessionId().value()));
        entity.setSession(session);
        entity.setUserQuery(transcript.getUserQuery());
        entity.setAssistantResponse(transcript.getAssistantResponse());
        entity.setAudioFilePath(transcript.getAudioFilePath());
        entity.setContainsWakeWord(transcript.containsWakeWord());
        return toDomain(repository.saveAndFlush(entity), transcript.getSessionId());
    }

    @Override
    public Transcript update(Transcript transcript) {
        if (!transcript.isPersisted()) {
            throw new IllegalArgumentException("Transcript must be persisted before update");
        }
        TranscriptEntity entity = repository.findById(transcript.getId().value())
                .orElseThrow(() -> new NoSuchElementException("Transcript not found: " + transcript.getId().value()));
        entity.setAssistantResponse(transcript.getAssistantResponse());
        entity.setAudioFilePath(transcript.getAudioFilePath());
        return toDomain(repository.saveAndFlush(entity), transcript.getSessionId());
    }

    @Override
    public Optional<Transcript> findById(TranscriptId id) {
        return repository.findById(id.value()).map(this::toDomain);
    }

    @Override
    public PageResult<Transcript> page(PageQuery query) {
        Page<TranscriptEntity> page = repository.findAll(new OffsetPageRequest(query.offset(), query.limit(), NEWEST_FIRST));
        return PageResult.of(page.getContent().stream().map(this::toDomain).collect(Collectors.toList()),
                page.getTotalElements());
    }

    @Override
    public List<Transcript> findRecentBySession(GolfSessionId sessionId, int limit) {
        return repository.findBySessionIdOrderByCreatedAtDescIdDesc(sessionId.value(), Limit.of(limit)).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    private Transcript toDomain(TranscriptEntity entity) {
        return toDomain(entity, GolfSessionId.of(entity.getSessionId()));
    }

    private Transcript toDomain(TranscriptEntity entity, GolfSessionId sessionId) {
        return Transcript.rehydrate(
                TranscriptId.of(entity.getId()),
                sessionId,
                entity.getUserQuery(),
                entity.getAssistantResponse(),
                entity.getAudioFilePath(),
                entity.isContainsWakeWord(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
