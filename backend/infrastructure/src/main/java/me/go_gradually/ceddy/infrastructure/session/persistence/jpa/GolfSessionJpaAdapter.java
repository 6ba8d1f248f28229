package me.go_gradually.ceddy.infrastructure.session.persistence.jpa;

import me.go_gradually.ceddy.application.session.model.DuplicateSessionException;
import me.go_gradually.ceddy.application.session.model.SessionNotFoundException;
import me.go_gradually.ceddy.application.session.port.SessionStorePort;
import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.application.shared.model.PageResult;
import me.go_gradually.ceddy.domain.session.GolfSession;
import me.go_gradually.ceddy.domain.session.GolfSessionId;
import me.go_gradually.ceddy.domain.session.SessionKey;
import me.go_gradually.ceddy.infrastructure.shared.persistence.OffsetPageRequest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class GolfSessionJpaAdapter implements SessionStorePort {
    static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final GolfSessionJpaRepository repository;

    public GolfSessionJpaAdapter(GolfSessionJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public GolfSession create(GolfSession session) {
        if (session.isPersisted()) {
            throw new IllegalArgumentException("Session is already persisted");
        }
        GolfSessionEntity entity = new GolfSessionEntity();
        entity.setSessionKey(session.getKey().value());
        entity.setUserId(session.getUserId());
        entity.setActive(session.isActive());
        try {
            return toDomain(repository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateSessionException(session.getKey().value(), e);
        }
    }

    @Override
    public Optional<GolfSession> findByKey(SessionKey key, boolean activeOnly) {
        Optional<GolfSessionEntity> entity = activeOnly
                ? repository.findBySessionKeyAndActiveTrue(key.value())
                : repository.findBySessionKey(key.value());
        return entity.map(this::toDomain);
    }

    @Override
    public GolfSession update(GolfSession session) {
        if (!session.isPersisted()) {
            throw new IllegalArgumentException("Session must be persisted before update");
        }
        GolfSessionEntity entity = repository.findById(session.getId().value())
                .orElseThrow(() -> new SessionNotFoundException(session.getKey().value()));
        entity.setUserId(session.getUserId());
        entity.setActive(session.isActive());
        return toDomain(repository.saveAndFlush(entity));
    }

    @Override
    public PageResult<GolfSession> page(PageQuery query) {
        Page<GolfSessionEntity> page = repository.findAll(new OffsetPageRequest(query.offset(), query.limit(), NEWEST_FIRST));
        return PageResult.of(page.getContent().stream().map(this::toDomain).collect(Collectors.toList()), page.getTotalElements());
    }

    private GolfSession toDomain(GolfSessionEntity entity) {
        return GolfSession.rehydrate(
                GolfSessionId.of(entity.getId()),
                SessionKey.of(entity.getSessionKey()),
                entity.getUserId(),
                entity.isActive(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
