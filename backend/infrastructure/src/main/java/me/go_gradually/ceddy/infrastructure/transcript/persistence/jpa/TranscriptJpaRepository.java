package me.go_gradually.ceddy.infrastructure.transcript.persistence.jpa;

import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TranscriptJpaRepository extends JpaRepository<TranscriptEntity, Long> {
    List<TranscriptEntity> findBySessionIdOrderByCreatedAtDescIdDesc(Long sessionId, Limit limit);
}
