package me.go_gradually.ceddy.infrastructure.session.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface GolfSessionJpaRepository extends JpaRepository<GolfSessionEntity, Long> {
    Optional<GolfSessionEntity> findBySessionKey(String sessionKey);

    Optional<GolfSessionEntity> findBySessionKeyAndActiveTrue(String sessionKey);

    boolean existsBySessionKey(String sessionKey);
}
