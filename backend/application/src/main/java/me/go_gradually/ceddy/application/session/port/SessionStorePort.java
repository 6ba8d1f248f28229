package me.go_gradually.ceddy.application.session.port;

import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.application.shared.model.PageResult;
import me.go_gradually.ceddy.domain.session.GolfSession;
import me.go_gradually.ceddy.domain.session.SessionKey;

import java.util.Optional;

/**
 * Durable session records. Every mutating call is committed before it returns.
 */
public interface SessionStorePort {
    GolfSession create(GolfSession session);

    Optional<GolfSession> findByKey(SessionKey key, boolean activeOnly);

    GolfSession update(GolfSession session);

    PageResult<GolfSession> page(PageQuery query);
}
