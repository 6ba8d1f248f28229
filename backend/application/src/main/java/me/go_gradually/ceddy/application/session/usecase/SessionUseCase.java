package me.go_gradually.ceddy.application.session.usecase;

import me.go_gradually.ceddy.application.session.model.DuplicateSessionException;
import me.go_gradually.ceddy.application.session.model.SessionCreateCommand;
import me.go_gradually.ceddy.application.session.model.SessionNotFoundException;
import me.go_gradually.ceddy.application.session.model.SessionUpdateCommand;
import me.go_gradually.ceddy.application.session.port.SessionStorePort;
import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.application.shared.model.PageResult;
import me.go_gradually.ceddy.domain.session.GolfSession;
import me.go_gradually.ceddy.domain.session.SessionKey;

import java.util.logging.Logger;

public class SessionUseCase {
    private static final Logger log = Logger.getLogger(SessionUseCase.class.getName());

    private final SessionStorePort sessionStore;

    public SessionUseCase(SessionStorePort sessionStore) {
        this.sessionStore = sessionStore;
    }

    public GolfSession create(SessionCreateCommand command) {
        SessionKey key = resolveKey(command);
        if (sessionStore.findByKey(key, false).isPresent()) {
            throw new DuplicateSessionException(key.value());
        }
        GolfSession created = sessionStore.create(GolfSession.createNew(key, command == null ? null : command.getUserId()));
        log.info(() -> "session.created session=" + key.value());
        return created;
    }

    public GolfSession get(String sessionKey) {
        return get(sessionKey, false);
    }

    public GolfSession get(String sessionKey, boolean includeInactive) {
        SessionKey key = toKey(sessionKey);
        return sessionStore.findByKey(key, !includeInactive)
                .orElseThrow(() -> new SessionNotFoundException(key.value()));
    }

    /**
     * Inactive sessions are included in the lookup so a deactivated session can be reactivated.
     */
    public GolfSession update(SessionUpdateCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("update command is required");
        }
        GolfSession session = get(command.getSessionKey(), true);
        session.applyUpdate(command.getUserId(), command.getActive());
        return sessionStore.update(session);
    }

    public PageResult<GolfSession> list(PageQuery query) {
        return sessionStore.page(query == null ? PageQuery.firstPage() : query);
    }

    private SessionKey resolveKey(SessionCreateCommand command) {
        if (command == null || command.getSessionKey() == null || command.getSessionKey().isBlank()) {
            return SessionKey.newKey();
        }
        return SessionKey.of(command.getSessionKey());
    }

    /**
     * Lookup keys that could never have been stored are reported as unknown rather than invalid.
     */
    private SessionKey toKey(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank() || sessionKey.length() > SessionKey.MAX_LENGTH) {
            throw new SessionNotFoundException(sessionKey);
        }
        return SessionKey.of(sessionKey);
    }
}
