package me.go_gradually.ceddy.application.transcript.port;

import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.application.shared.model.PageResult;
import me.go_gradually.ceddy.domain.session.GolfSessionId;
import me.go_gradually.ceddy.domain.transcript.Transcript;
import me.go_gradually.ceddy.domain.transcript.TranscriptId;

import java.util.List;
import java.util.Optional;

public interface TranscriptStorePort {
    Transcript create(Transcript transcript);

    Transcript update(Transcript transcript);

    Optional<Transcript> findById(TranscriptId id);

    PageResult<Transcript> page(PageQuery query);

    /**
     * Newest first.
     */
    List<Transcript> findRecentBySession(GolfSessionId sessionId, int limit);
}
