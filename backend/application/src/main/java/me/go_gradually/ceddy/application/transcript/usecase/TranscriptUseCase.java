package me.go_gradually.ceddy.application.transcript.usecase;

import me.go_gradually.ceddy.application.session.usecase.SessionUseCase;
import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.application.shared.model.PageResult;
import me.go_gradually.ceddy.application.transcript.policy.TranscriptPolicy;
import me.go_gradually.ceddy.application.transcript.port.TranscriptStorePort;
import me.go_gradually.ceddy.domain.session.GolfSession;
import me.go_gradually.ceddy.domain.transcript.Transcript;

import java.util.List;

public class TranscriptUseCase {
    private final TranscriptStorePort transcriptStore;
    private final SessionUseCase sessionUseCase;
    private final TranscriptPolicy transcriptPolicy;

    public TranscriptUseCase(TranscriptStorePort transcriptStore,
                             SessionUseCase sessionUseCase,
                             TranscriptPolicy transcriptPolicy) {
        this.transcriptStore = transcriptStore;
        this.sessionUseCase = sessionUseCase;
        this.transcriptPolicy = transcriptPolicy;
    }

    /**
     * Without a session filter this is a plain page over all transcripts. With a filter the
     * offset is ignored and the most recent turns of that session are returned, capped by the
     * configured filter limit; total is then the number of returned items.
     */
    public PageResult<Transcript> list(PageQuery query, String sessionKey) {
        PageQuery page = query == null ? PageQuery.firstPage() : query;
        if (sessionKey == null || sessionKey.isBlank()) {
            return transcriptStore.page(page);
        }
        GolfSession session = sessionUseCase.get(sessionKey);
        int cap = Math.min(page.limit(), Math.max(1, transcriptPolicy.transcriptFilterLimit()));
        List<Transcript> recent = transcriptStore.findRecentBySession(session.getId(), cap);
        return PageResult.of(recent, recent.size());
    }
}
