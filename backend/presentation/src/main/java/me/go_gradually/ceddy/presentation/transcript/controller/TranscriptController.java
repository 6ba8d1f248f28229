package me.go_gradually.ceddy.presentation.transcript.controller;

import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.application.transcript.usecase.TranscriptUseCase;
import me.go_gradually.ceddy.presentation.shared.dto.PageResponse;
import me.go_gradually.ceddy.presentation.transcript.dto.TranscriptResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/golf-assistant/transcripts")
public class TranscriptController {
    private final TranscriptUseCase transcriptUseCase;

    public TranscriptController(TranscriptUseCase transcriptUseCase) {
        this.transcriptUseCase = transcriptUseCase;
    }

    @GetMapping
    public PageResponse<TranscriptResponse> list(@RequestParam(value = "limit", defaultValue = "10") int limit,
                                                 @RequestParam(value = "offset", defaultValue = "0") int offset,
                                                 @RequestParam(value = "session_id", required = false) String sessionId) {
        return PageResponse.from(transcriptUseCase.list(PageQuery.of(limit, offset), sessionId),
                TranscriptResponse::from);
    }
}
