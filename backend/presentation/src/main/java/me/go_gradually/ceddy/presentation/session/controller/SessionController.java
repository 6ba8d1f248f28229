package me.go_gradually.ceddy.presentation.session.controller;

import jakarta.validation.Valid;
import me.go_gradually.ceddy.application.session.model.SessionCreateCommand;
import me.go_gradually.ceddy.application.session.model.SessionUpdateCommand;
import me.go_gradually.ceddy.application.session.usecase.SessionUseCase;
import me.go_gradually.ceddy.application.shared.model.PageQuery;
import me.go_gradually.ceddy.presentation.session.dto.SessionCreateRequest;
import me.go_gradually.ceddy.presentation.session.dto.SessionResponse;
import me.go_gradually.ceddy.presentation.session.dto.SessionUpdateRequest;
import me.go_gradually.ceddy.presentation.shared.dto.PageResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/golf-assistant/sessions")
public class SessionController {
    private final SessionUseCase sessionUseCase;

    public SessionController(SessionUseCase sessionUseCase) {
        this.sessionUseCase = sessionUseCase;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponse create(@Valid @RequestBody(required = false) SessionCreateRequest request,
                                  @RequestParam(value = "user_id", required = false) String userIdParam) {
        SessionCreateCommand command = new SessionCreateCommand();
        command.setUserId(userIdParam);
        if (request != null) {
            command.setSessionKey(request.getSessionId());
            if (request.getUserId() != null) {
                command.setUserId(request.getUserId());
            }
        }
        return SessionResponse.from(sessionUseCase.create(command));
    }

    @GetMapping
    public PageResponse<SessionResponse> list(@RequestParam(value = "limit", defaultValue = "10") int limit,
                                              @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return PageResponse.from(sessionUseCase.list(PageQuery.of(limit, offset)), SessionResponse::from);
    }

    @GetMapping("/{sessionId}")
    public SessionResponse get(@PathVariable("sessionId") String sessionId,
                               @RequestParam(value = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return SessionResponse.from(sessionUseCase.get(sessionId, includeInactive));
    }

    @PatchMapping("/{sessionId}")
    public SessionResponse update(@PathVariable("sessionId") String sessionId,
                                  @Valid @RequestBody SessionUpdateRequest request) {
        SessionUpdateCommand command = new SessionUpdateCommand();
        command.setSessionKey(sessionId);
        command.setUserId(request.getUserId());
        command.setActive(request.getActive());
        return SessionResponse.from(sessionUseCase.update(command));
    }
}
