package io.github.drompincen.pocpilot.gateway.controller;

import io.github.drompincen.pocpilot.protocol.api.*;
import io.github.drompincen.pocpilot.runtime.llm.LlmGateway;
import io.github.drompincen.pocpilot.runtime.llm.TurnResult;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import io.github.drompincen.pocpilot.runtime.session.ChatMessage;
import io.github.drompincen.pocpilot.runtime.session.SessionNotFoundException;
import io.github.drompincen.pocpilot.runtime.session.SessionRegistry;
import io.github.drompincen.pocpilot.runtime.session.SessionSnapshot;
import io.github.drompincen.pocpilot.runtime.status.StatusResolver;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assistant")
public class AssistantController {

    private final StatusResolver statusResolver;
    private final SessionRegistry sessionRegistry;
    private final LlmGateway llmGateway;

    public AssistantController(StatusResolver statusResolver,
                               SessionRegistry sessionRegistry,
                               LlmGateway llmGateway) {
        this.statusResolver = statusResolver;
        this.sessionRegistry = sessionRegistry;
        this.llmGateway = llmGateway;
    }

    @GetMapping("/status")
    public AssistantStatusDto status(CallerIdentity caller) {
        return statusResolver.resolve(caller);
    }

    /** Starts a fresh chat, closing {@code priorSessionId} if the caller owns it. */
    @PostMapping("/sessions")
    public ResponseEntity<ChatSessionDto> newSession(CallerIdentity caller,
                                                     @RequestParam(required = false) String priorSessionId) {
        statusResolver.requireReady(caller);
        SessionSnapshot session = sessionRegistry.rotate(priorSessionId, caller.tenantId(), caller.userId());
        return ResponseEntity.ok(toDto(session));
    }

    @PostMapping("/messages")
    public ResponseEntity<ChatSessionDto> send(CallerIdentity caller, @RequestBody SendMessageRequest req) {
        if (req == null) throw new IllegalArgumentException("Request body is required");
        TurnResult result = llmGateway.send(caller, req.sessionId(), req.text());
        return ResponseEntity.ok(toDto(result.session()));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<ChatSessionDto> get(CallerIdentity caller, @PathVariable String sessionId) {
        return sessionRegistry.findOwned(sessionId, caller.tenantId(), caller.userId())
                .map(s -> ResponseEntity.ok(toDto(s)))
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> close(CallerIdentity caller, @PathVariable String sessionId) {
        sessionRegistry.closeOwned(sessionId, caller.tenantId(), caller.userId());
        return ResponseEntity.noContent().build();
    }

    static ChatSessionDto toDto(SessionSnapshot s) {
        List<ChatMessageDto> messages = s.messages().stream()
                .map(AssistantController::toDto)
                .toList();
        return new ChatSessionDto(s.sessionId(), s.createdAt(), s.lastActivityAt(), messages);
    }

    private static ChatMessageDto toDto(ChatMessage m) {
        return new ChatMessageDto(m.role(), m.text(), m.timestamp(), m.errorKind());
    }
}
