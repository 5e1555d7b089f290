package io.github.drompincen.pocpilot.runtime.session;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a session taken under its registry guard. Messages are in append order.
 */
public record SessionSnapshot(
        String sessionId,
        String tenantId,
        String userId,
        Instant createdAt,
        Instant lastActivityAt,
        SessionState state,
        List<ChatMessage> messages
) {}
