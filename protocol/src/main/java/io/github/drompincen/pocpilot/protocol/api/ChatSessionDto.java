package io.github.drompincen.pocpilot.protocol.api;

import java.time.Instant;
import java.util.List;

public record ChatSessionDto(
        String sessionId,
        Instant createdAt,
        Instant lastActivityAt,
        List<ChatMessageDto> messages
) {}
