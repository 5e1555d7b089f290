package io.github.drompincen.pocpilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessageDto(
        ChatRole role,
        String text,
        Instant timestamp,
        AssistantErrorKind errorKind
) {}
