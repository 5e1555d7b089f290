package io.github.drompincen.pocpilot.runtime.session;

import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;
import io.github.drompincen.pocpilot.protocol.api.ChatRole;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a session's history. {@code errorKind} is set only on synthetic assistant
 * messages that explain a failed turn.
 */
public record ChatMessage(
        ChatRole role,
        String text,
        Instant timestamp,
        AssistantErrorKind errorKind
) {
    public ChatMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ChatMessage user(String text, Instant at) {
        return new ChatMessage(ChatRole.USER, text, at, null);
    }

    public static ChatMessage assistant(String text, Instant at) {
        return new ChatMessage(ChatRole.ASSISTANT, text, at, null);
    }

    public static ChatMessage failure(AssistantErrorKind kind, String text, Instant at) {
        return new ChatMessage(ChatRole.ASSISTANT, text, at, Objects.requireNonNull(kind, "kind"));
    }

    public boolean isFailure() {
        return errorKind != null;
    }
}
