package io.github.drompincen.pocpilot.protocol.api;

public record AssistantStatusDto(
        boolean enabled,
        boolean hasCredential,
        String message
) {
    public boolean ready() {
        return enabled && hasCredential;
    }
}
