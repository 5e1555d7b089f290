package io.github.drompincen.pocpilot.protocol.api;

public record SendMessageRequest(
        String text,
        String sessionId
) {
    public SendMessageRequest(String text) {
        this(text, null);
    }
}
