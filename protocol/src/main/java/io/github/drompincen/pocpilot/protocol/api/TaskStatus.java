package io.github.drompincen.pocpilot.protocol.api;

public enum TaskStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED,
    BLOCKED,
    SATISFIED,
    PARTIALLY_SATISFIED,
    NOT_SATISFIED
}
