package io.github.drompincen.pocpilot.protocol.api;

public enum PocStatus {
    DRAFT,
    ACTIVE,
    COMPLETED,
    ARCHIVED
}
