package io.github.drompincen.pocpilot.protocol.api;

public record ErrorResponse(String error, String message) {}
