package io.github.drompincen.pocpilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    ChatRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
