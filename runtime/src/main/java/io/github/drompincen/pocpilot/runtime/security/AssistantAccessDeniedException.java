package io.github.drompincen.pocpilot.runtime.security;

public class AssistantAccessDeniedException extends RuntimeException {

    public AssistantAccessDeniedException(String message) {
        super(message);
    }
}
