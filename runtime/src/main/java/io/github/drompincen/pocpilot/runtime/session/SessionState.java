package io.github.drompincen.pocpilot.runtime.session;

public enum SessionState {
    ACTIVE,
    EXPIRED,
    CLOSED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
