package io.github.drompincen.pocpilot.runtime.session;

/**
 * The session is absent, expired or closed. Callers cannot tell which; the only recovery is
 * a new session.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Chat session not found or no longer active: " + SessionIds.abbreviate(sessionId));
    }
}
