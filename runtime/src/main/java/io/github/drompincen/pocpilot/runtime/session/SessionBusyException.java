package io.github.drompincen.pocpilot.runtime.session;

public class SessionBusyException extends RuntimeException {

    public SessionBusyException(String sessionId) {
        super("A message is already being processed for session " + SessionIds.abbreviate(sessionId));
    }
}
