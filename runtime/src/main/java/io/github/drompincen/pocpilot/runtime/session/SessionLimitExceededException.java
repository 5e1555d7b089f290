package io.github.drompincen.pocpilot.runtime.session;

public class SessionLimitExceededException extends RuntimeException {

    public SessionLimitExceededException(int limit) {
        super("This chat reached its limit of " + limit + " messages. Start a new chat to continue.");
    }
}
