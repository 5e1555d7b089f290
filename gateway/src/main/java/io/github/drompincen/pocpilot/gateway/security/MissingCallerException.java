package io.github.drompincen.pocpilot.gateway.security;

/** The request did not carry a usable caller identity. */
public class MissingCallerException extends RuntimeException {

    public MissingCallerException(String message) {
        super(message);
    }
}
