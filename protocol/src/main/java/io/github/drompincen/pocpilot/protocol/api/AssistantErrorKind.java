package io.github.drompincen.pocpilot.protocol.api;

/**
 * Closed set of failure conditions a turn can end with. Each one is surfaced to the
 * user as a single synthetic assistant message carrying this kind.
 */
public enum AssistantErrorKind {
    /** Feature disabled, credential missing or unreadable. */
    CONFIGURATION(false),
    /** Upstream rejected the tenant credential. Needs an administrator. */
    UPSTREAM_AUTH(false),
    /** Network failure, timeout or upstream 5xx. */
    UPSTREAM_UNAVAILABLE(true),
    RATE_LIMITED(false),
    /** Any other upstream rejection. */
    UPSTREAM_ERROR(false),
    SESSION_NOT_FOUND(false),
    TOOL_EXECUTION_FAILED(false),
    TOOL_ROUNDS_EXCEEDED(false);

    private final boolean retryable;

    AssistantErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
