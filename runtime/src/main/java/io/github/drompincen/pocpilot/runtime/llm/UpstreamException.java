package io.github.drompincen.pocpilot.runtime.llm;

import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;

/**
 * A classified failure of the model service. Never carries the upstream response body.
 */
public class UpstreamException extends RuntimeException {

    private final AssistantErrorKind kind;
    private final int status;

    public UpstreamException(AssistantErrorKind kind, int status) {
        super("Model service call failed: " + kind + (status > 0 ? " (HTTP " + status + ")" : ""));
        this.kind = kind;
        this.status = status;
    }

    public UpstreamException(AssistantErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = -1;
    }

    public AssistantErrorKind getKind() { return kind; }
    public int getStatus() { return status; }

    public static AssistantErrorKind classify(int status) {
        if (status == 401 || status == 403) return AssistantErrorKind.UPSTREAM_AUTH;
        if (status == 429) return AssistantErrorKind.RATE_LIMITED;
        if (status == 408 || status >= 500) return AssistantErrorKind.UPSTREAM_UNAVAILABLE;
        return AssistantErrorKind.UPSTREAM_ERROR;
    }
}
