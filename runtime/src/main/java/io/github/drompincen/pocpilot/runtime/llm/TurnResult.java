package io.github.drompincen.pocpilot.runtime.llm;

import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;
import io.github.drompincen.pocpilot.runtime.session.SessionSnapshot;

/**
 * Outcome of one turn: the session as it stands after the turn, and the failure kind when
 * the turn ended with a synthetic message.
 */
public record TurnResult(
        SessionSnapshot session,
        AssistantErrorKind errorKind
) {
    public boolean failed() {
        return errorKind != null;
    }
}
