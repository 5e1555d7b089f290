package io.github.drompincen.pocpilot.runtime.session;

import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ChatSessionTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Test
    void terminalStateCannotBeLeft() {
        ChatSession session = new ChatSession("s1", "t1", "u1", T0);

        assertThat(session.transitionTo(SessionState.EXPIRED)).isTrue();
        assertThat(session.transitionTo(SessionState.CLOSED)).isFalse();
        assertThat(session.transitionTo(SessionState.ACTIVE)).isFalse();
        assertThat(session.getState()).isEqualTo(SessionState.EXPIRED);
    }

    @Test
    void ownershipNeedsTenantAndUser() {
        ChatSession session = new ChatSession("s1", "t1", "u1", T0);

        assertThat(session.isOwnedBy("t1", "u1")).isTrue();
        assertThat(session.isOwnedBy("t2", "u1")).isFalse();
        assertThat(session.isOwnedBy("t1", "u2")).isFalse();
    }

    @Test
    void failureMessagesCarryTheirKind() {
        ChatMessage ok = ChatMessage.assistant("hi", T0);
        ChatMessage failed = ChatMessage.failure(AssistantErrorKind.RATE_LIMITED, "busy", T0);

        assertThat(ok.isFailure()).isFalse();
        assertThat(failed.isFailure()).isTrue();
    }

    @Test
    void abbreviateKeepsOnlyAPrefix() {
        assertThat(SessionIds.abbreviate("abcdefghijklmnop")).isEqualTo("abcdefgh…");
        assertThat(SessionIds.abbreviate("short")).isEqualTo("short");
    }
}
