package io.github.drompincen.pocpilot.gateway.controller;

import io.github.drompincen.pocpilot.protocol.api.*;
import io.github.drompincen.pocpilot.runtime.llm.LlmGateway;
import io.github.drompincen.pocpilot.runtime.llm.TurnResult;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import io.github.drompincen.pocpilot.runtime.session.ChatMessage;
import io.github.drompincen.pocpilot.runtime.session.SessionNotFoundException;
import io.github.drompincen.pocpilot.runtime.session.SessionRegistry;
import io.github.drompincen.pocpilot.runtime.session.SessionSnapshot;
import io.github.drompincen.pocpilot.runtime.session.SessionState;
import io.github.drompincen.pocpilot.runtime.status.AssistantConfigurationException;
import io.github.drompincen.pocpilot.runtime.status.StatusResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssistantControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock private StatusResolver statusResolver;
    @Mock private SessionRegistry sessionRegistry;
    @Mock private LlmGateway llmGateway;

    private AssistantController controller;
    private final CallerIdentity caller = new CallerIdentity("t1", "u1", UserRole.SALES_ENGINEER);

    @BeforeEach
    void setUp() {
        controller = new AssistantController(statusResolver, sessionRegistry, llmGateway);
    }

    @Test
    void statusDelegatesToResolver() {
        AssistantStatusDto status = new AssistantStatusDto(true, true, "AI Assistant is ready to use.");
        when(statusResolver.resolve(caller)).thenReturn(status);

        assertThat(controller.status(caller)).isEqualTo(status);
    }

    @Test
    void sendReturnsWholeSession() {
        SessionSnapshot snapshot = snapshot("s1", List.of(
                ChatMessage.user("How many POCs?", NOW),
                ChatMessage.assistant("You have 3.", NOW)));
        when(llmGateway.send(caller, "s1", "How many POCs?")).thenReturn(new TurnResult(snapshot, null));

        ResponseEntity<ChatSessionDto> response = controller.send(caller, new SendMessageRequest("How many POCs?", "s1"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        ChatSessionDto body = response.getBody();
        assertThat(body.sessionId()).isEqualTo("s1");
        assertThat(body.messages()).extracting(ChatMessageDto::role).containsExactly(ChatRole.USER, ChatRole.ASSISTANT);
    }

    @Test
    void failedTurnCarriesErrorKind() {
        SessionSnapshot snapshot = snapshot("s1", List.of(
                ChatMessage.user("Hi", NOW),
                ChatMessage.failure(AssistantErrorKind.UPSTREAM_AUTH, "rejected", NOW)));
        when(llmGateway.send(caller, null, "Hi")).thenReturn(new TurnResult(snapshot, AssistantErrorKind.UPSTREAM_AUTH));

        ChatSessionDto body = controller.send(caller, new SendMessageRequest("Hi")).getBody();

        assertThat(body.messages().get(1).errorKind()).isEqualTo(AssistantErrorKind.UPSTREAM_AUTH);
    }

    @Test
    void newSessionRequiresReadyAssistant() {
        doThrow(new AssistantConfigurationException("not enabled")).when(statusResolver).requireReady(caller);

        assertThatThrownBy(() -> controller.newSession(caller, null))
                .isInstanceOf(AssistantConfigurationException.class);
        verifyNoInteractions(sessionRegistry);
    }

    @Test
    void newSessionRotatesPriorSession() {
        when(sessionRegistry.rotate("old", "t1", "u1")).thenReturn(snapshot("new", List.of()));

        ResponseEntity<ChatSessionDto> response = controller.newSession(caller, "old");

        assertThat(response.getBody().sessionId()).isEqualTo("new");
        assertThat(response.getBody().messages()).isEmpty();
    }

    @Test
    void getUnknownSessionIsNotFound() {
        when(sessionRegistry.findOwned("s9", "t1", "u1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.get(caller, "s9")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void closeAnswersNoContentEvenWhenAlreadyClosed() {
        when(sessionRegistry.closeOwned("s1", "t1", "u1")).thenReturn(false);

        ResponseEntity<Void> response = controller.close(caller, "s1");

        assertThat(response.getStatusCode().value()).isEqualTo(204);
    }

    private static SessionSnapshot snapshot(String id, List<ChatMessage> messages) {
        return new SessionSnapshot(id, "t1", "u1", NOW, NOW, SessionState.ACTIVE, messages);
    }
}
