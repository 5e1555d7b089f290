package io.github.drompincen.pocpilot.runtime.llm;

import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;
import io.github.drompincen.pocpilot.protocol.api.ChatRole;
import io.github.drompincen.pocpilot.protocol.api.ToolDescriptor;
import io.github.drompincen.pocpilot.runtime.config.AssistantProperties;
import io.github.drompincen.pocpilot.runtime.config.TenantAiConfigService;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import io.github.drompincen.pocpilot.runtime.session.ChatMessage;
import io.github.drompincen.pocpilot.runtime.session.SessionIds;
import io.github.drompincen.pocpilot.runtime.session.SessionLimitExceededException;
import io.github.drompincen.pocpilot.runtime.session.SessionNotFoundException;
import io.github.drompincen.pocpilot.runtime.session.SessionRegistry;
import io.github.drompincen.pocpilot.runtime.session.SessionSnapshot;
import io.github.drompincen.pocpilot.runtime.status.AssistantConfigurationException;
import io.github.drompincen.pocpilot.runtime.status.StatusResolver;
import io.github.drompincen.pocpilot.runtime.tools.ToolBridge;
import io.github.drompincen.pocpilot.runtime.tools.ToolContext;
import io.github.drompincen.pocpilot.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one conversational turn: user message in, exactly one assistant message out.
 * <p>
 * The turn holds the session's turn claim from the user append to the final append. Upstream
 * and tool failures never escape as exceptions; they end the turn with a synthetic assistant
 * message whose {@code errorKind} names the failure. Only conditions that stop the turn from
 * starting (not ready, settings changed, busy, over the session cap) and a session closed
 * mid-turn are thrown.
 */
@Service
public class LlmGateway {

    private static final Logger log = LoggerFactory.getLogger(LlmGateway.class);

    static final String SETTINGS_CHANGED = "AI Assistant settings were changed. Please start a new chat.";

    private final StatusResolver statusResolver;
    private final TenantAiConfigService configService;
    private final SessionRegistry sessions;
    private final ToolBridge toolBridge;
    private final LlmClient llmClient;
    private final TenantTurnLimiter limiter;
    private final AssistantProperties properties;
    private final Clock clock;

    public LlmGateway(StatusResolver statusResolver, TenantAiConfigService configService,
                      SessionRegistry sessions, ToolBridge toolBridge, LlmClient llmClient,
                      TenantTurnLimiter limiter, AssistantProperties properties, Clock clock) {
        this.statusResolver = statusResolver;
        this.configService = configService;
        this.sessions = sessions;
        this.toolBridge = toolBridge;
        this.llmClient = llmClient;
        this.limiter = limiter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param sessionId the caller's current session; null, unknown, expired or foreign ids start
     *                  a new session
     */
    public TurnResult send(CallerIdentity caller, String sessionId, String text) {
        String message = validate(text);
        statusResolver.requireReady(caller);
        long generation = sessions.tenantGeneration(caller.tenantId());
        String credential = configService.resolveCredential(caller.tenantId())
                .orElseThrow(() -> new AssistantConfigurationException(StatusResolver.NO_CREDENTIAL));

        SessionSnapshot session = (sessionId == null ? null
                : sessions.findOwned(sessionId, caller.tenantId(), caller.userId()).orElse(null));
        if (session == null) {
            session = sessions.create(caller.tenantId(), caller.userId());
            if (sessionId != null) {
                log.debug("Session {} not available for user {}, started {}", SessionIds.abbreviate(sessionId),
                        caller.userId(), SessionIds.abbreviate(session.sessionId()));
            }
        }
        if (session.messages().size() + 2 > properties.getMaxMessagesPerSession()) {
            throw new SessionLimitExceededException(properties.getMaxMessagesPerSession());
        }

        String id = session.sessionId();
        try (SessionRegistry.Turn turn = sessions.beginTurn(id)) {
            if (sessions.tenantGeneration(caller.tenantId()) != generation) {
                // tenant sessions were invalidated after the readiness check
                sessions.close(id);
                log.info("Tenant {} settings changed while session {} was starting; turn refused",
                        caller.tenantId(), SessionIds.abbreviate(id));
                statusResolver.requireReady(caller);
                throw new AssistantConfigurationException(SETTINGS_CHANGED);
            }
            SessionSnapshot withUser = sessions.append(id, ChatMessage.user(message, clock.instant()));

            if (!limiter.tryAcquire(caller.tenantId())) {
                return finish(id, failure(AssistantErrorKind.RATE_LIMITED));
            }
            ChatMessage reply;
            try {
                reply = runTurn(caller, id, credential, withUser.messages());
            } finally {
                limiter.release(caller.tenantId());
            }
            return finish(id, reply);
        }
    }

    private TurnResult finish(String sessionId, ChatMessage reply) {
        try {
            SessionSnapshot after = sessions.append(sessionId, reply);
            return new TurnResult(after, reply.errorKind());
        } catch (SessionNotFoundException e) {
            log.info("Session {} ended during the turn; reply discarded", SessionIds.abbreviate(sessionId));
            throw e;
        }
    }

    private ChatMessage runTurn(CallerIdentity caller, String sessionId, String credential, List<ChatMessage> history) {
        List<ToolDescriptor> tools = toolBridge.descriptors();
        List<ModelMessage> working = new ArrayList<>(contextWindow(history));
        String systemPrompt = AssistantPrompts.systemPrompt(tools);
        ToolContext toolContext = new ToolContext(caller, sessionId);

        int toolCalls = 0;
        try {
            for (int round = 0; ; round++) {
                ModelReply reply = callUpstream(new ModelRequest(credential, systemPrompt, List.copyOf(working), tools), sessionId);

                if (!reply.hasToolCalls()) {
                    if (properties.isRequireToolGrounding() && toolCalls == 0) {
                        log.info("Session {}: answer without a tool call replaced", SessionIds.abbreviate(sessionId));
                        return ChatMessage.assistant(SyntheticReplies.UNGROUNDED_ANSWER, clock.instant());
                    }
                    if (reply.text() == null || reply.text().isBlank()) {
                        return failure(AssistantErrorKind.UPSTREAM_ERROR);
                    }
                    return ChatMessage.assistant(reply.text(), clock.instant());
                }

                if (round >= properties.getMaxToolRounds()) {
                    log.warn("Session {}: tool round limit {} reached", SessionIds.abbreviate(sessionId),
                            properties.getMaxToolRounds());
                    return failure(AssistantErrorKind.TOOL_ROUNDS_EXCEEDED);
                }

                working.add(ModelMessage.toolCalls(reply.text(), reply.toolCalls()));
                for (ToolCallRequest call : reply.toolCalls()) {
                    ToolResult result = toolBridge.invoke(call.name(), call.argumentsJson(), toolContext);
                    toolCalls++;
                    working.add(ModelMessage.toolResult(call, ToolBridge.toModelPayload(result)));
                }
            }
        } catch (UpstreamException e) {
            log.warn("Session {}: turn failed with {}", SessionIds.abbreviate(sessionId), e.getMessage());
            return failure(e.getKind());
        } catch (RuntimeException e) {
            log.error("Session {}: turn failed unexpectedly", SessionIds.abbreviate(sessionId), e);
            return failure(AssistantErrorKind.UPSTREAM_ERROR);
        }
    }

    /** One retry for transient failures, none for anything else. */
    private ModelReply callUpstream(ModelRequest request, String sessionId) {
        try {
            return llmClient.complete(request);
        } catch (UpstreamException e) {
            if (!e.getKind().retryable()) {
                throw e;
            }
            log.info("Session {}: model service unavailable, retrying once", SessionIds.abbreviate(sessionId));
            return llmClient.complete(request);
        }
    }

    /** Most recent messages, oldest first. Synthetic failure messages are not model output and stay out. */
    private List<ModelMessage> contextWindow(List<ChatMessage> history) {
        List<ChatMessage> relevant = history.stream().filter(m -> !m.isFailure()).toList();
        int window = properties.getContextWindow();
        if (window > 0 && relevant.size() > window) {
            relevant = relevant.subList(relevant.size() - window, relevant.size());
        }
        return relevant.stream()
                .map(m -> m.role() == ChatRole.USER ? ModelMessage.user(m.text()) : ModelMessage.assistant(m.text()))
                .toList();
    }

    private String validate(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Message text is required");
        }
        String trimmed = text.strip();
        if (trimmed.length() > properties.getMaxMessageLength()) {
            throw new IllegalArgumentException("Message is longer than " + properties.getMaxMessageLength() + " characters");
        }
        return trimmed;
    }

    private ChatMessage failure(AssistantErrorKind kind) {
        return ChatMessage.failure(kind, SyntheticReplies.forKind(kind), clock.instant());
    }
}
