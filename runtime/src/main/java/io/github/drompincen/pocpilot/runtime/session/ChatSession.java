package io.github.drompincen.pocpilot.runtime.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered message log of one conversation. Not thread-safe: every access goes through
 * {@link SessionRegistry}, which serializes it per session.
 */
public class ChatSession {

    private final String sessionId;
    private final String tenantId;
    private final String userId;
    private final Instant createdAt;
    private final List<ChatMessage> messages = new ArrayList<>();
    private Instant lastActivityAt;
    private SessionState state = SessionState.ACTIVE;

    ChatSession(String sessionId, String tenantId, String userId, Instant createdAt) {
        this.sessionId = sessionId;
        this.tenantId = tenantId;
        this.userId = userId;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    void append(ChatMessage message) {
        messages.add(message);
        touch(message.timestamp());
    }

    /** Never moves the activity clock backwards. */
    void touch(Instant at) {
        if (at.isAfter(lastActivityAt)) {
            lastActivityAt = at;
        }
    }

    /** ACTIVE is the only state that can be left; returns false if already terminal. */
    boolean transitionTo(SessionState target) {
        if (state.isTerminal() || !target.isTerminal()) {
            return false;
        }
        state = target;
        return true;
    }

    boolean isOwnedBy(String tenantId, String userId) {
        return this.tenantId.equals(tenantId) && this.userId.equals(userId);
    }

    SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, tenantId, userId, createdAt, lastActivityAt, state,
                List.copyOf(messages));
    }

    public String getSessionId() { return sessionId; }
    public String getTenantId() { return tenantId; }
    public String getUserId() { return userId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastActivityAt() { return lastActivityAt; }
    public SessionState getState() { return state; }
    public int size() { return messages.size(); }
}
