package io.github.drompincen.pocpilot.runtime.session;

import io.github.drompincen.pocpilot.runtime.config.AssistantProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every live chat session of the process.
 * <p>
 * Each session sits in its own slot: the slot monitor guards the message log and state, and
 * the slot's turn lock admits a single in-flight turn. Nothing is shared between slots, so
 * sessions never contend with each other. Sessions leave the map as soon as they become
 * EXPIRED or CLOSED.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, Slot> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> tenantGenerations = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleTimeout;

    public SessionRegistry(AssistantProperties properties, Clock clock) {
        this.clock = clock;
        this.idleTimeout = properties.getIdleTimeout();
    }

    public SessionSnapshot create(String tenantId, String userId) {
        if (tenantId == null || userId == null) {
            throw new IllegalArgumentException("tenantId and userId are required");
        }
        Slot slot;
        String sessionId;
        do {
            sessionId = SessionIds.next();
            slot = new Slot(new ChatSession(sessionId, tenantId, userId, clock.instant()));
        } while (sessions.putIfAbsent(sessionId, slot) != null);
        log.debug("Created chat session {} for user {} in tenant {}", SessionIds.abbreviate(sessionId), userId, tenantId);
        synchronized (slot) {
            return slot.session.snapshot();
        }
    }

    /** Closes the caller's prior session, if any, and opens a fresh one. */
    public SessionSnapshot rotate(String priorSessionId, String tenantId, String userId) {
        if (priorSessionId != null) {
            closeOwned(priorSessionId, tenantId, userId);
        }
        return create(tenantId, userId);
    }

    public Optional<SessionSnapshot> find(String sessionId) {
        try {
            Slot slot = activeSlot(sessionId);
            synchronized (slot) {
                return Optional.of(slot.session.snapshot());
            }
        } catch (SessionNotFoundException e) {
            return Optional.empty();
        }
    }

    /** Like {@link #find} but a session of another tenant or user reads as absent. */
    public Optional<SessionSnapshot> findOwned(String sessionId, String tenantId, String userId) {
        return find(sessionId)
                .filter(s -> s.tenantId().equals(tenantId) && s.userId().equals(userId));
    }

    public void touch(String sessionId) {
        Slot slot = activeSlot(sessionId);
        synchronized (slot) {
            requireActive(slot);
            slot.session.touch(clock.instant());
        }
    }

    public SessionSnapshot append(String sessionId, ChatMessage message) {
        Slot slot = activeSlot(sessionId);
        synchronized (slot) {
            requireActive(slot);
            slot.session.append(message);
            slot.session.touch(clock.instant());
            return slot.session.snapshot();
        }
    }

    /**
     * Claims the session for one turn. A second claim while the first is open fails with
     * {@link SessionBusyException}; the sweep leaves claimed sessions alone.
     */
    public Turn beginTurn(String sessionId) {
        Slot slot = sessions.get(sessionId);
        if (slot == null) {
            throw new SessionNotFoundException(sessionId);
        }
        if (!slot.turnLock.tryLock()) {
            throw new SessionBusyException(sessionId);
        }
        try {
            synchronized (slot) {
                requireActive(slot);
                if (isIdle(slot.session, clock.instant())) {
                    expire(slot);
                    throw new SessionNotFoundException(sessionId);
                }
            }
        } catch (RuntimeException e) {
            slot.turnLock.unlock();
            throw e;
        }
        return new Turn(sessionId, slot);
    }

    /**
     * Expires every session idle for longer than the timeout. Sessions with a turn in flight
     * are skipped and looked at again on the next pass.
     */
    @Scheduled(fixedDelayString = "${pocpilot.assistant.sweep-interval-ms:60000}")
    public int expireSweep() {
        Instant now = clock.instant();
        int expired = 0;
        for (Map.Entry<String, Slot> entry : sessions.entrySet()) {
            Slot slot = entry.getValue();
            if (!slot.turnLock.tryLock()) {
                continue;
            }
            try {
                synchronized (slot) {
                    if (isIdle(slot.session, now) && expire(slot)) {
                        expired++;
                    }
                }
            } finally {
                slot.turnLock.unlock();
            }
        }
        if (expired > 0) {
            log.info("Expired {} idle chat session(s), {} still active", expired, sessions.size());
        }
        return expired;
    }

    /** Idempotent. A turn still running on the session will find it closed when it tries to append. */
    public boolean close(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        Slot slot = sessions.remove(sessionId);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            slot.session.transitionTo(SessionState.CLOSED);
        }
        log.debug("Closed chat session {}", SessionIds.abbreviate(sessionId));
        return true;
    }

    public boolean closeOwned(String sessionId, String tenantId, String userId) {
        Slot slot = sessionId != null ? sessions.get(sessionId) : null;
        if (slot == null || !slot.session.isOwnedBy(tenantId, userId)) {
            return false;
        }
        return close(sessionId);
    }

    /**
     * Closes every session of the tenant. Each session is closed under its own guard, so an
     * append racing with this call either lands before the close or is rejected.
     */
    public int invalidateForTenant(String tenantId) {
        tenantGenerations.computeIfAbsent(tenantId, k -> new AtomicLong()).incrementAndGet();
        int closed = 0;
        for (Map.Entry<String, Slot> entry : sessions.entrySet()) {
            Slot slot = entry.getValue();
            if (!slot.session.getTenantId().equals(tenantId)) {
                continue;
            }
            synchronized (slot) {
                if (slot.session.transitionTo(SessionState.CLOSED)) {
                    closed++;
                }
            }
            sessions.remove(entry.getKey(), slot);
        }
        log.info("Invalidated {} chat session(s) for tenant {}", closed, tenantId);
        return closed;
    }

    /**
     * Counter bumped at the start of every {@link #invalidateForTenant}. A turn that read it
     * before its readiness check and reads a different value once it holds its session knows
     * the tenant was invalidated in between.
     */
    public long tenantGeneration(String tenantId) {
        AtomicLong generation = tenantId != null ? tenantGenerations.get(tenantId) : null;
        return generation != null ? generation.get() : 0L;
    }

    public int activeCount() {
        return sessions.size();
    }

    public long activeCountForTenant(String tenantId) {
        return sessions.values().stream()
                .filter(slot -> slot.session.getTenantId().equals(tenantId))
                .count();
    }

    private Slot activeSlot(String sessionId) {
        Slot slot = sessionId != null ? sessions.get(sessionId) : null;
        if (slot == null) {
            throw new SessionNotFoundException(sessionId);
        }
        synchronized (slot) {
            requireActive(slot);
            if (!slot.turnLock.isLocked() && isIdle(slot.session, clock.instant())) {
                expire(slot);
                throw new SessionNotFoundException(sessionId);
            }
        }
        return slot;
    }

    private void requireActive(Slot slot) {
        if (slot.session.getState() != SessionState.ACTIVE) {
            sessions.remove(slot.session.getSessionId(), slot);
            throw new SessionNotFoundException(slot.session.getSessionId());
        }
    }

    private boolean isIdle(ChatSession session, Instant now) {
        return Duration.between(session.getLastActivityAt(), now).compareTo(idleTimeout) > 0;
    }

    // Caller holds the slot monitor.
    private boolean expire(Slot slot) {
        boolean changed = slot.session.transitionTo(SessionState.EXPIRED);
        sessions.remove(slot.session.getSessionId(), slot);
        if (changed) {
            log.debug("Expired chat session {}", SessionIds.abbreviate(slot.session.getSessionId()));
        }
        return changed;
    }

    private static final class Slot {
        final ChatSession session;
        final ReentrantLock turnLock = new ReentrantLock();

        Slot(ChatSession session) {
            this.session = session;
        }
    }

    /** An open claim on one session. Closing it lets the next turn in. */
    public static final class Turn implements AutoCloseable {

        private final String sessionId;
        private final Slot slot;

        private Turn(String sessionId, Slot slot) {
            this.sessionId = sessionId;
            this.slot = slot;
        }

        public String sessionId() {
            return sessionId;
        }

        @Override
        public void close() {
            if (slot.turnLock.isHeldByCurrentThread()) {
                slot.turnLock.unlock();
            }
        }
    }
}
