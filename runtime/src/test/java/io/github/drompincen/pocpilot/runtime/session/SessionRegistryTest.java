package io.github.drompincen.pocpilot.runtime.session;

import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;
import io.github.drompincen.pocpilot.protocol.api.ChatRole;
import io.github.drompincen.pocpilot.runtime.MutableClock;
import io.github.drompincen.pocpilot.runtime.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
        registry = new SessionRegistry(new AssistantProperties(), clock);
    }

    @Test
    void createdSessionIsActiveAndEmpty() {
        SessionSnapshot s = registry.create("t1", "u1");

        assertThat(s.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(s.messages()).isEmpty();
        assertThat(s.createdAt()).isEqualTo(clock.instant());
        assertThat(s.sessionId()).hasSize(43);
        assertThat(registry.activeCount()).isEqualTo(1);
    }

    @Test
    void sessionIdsAreUnique() {
        String a = registry.create("t1", "u1").sessionId();
        String b = registry.create("t1", "u1").sessionId();

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void appendKeepsInsertionOrder() {
        String id = registry.create("t1", "u1").sessionId();

        registry.append(id, ChatMessage.user("m1", clock.instant()));
        clock.advance(Duration.ofSeconds(1));
        registry.append(id, ChatMessage.assistant("m2", clock.instant()));
        clock.advance(Duration.ofSeconds(1));
        SessionSnapshot s = registry.append(id, ChatMessage.user("m3", clock.instant()));

        assertThat(s.messages()).extracting(ChatMessage::text).containsExactly("m1", "m2", "m3");
        assertThat(s.messages()).extracting(ChatMessage::role)
                .containsExactly(ChatRole.USER, ChatRole.ASSISTANT, ChatRole.USER);
    }

    @Test
    void snapshotIsNotAffectedByLaterAppends() {
        String id = registry.create("t1", "u1").sessionId();
        SessionSnapshot before = registry.append(id, ChatMessage.user("m1", clock.instant()));

        registry.append(id, ChatMessage.assistant("m2", clock.instant()));

        assertThat(before.messages()).hasSize(1);
        assertThatThrownBy(() -> before.messages().add(ChatMessage.user("x", clock.instant())))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void lastActivityNeverMovesBackwards() {
        String id = registry.create("t1", "u1").sessionId();
        clock.advance(Duration.ofMinutes(2));
        registry.touch(id);

        SessionSnapshot s = registry.append(id, ChatMessage.user("late stamp", clock.instant().minusSeconds(90)));

        assertThat(s.lastActivityAt()).isEqualTo(clock.instant());
    }

    @Test
    void idleSessionExpiresAndRejectsAppend() {
        String id = registry.create("t1", "u1").sessionId();
        registry.append(id, ChatMessage.user("hello", clock.instant()));

        clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(() -> registry.append(id, ChatMessage.user("again", clock.instant())))
                .isInstanceOf(SessionNotFoundException.class);
        assertThat(registry.find(id)).isEmpty();
    }

    @Test
    void sweepExpiresOnlyIdleSessions() {
        String idle = registry.create("t1", "u1").sessionId();
        clock.advance(Duration.ofMinutes(8));
        String recent = registry.create("t1", "u2").sessionId();
        clock.advance(Duration.ofMinutes(3));

        int expired = registry.expireSweep();

        assertThat(expired).isEqualTo(1);
        assertThat(registry.find(idle)).isEmpty();
        assertThat(registry.find(recent)).isPresent();
    }

    @Test
    void sweepSkipsSessionWithTurnInFlight() throws Exception {
        String id = registry.create("t1", "u1").sessionId();

        try (SessionRegistry.Turn turn = registry.beginTurn(id)) {
            clock.advance(Duration.ofMinutes(30));
            int expired = CompletableFuture.supplyAsync(registry::expireSweep).get(5, TimeUnit.SECONDS);
            assertThat(expired).isZero();
            registry.append(id, ChatMessage.assistant("still here", clock.instant()));
        }

        assertThat(registry.find(id)).isPresent();
    }

    @Test
    void secondTurnOnSameSessionIsRejected() throws Exception {
        String id = registry.create("t1", "u1").sessionId();

        try (SessionRegistry.Turn turn = registry.beginTurn(id)) {
            CompletableFuture<Throwable> other = CompletableFuture.supplyAsync(() -> {
                try (SessionRegistry.Turn second = registry.beginTurn(id)) {
                    return null;
                } catch (RuntimeException e) {
                    return e;
                }
            });
            assertThat(other.get(5, TimeUnit.SECONDS)).isInstanceOf(SessionBusyException.class);
        }

        try (SessionRegistry.Turn next = registry.beginTurn(id)) {
            assertThat(next.sessionId()).isEqualTo(id);
        }
    }

    @Test
    void turnsOnDifferentSessionsDoNotBlockEachOther() {
        String a = registry.create("t1", "u1").sessionId();
        String b = registry.create("t1", "u2").sessionId();

        try (SessionRegistry.Turn ta = registry.beginTurn(a);
             SessionRegistry.Turn tb = registry.beginTurn(b)) {
            assertThat(ta.sessionId()).isEqualTo(a);
            assertThat(tb.sessionId()).isEqualTo(b);
        }
    }

    @Test
    void closeIsIdempotentAndRejectsLaterAppends() {
        String id = registry.create("t1", "u1").sessionId();

        assertThat(registry.close(id)).isTrue();
        assertThat(registry.close(id)).isFalse();
        assertThatThrownBy(() -> registry.append(id, ChatMessage.user("x", clock.instant())))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void closeDuringTurnDiscardsTheLateReply() {
        String id = registry.create("t1", "u1").sessionId();

        try (SessionRegistry.Turn turn = registry.beginTurn(id)) {
            registry.append(id, ChatMessage.user("question", clock.instant()));
            registry.close(id);

            assertThatThrownBy(() -> registry.append(id,
                    ChatMessage.failure(AssistantErrorKind.UPSTREAM_ERROR, "late", clock.instant())))
                    .isInstanceOf(SessionNotFoundException.class);
        }
        assertThat(registry.find(id)).isEmpty();
    }

    @Test
    void invalidateForTenantClosesOnlyThatTenant() {
        String a1 = registry.create("tenant-a", "u1").sessionId();
        String a2 = registry.create("tenant-a", "u2").sessionId();
        String b1 = registry.create("tenant-b", "u3").sessionId();

        int closed = registry.invalidateForTenant("tenant-a");

        assertThat(closed).isEqualTo(2);
        assertThat(registry.find(a1)).isEmpty();
        assertThat(registry.find(a2)).isEmpty();
        assertThat(registry.activeCountForTenant("tenant-a")).isZero();
        assertThat(registry.activeCountForTenant("tenant-b")).isEqualTo(1);
        assertThatThrownBy(() -> registry.append(a1, ChatMessage.user("x", clock.instant())))
                .isInstanceOf(SessionNotFoundException.class);

        SessionSnapshot b = registry.append(b1, ChatMessage.user("still open?", clock.instant()));
        assertThat(b.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(b.messages()).extracting(ChatMessage::text).containsExactly("still open?");
    }

    @Test
    void invalidationDuringTurnRejectsTheReply() throws Exception {
        String id = registry.create("tenant-a", "u1").sessionId();
        CountDownLatch questionAppended = new CountDownLatch(1);
        CountDownLatch invalidated = new CountDownLatch(1);

        CompletableFuture<Throwable> turnThread = CompletableFuture.supplyAsync(() -> {
            try (SessionRegistry.Turn turn = registry.beginTurn(id)) {
                registry.append(id, ChatMessage.user("question", clock.instant()));
                questionAppended.countDown();
                await(invalidated);
                registry.append(id, ChatMessage.assistant("answer", clock.instant()));
                return null;
            } catch (RuntimeException e) {
                return e;
            }
        });

        assertThat(questionAppended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(registry.invalidateForTenant("tenant-a")).isEqualTo(1);
        invalidated.countDown();

        assertThat(turnThread.get(5, TimeUnit.SECONDS)).isInstanceOf(SessionNotFoundException.class);
        assertThat(registry.find(id)).isEmpty();
        assertThat(registry.activeCountForTenant("tenant-a")).isZero();
    }

    @Test
    void appendRacingWithInvalidationNeverLeavesSessionActive() throws Exception {
        for (int round = 0; round < 200; round++) {
            String id = registry.create("tenant-a", "u" + round).sessionId();
            CountDownLatch go = new CountDownLatch(1);
            CompletableFuture<Boolean> appender = CompletableFuture.supplyAsync(() -> {
                await(go);
                try {
                    registry.append(id, ChatMessage.user("racing", clock.instant()));
                    return true;
                } catch (SessionNotFoundException e) {
                    return false;
                }
            });

            go.countDown();
            registry.invalidateForTenant("tenant-a");
            appender.get(5, TimeUnit.SECONDS);

            assertThat(registry.find(id)).isEmpty();
            assertThat(registry.activeCountForTenant("tenant-a")).isZero();
            assertThatThrownBy(() -> registry.append(id, ChatMessage.user("late", clock.instant())))
                    .isInstanceOf(SessionNotFoundException.class);
        }
    }

    @Test
    void invalidationBumpsTenantGeneration() {
        assertThat(registry.tenantGeneration("tenant-a")).isZero();

        registry.invalidateForTenant("tenant-a");
        registry.invalidateForTenant("tenant-a");

        assertThat(registry.tenantGeneration("tenant-a")).isEqualTo(2);
        assertThat(registry.tenantGeneration("tenant-b")).isZero();
    }

    @Test
    void findOwnedHidesForeignSessions() {
        String id = registry.create("t1", "u1").sessionId();

        assertThat(registry.findOwned(id, "t1", "u1")).isPresent();
        assertThat(registry.findOwned(id, "t1", "u2")).isEmpty();
        assertThat(registry.findOwned(id, "t2", "u1")).isEmpty();
    }

    @Test
    void rotateClosesOwnedPriorSessionOnly() {
        String mine = registry.create("t1", "u1").sessionId();
        String theirs = registry.create("t1", "u2").sessionId();

        SessionSnapshot fresh = registry.rotate(mine, "t1", "u1");
        registry.rotate(theirs, "t1", "u1");

        assertThat(fresh.sessionId()).isNotEqualTo(mine);
        assertThat(registry.find(mine)).isEmpty();
        assertThat(registry.find(theirs)).isPresent();
    }

    @Test
    void beginTurnOnUnknownSessionFails() {
        assertThatThrownBy(() -> registry.beginTurn("nope"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
