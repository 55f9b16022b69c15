package com.schooltrack.collab.lock;

import com.schooltrack.collab.error.NotJoinedException;
import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.MessageType;
import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.testing.HubFixture;
import com.schooltrack.collab.testing.RecordingChannel;
import com.schooltrack.collab.testing.TestConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.schooltrack.collab.testing.HubFixture.user;

final class LockManagerTest {

    private final HubFixture hub = new HubFixture();
    private final RecordingChannel alice = new RecordingChannel("c-alice");
    private final RecordingChannel bob = new RecordingChannel("c-bob");

    private void bothJoin() {
        hub.registry.join(alice, user("alice"), "doc-1");
        hub.registry.join(bob, user("bob"), "doc-1");
    }

    @Test
    void firstRequestWinsAndSecondIsDeniedWithHolder() {
        bothJoin();

        LockResult first = hub.locks.acquire("doc-1", "alice");
        LockResult second = hub.locks.acquire("doc-1", "bob");

        Assertions.assertTrue(first.granted());
        Assertions.assertInstanceOf(LockResult.Denied.class, second);
        Assertions.assertEquals("alice", ((LockResult.Denied) second).heldBy().holderId());

        DocumentLock granted = bob.lastPayload(MessageType.LOCK_GRANTED);
        Assertions.assertEquals("alice", granted.holderId());
        ServerMessage.LockDenial denial = bob.lastPayload(MessageType.LOCK_DENIED);
        Assertions.assertEquals("Alice", denial.holderName());
        Assertions.assertTrue(alice.received(MessageType.LOCK_DENIED).isEmpty());
        ServerMessage.ConflictWarning warning = alice.lastPayload(MessageType.CONFLICT_WARNING);
        Assertions.assertEquals("bob", warning.attemptedById());
    }

    @Test
    void holderRequestingAgainRefreshes() {
        HubFixture expiring = new HubFixture(new TestConfig().lockExpiry(Duration.ofMinutes(5)));
        expiring.registry.join(alice, user("alice"), "doc-1");
        LockResult.Granted first = (LockResult.Granted) expiring.locks.acquire("doc-1", "alice");
        expiring.clock.advance(Duration.ofMinutes(4));

        LockResult.Granted again = (LockResult.Granted) expiring.locks.acquire("doc-1", "alice");

        Assertions.assertTrue(again.refreshed());
        Assertions.assertEquals(first.lock().acquiredAt(), again.lock().acquiredAt());
        Assertions.assertEquals(expiring.clock.instant().plus(Duration.ofMinutes(5)), again.lock().expiresAt());
    }

    @Test
    void releaseByNonHolderIsIgnored() {
        bothJoin();
        hub.locks.acquire("doc-1", "alice");

        Assertions.assertFalse(hub.locks.release("doc-1", "bob"));
        Assertions.assertEquals("alice", hub.locks.currentLock("doc-1").orElseThrow().holderId());

        Assertions.assertTrue(hub.locks.release("doc-1", "alice"));
        Assertions.assertFalse(hub.locks.release("doc-1", "alice"));
        ServerMessage.LockRelease released = bob.lastPayload(MessageType.LOCK_RELEASED);
        Assertions.assertEquals(LockReleaseReason.RELEASED, released.reason());
        Assertions.assertTrue(hub.locks.acquire("doc-1", "bob").granted());
    }

    @Test
    void nonMemberCannotAcquire() {
        hub.registry.join(alice, user("alice"), "doc-1");

        Assertions.assertThrows(NotJoinedException.class, () -> hub.locks.acquire("doc-1", "mallory"));
        Assertions.assertThrows(NotJoinedException.class, () -> hub.locks.acquire("doc-9", "alice"));
    }

    @Test
    void lockIsReleasedWhenHolderLeavesAnyWay() {
        for (DisconnectReason reason : List.of(DisconnectReason.LEFT, DisconnectReason.TRANSPORT_CLOSED,
            DisconnectReason.IDLE_TIMEOUT)) {
            HubFixture fresh = new HubFixture();
            RecordingChannel a = new RecordingChannel("c-a");
            RecordingChannel b = new RecordingChannel("c-b");
            fresh.registry.join(a, user("alice"), "doc-1");
            fresh.registry.join(b, user("bob"), "doc-1");
            fresh.locks.acquire("doc-1", "alice");

            fresh.registry.leave("c-a", reason);

            ServerMessage.LockRelease released = b.lastPayload(MessageType.LOCK_RELEASED);
            Assertions.assertEquals(reason == DisconnectReason.IDLE_TIMEOUT
                ? LockReleaseReason.IDLE_TIMEOUT
                : LockReleaseReason.HOLDER_LEFT, released.reason());
            Assertions.assertTrue(fresh.locks.acquire("doc-1", "bob").granted(), "after " + reason);
        }
    }

    @Test
    void expiredLockIsSweptAndAcquirable() {
        HubFixture expiring = new HubFixture(new TestConfig().lockExpiry(Duration.ofMinutes(5)));
        expiring.registry.join(alice, user("alice"), "doc-1");
        expiring.registry.join(bob, user("bob"), "doc-1");
        expiring.locks.acquire("doc-1", "alice");

        expiring.clock.advance(Duration.ofMinutes(4));
        Assertions.assertEquals(0, expiring.locks.sweepExpired(expiring.clock.instant()));
        expiring.clock.advance(Duration.ofMinutes(1));
        Assertions.assertTrue(expiring.locks.currentLock("doc-1").isEmpty());
        Assertions.assertEquals(1, expiring.locks.sweepExpired(expiring.clock.instant()));

        ServerMessage.LockRelease released = bob.lastPayload(MessageType.LOCK_RELEASED);
        Assertions.assertEquals(LockReleaseReason.EXPIRED, released.reason());
        Assertions.assertTrue(expiring.locks.acquire("doc-1", "bob").granted());
    }

    @Test
    void expiredLockIsReplacedOnAcquireBeforeSweep() {
        HubFixture expiring = new HubFixture(new TestConfig().lockExpiry(Duration.ofMinutes(5)));
        expiring.registry.join(alice, user("alice"), "doc-1");
        expiring.registry.join(bob, user("bob"), "doc-1");
        expiring.locks.acquire("doc-1", "alice");
        expiring.clock.advance(Duration.ofMinutes(6));

        Assertions.assertTrue(expiring.locks.acquire("doc-1", "bob").granted());
        Assertions.assertEquals(LockReleaseReason.EXPIRED,
            ((ServerMessage.LockRelease) alice.lastPayload(MessageType.LOCK_RELEASED)).reason());
    }

    @Test
    void forceReleaseFreesLock() {
        bothJoin();
        hub.locks.acquire("doc-1", "alice");

        Assertions.assertEquals("alice", hub.locks.forceRelease("doc-1").orElseThrow().holderId());
        Assertions.assertTrue(hub.locks.forceRelease("doc-1").isEmpty());
        Assertions.assertEquals(LockReleaseReason.FORCED,
            ((ServerMessage.LockRelease) alice.lastPayload(MessageType.LOCK_RELEASED)).reason());
        Assertions.assertTrue(hub.locks.activeLocks().isEmpty());
    }

    @Test
    void neverMoreThanOneHolderUnderConcurrentRequests() throws Exception {
        int users = 8;
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < users; i++) {
            ids.add("user" + i);
            hub.registry.join(new RecordingChannel("c-" + i), user("user" + i), "doc-1");
        }
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger violations = new AtomicInteger();
        AtomicInteger grants = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(users);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < users; i++) {
                String userId = ids.get(i);
                Random random = new Random(i);
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int round = 0; round < 500; round++) {
                        if (hub.locks.acquire("doc-1", userId).granted()) {
                            grants.incrementAndGet();
                            if (holders.incrementAndGet() != 1) {
                                violations.incrementAndGet();
                            }
                            if (random.nextBoolean()) {
                                Thread.yield();
                            }
                            holders.decrementAndGet();
                            Assertions.assertTrue(hub.locks.release("doc-1", userId));
                        } else if (random.nextInt(4) == 0) {
                            // stale release from a loser must never drop the winner's lock
                            hub.locks.release("doc-1", userId);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Assertions.assertEquals(0, violations.get());
        Assertions.assertTrue(grants.get() > 0);
        Assertions.assertTrue(hub.locks.currentLock("doc-1").isEmpty());
    }
}
