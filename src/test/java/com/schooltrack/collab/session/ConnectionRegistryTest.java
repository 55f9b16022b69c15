package com.schooltrack.collab.session;

import com.schooltrack.collab.config.DuplicateJoinPolicy;
import com.schooltrack.collab.error.AlreadyJoinedException;
import com.schooltrack.collab.error.MalformedMessageException;
import com.schooltrack.collab.error.UnauthenticatedException;
import com.schooltrack.collab.lock.LockResult;
import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.MessageType;
import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.presence.DocumentViewer;
import com.schooltrack.collab.testing.HubFixture;
import com.schooltrack.collab.testing.RecordingChannel;
import com.schooltrack.collab.testing.TestConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.schooltrack.collab.testing.HubFixture.user;

final class ConnectionRegistryTest {

    private final HubFixture hub = new HubFixture();

    @Test
    void joinRegistersMemberAndSendsSnapshot() {
        RecordingChannel a = new RecordingChannel("c-a");

        ConnectedUser joined = hub.registry.join(a, user("alice"), "doc-1");

        Assertions.assertEquals("alice", joined.userId());
        Assertions.assertEquals("doc-1", joined.documentId());
        Assertions.assertEquals(hub.clock.instant(), joined.lastActivity());
        Assertions.assertTrue(hub.registry.find("c-a").isPresent());
        ServerMessage.Joined snapshot = a.lastPayload(MessageType.JOINED);
        Assertions.assertEquals("c-a", snapshot.connectionId());
        Assertions.assertEquals(List.of("alice"), snapshot.viewers().stream().map(DocumentViewer::userId).toList());
        Assertions.assertNull(snapshot.lock());
    }

    @Test
    void joinWithoutIdentityIsUnauthenticated() {
        RecordingChannel a = new RecordingChannel("c-a");

        Assertions.assertThrows(UnauthenticatedException.class, () -> hub.registry.join(a, null, "doc-1"));
        Assertions.assertEquals(0, hub.rooms.size());
    }

    @Test
    void joinWithoutRoomIsMalformed() {
        Assertions.assertThrows(MalformedMessageException.class,
            () -> hub.registry.join(new RecordingChannel("c-a"), user("alice"), " "));
    }

    @Test
    void leaveIsIdempotent() {
        RecordingChannel a = new RecordingChannel("c-a");
        RecordingChannel b = new RecordingChannel("c-b");
        hub.registry.join(a, user("alice"), "doc-1");
        hub.registry.join(b, user("bob"), "doc-1");
        b.clear();

        Assertions.assertTrue(hub.registry.leave("c-a", DisconnectReason.LEFT));
        Assertions.assertFalse(hub.registry.leave("c-a", DisconnectReason.TRANSPORT_CLOSED));

        Assertions.assertEquals(1, b.received(MessageType.PRESENCE_UPDATE).size());
        ServerMessage.Presence presence = b.lastPayload(MessageType.PRESENCE_UPDATE);
        Assertions.assertEquals("left", presence.action());
        Assertions.assertEquals("alice", presence.userId());
        Assertions.assertEquals(List.of("bob"), presence.viewers().stream().map(DocumentViewer::userId).toList());
    }

    @Test
    void lastLeaveRetiresRoom() {
        hub.registry.join(new RecordingChannel("c-a"), user("alice"), "doc-1");
        Assertions.assertEquals(1, hub.rooms.size());

        hub.registry.leave("c-a", DisconnectReason.TRANSPORT_CLOSED);

        Assertions.assertEquals(0, hub.rooms.size());
        Assertions.assertTrue(hub.registry.members("doc-1").isEmpty());
    }

    @Test
    void newerConnectionReplacesOlderOneOfSameUser() {
        RecordingChannel first = new RecordingChannel("c-1");
        RecordingChannel second = new RecordingChannel("c-2");
        hub.registry.join(first, user("alice"), "doc-1");
        Assertions.assertTrue(hub.locks.acquire("doc-1", "alice").granted());

        hub.registry.join(second, user("alice"), "doc-1");

        ServerMessage.ForceDisconnect forced = first.lastPayload(MessageType.FORCE_DISCONNECT);
        Assertions.assertEquals(DisconnectReason.SUPERSEDED, forced.reason());
        Assertions.assertEquals(DisconnectReason.SUPERSEDED, first.closedWith());
        Assertions.assertTrue(hub.registry.find("c-1").isEmpty());
        Assertions.assertEquals(List.of("c-2"),
            hub.registry.members("doc-1").stream().map(ConnectedUser::connectionId).toList());
        Assertions.assertTrue(hub.locks.currentLock("doc-1").isEmpty(), "lock must not outlive its connection");
        Assertions.assertEquals(1, hub.rooms.size());

        // the superseded transport closing later changes nothing
        Assertions.assertFalse(hub.registry.leave("c-1", DisconnectReason.TRANSPORT_CLOSED));
        Assertions.assertEquals(1, hub.registry.members("doc-1").size());
    }

    @Test
    void rejectPolicyRefusesSecondConnection() {
        HubFixture rejecting = new HubFixture(new TestConfig().duplicateJoinPolicy(DuplicateJoinPolicy.REJECT));
        RecordingChannel first = new RecordingChannel("c-1");
        rejecting.registry.join(first, user("alice"), "doc-1");

        Assertions.assertThrows(AlreadyJoinedException.class,
            () -> rejecting.registry.join(new RecordingChannel("c-2"), user("alice"), "doc-1"));
        Assertions.assertNull(first.closedWith());
        Assertions.assertEquals(1, rejecting.registry.members("doc-1").size());
    }

    @Test
    void joiningAnotherDocumentLeavesTheCurrentOne() {
        RecordingChannel a = new RecordingChannel("c-a");
        hub.registry.join(a, user("alice"), "doc-1");
        hub.locks.acquire("doc-1", "alice");

        hub.registry.join(a, user("alice"), "doc-2");

        Assertions.assertTrue(hub.registry.members("doc-1").isEmpty());
        Assertions.assertEquals(1, hub.registry.members("doc-2").size());
        Assertions.assertTrue(hub.locks.currentLock("doc-1").isEmpty());
    }

    @Test
    void rejoiningSameDocumentKeepsMembership() {
        RecordingChannel a = new RecordingChannel("c-a");
        ConnectedUser first = hub.registry.join(a, user("alice"), "doc-1");

        Assertions.assertSame(first, hub.registry.join(a, user("alice"), "doc-1"));
        Assertions.assertEquals(1, hub.registry.members("doc-1").size());
    }

    @Test
    void activityPingMovesLastActivity() {
        hub.registry.join(new RecordingChannel("c-a"), user("alice"), "doc-1");
        hub.clock.advance(Duration.ofMinutes(3));

        Assertions.assertTrue(hub.registry.activityPing("c-a"));
        Assertions.assertFalse(hub.registry.activityPing("c-unknown"));

        Assertions.assertEquals(hub.clock.instant(), hub.registry.find("c-a").orElseThrow().lastActivity());
    }

    @Test
    void snapshotCarriesCurrentLockAndChat() {
        RecordingChannel a = new RecordingChannel("c-a");
        hub.registry.join(a, user("alice"), "doc-1");
        LockResult result = hub.locks.acquire("doc-1", "alice");
        hub.chat.send("doc-1", "alice", "hello");

        RecordingChannel b = new RecordingChannel("c-b");
        hub.registry.join(b, user("bob"), "doc-1");

        ServerMessage.Joined snapshot = b.lastPayload(MessageType.JOINED);
        Assertions.assertEquals(((LockResult.Granted) result).lock(), snapshot.lock());
        Assertions.assertEquals(1, snapshot.recentChat().size());
        Assertions.assertEquals("hello", snapshot.recentChat().get(0).text());
    }
}
