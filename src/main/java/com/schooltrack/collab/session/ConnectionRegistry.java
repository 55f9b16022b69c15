package com.schooltrack.collab.session;

import com.schooltrack.collab.chat.ChatRelay;
import com.schooltrack.collab.config.CollabConfig;
import com.schooltrack.collab.config.DuplicateJoinPolicy;
import com.schooltrack.collab.error.AlreadyJoinedException;
import com.schooltrack.collab.error.MalformedMessageException;
import com.schooltrack.collab.error.NotJoinedException;
import com.schooltrack.collab.error.UnauthenticatedException;
import com.schooltrack.collab.lock.LockManager;
import com.schooltrack.collab.lock.LockReleaseReason;
import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.presence.PresenceBroadcaster;
import com.schooltrack.collab.security.UserIdentity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative map from connection to {@link ConnectedUser} and the only writer of room membership.
 */
@ApplicationScoped
public class ConnectionRegistry {

    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    static final int MAX_ACTIVITY_LENGTH = 64;

    private final ConcurrentHashMap<String, ConnectedUser> connections = new ConcurrentHashMap<>();

    private final RoomDirectory rooms;
    private final PresenceBroadcaster presence;
    private final LockManager locks;
    private final ChatRelay chat;
    private final CollabConfig config;
    private final Clock clock;

    @Inject
    public ConnectionRegistry(RoomDirectory rooms, PresenceBroadcaster presence, LockManager locks,
                              ChatRelay chat, CollabConfig config, Clock clock) {
        this.rooms = rooms;
        this.presence = presence;
        this.locks = locks;
        this.chat = chat;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Joins the connection to a document room. A connection belongs to at most one room, so
     * joining another document leaves the current one first.
     *
     * @throws UnauthenticatedException if no verified identity is available
     * @throws AlreadyJoinedException   if the user is already in the room and the policy is {@code REJECT}
     */
    public ConnectedUser join(ClientChannel channel, UserIdentity identity, String documentId) {
        if (identity == null || identity.userId() == null || identity.userId().isBlank()) {
            throw new UnauthenticatedException("Authentication required");
        }
        if (documentId == null || documentId.isBlank()) {
            throw new MalformedMessageException("Room id required");
        }

        ConnectedUser current = connections.get(channel.id());
        if (current != null) {
            if (current.documentId().equals(documentId)) {
                return current;
            }
            leave(channel.id(), DisconnectReason.LEFT);
        }

        ConnectedUser user = rooms.withRoom(documentId, room -> {
            Optional<ConnectedUser> existing = room.member(identity.userId());
            if (existing.isPresent()) {
                if (config.duplicateJoinPolicy() == DuplicateJoinPolicy.REJECT) {
                    throw new AlreadyJoinedException(identity.userId(), documentId);
                }
                supersede(room, existing.get(), channel.id());
            }
            ConnectedUser joined = new ConnectedUser(channel, identity, documentId, clock.instant());
            room.add(joined);
            connections.put(channel.id(), joined);
            joined.channel().send(ServerMessage.joined(documentId, new ServerMessage.Joined(
                joined.connectionId(),
                presence.viewers(room),
                locks.currentLock(room).orElse(null),
                chat.recent(room),
                chat.typing(room))));
            presence.announceJoin(room, joined);
            return joined;
        });
        LOG.infof("User %s joined document %s via %s", identity.userId(), documentId, channel.id());
        return user;
    }

    /**
     * Removes the connection from its room, releasing any lock it held. Safe to call repeatedly.
     *
     * @return {@code true} if the connection was joined and is now removed
     */
    public boolean leave(String connectionId, DisconnectReason reason) {
        ConnectedUser user = connections.remove(connectionId);
        if (user == null) {
            return false;
        }
        rooms.withExistingRoom(user.documentId(), room -> {
            removeMember(room, user, reason);
            return room;
        });
        LOG.infof("User %s left document %s (%s)", user.userId(), user.documentId(), reason.wireName());
        return true;
    }

    /**
     * Records inbound traffic on the connection.
     *
     * @return {@code false} if the connection is not joined
     */
    public boolean activityPing(String connectionId) {
        ConnectedUser user = connections.get(connectionId);
        if (user == null) {
            return false;
        }
        user.touch(clock.instant());
        return true;
    }

    /**
     * Publishes what the connection's user is doing to everyone in its room.
     *
     * @return {@code false} if the activity was unchanged
     * @throws NotJoinedException if the connection is not in a room
     */
    public boolean updateActivity(String connectionId, String activity) {
        if (activity == null || activity.isBlank() || activity.length() > MAX_ACTIVITY_LENGTH) {
            throw new MalformedMessageException("Activity must be 1-" + MAX_ACTIVITY_LENGTH + " characters");
        }
        ConnectedUser user = connections.get(connectionId);
        if (user == null) {
            throw new NotJoinedException(null);
        }
        String label = activity.trim();
        return rooms.withExistingRoom(user.documentId(), room -> {
            if (label.equals(user.activity())) {
                return false;
            }
            user.activity(label);
            presence.announceActivity(room, user);
            return true;
        }).orElseThrow(() -> new NotJoinedException(user.documentId()));
    }

    public Optional<ConnectedUser> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Collection<ConnectedUser> connectedUsers() {
        return List.copyOf(connections.values());
    }

    public List<ConnectedUser> members(String documentId) {
        return rooms.withExistingRoom(documentId, DocumentRoom::members).orElse(List.of());
    }

    public int connectionCount() {
        return connections.size();
    }

    private void supersede(DocumentRoom room, ConnectedUser previous, String replacementId) {
        LOG.infof("Connection %s supersedes %s for user %s on document %s",
            replacementId, previous.connectionId(), previous.userId(), room.documentId());
        connections.remove(previous.connectionId(), previous);
        previous.channel().send(ServerMessage.forceDisconnect(room.documentId(), DisconnectReason.SUPERSEDED));
        // the replacement joins right after, so the room must survive even if it is momentarily empty
        removeMember(room, previous, DisconnectReason.SUPERSEDED, false);
        previous.channel().close(DisconnectReason.SUPERSEDED);
    }

    private void removeMember(DocumentRoom room, ConnectedUser user, DisconnectReason reason) {
        removeMember(room, user, reason, true);
    }

    private void removeMember(DocumentRoom room, ConnectedUser user, DisconnectReason reason, boolean retireWhenEmpty) {
        if (!room.remove(user)) {
            return;
        }
        locks.releaseHeldBy(room, user.userId(), reason == DisconnectReason.IDLE_TIMEOUT
            ? LockReleaseReason.IDLE_TIMEOUT
            : LockReleaseReason.HOLDER_LEFT);
        chat.clearTyping(room, user.userId());
        presence.announceLeave(room, user);
        if (retireWhenEmpty) {
            rooms.retireIfEmpty(room);
        }
    }
}
