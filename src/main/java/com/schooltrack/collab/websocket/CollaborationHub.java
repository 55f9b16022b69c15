package com.schooltrack.collab.websocket;

import com.schooltrack.collab.chat.ChatRelay;
import com.schooltrack.collab.error.AlreadyJoinedException;
import com.schooltrack.collab.error.CollaborationException;
import com.schooltrack.collab.error.ErrorCode;
import com.schooltrack.collab.error.MalformedMessageException;
import com.schooltrack.collab.error.NotJoinedException;
import com.schooltrack.collab.error.UnauthenticatedException;
import com.schooltrack.collab.idle.IdleSupervisor;
import com.schooltrack.collab.lock.LockManager;
import com.schooltrack.collab.message.ClientMessage;
import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.MessageCodec;
import com.schooltrack.collab.message.MessageType;
import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.security.UserIdentity;
import com.schooltrack.collab.session.ClientChannel;
import com.schooltrack.collab.session.ConnectedUser;
import com.schooltrack.collab.session.ConnectionRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Transport-independent entry point: one call per connection open, inbound message and close.
 * Errors stay with the connection that caused them.
 */
@ApplicationScoped
public class CollaborationHub {

    private static final Logger LOG = Logger.getLogger(CollaborationHub.class);

    private final ConcurrentHashMap<String, OpenConnection> open = new ConcurrentHashMap<>();

    private final ConnectionRegistry registry;
    private final LockManager locks;
    private final ChatRelay chat;
    private final IdleSupervisor supervisor;
    private final MessageCodec codec;

    record OpenConnection(ClientChannel channel, UserIdentity identity) {}

    @Inject
    public CollaborationHub(ConnectionRegistry registry, LockManager locks, ChatRelay chat,
                            IdleSupervisor supervisor, MessageCodec codec) {
        this.registry = registry;
        this.locks = locks;
        this.chat = chat;
        this.supervisor = supervisor;
        this.codec = codec;
    }

    /** Registers an authenticated connection; it becomes a room member once it sends {@code join}. */
    public void open(ClientChannel channel, UserIdentity identity) {
        open.put(channel.id(), new OpenConnection(channel, identity));
        supervisor.track(channel);
        LOG.infof("Connection %s opened for user %s", channel.id(), identity.userId());
    }

    public void onMessage(String connectionId, String json) {
        OpenConnection connection = open.get(connectionId);
        if (connection == null) {
            LOG.debugf("Message on unknown connection %s ignored", connectionId);
            return;
        }
        registry.activityPing(connectionId);
        ClientMessage message;
        try {
            message = codec.decode(json);
        } catch (MalformedMessageException e) {
            LOG.warnf("Dropping malformed message on %s: %s", connectionId, e.getMessage());
            connection.channel().send(ServerMessage.error(e.code(), e.getMessage()));
            return;
        }

        try {
            dispatch(connection, message);
        } catch (UnauthenticatedException | AlreadyJoinedException e) {
            LOG.infof("Join on %s refused: %s", connectionId, e.getMessage());
            connection.channel().send(ServerMessage.error(e.code(), e.getMessage()));
            connection.channel().close(e instanceof UnauthenticatedException
                ? DisconnectReason.UNAUTHENTICATED
                : DisconnectReason.DUPLICATE);
        } catch (CollaborationException e) {
            LOG.debugf("%s on %s: %s", e.code(), connectionId, e.getMessage());
            connection.channel().send(ServerMessage.error(e.code(), e.getMessage()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to handle %s on %s", message.type(), connectionId);
            connection.channel().send(ServerMessage.error(ErrorCode.INTERNAL, "Internal error"));
        }
    }

    /** Transport-level end of the connection. Releases its membership and lock. Idempotent. */
    public void onClose(String connectionId, DisconnectReason reason) {
        OpenConnection connection = open.remove(connectionId);
        registry.leave(connectionId, reason);
        supervisor.released(connectionId);
        if (connection != null) {
            LOG.infof("Connection %s closed (%s)", connectionId, reason.wireName());
        }
    }

    public int openConnections() {
        return open.size();
    }

    private void dispatch(OpenConnection connection, ClientMessage message) {
        String id = connection.channel().id();
        MessageType type = MessageType.fromWire(message.type()).orElseThrow();
        switch (type) {
            case JOIN -> join(connection, message.roomId());
            case RECONNECT -> {
                String roomId = supervisor.claimReconnect(connection.identity().userId(), message.roomId())
                    .orElseThrow(() -> new MalformedMessageException("Nothing to reconnect to: room id required"));
                join(connection, roomId);
            }
            case LEAVE -> {
                if (registry.leave(id, DisconnectReason.LEFT)) {
                    supervisor.leftRoom(id);
                }
            }
            case LOCK_ACQUIRE -> {
                ConnectedUser user = joinedTo(id, message.roomId());
                locks.acquire(user.documentId(), user.userId());
            }
            case LOCK_RELEASE -> {
                ConnectedUser user = joinedTo(id, message.roomId());
                locks.release(user.documentId(), user.userId());
            }
            case CHAT_MESSAGE -> {
                ConnectedUser user = joinedTo(id, message.roomId());
                chat.send(user.documentId(), user.userId(),
                    message.payloadText("text").orElse(null),
                    message.payloadText("toUserId").orElse(null));
            }
            case TYPING_START -> {
                ConnectedUser user = joinedTo(id, message.roomId());
                chat.startTyping(user.documentId(), user.userId());
            }
            case TYPING_STOP -> {
                ConnectedUser user = joinedTo(id, message.roomId());
                chat.stopTyping(user.documentId(), user.userId());
            }
            case PRESENCE_UPDATE -> {
                joinedTo(id, message.roomId());
                registry.updateActivity(id, message.payloadText("activity").orElse(null));
            }
            case ACTIVITY_PING -> {
                // activity already recorded
            }
            default -> throw new MalformedMessageException("Unsupported message type: " + message.type());
        }
    }

    private void join(OpenConnection connection, String roomId) {
        String id = connection.channel().id();
        supervisor.joinAttempt(id);
        try {
            registry.join(connection.channel(), connection.identity(), roomId);
        } catch (RuntimeException e) {
            supervisor.attemptFailed(id);
            throw e;
        }
        supervisor.joined(id);
    }

    private ConnectedUser joinedTo(String connectionId, String roomId) {
        ConnectedUser user = registry.find(connectionId).orElseThrow(() -> new NotJoinedException(roomId));
        if (roomId != null && !roomId.equals(user.documentId())) {
            throw new NotJoinedException(roomId);
        }
        return user;
    }
}
