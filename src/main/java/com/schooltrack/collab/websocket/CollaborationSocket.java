package com.schooltrack.collab.websocket;

import com.schooltrack.collab.config.CollabConfig;
import com.schooltrack.collab.error.ErrorCode;
import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.MessageCodec;
import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.security.AuthService;
import com.schooltrack.collab.security.UserIdentity;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Optional;

/**
 * WebSocket endpoint of the collaboration hub.
 * Requires JWT authentication - user identity extracted from token, never from the client's messages.
 */
@WebSocket(path = "/ws/collab")
public class CollaborationSocket {

    private static final Logger LOG = Logger.getLogger(CollaborationSocket.class);

    @Inject
    CollaborationHub hub;

    @Inject
    AuthService authService;

    @Inject
    MessageCodec codec;

    @Inject
    CollabConfig config;

    @Inject
    Clock clock;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        Optional<UserIdentity> identity = authService.currentIdentity();
        if (identity.isEmpty()) {
            LOG.warnf("Unauthenticated WebSocket connection attempt: %s", connection.id());
            connection.sendTextAndAwait(codec.encode(
                ServerMessage.error(ErrorCode.UNAUTHENTICATED, "Authentication required")));
            connection.closeAndAwait(new CloseReason(DisconnectReason.UNAUTHENTICATED.closeCode(), "Authentication required"));
            return;
        }
        hub.open(new WebSocketChannel(WebSocketChannel.Socket.of(connection), codec,
            config.outboundQueueCapacity(), config.writeTimeout(), clock), identity.get());
    }

    @OnTextMessage
    public void onMessage(String message, WebSocketConnection connection) {
        hub.onMessage(connection.id(), message);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        hub.onClose(connection.id(), DisconnectReason.TRANSPORT_CLOSED);
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warnf("WebSocket error on %s: %s", connection.id(), t.getMessage());
        if (connection.isOpen()) {
            connection.closeAndAwait(new CloseReason(DisconnectReason.ERROR.closeCode(), DisconnectReason.ERROR.wireName()));
        } else {
            hub.onClose(connection.id(), DisconnectReason.ERROR);
        }
    }
}
