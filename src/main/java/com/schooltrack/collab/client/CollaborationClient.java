package com.schooltrack.collab.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.schooltrack.collab.error.MalformedMessageException;
import com.schooltrack.collab.idle.ConnectionState;
import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.MessageCodec;
import com.schooltrack.collab.message.MessageType;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Client of the collaboration hub for one document, exposing the connection state a UI renders
 * and the manual reconnect action it offers after an idle disconnect.
 * <p>
 * Never reconnects by itself. A failed connect or reconnect, including one the hub answers
 * with an {@code error}, leaves the client {@link ConnectionState#DISCONNECTED}, from where it
 * can be retried.
 */
public class CollaborationClient implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(CollaborationClient.class);

    private final HubTransport transport;
    private final MessageCodec codec;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final List<Consumer<ConnectionState>> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<JsonNode>> eventListeners = new CopyOnWriteArrayList<>();

    private volatile String documentId;
    private volatile HubTransport.Session session;

    record Envelope(String type, String roomId, Object payload) {}

    public CollaborationClient(HubTransport transport, MessageCodec codec) {
        this.transport = transport;
        this.codec = codec;
    }

    public ConnectionState state() {
        return state.get();
    }

    public String documentId() {
        return documentId;
    }

    public void onStateChange(Consumer<ConnectionState> listener) {
        stateListeners.add(listener);
    }

    /** Every envelope received from the hub: presence, lock, chat and typing events. */
    public void onEvent(Consumer<JsonNode> listener) {
        eventListeners.add(listener);
    }

    public CompletionStage<ConnectionState> connect(String documentId) {
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        return open(MessageType.JOIN);
    }

    /**
     * Re-runs the join flow against the same document. Ignored while already connecting or connected.
     * A lock held before the disconnect is not restored; it has to be acquired again.
     */
    public CompletionStage<ConnectionState> reconnect() {
        if (documentId == null) {
            throw new IllegalStateException("reconnect() before connect()");
        }
        return open(MessageType.RECONNECT);
    }

    public void acquireLock() {
        send(MessageType.LOCK_ACQUIRE, null);
    }

    public void releaseLock() {
        send(MessageType.LOCK_RELEASE, null);
    }

    public void sendChat(String text) {
        send(MessageType.CHAT_MESSAGE, Map.of("text", text));
    }

    /** Tells the other viewers what this user is doing, e.g. {@code reviewing_evidence}. */
    public void updateActivity(String activity) {
        send(MessageType.PRESENCE_UPDATE, Map.of("activity", activity));
    }

    public void startTyping() {
        send(MessageType.TYPING_START, null);
    }

    public void stopTyping() {
        send(MessageType.TYPING_STOP, null);
    }

    public void activityPing() {
        send(MessageType.ACTIVITY_PING, null);
    }

    @Override
    public void close() {
        HubTransport.Session current = session;
        if (current != null) {
            send(MessageType.LEAVE, null);
            current.close();
        }
        session = null;
        transition(ConnectionState.DISCONNECTED);
    }

    private CompletionStage<ConnectionState> open(MessageType joinType) {
        ConnectionState previous = state.get();
        if (previous == ConnectionState.CONNECTING || previous == ConnectionState.CONNECTED
            || !state.compareAndSet(previous, ConnectionState.CONNECTING)) {
            LOG.debugf("Already %s, ignoring %s", state.get().wireName(), joinType.wireName());
            return CompletableFuture.completedFuture(state.get());
        }
        notifyState(ConnectionState.CONNECTING);
        return transport.open(new Listener())
            .thenApply(opened -> {
                session = opened;
                send(joinType, null);
                return state.get();
            })
            .exceptionally(failure -> {
                LOG.warnf("Connecting to document %s failed: %s", documentId, failure.getMessage());
                transition(ConnectionState.DISCONNECTED);
                return ConnectionState.DISCONNECTED;
            });
    }

    /** A refused join leaves the socket open; drop it so the user can retry right away. */
    private void abandonAttempt() {
        HubTransport.Session current = session;
        session = null;
        if (current != null) {
            current.close();
        }
        transition(ConnectionState.DISCONNECTED);
    }

    private void send(MessageType type, Object payload) {
        HubTransport.Session current = session;
        if (current == null) {
            LOG.debugf("Not connected, cannot send %s", type.wireName());
            return;
        }
        current.sendText(codec.write(new Envelope(type.wireName(), documentId, payload)));
    }

    private void transition(ConnectionState next) {
        if (state.getAndSet(next) != next) {
            notifyState(next);
        }
    }

    private void notifyState(ConnectionState next) {
        stateListeners.forEach(l -> l.accept(next));
    }

    private final class Listener implements HubTransport.Listener {

        @Override
        public void onText(String text) {
            JsonNode envelope;
            try {
                envelope = codec.readTree(text);
            } catch (MalformedMessageException e) {
                LOG.warnf("Ignoring unreadable hub message: %s", e.getMessage());
                return;
            }
            String type = envelope.path("type").asText();
            if (MessageType.JOINED.wireName().equals(type)) {
                transition(ConnectionState.CONNECTED);
            } else if (MessageType.FORCE_DISCONNECT.wireName().equals(type)) {
                String reason = envelope.path("payload").path("reason").asText();
                transition(DisconnectReason.IDLE_TIMEOUT.wireName().equals(reason)
                    ? ConnectionState.IDLE_DISCONNECTED
                    : ConnectionState.DISCONNECTED);
            } else if (MessageType.ERROR.wireName().equals(type) && state.get() == ConnectionState.CONNECTING) {
                LOG.warnf("Joining document %s refused: %s", documentId,
                    envelope.path("payload").path("message").asText());
                abandonAttempt();
            }
            eventListeners.forEach(l -> l.accept(envelope));
        }

        @Override
        public void onClosed() {
            session = null;
            if (state.get() != ConnectionState.IDLE_DISCONNECTED) {
                transition(ConnectionState.DISCONNECTED);
            }
        }
    }
}
