package com.schooltrack.collab.websocket;

import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.MessageCodec;
import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.session.ClientChannel;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ClientChannel} over a WebSocket connection. Messages are written one at a time from a
 * bounded queue; when a slow client lets the queue fill up, new messages are dropped.
 * <p>
 * Closing flushes what is queued first, unless the write in flight has been stuck for longer
 * than the write timeout, in which case the socket is closed right away.
 */
final class WebSocketChannel implements ClientChannel {

    private static final Logger LOG = Logger.getLogger(WebSocketChannel.class);

    /** The part of a server connection the channel writes to. */
    interface Socket {

        String id();

        boolean isOpen();

        Uni<Void> sendText(String text);

        Uni<Void> close(CloseReason reason);

        static Socket of(WebSocketConnection connection) {
            return new Socket() {
                @Override
                public String id() {
                    return connection.id();
                }

                @Override
                public boolean isOpen() {
                    return connection.isOpen();
                }

                @Override
                public Uni<Void> sendText(String text) {
                    return connection.sendText(text);
                }

                @Override
                public Uni<Void> close(CloseReason reason) {
                    return connection.close(reason);
                }
            };
        }
    }

    private final Socket socket;
    private final MessageCodec codec;
    private final int capacity;
    private final Duration writeTimeout;
    private final Clock clock;

    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicBoolean writing = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile DisconnectReason closeReason;
    private volatile Instant writeStartedAt;

    WebSocketChannel(Socket socket, MessageCodec codec, int capacity, Duration writeTimeout, Clock clock) {
        this.socket = socket;
        this.codec = codec;
        this.capacity = capacity;
        this.writeTimeout = writeTimeout;
        this.clock = clock;
    }

    @Override
    public String id() {
        return socket.id();
    }

    @Override
    public boolean isOpen() {
        return closeReason == null && socket.isOpen();
    }

    @Override
    public void send(ServerMessage message) {
        if (!isOpen()) {
            LOG.debugf("Dropping %s for closing connection %s", message.type(), id());
            return;
        }
        if (queued.incrementAndGet() > capacity) {
            queued.decrementAndGet();
            LOG.warnf("Outbound queue of %s is full, dropping %s", id(), message.type());
            return;
        }
        pending.add(codec.encode(message));
        drain();
    }

    @Override
    public void close(DisconnectReason reason) {
        if (closeReason != null) {
            return;
        }
        closeReason = reason;
        Instant started = writeStartedAt;
        if (writing.get() && started != null && !clock.instant().isBefore(started.plus(writeTimeout))) {
            LOG.warnf("Write to %s stuck since %s, closing without flushing %d frame(s)", id(), started, queued.get());
            pending.clear();
            queued.set(0);
            closeNow();
            return;
        }
        drain();
    }

    private void drain() {
        if (!writing.compareAndSet(false, true)) {
            return;
        }
        String next = pending.poll();
        if (next == null) {
            writing.set(false);
            if (!pending.isEmpty()) {
                drain();
            } else if (closeReason != null) {
                closeNow();
            }
            return;
        }
        queued.decrementAndGet();
        writeStartedAt = clock.instant();
        socket.sendText(next)
            .ifNoItem().after(writeTimeout).fail()
            .subscribe().with(
                ignored -> written(),
                failure -> {
                    LOG.debugf("Write to %s failed: %s", id(), failure.getMessage());
                    written();
                });
    }

    private void written() {
        writeStartedAt = null;
        writing.set(false);
        drain();
    }

    private void closeNow() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        DisconnectReason reason = closeReason;
        socket.close(new CloseReason(reason.closeCode(), reason.wireName())).subscribe().with(
            ignored -> LOG.debugf("Closed %s (%s)", id(), reason.wireName()),
            failure -> LOG.debugf("Close of %s failed: %s", id(), failure.getMessage()));
    }
}
