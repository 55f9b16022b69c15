package com.schooltrack.collab.session;

import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.ServerMessage;

/**
 * Outbound side of one live connection.
 * <p>
 * {@link #send} must never block the caller: rooms enqueue broadcasts while serialized,
 * so a slow consumer may only lose messages, not stall the room.
 */
public interface ClientChannel {

    String id();

    boolean isOpen();

    /** Best-effort, at-most-once delivery. Dropped once the channel is closing. */
    void send(ServerMessage message);

    /** Closes after already queued messages have been flushed. Idempotent. */
    void close(DisconnectReason reason);
}
