package com.schooltrack.collab.message;

import java.util.Arrays;
import java.util.Optional;

/**
 * Envelope types carried over the hub connection, with the direction they travel in.
 */
public enum MessageType {
    // client -> hub
    JOIN("join", true),
    LEAVE("leave", true),
    RECONNECT("reconnect", true),
    LOCK_ACQUIRE("lockAcquire", true),
    LOCK_RELEASE("lockRelease", true),
    ACTIVITY_PING("activityPing", true),
    // both directions
    CHAT_MESSAGE("chatMessage", true),
    TYPING_START("typingStart", true),
    TYPING_STOP("typingStop", true),
    // hub -> client
    JOINED("joined", false),
    PRESENCE_UPDATE("presenceUpdate", true),
    LOCK_GRANTED("lockGranted", false),
    LOCK_DENIED("lockDenied", false),
    LOCK_RELEASED("lockReleased", false),
    CONFLICT_WARNING("conflictWarning", false),
    IDLE_WARNING("idleWarning", false),
    FORCE_DISCONNECT("forceDisconnect", false),
    ERROR("error", false);

    private final String wireName;
    private final boolean acceptedFromClient;

    MessageType(String wireName, boolean acceptedFromClient) {
        this.wireName = wireName;
        this.acceptedFromClient = acceptedFromClient;
    }

    public String wireName() {
        return wireName;
    }

    public boolean acceptedFromClient() {
        return acceptedFromClient;
    }

    public static Optional<MessageType> fromWire(String wireName) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(wireName))
            .findFirst();
    }
}
