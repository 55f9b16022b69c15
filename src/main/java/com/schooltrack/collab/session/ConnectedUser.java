package com.schooltrack.collab.session;

import com.schooltrack.collab.security.UserIdentity;

import java.time.Instant;

/**
 * A connection that has joined a document room. Owned by {@link ConnectionRegistry};
 * everything else only reads it.
 */
public final class ConnectedUser {

    public static final String DEFAULT_ACTIVITY = "viewing";

    private final ClientChannel channel;
    private final UserIdentity identity;
    private final String documentId;
    private final Instant joinedAt;
    private volatile Instant lastActivity;
    private volatile String activity = DEFAULT_ACTIVITY;

    ConnectedUser(ClientChannel channel, UserIdentity identity, String documentId, Instant joinedAt) {
        this.channel = channel;
        this.identity = identity;
        this.documentId = documentId;
        this.joinedAt = joinedAt;
        this.lastActivity = joinedAt;
    }

    public String connectionId() {
        return channel.id();
    }

    public ClientChannel channel() {
        return channel;
    }

    public UserIdentity identity() {
        return identity;
    }

    public String userId() {
        return identity.userId();
    }

    public String displayName() {
        return identity.displayName();
    }

    public String documentId() {
        return documentId;
    }

    public Instant joinedAt() {
        return joinedAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    /** What the user says they are doing, e.g. {@code reviewing_evidence}. */
    public String activity() {
        return activity;
    }

    void activity(String activity) {
        this.activity = activity;
    }

    void touch(Instant now) {
        if (now.isAfter(lastActivity)) {
            lastActivity = now;
        }
    }

    @Override
    public String toString() {
        return "ConnectedUser[" + identity.userId() + "@" + documentId + " via " + channel.id() + "]";
    }
}
