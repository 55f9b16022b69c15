package com.schooltrack.collab.idle;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one connection as seen by the supervisor and by clients.
 */
public enum ConnectionState {
    /** Open (or reopening) and waiting for its join to complete. The idle timer does not run. */
    CONNECTING("connecting"),
    CONNECTED("connected"),
    IDLE_DISCONNECTED("idle-disconnected"),
    DISCONNECTED("disconnected");

    private final String wireName;

    ConnectionState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
