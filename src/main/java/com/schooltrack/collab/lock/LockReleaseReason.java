package com.schooltrack.collab.lock;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LockReleaseReason {
    RELEASED("released"),
    HOLDER_LEFT("holder_left"),
    IDLE_TIMEOUT("idle_timeout"),
    EXPIRED("expired"),
    FORCED("forced");

    private final String wireName;

    LockReleaseReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
