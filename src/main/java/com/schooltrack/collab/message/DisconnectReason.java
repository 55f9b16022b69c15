package com.schooltrack.collab.message;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a connection left its room. Surfaced to the client in {@code forceDisconnect} and as the close reason.
 */
public enum DisconnectReason {
    LEFT("left", 1000),
    TRANSPORT_CLOSED("transport_closed", 1000),
    IDLE_TIMEOUT("idle", 1000),
    SUPERSEDED("superseded", 1000),
    DUPLICATE("duplicate", 1008),
    CONNECT_TIMEOUT("connect_timeout", 1000),
    UNAUTHENTICATED("unauthenticated", 1008),
    ERROR("error", 1011);

    private final String wireName;
    private final int closeCode;

    DisconnectReason(String wireName, int closeCode) {
        this.wireName = wireName;
        this.closeCode = closeCode;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int closeCode() {
        return closeCode;
    }
}
