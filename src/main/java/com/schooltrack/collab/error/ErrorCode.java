package com.schooltrack.collab.error;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorCode {
    UNAUTHENTICATED("unauthenticated"),
    ALREADY_JOINED("already_joined"),
    MALFORMED_MESSAGE("malformed_message"),
    NOT_JOINED("not_joined"),
    INTERNAL("internal");

    private final String wireName;

    ErrorCode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
