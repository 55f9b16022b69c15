package com.schooltrack.collab.chat;

import java.time.Instant;

public record TypingUser(String roomId, String userId, String name, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
