package com.schooltrack.collab.lock;

import java.time.Instant;

/**
 * Exclusive edit right on a document.
 *
 * @param expiresAt end of the lock's lifetime, or {@code null} if it lives until released
 */
public record DocumentLock(
    String documentId,
    String holderId,
    String holderName,
    Instant acquiredAt,
    Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isHeldBy(String userId) {
        return holderId.equals(userId);
    }
}
