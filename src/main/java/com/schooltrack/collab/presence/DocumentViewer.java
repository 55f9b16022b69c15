package com.schooltrack.collab.presence;

import com.schooltrack.collab.session.ConnectedUser;

import java.time.Instant;

/**
 * Read-only projection of a {@link ConnectedUser} for viewer lists.
 */
public record DocumentViewer(String userId, String name, Instant joinedAt, String activity) {

    public static DocumentViewer of(ConnectedUser user) {
        return new DocumentViewer(user.userId(), user.displayName(), user.joinedAt(), user.activity());
    }
}
