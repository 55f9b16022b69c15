package com.schooltrack.collab.config;

/**
 * What happens when a user joins a document they already hold a live connection to.
 */
public enum DuplicateJoinPolicy {
    /** The newer connection wins; the older one is told it was superseded and dropped. */
    REPLACE,
    /** The newer connection is refused with {@code AlreadyJoined}. */
    REJECT
}
