package com.schooltrack.collab.lock;

/**
 * Outcome of a lock request. A denial is an expected answer, not an error.
 */
public sealed interface LockResult {

    record Granted(DocumentLock lock, boolean refreshed) implements LockResult {}

    record Denied(DocumentLock heldBy) implements LockResult {}

    default boolean granted() {
        return this instanceof Granted;
    }
}
