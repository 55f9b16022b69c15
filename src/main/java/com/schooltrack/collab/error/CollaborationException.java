package com.schooltrack.collab.error;

/**
 * Base of the per-connection failures the hub reports back to the offending client.
 * None of them is fatal to the hub or to other connections.
 */
public abstract class CollaborationException extends RuntimeException {

    private final ErrorCode code;

    protected CollaborationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected CollaborationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
