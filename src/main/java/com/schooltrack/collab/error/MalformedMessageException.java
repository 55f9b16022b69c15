package com.schooltrack.collab.error;

public class MalformedMessageException extends CollaborationException {

    public MalformedMessageException(String message) {
        super(ErrorCode.MALFORMED_MESSAGE, message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_MESSAGE, message, cause);
    }
}
