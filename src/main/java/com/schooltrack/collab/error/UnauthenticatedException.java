package com.schooltrack.collab.error;

public class UnauthenticatedException extends CollaborationException {

    public UnauthenticatedException(String message) {
        super(ErrorCode.UNAUTHENTICATED, message);
    }
}
