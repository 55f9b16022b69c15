package com.schooltrack.collab.error;

public class AlreadyJoinedException extends CollaborationException {

    public AlreadyJoinedException(String userId, String documentId) {
        super(ErrorCode.ALREADY_JOINED,
            "User " + userId + " already has a live connection to document " + documentId);
    }
}
