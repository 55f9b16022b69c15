package com.schooltrack.collab.error;

public class NotJoinedException extends CollaborationException {

    public NotJoinedException(String documentId) {
        super(ErrorCode.NOT_JOINED, documentId == null
            ? "Not joined to a document"
            : "Not joined to document " + documentId);
    }
}
