package com.schooltrack.collab.message;

import com.schooltrack.collab.chat.ChatMessage;
import com.schooltrack.collab.chat.TypingUser;
import com.schooltrack.collab.error.ErrorCode;
import com.schooltrack.collab.lock.DocumentLock;
import com.schooltrack.collab.lock.LockReleaseReason;
import com.schooltrack.collab.presence.DocumentViewer;

import java.time.Instant;
import java.util.List;

/**
 * Outbound envelope: {@code {type, roomId, payload}}.
 */
public record ServerMessage(
    String type,
    String roomId,
    Object payload
) {
    public record Joined(
        String connectionId,
        List<DocumentViewer> viewers,
        DocumentLock lock,
        List<ChatMessage> recentChat,
        List<TypingUser> typing
    ) {}

    public record Presence(String action, String userId, List<DocumentViewer> viewers) {}

    public record LockDenial(String holderId, String holderName, Instant lockedAt, Instant expiresAt) {}

    public record LockRelease(String documentId, String userId, LockReleaseReason reason) {}

    public record ConflictWarning(String attemptedById, String attemptedByName) {}

    public record TypingStop(String userId, boolean expired) {}

    public record IdleWarning(Instant disconnectAt) {}

    public record ForceDisconnect(DisconnectReason reason) {}

    public record Error(ErrorCode code, String message) {}

    public static ServerMessage joined(String roomId, Joined snapshot) {
        return new ServerMessage(MessageType.JOINED.wireName(), roomId, snapshot);
    }

    public static ServerMessage userJoined(String roomId, String userId, List<DocumentViewer> viewers) {
        return new ServerMessage(MessageType.PRESENCE_UPDATE.wireName(), roomId, new Presence("joined", userId, viewers));
    }

    public static ServerMessage activityChanged(String roomId, String userId, List<DocumentViewer> viewers) {
        return new ServerMessage(MessageType.PRESENCE_UPDATE.wireName(), roomId,
            new Presence("activity_changed", userId, viewers));
    }

    public static ServerMessage userLeft(String roomId, String userId, List<DocumentViewer> viewers) {
        return new ServerMessage(MessageType.PRESENCE_UPDATE.wireName(), roomId, new Presence("left", userId, viewers));
    }

    public static ServerMessage lockGranted(DocumentLock lock) {
        return new ServerMessage(MessageType.LOCK_GRANTED.wireName(), lock.documentId(), lock);
    }

    public static ServerMessage lockDenied(DocumentLock heldBy) {
        return new ServerMessage(MessageType.LOCK_DENIED.wireName(), heldBy.documentId(),
            new LockDenial(heldBy.holderId(), heldBy.holderName(), heldBy.acquiredAt(), heldBy.expiresAt()));
    }

    public static ServerMessage lockReleased(DocumentLock lock, LockReleaseReason reason) {
        return new ServerMessage(MessageType.LOCK_RELEASED.wireName(), lock.documentId(),
            new LockRelease(lock.documentId(), lock.holderId(), reason));
    }

    public static ServerMessage conflictWarning(String roomId, String attemptedById, String attemptedByName) {
        return new ServerMessage(MessageType.CONFLICT_WARNING.wireName(), roomId,
            new ConflictWarning(attemptedById, attemptedByName));
    }

    public static ServerMessage chat(ChatMessage message) {
        return new ServerMessage(MessageType.CHAT_MESSAGE.wireName(), message.roomId(), message);
    }

    public static ServerMessage typingStart(TypingUser typing) {
        return new ServerMessage(MessageType.TYPING_START.wireName(), typing.roomId(), typing);
    }

    public static ServerMessage typingStop(String roomId, String userId, boolean expired) {
        return new ServerMessage(MessageType.TYPING_STOP.wireName(), roomId, new TypingStop(userId, expired));
    }

    public static ServerMessage idleWarning(String roomId, Instant disconnectAt) {
        return new ServerMessage(MessageType.IDLE_WARNING.wireName(), roomId, new IdleWarning(disconnectAt));
    }

    public static ServerMessage forceDisconnect(String roomId, DisconnectReason reason) {
        return new ServerMessage(MessageType.FORCE_DISCONNECT.wireName(), roomId, new ForceDisconnect(reason));
    }

    public static ServerMessage error(ErrorCode code, String message) {
        return new ServerMessage(MessageType.ERROR.wireName(), null, new Error(code, message));
    }
}
