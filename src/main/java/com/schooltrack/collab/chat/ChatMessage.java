package com.schooltrack.collab.chat;

import java.time.Instant;

/**
 * One chat line. {@code sequence} is assigned per room and never reused while the room lives.
 *
 * @param toUserId recipient of a direct message, {@code null} for the whole room
 */
public record ChatMessage(
    String roomId,
    long sequence,
    String senderId,
    String senderName,
    String text,
    String toUserId,
    Instant sentAt
) {

    public boolean isDirect() {
        return toUserId != null;
    }
}
