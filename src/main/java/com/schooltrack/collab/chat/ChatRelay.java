package com.schooltrack.collab.chat;

import com.schooltrack.collab.config.CollabConfig;
import com.schooltrack.collab.error.MalformedMessageException;
import com.schooltrack.collab.error.NotJoinedException;
import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.session.ConnectedUser;
import com.schooltrack.collab.session.DocumentRoom;
import com.schooltrack.collab.session.RoomDirectory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Ephemeral, ordered chat and typing indicators within a room.
 * <p>
 * Delivery is at-most-once: a member whose connection is going away simply misses the message.
 */
@ApplicationScoped
public class ChatRelay {

    private static final Logger LOG = Logger.getLogger(ChatRelay.class);

    private final RoomDirectory rooms;
    private final CollabConfig config;
    private final Clock clock;

    @Inject
    public ChatRelay(RoomDirectory rooms, CollabConfig config, Clock clock) {
        this.rooms = rooms;
        this.config = config;
        this.clock = clock;
    }

    public ChatMessage send(String roomId, String userId, String text) {
        return send(roomId, userId, text, null);
    }

    /**
     * Assigns the room's next sequence number and fans the message out. A direct message
     * goes to {@code toUserId} and back to the sender only.
     *
     * @throws MalformedMessageException if the text is empty or too long
     * @throws NotJoinedException        if the sender is not in the room
     */
    public ChatMessage send(String roomId, String userId, String text, String toUserId) {
        if (text == null || text.isBlank()) {
            throw new MalformedMessageException("Chat text required");
        }
        if (text.length() > config.chatMaxLength()) {
            throw new MalformedMessageException("Chat text longer than " + config.chatMaxLength() + " characters");
        }
        return rooms.withExistingRoom(roomId, room -> {
            ConnectedUser sender = room.member(userId).orElseThrow(() -> new NotJoinedException(roomId));
            ChatLog log = log(room);
            ChatMessage message = new ChatMessage(
                roomId, log.nextSequence(), userId, sender.displayName(), text, toUserId, clock.instant());

            if (log.typing().remove(userId) != null) {
                room.broadcast(ServerMessage.typingStop(roomId, userId, false), userId);
            }
            ServerMessage envelope = ServerMessage.chat(message);
            if (message.isDirect()) {
                if (!toUserId.equals(userId)) {
                    room.sendTo(toUserId, envelope);
                }
                sender.channel().send(envelope);
            } else {
                log.append(message);
                room.broadcast(envelope);
            }
            LOG.debugf("Chat #%d on %s from %s", message.sequence(), roomId, userId);
            return message;
        }).orElseThrow(() -> new NotJoinedException(roomId));
    }

    /**
     * Marks the user as typing until the typing expiry passes.
     *
     * @return {@code true} if the user was not already typing
     */
    public boolean startTyping(String roomId, String userId) {
        return rooms.withExistingRoom(roomId, room -> {
            ConnectedUser member = room.member(userId).orElseThrow(() -> new NotJoinedException(roomId));
            TypingUser typing = new TypingUser(roomId, userId, member.displayName(),
                clock.instant().plus(config.typingExpiry()));
            boolean started = log(room).typing().put(userId, typing) == null;
            if (started) {
                room.broadcast(ServerMessage.typingStart(typing), userId);
            }
            return started;
        }).orElseThrow(() -> new NotJoinedException(roomId));
    }

    public boolean stopTyping(String roomId, String userId) {
        return rooms.withExistingRoom(roomId, room -> {
            boolean stopped = log(room).typing().remove(userId) != null;
            if (stopped) {
                room.broadcast(ServerMessage.typingStop(roomId, userId, false), userId);
            }
            return stopped;
        }).orElse(false);
    }

    /** Drops a departing member's typing indicator. Only called from inside the room. */
    public void clearTyping(DocumentRoom room, String userId) {
        room.checkSerialized();
        if (log(room).typing().remove(userId) != null) {
            room.broadcast(ServerMessage.typingStop(room.documentId(), userId, false));
        }
    }

    /**
     * Clears typing indicators whose sender went quiet without a {@code typingStop}.
     *
     * @return number of indicators cleared
     */
    public int sweepTyping(Instant now) {
        int cleared = 0;
        for (DocumentRoom room : rooms.all()) {
            cleared += rooms.withExistingRoom(room.documentId(), r -> expireTyping(r, now)).orElse(0);
        }
        return cleared;
    }

    public List<ChatMessage> recent(DocumentRoom room) {
        room.checkSerialized();
        return log(room).history();
    }

    public List<TypingUser> typing(DocumentRoom room) {
        room.checkSerialized();
        return List.copyOf(log(room).typing().values());
    }

    private int expireTyping(DocumentRoom room, Instant now) {
        List<TypingUser> expired = new ArrayList<>();
        Iterator<TypingUser> it = log(room).typing().values().iterator();
        while (it.hasNext()) {
            TypingUser typing = it.next();
            if (typing.isExpired(now)) {
                it.remove();
                expired.add(typing);
            }
        }
        expired.forEach(t -> room.broadcast(ServerMessage.typingStop(t.roomId(), t.userId(), true), t.userId()));
        return expired.size();
    }

    private ChatLog log(DocumentRoom room) {
        return room.attachment(ChatLog.class, () -> new ChatLog(config.chatHistorySize()));
    }
}
