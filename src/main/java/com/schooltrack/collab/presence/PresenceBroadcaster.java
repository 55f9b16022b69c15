package com.schooltrack.collab.presence;

import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.session.ConnectedUser;
import com.schooltrack.collab.session.DocumentRoom;
import com.schooltrack.collab.session.RoomDirectory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;

/**
 * Turns membership and activity changes into {@code presenceUpdate} broadcasts.
 * <p>
 * Every update carries the full viewer list rather than a delta, so a member that missed
 * one update is corrected by the next.
 */
@ApplicationScoped
public class PresenceBroadcaster {

    private static final Logger LOG = Logger.getLogger(PresenceBroadcaster.class);

    private final RoomDirectory rooms;

    @Inject
    public PresenceBroadcaster(RoomDirectory rooms) {
        this.rooms = rooms;
    }

    public void announceJoin(DocumentRoom room, ConnectedUser user) {
        room.checkSerialized();
        List<DocumentViewer> viewers = viewers(room);
        LOG.debugf("Presence on %s after join of %s: %d viewer(s)", room.documentId(), user.userId(), viewers.size());
        room.broadcast(ServerMessage.userJoined(room.documentId(), user.userId(), viewers));
    }

    public void announceLeave(DocumentRoom room, ConnectedUser user) {
        room.checkSerialized();
        List<DocumentViewer> viewers = viewers(room);
        LOG.debugf("Presence on %s after leave of %s: %d viewer(s)", room.documentId(), user.userId(), viewers.size());
        room.broadcast(ServerMessage.userLeft(room.documentId(), user.userId(), viewers));
    }

    public void announceActivity(DocumentRoom room, ConnectedUser user) {
        room.checkSerialized();
        LOG.debugf("Presence on %s: %s is now %s", room.documentId(), user.userId(), user.activity());
        room.broadcast(ServerMessage.activityChanged(room.documentId(), user.userId(), viewers(room)));
    }

    /** Current viewers in join order. */
    public List<DocumentViewer> viewers(DocumentRoom room) {
        return room.members().stream()
            .map(DocumentViewer::of)
            .sorted(Comparator.comparing(DocumentViewer::joinedAt))
            .toList();
    }

    public List<DocumentViewer> viewers(String documentId) {
        return rooms.withExistingRoom(documentId, this::viewers).orElse(List.of());
    }
}
