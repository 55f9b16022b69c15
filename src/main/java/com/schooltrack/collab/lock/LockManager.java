package com.schooltrack.collab.lock;

import com.schooltrack.collab.config.CollabConfig;
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
import java.util.List;
import java.util.Optional;

/**
 * Arbitrates the single exclusive edit lock of each document.
 * <p>
 * Per document the lock is either absent or held by exactly one member; every transition
 * runs under the room's serialization, so of two simultaneous requests the first one
 * serialized wins and the other is denied with the winner as holder.
 */
@ApplicationScoped
public class LockManager {

    private static final Logger LOG = Logger.getLogger(LockManager.class);

    private final RoomDirectory rooms;
    private final CollabConfig config;
    private final Clock clock;

    static final class LockSlot {
        DocumentLock lock;
    }

    @Inject
    public LockManager(RoomDirectory rooms, CollabConfig config, Clock clock) {
        this.rooms = rooms;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Requests the edit lock for a member of the document's room. A holder asking again refreshes its lock.
     *
     * @throws NotJoinedException if the user is not in the room
     */
    public LockResult acquire(String documentId, String userId) {
        return rooms.withExistingRoom(documentId, room -> acquire(room, userId))
            .orElseThrow(() -> new NotJoinedException(documentId));
    }

    private LockResult acquire(DocumentRoom room, String userId) {
        ConnectedUser requester = room.member(userId)
            .orElseThrow(() -> new NotJoinedException(room.documentId()));
        LockSlot slot = slot(room);
        Instant now = clock.instant();
        expireIfDue(room, slot, now);

        DocumentLock current = slot.lock;
        if (current != null && !current.isHeldBy(userId)) {
            LOG.debugf("Lock on %s denied to %s, held by %s", room.documentId(), userId, current.holderId());
            requester.channel().send(ServerMessage.lockDenied(current));
            room.sendTo(current.holderId(),
                ServerMessage.conflictWarning(room.documentId(), requester.userId(), requester.displayName()));
            return new LockResult.Denied(current);
        }

        boolean refresh = current != null;
        DocumentLock lock = new DocumentLock(
            room.documentId(),
            userId,
            requester.displayName(),
            refresh ? current.acquiredAt() : now,
            config.lockExpiry().map(now::plus).orElse(null));
        slot.lock = lock;
        room.broadcast(ServerMessage.lockGranted(lock));
        if (refresh) {
            LOG.debugf("Lock on %s refreshed by %s", room.documentId(), userId);
        } else {
            LOG.infof("Lock on %s granted to %s", room.documentId(), userId);
        }
        return new LockResult.Granted(lock, refresh);
    }

    /**
     * Releases the lock if {@code userId} holds it. Anyone else's release is ignored.
     *
     * @return {@code true} if a lock was released
     */
    public boolean release(String documentId, String userId) {
        return rooms.withExistingRoom(documentId, room -> {
            LockSlot slot = slot(room);
            if (slot.lock == null || !slot.lock.isHeldBy(userId)) {
                LOG.debugf("Ignoring stale release of %s by %s", documentId, userId);
                return false;
            }
            clear(room, slot, LockReleaseReason.RELEASED);
            return true;
        }).orElse(false);
    }

    /**
     * Drops the lock held by a departing member. Only called from inside the room.
     */
    public void releaseHeldBy(DocumentRoom room, String userId, LockReleaseReason reason) {
        room.checkSerialized();
        LockSlot slot = slot(room);
        if (slot.lock != null && slot.lock.isHeldBy(userId)) {
            clear(room, slot, reason);
        }
    }

    /** Administrative unlock regardless of holder. */
    public Optional<DocumentLock> forceRelease(String documentId) {
        return rooms.withExistingRoom(documentId, room -> {
            LockSlot slot = slot(room);
            DocumentLock lock = slot.lock;
            if (lock != null) {
                clear(room, slot, LockReleaseReason.FORCED);
            }
            return lock;
        });
    }

    public Optional<DocumentLock> currentLock(String documentId) {
        return rooms.withExistingRoom(documentId, room -> currentLock(room).orElse(null));
    }

    public Optional<DocumentLock> currentLock(DocumentRoom room) {
        room.checkSerialized();
        DocumentLock lock = slot(room).lock;
        if (lock == null || lock.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(lock);
    }

    public List<DocumentLock> activeLocks() {
        return rooms.all().stream()
            .map(room -> currentLock(room.documentId()))
            .flatMap(Optional::stream)
            .toList();
    }

    /**
     * Releases every lock whose lifetime has run out.
     *
     * @return number of locks released
     */
    public int sweepExpired(Instant now) {
        if (config.lockExpiry().isEmpty()) {
            return 0;
        }
        int released = 0;
        for (DocumentRoom room : rooms.all()) {
            boolean expired = rooms.withExistingRoom(room.documentId(), r -> expireIfDue(r, slot(r), now))
                .orElse(false);
            if (expired) {
                released++;
            }
        }
        return released;
    }

    private boolean expireIfDue(DocumentRoom room, LockSlot slot, Instant now) {
        if (slot.lock != null && slot.lock.isExpired(now)) {
            clear(room, slot, LockReleaseReason.EXPIRED);
            return true;
        }
        return false;
    }

    private void clear(DocumentRoom room, LockSlot slot, LockReleaseReason reason) {
        DocumentLock lock = slot.lock;
        slot.lock = null;
        LOG.infof("Lock on %s held by %s released (%s)", lock.documentId(), lock.holderId(), reason.wireName());
        room.broadcast(ServerMessage.lockReleased(lock, reason));
    }

    private static LockSlot slot(DocumentRoom room) {
        return room.attachment(LockSlot.class, LockSlot::new);
    }
}
