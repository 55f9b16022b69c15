package com.schooltrack.collab.session;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Index of live rooms by document id. A room exists while it has members and is
 * retired, under its own serialization, when the last one leaves.
 */
@ApplicationScoped
public class RoomDirectory {

    private final ConcurrentHashMap<String, DocumentRoom> rooms = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} serialized on the room for {@code documentId}, creating the room if needed.
     */
    public <T> T withRoom(String documentId, Function<DocumentRoom, T> action) {
        while (true) {
            DocumentRoom room = rooms.computeIfAbsent(documentId, DocumentRoom::new);
            room.lock();
            try {
                if (room.isRetired()) {
                    // lost a race with the last leave; the next lookup creates a fresh room
                    continue;
                }
                return action.apply(room);
            } finally {
                room.unlock();
            }
        }
    }

    /**
     * Runs {@code action} serialized on an existing room, or returns empty if nobody is in it.
     */
    public <T> Optional<T> withExistingRoom(String documentId, Function<DocumentRoom, T> action) {
        if (documentId == null) {
            return Optional.empty();
        }
        DocumentRoom room = rooms.get(documentId);
        if (room == null) {
            return Optional.empty();
        }
        room.lock();
        try {
            if (room.isRetired()) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.apply(room));
        } finally {
            room.unlock();
        }
    }

    void retireIfEmpty(DocumentRoom room) {
        room.checkSerialized();
        if (room.isEmpty() && !room.isRetired()) {
            room.retire();
            rooms.remove(room.documentId(), room);
        }
    }

    public List<DocumentRoom> all() {
        return List.copyOf(rooms.values());
    }

    public int size() {
        return rooms.size();
    }
}
