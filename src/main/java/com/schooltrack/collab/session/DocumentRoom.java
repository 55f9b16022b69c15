package com.schooltrack.collab.session;

import com.schooltrack.collab.message.ServerMessage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * All connections currently joined to one document, plus the per-room state of the
 * components that arbitrate it.
 * <p>
 * Every mutation of a room (membership, lock, chat sequence, typing set) happens while
 * holding the room's serialization, which makes the room its own linearization point.
 * Broadcasts are enqueued from inside that section, so each member observes the room's
 * events in mutation order. Different rooms never contend.
 */
public final class DocumentRoom {

    private final String documentId;
    private final ReentrantLock serial = new ReentrantLock();
    private final Map<String, ConnectedUser> members = new LinkedHashMap<>();
    private final Map<Class<?>, Object> attachments = new LinkedHashMap<>();
    private boolean retired;

    DocumentRoom(String documentId) {
        this.documentId = documentId;
    }

    public String documentId() {
        return documentId;
    }

    /**
     * Runs {@code action} under this room's serialization. Reentrant, so components
     * may call each other while already inside the room.
     */
    public <T> T serialized(Supplier<T> action) {
        serial.lock();
        try {
            return action.get();
        } finally {
            serial.unlock();
        }
    }

    public void serialized(Runnable action) {
        serialized(() -> {
            action.run();
            return null;
        });
    }

    /** Guards entry points that must only be reached from inside the room. */
    public void checkSerialized() {
        if (!serial.isHeldByCurrentThread()) {
            throw new IllegalStateException("Room " + documentId + " mutated outside its serialization");
        }
    }

    void lock() {
        serial.lock();
    }

    void unlock() {
        serial.unlock();
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        checkSerialized();
        retired = true;
        attachments.clear();
    }

    void add(ConnectedUser user) {
        checkSerialized();
        members.put(user.connectionId(), user);
    }

    boolean remove(ConnectedUser user) {
        checkSerialized();
        return members.remove(user.connectionId(), user);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /** Members in join order. */
    public List<ConnectedUser> members() {
        return serialized(() -> List.copyOf(members.values()));
    }

    public Optional<ConnectedUser> member(String userId) {
        return serialized(() -> members.values().stream()
            .filter(m -> m.userId().equals(userId))
            .findFirst());
    }

    /**
     * Per-room state owned by another component, created on first use and discarded with the room.
     * Callers must be serialized.
     */
    public <T> T attachment(Class<T> type, Supplier<T> factory) {
        checkSerialized();
        return type.cast(attachments.computeIfAbsent(type, t -> factory.get()));
    }

    public void broadcast(ServerMessage message) {
        broadcast(message, null);
    }

    public void broadcast(ServerMessage message, String excludeUserId) {
        List<ConnectedUser> recipients = new ArrayList<>();
        serialized(() -> members.values().forEach(m -> {
            if (!m.userId().equals(excludeUserId)) {
                recipients.add(m);
            }
        }));
        recipients.forEach(m -> m.channel().send(message));
    }

    public void sendTo(String userId, ServerMessage message) {
        member(userId).ifPresent(m -> m.channel().send(message));
    }

    @Override
    public String toString() {
        return "DocumentRoom[" + documentId + ", members=" + members.size() + "]";
    }
}
