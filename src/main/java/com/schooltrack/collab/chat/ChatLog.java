package com.schooltrack.collab.chat;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat state of one room. Only touched under the room's serialization.
 */
final class ChatLog {

    private final int capacity;
    private final Deque<ChatMessage> history = new ArrayDeque<>();
    private final Map<String, TypingUser> typing = new LinkedHashMap<>();
    private long lastSequence;

    ChatLog(int capacity) {
        this.capacity = capacity;
    }

    long nextSequence() {
        return ++lastSequence;
    }

    void append(ChatMessage message) {
        if (capacity <= 0) {
            return;
        }
        history.addLast(message);
        while (history.size() > capacity) {
            history.removeFirst();
        }
    }

    List<ChatMessage> history() {
        return List.copyOf(history);
    }

    Map<String, TypingUser> typing() {
        return typing;
    }
}
