package me.tavon.omnidock.stream.chat;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Messages in arrival order, never more than the capacity. Not thread-safe; the aggregator guards it.
 */
class ChatLog {

    private final ArrayDeque<ChatMessage> messages = new ArrayDeque<>();
    private int capacity;

    ChatLog(int capacity) {
        this.capacity = capacity;
    }

    /**
     * @return how many of the oldest messages were dropped to make room
     */
    int append(ChatMessage message) {
        messages.addLast(message);
        return trim();
    }

    int setCapacity(int capacity) {
        this.capacity = capacity;
        return trim();
    }

    int size() {
        return messages.size();
    }

    List<ChatMessage> newest(int count) {
        List<ChatMessage> copy = new ArrayList<>(messages);
        int from = Math.max(0, copy.size() - count);
        return copy.subList(from, copy.size());
    }

    private int trim() {
        int dropped = 0;

        while (messages.size() > capacity) {
            messages.removeFirst();
            dropped++;
        }

        return dropped;
    }
}
