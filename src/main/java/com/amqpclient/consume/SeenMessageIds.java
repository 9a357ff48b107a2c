package com.amqpclient.consume;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message ids seen recently, oldest evicted first once the window is full.
 * Confined to the session thread.
 */
public class SeenMessageIds {

    private final int capacity;
    private final Map<String, Boolean> ids;

    public SeenMessageIds(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ids = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > SeenMessageIds.this.capacity;
            }
        };
    }

    public boolean contains(String messageId) {
        return ids.containsKey(messageId);
    }

    /**
     * Records {@code messageId}.
     *
     * @return false if it was already present
     */
    public boolean add(String messageId) {
        return ids.putIfAbsent(messageId, Boolean.TRUE) == null;
    }

    public int size() {
        return ids.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        ids.clear();
    }
}
