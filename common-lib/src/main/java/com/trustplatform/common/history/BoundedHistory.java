package com.trustplatform.common.history;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * FIFO log with a fixed capacity. Appending to a full log evicts the oldest entry.
 *
 * <p>Not thread-safe; the owning {@link AgentLedger} is only touched while its
 * agent's lock is held.
 */
public final class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public void append(T entry) {
        entries.addLast(entry);
        if (entries.size() > capacity) entries.pollFirst();
    }

    /** Replaces the contents with the newest {@code capacity} items of {@code items}. */
    public void replaceWith(List<T> items) {
        entries.clear();
        int from = Math.max(0, items.size() - capacity);
        for (T item : items.subList(from, items.size())) {
            entries.addLast(item);
        }
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Oldest-first copy. */
    public List<T> snapshot() {
        return List.copyOf(entries);
    }

    /** Oldest-first copy of at most the newest {@code n} entries. */
    public List<T> latest(int n) {
        if (n <= 0) return List.of();
        List<T> all = new ArrayList<>(entries);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }
}
