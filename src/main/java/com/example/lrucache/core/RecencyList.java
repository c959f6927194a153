package com.example.lrucache.core;

import java.util.Arrays;

/**
 * Recency-ordered sequence of entries kept in a fixed slot arena.
 *
 * <p>Slots are linked through the {@code prev}/{@code next} arrays. The head slot holds the most
 * recently used entry and the tail slot the least recently used one. Slots not in the sequence
 * are chained through {@code next} as a free list, so a slot is always either linked or free.
 *
 * <p>Not thread-safe: every method must be called with the owning {@link LruCache} lock held.
 */
final class RecencyList<K, V> {

    static final int NIL = -1;

    private final Object[] keys;
    private final Object[] values;
    private final int[] prev;
    private final int[] next;

    private int head = NIL;
    private int tail = NIL;
    private int freeHead = NIL;
    private int linked;

    RecencyList(int capacity) {
        this.keys = new Object[capacity];
        this.values = new Object[capacity];
        this.prev = new int[capacity];
        this.next = new int[capacity];
        resetFreeList();
    }

    int linkedCount() {
        return linked;
    }

    boolean hasFreeSlot() {
        return freeHead != NIL;
    }

    int head() {
        return head;
    }

    int tail() {
        return tail;
    }

    int next(int slot) {
        return next[slot];
    }

    int prev(int slot) {
        return prev[slot];
    }

    int freeHead() {
        return freeHead;
    }

    K key(int slot) {
        return cast(keys[slot]);
    }

    V value(int slot) {
        return cast(values[slot]);
    }

    void setValue(int slot, V value) {
        values[slot] = value;
    }

    /**
     * Takes a slot off the free list, stores the entry in it and links it at the head.
     *
     * @return the slot now holding the entry
     * @throws IllegalStateException if every slot is in use
     */
    int addFirst(K key, V value) {
        int slot = freeHead;
        if (slot == NIL) {
            throw new IllegalStateException("No free slot, capacity " + keys.length);
        }
        freeHead = next[slot];

        keys[slot] = key;
        values[slot] = value;
        linkAtHead(slot);
        linked++;
        return slot;
    }

    void moveToFront(int slot) {
        if (slot == head) {
            return;
        }
        unlink(slot);
        linkAtHead(slot);
    }

    /**
     * Unlinks the slot, drops its key and value and pushes it on the free list.
     */
    void release(int slot) {
        unlink(slot);
        keys[slot] = null;
        values[slot] = null;
        next[slot] = freeHead;
        freeHead = slot;
        linked--;
    }

    void clear() {
        Arrays.fill(keys, null);
        Arrays.fill(values, null);
        head = NIL;
        tail = NIL;
        linked = 0;
        resetFreeList();
    }

    // --- link helpers ---

    private void linkAtHead(int slot) {
        prev[slot] = NIL;
        next[slot] = head;
        if (head != NIL) {
            prev[head] = slot;
        } else {
            tail = slot; // first entry
        }
        head = slot;
    }

    private void unlink(int slot) {
        int p = prev[slot];
        int n = next[slot];

        if (p != NIL) {
            next[p] = n;
        } else {
            head = n;
        }

        if (n != NIL) {
            prev[n] = p;
        } else {
            tail = p;
        }

        prev[slot] = NIL;
        next[slot] = NIL;
    }

    // slots only ever hold what addFirst/setValue stored
    @SuppressWarnings("unchecked")
    private static <T> T cast(Object o) {
        return (T) o;
    }

    private void resetFreeList() {
        for (int i = 0; i < keys.length; i++) {
            prev[i] = NIL;
            next[i] = i + 1 < keys.length ? i + 1 : NIL;
        }
        freeHead = keys.length > 0 ? 0 : NIL;
    }
}
