package org.micronav.planning.search;

/**
 * Fixed-capacity ring buffer of recently visited cell indices.
 *
 * <p>Appending is O(1) and overwrites the oldest entry once full; occurrence counting is a
 * linear scan over at most {@code capacity} slots. Memory never grows past the capacity.</p>
 */
final class PositionHistory {
    private final int[] slots;
    private int head = 0;
    private int size = 0;

    PositionHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.slots = new int[capacity];
    }

    /**
     * Appends a cell, evicting the oldest one when full.
     */
    void add(int cellIndex) {
        slots[head] = cellIndex;
        head = (head + 1) % slots.length;
        if (size < slots.length) {
            size++;
        }
    }

    /**
     * Number of times {@code cellIndex} occurs in the window.
     */
    int count(int cellIndex) {
        int hits = 0;
        for (int i = 0; i < size; i++) {
            if (slots[i] == cellIndex) {
                hits++;
            }
        }
        return hits;
    }

    int size() {
        return size;
    }

    int capacity() {
        return slots.length;
    }
}
