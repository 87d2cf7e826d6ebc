package org.micronav.planning.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.NoSuchElementException;

/**
 * Indexed min-priority queue of grid cells for A* frontier management.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Decrease-Key:</strong> each cell occupies at most one heap slot; a better key for a
 * queued cell updates that slot in O(log n) via a position index.</li>
 * <li><strong>Deterministic Ties:</strong> every insert or decrease-key takes the next value of a
 * monotonically increasing sequence counter, and equal keys pop in sequence order (FIFO).</li>
 * </ul>
 * </p>
 * <p>One queue serves one search. Not thread-safe.</p>
 */
public class SearchQueue {
    // 1-based binary heap
    private final FrontierEntry[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // positions[cellIndex] = heap index, 0 when absent
    private final int[] positions;

    private long nextSequence = 0L;
    @Getter
    private int peakSize = 0;

    /**
     * Creates a queue able to hold every cell of a grid at once.
     *
     * @param cellCount number of addressable cells.
     * @throws IllegalArgumentException if cellCount is not positive.
     */
    public SearchQueue(int cellCount) {
        if (cellCount <= 0) {
            throw new IllegalArgumentException("cellCount must be positive");
        }
        this.heap = new FrontierEntry[cellCount + 1];
        this.positions = new int[cellCount];
    }

    /**
     * Queues a cell, or lowers its key when it is already queued with a worse one.
     *
     * @param cellIndex row-major cell index.
     * @param priority  queue key.
     * @param cost      accumulated path cost carried with the entry.
     * @return {@code true} when the queue changed.
     * @throws IllegalArgumentException if cellIndex is out of bounds.
     */
    public boolean insert(int cellIndex, double priority, double cost) {
        if (cellIndex < 0 || cellIndex >= positions.length) {
            throw new IllegalArgumentException("cellIndex " + cellIndex + " out of bounds (max: " + (positions.length - 1) + ")");
        }

        int existingIdx = positions[cellIndex];
        if (existingIdx > 0) {
            FrontierEntry existing = heap[existingIdx];
            if (priority < existing.priority) {
                existing.update(priority, cost, nextSequence++);
                swim(existingIdx);
                return true;
            }
            return false;
        }

        size++;
        heap[size] = new FrontierEntry(cellIndex, priority, cost, nextSequence++);
        positions[cellIndex] = size;
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
        return true;
    }

    /**
     * Removes and returns the entry with the smallest key.
     *
     * @throws NoSuchElementException if the queue is empty.
     */
    public FrontierEntry extractMin() {
        if (isEmpty()) {
            throw new NoSuchElementException("Queue is empty");
        }

        FrontierEntry min = heap[1];
        positions[min.cellIndex] = 0;
        if (size == 1) {
            heap[1] = null;
            size = 0;
            return min;
        }

        FrontierEntry last = heap[size];
        heap[size] = null;
        size--;
        heap[1] = last;
        positions[last.cellIndex] = 1;
        sink(1);
        return min;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        FrontierEntry a = heap[i];
        FrontierEntry b = heap[j];
        heap[i] = b;
        heap[j] = a;
        positions[a.cellIndex] = j;
        positions[b.cellIndex] = i;
    }
}
