package org.micronav.planning.search;

/**
 * A* frontier entry. The cell is fixed; key, cost and stamp change on decrease-key.
 */
public class FrontierEntry implements Comparable<FrontierEntry> {

    /** Row-major index of the cell. */
    public final int cellIndex;

    /** Queue key: accumulated cost plus the cell's field value. */
    public double priority;

    /** Accumulated path cost from the start to this cell. */
    public double cost;

    /** Insertion stamp; lower stamps win key ties. */
    public long sequence;

    public FrontierEntry(int cellIndex, double priority, double cost, long sequence) {
        this.cellIndex = cellIndex;
        this.priority = priority;
        this.cost = cost;
        this.sequence = sequence;
    }

    void update(double priority, double cost, long sequence) {
        this.priority = priority;
        this.cost = cost;
        this.sequence = sequence;
    }

    /**
     * Orders by priority, then by insertion stamp (earlier first).
     */
    @Override
    public int compareTo(FrontierEntry other) {
        int byPriority = Double.compare(this.priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "FrontierEntry{" +
                "cell=" + cellIndex +
                ", priority=" + priority +
                ", cost=" + cost +
                ", seq=" + sequence +
                '}';
    }
}
