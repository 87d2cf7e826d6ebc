package org.micronav.grid;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered waypoint sequence produced by path extraction.
 *
 * <p>Contract enforced at construction: at least one waypoint and every consecutive pair
 * 8-connected. A trajectory is complete for a goal when its last waypoint equals that goal;
 * otherwise it is partial.</p>
 */
public final class Trajectory implements Iterable<Position> {
    private final List<Position> waypoints;

    private Trajectory(List<Position> waypoints) {
        this.waypoints = waypoints;
    }

    /**
     * Creates a trajectory from waypoints. The list is copied.
     *
     * @throws IllegalArgumentException when empty or when two consecutive waypoints are not
     * 8-connected neighbors.
     */
    public static Trajectory of(List<Position> waypoints) {
        Objects.requireNonNull(waypoints, "waypoints");
        List<Position> copy = List.copyOf(waypoints);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("trajectory must contain at least one waypoint");
        }
        for (int i = 1; i < copy.size(); i++) {
            if (!copy.get(i - 1).isAdjacentTo(copy.get(i))) {
                throw new IllegalArgumentException(
                        "waypoints " + (i - 1) + " and " + i + " are not adjacent: "
                                + copy.get(i - 1) + " -> " + copy.get(i)
                );
            }
        }
        return new Trajectory(copy);
    }

    /**
     * Single-waypoint trajectory.
     */
    public static Trajectory singleton(Position position) {
        return new Trajectory(List.of(Objects.requireNonNull(position, "position")));
    }

    public List<Position> waypoints() {
        return waypoints;
    }

    public int size() {
        return waypoints.size();
    }

    public Position first() {
        return waypoints.get(0);
    }

    public Position last() {
        return waypoints.get(waypoints.size() - 1);
    }

    public Position get(int index) {
        return waypoints.get(index);
    }

    /**
     * Returns whether the trajectory ends on {@code goal}.
     */
    public boolean reaches(Position goal) {
        return last().equals(goal);
    }

    /**
     * Running metric length at each waypoint (first entry is {@code 0}).
     */
    public double[] cumulativeCosts() {
        double[] costs = new double[waypoints.size()];
        for (int i = 1; i < waypoints.size(); i++) {
            costs[i] = costs[i - 1] + Direction.stepCost(waypoints.get(i - 1), waypoints.get(i));
        }
        return costs;
    }

    /**
     * Total metric length: 1 per axial step, sqrt(2) per diagonal step.
     */
    public double cost() {
        double[] costs = cumulativeCosts();
        return costs[costs.length - 1];
    }

    @Override
    public Iterator<Position> iterator() {
        return waypoints.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trajectory other)) return false;
        return waypoints.equals(other.waypoints);
    }

    @Override
    public int hashCode() {
        return waypoints.hashCode();
    }

    @Override
    public String toString() {
        return "Trajectory" + waypoints;
    }
}
