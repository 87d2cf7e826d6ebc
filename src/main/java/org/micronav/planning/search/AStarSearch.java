package org.micronav.planning.search;

import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.micronav.grid.Direction;
import org.micronav.grid.Position;
import org.micronav.planning.field.PotentialField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Primary path-extraction strategy: A* over the 8-connected grid of finite-potential cells.
 *
 * <p>Search contract:</p>
 * <ul>
 * <li>Edge cost is 1 for axial and sqrt(2) for diagonal moves.</li>
 * <li>Queue key is {@code g + field[cell]}: the field value itself is the estimate-to-goal.
 * Repulsion can push it above the true remaining cost, so the heuristic is not admissible and
 * the returned path is not guaranteed optimal.</li>
 * <li>Equal keys pop in insertion order (see {@link SearchQueue}).</li>
 * <li>A cell is (re-)queued only when a strictly smaller {@code g} is found.</li>
 * <li>At most {@code iterationFactor * rows * columns} pops; the search may be abandoned with a
 * non-empty frontier.</li>
 * </ul>
 * <p>Predecessors are kept in a cell-to-parent map and the path is rebuilt once at the goal,
 * so memory is proportional to the number of touched cells.</p>
 */
public final class AStarSearch {
    private static final int NO_PARENT = -1;

    private final int iterationFactor;

    /**
     * @param iterationFactor multiplier of the grid area bounding pops (&gt; 0).
     */
    public AStarSearch(int iterationFactor) {
        if (iterationFactor <= 0) {
            throw new IllegalArgumentException("iterationFactor must be positive, got " + iterationFactor);
        }
        this.iterationFactor = iterationFactor;
    }

    /**
     * Runs one search.
     *
     * @param field potential field (read-only).
     * @param start start position inside the field.
     * @param goal goal position inside the field.
     * @return path to the goal, or an empty path with the termination cause.
     */
    public Result search(PotentialField field, Position start, Position goal) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");

        int rows = field.rows();
        int columns = field.columns();
        int startIdx = field.indexOf(start);
        int goalIdx = field.indexOf(goal);
        long iterationLimit = (long) iterationFactor * field.cellCount();

        SearchQueue frontier = new SearchQueue(field.cellCount());
        Int2DoubleOpenHashMap bestCost = new Int2DoubleOpenHashMap();
        bestCost.defaultReturnValue(Double.POSITIVE_INFINITY);
        Int2IntOpenHashMap parent = new Int2IntOpenHashMap();
        parent.defaultReturnValue(NO_PARENT);

        bestCost.put(startIdx, 0.0d);
        frontier.insert(startIdx, field.valueAt(startIdx), 0.0d);

        long iterations = 0L;
        int expanded = 0;
        while (!frontier.isEmpty() && iterations < iterationLimit) {
            iterations++;
            FrontierEntry entry = frontier.extractMin();
            int cellIdx = entry.cellIndex;
            double g = entry.cost;
            expanded++;

            if (cellIdx == goalIdx) {
                return new Result(buildPath(field, parent, cellIdx), expanded, FallbackTrigger.NONE, frontier.getPeakSize());
            }

            int row = cellIdx / columns;
            int column = cellIdx % columns;
            for (Direction direction : Direction.values()) {
                int nextRow = row + direction.dRow();
                int nextColumn = column + direction.dColumn();
                if (nextRow < 0 || nextRow >= rows || nextColumn < 0 || nextColumn >= columns) {
                    continue;
                }
                int nextIdx = field.indexOf(nextRow, nextColumn);
                if (field.isImpassable(nextIdx)) {
                    continue;
                }
                double nextG = g + direction.stepCost();
                if (nextG < bestCost.get(nextIdx)) {
                    bestCost.put(nextIdx, nextG);
                    parent.put(nextIdx, cellIdx);
                    frontier.insert(nextIdx, nextG + field.valueAt(nextIdx), nextG);
                }
            }
        }

        FallbackTrigger cause = frontier.isEmpty()
                ? FallbackTrigger.FRONTIER_EXHAUSTED
                : FallbackTrigger.ITERATION_LIMIT;
        return new Result(List.of(), expanded, cause, frontier.getPeakSize());
    }

    private static List<Position> buildPath(PotentialField field, Int2IntOpenHashMap parent, int goalIdx) {
        IntArrayList reversed = new IntArrayList();
        int cursor = goalIdx;
        while (cursor != NO_PARENT) {
            reversed.add(cursor);
            cursor = parent.get(cursor);
        }
        List<Position> path = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            path.add(field.positionOf(reversed.getInt(i)));
        }
        return path;
    }

    /**
     * Outcome of one A* run.
     *
     * @param path waypoints from start to goal; empty when the goal was not reached.
     * @param expandedNodes number of popped frontier entries.
     * @param termination {@link FallbackTrigger#NONE} on success, otherwise why the search stopped.
     * @param peakFrontierSize largest frontier size observed.
     */
    public record Result(List<Position> path, int expandedNodes, FallbackTrigger termination, int peakFrontierSize) {
        public boolean reachedGoal() {
            return termination == FallbackTrigger.NONE;
        }
    }
}
