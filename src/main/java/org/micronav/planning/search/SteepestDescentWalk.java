package org.micronav.planning.search;

import org.micronav.grid.Direction;
import org.micronav.grid.Position;
import org.micronav.planning.field.PotentialField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fallback path-extraction strategy: greedy descent on the potential field.
 *
 * <p>Each step moves to the in-bounds neighbor with the lowest finite potential (scan order
 * of {@link Direction}, first wins ties). The walk does not require the neighbor to be lower
 * than the current cell, which is what lets it oscillate on plateaus and local minima; the
 * recent-position window catches that. Halting rules:</p>
 * <ul>
 * <li>no finite neighbor: {@link PartialReason#DEAD_END};</li>
 * <li>after the warm-up steps, the chosen neighbor already occurs more than the repeat limit in
 * the window: {@link PartialReason#CYCLE};</li>
 * <li>{@code stepFactor * rows * columns} steps taken: {@link PartialReason#STEP_LIMIT}.</li>
 * </ul>
 */
public final class SteepestDescentWalk {
    private final int stepFactor;
    private final int cycleWindow;
    private final int cycleWarmupSteps;
    private final int cycleRepeatLimit;

    /**
     * @param stepFactor multiplier of the grid area bounding steps.
     * @param cycleWindow number of recent positions kept.
     * @param cycleWarmupSteps step index after which cycle checks start.
     * @param cycleRepeatLimit occurrences tolerated before a candidate is rejected as a cycle.
     */
    public SteepestDescentWalk(int stepFactor, int cycleWindow, int cycleWarmupSteps, int cycleRepeatLimit) {
        if (stepFactor <= 0 || cycleWindow <= 0 || cycleWarmupSteps < 0 || cycleRepeatLimit <= 0) {
            throw new IllegalArgumentException(
                    "invalid descent bounds: stepFactor=" + stepFactor + ", window=" + cycleWindow
                            + ", warmup=" + cycleWarmupSteps + ", repeatLimit=" + cycleRepeatLimit
            );
        }
        this.stepFactor = stepFactor;
        this.cycleWindow = cycleWindow;
        this.cycleWarmupSteps = cycleWarmupSteps;
        this.cycleRepeatLimit = cycleRepeatLimit;
    }

    /**
     * Walks from {@code start} toward {@code goal}.
     *
     * @return walked trajectory (always starts with {@code start}) and halt reason.
     */
    public Result walk(PotentialField field, Position start, Position goal) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");

        List<Position> waypoints = new ArrayList<>();
        waypoints.add(start);
        if (start.equals(goal)) {
            return new Result(waypoints, 0, PartialReason.NONE);
        }

        int rows = field.rows();
        int columns = field.columns();
        int goalIdx = field.indexOf(goal);
        int currentIdx = field.indexOf(start);
        PositionHistory history = new PositionHistory(cycleWindow);
        history.add(currentIdx);

        long stepLimit = (long) stepFactor * field.cellCount();
        for (long step = 0; step < stepLimit; step++) {
            int row = currentIdx / columns;
            int column = currentIdx % columns;
            int bestIdx = -1;
            double bestValue = PotentialField.IMPASSABLE;
            for (Direction direction : Direction.values()) {
                int nextRow = row + direction.dRow();
                int nextColumn = column + direction.dColumn();
                if (nextRow < 0 || nextRow >= rows || nextColumn < 0 || nextColumn >= columns) {
                    continue;
                }
                int nextIdx = field.indexOf(nextRow, nextColumn);
                double value = field.valueAt(nextIdx);
                if (value < bestValue) {
                    bestValue = value;
                    bestIdx = nextIdx;
                }
            }

            if (bestIdx < 0) {
                return new Result(waypoints, waypoints.size() - 1, PartialReason.DEAD_END);
            }
            if (step > cycleWarmupSteps && history.count(bestIdx) > cycleRepeatLimit) {
                return new Result(waypoints, waypoints.size() - 1, PartialReason.CYCLE);
            }

            waypoints.add(field.positionOf(bestIdx));
            history.add(bestIdx);
            currentIdx = bestIdx;
            if (currentIdx == goalIdx) {
                return new Result(waypoints, waypoints.size() - 1, PartialReason.NONE);
            }
        }
        return new Result(waypoints, waypoints.size() - 1, PartialReason.STEP_LIMIT);
    }

    /**
     * Outcome of one walk.
     *
     * @param path walked waypoints, starting at the start position.
     * @param steps number of moves taken.
     * @param haltReason {@link PartialReason#NONE} when the goal was reached.
     */
    public record Result(List<Position> path, int steps, PartialReason haltReason) {
        public boolean reachedGoal() {
            return haltReason == PartialReason.NONE;
        }
    }
}
