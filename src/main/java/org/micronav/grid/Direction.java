package org.micronav.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * The eight moves of 8-connected grid navigation.
 *
 * <p>Declaration order is the neighbor scan order used by every planner stage, so it
 * also decides ties between equally good neighbors.</p>
 */
@Getter
@Accessors(fluent = true)
public enum Direction {
    NORTH(-1, 0),
    SOUTH(1, 0),
    WEST(0, -1),
    EAST(0, 1),
    NORTH_WEST(-1, -1),
    NORTH_EAST(-1, 1),
    SOUTH_WEST(1, -1),
    SOUTH_EAST(1, 1);

    public static final double DIAGONAL_STEP_COST = Math.sqrt(2.0d);
    public static final double AXIAL_STEP_COST = 1.0d;

    private final int dRow;
    private final int dColumn;

    Direction(int dRow, int dColumn) {
        this.dRow = dRow;
        this.dColumn = dColumn;
    }

    /**
     * Returns whether the move changes both row and column.
     */
    public boolean isDiagonal() {
        return dRow != 0 && dColumn != 0;
    }

    /**
     * Metric length of the move: 1 for axial moves, sqrt(2) for diagonal moves.
     */
    public double stepCost() {
        return isDiagonal() ? DIAGONAL_STEP_COST : AXIAL_STEP_COST;
    }

    /**
     * Metric length of a move between two adjacent positions.
     *
     * @throws IllegalArgumentException when the positions are not 8-connected neighbors.
     */
    public static double stepCost(Position from, Position to) {
        if (!from.isAdjacentTo(to)) {
            throw new IllegalArgumentException("positions are not adjacent: " + from + " -> " + to);
        }
        return from.row() != to.row() && from.column() != to.column() ? DIAGONAL_STEP_COST : AXIAL_STEP_COST;
    }
}
