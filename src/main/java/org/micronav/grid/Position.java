package org.micronav.grid;

/**
 * Integer grid coordinate {@code (row, column)}.
 *
 * <p>Equality is structural. Used as start, goal and waypoint identity.</p>
 *
 * @param row zero-based row index.
 * @param column zero-based column index.
 */
public record Position(int row, int column) {

    /**
     * Shorthand factory.
     */
    public static Position of(int row, int column) {
        return new Position(row, column);
    }

    /**
     * Returns the neighbor reached by one move in {@code direction}.
     */
    public Position step(Direction direction) {
        return new Position(row + direction.dRow(), column + direction.dColumn());
    }

    /**
     * Returns whether {@code other} is one of the eight cells around this one.
     */
    public boolean isAdjacentTo(Position other) {
        int dr = Math.abs(other.row - row);
        int dc = Math.abs(other.column - column);
        return dr <= 1 && dc <= 1 && (dr + dc) > 0;
    }

    /**
     * Straight-line distance in cell units.
     */
    public double distanceTo(Position other) {
        return Math.hypot(other.row - row, other.column - column);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
