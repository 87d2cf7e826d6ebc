package org.micronav.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable rectangular occupancy grid.
 *
 * <p>Cells are stored row-major in a flat array. Construction enforces the loader
 * contract up front so no planner stage has to re-check it:</p>
 * <ul>
 * <li>at least one row and one column, all rows of equal length;</li>
 * <li>no {@code null} cells;</li>
 * <li>exactly one {@link Cell#START} and exactly one {@link Cell#GOAL}.</li>
 * </ul>
 * <p>Planner stages never mutate a grid; derived grids (for example inflated ones) are
 * new instances built through {@link #of(Cell[][])}.</p>
 */
public final class Grid {
    @Getter
    @Accessors(fluent = true)
    private final int rows;
    @Getter
    @Accessors(fluent = true)
    private final int columns;
    private final Cell[] cells;
    private final Position start;
    private final Position goal;
    private final int obstacleCount;

    private Grid(int rows, int columns, Cell[] cells) {
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;

        Position foundStart = null;
        Position foundGoal = null;
        int obstacles = 0;
        for (int i = 0; i < cells.length; i++) {
            Cell cell = cells[i];
            switch (cell) {
                case START -> {
                    if (foundStart != null) {
                        throw new GridValidationException(
                                GridValidationException.REASON_DUPLICATE_START,
                                "second start cell at " + positionOf(i) + ", first at " + foundStart
                        );
                    }
                    foundStart = positionOf(i);
                }
                case GOAL -> {
                    if (foundGoal != null) {
                        throw new GridValidationException(
                                GridValidationException.REASON_DUPLICATE_GOAL,
                                "second goal cell at " + positionOf(i) + ", first at " + foundGoal
                        );
                    }
                    foundGoal = positionOf(i);
                }
                case OBSTACLE -> obstacles++;
                case FREE -> {
                }
            }
        }
        if (foundStart == null) {
            throw new GridValidationException(GridValidationException.REASON_MISSING_START, "grid has no start cell");
        }
        if (foundGoal == null) {
            throw new GridValidationException(GridValidationException.REASON_MISSING_GOAL, "grid has no goal cell");
        }
        this.start = foundStart;
        this.goal = foundGoal;
        this.obstacleCount = obstacles;
    }

    /**
     * Builds a validated grid from a row-major cell matrix. The matrix is copied.
     *
     * @param matrix cell matrix indexed {@code [row][column]}.
     * @return validated immutable grid.
     * @throws GridValidationException when the matrix violates the grid contract.
     */
    public static Grid of(Cell[][] matrix) {
        if (matrix == null || matrix.length == 0) {
            throw new GridValidationException(GridValidationException.REASON_EMPTY, "grid must have at least one row");
        }
        if (matrix[0] == null || matrix[0].length == 0) {
            throw new GridValidationException(GridValidationException.REASON_EMPTY, "grid must have at least one column");
        }
        int rows = matrix.length;
        int columns = matrix[0].length;
        Cell[] flat = new Cell[rows * columns];
        for (int r = 0; r < rows; r++) {
            Cell[] row = matrix[r];
            if (row == null || row.length != columns) {
                throw new GridValidationException(
                        GridValidationException.REASON_RAGGED_ROWS,
                        "row " + r + " has length " + (row == null ? 0 : row.length) + ", expected " + columns
                );
            }
            for (int c = 0; c < columns; c++) {
                if (row[c] == null) {
                    throw new GridValidationException(
                            GridValidationException.REASON_NULL_CELL,
                            "cell (" + r + ", " + c + ") is null"
                    );
                }
                flat[r * columns + c] = row[c];
            }
        }
        return new Grid(rows, columns, flat);
    }

    /**
     * Returns the unique start position.
     */
    public Position start() {
        return start;
    }

    /**
     * Returns the unique goal position.
     */
    public Position goal() {
        return goal;
    }

    /**
     * Returns the number of {@link Cell#OBSTACLE} cells.
     */
    public int obstacleCount() {
        return obstacleCount;
    }

    /**
     * Returns total cell count ({@code rows * columns}).
     */
    public int cellCount() {
        return cells.length;
    }

    public boolean inBounds(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    public boolean inBounds(Position position) {
        return inBounds(position.row(), position.column());
    }

    /**
     * Returns the cell at {@code (row, column)}.
     *
     * @throws IndexOutOfBoundsException when the coordinate is outside the grid.
     */
    public Cell cellAt(int row, int column) {
        if (!inBounds(row, column)) {
            throw new IndexOutOfBoundsException(
                    "(" + row + ", " + column + ") outside grid " + rows + "x" + columns
            );
        }
        return cells[row * columns + column];
    }

    public Cell cellAt(Position position) {
        return cellAt(position.row(), position.column());
    }

    public boolean isObstacle(int row, int column) {
        return cellAt(row, column) == Cell.OBSTACLE;
    }

    public boolean isObstacle(Position position) {
        return isObstacle(position.row(), position.column());
    }

    /**
     * Returns a fresh, caller-owned copy of the cells as a {@code [row][column]} matrix.
     */
    public Cell[][] toCellMatrix() {
        Cell[][] matrix = new Cell[rows][columns];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(cells, r * columns, matrix[r], 0, columns);
        }
        return matrix;
    }

    private Position positionOf(int index) {
        return new Position(index / columns, index % columns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid other)) return false;
        return rows == other.rows && columns == other.columns && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, columns, Arrays.hashCode(cells));
    }

    /**
     * Renders the grid using the symbolic cell aliases, one line per row.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(rows * (columns + 1));
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                sb.append(cells[r * columns + c].symbol());
            }
            if (r < rows - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
