package org.micronav.planning.field;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.micronav.grid.Position;

import java.util.Objects;

/**
 * Immutable scalar cost surface over a grid.
 *
 * <p>Values are stored row-major. {@link #IMPASSABLE} ({@code +INF}) marks obstacle cells;
 * every other cell holds a finite, non-negative value.</p>
 */
public final class PotentialField {
    public static final double IMPASSABLE = Double.POSITIVE_INFINITY;

    @Getter
    @Accessors(fluent = true)
    private final int rows;
    @Getter
    @Accessors(fluent = true)
    private final int columns;
    private final double[] values;

    /**
     * Wraps a row-major value array. The array is copied.
     *
     * @param rows row count (&ge; 1).
     * @param columns column count (&ge; 1).
     * @param values row-major values of length {@code rows * columns}.
     */
    public PotentialField(int rows, int columns, double[] values) {
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("field dimensions must be >= 1, got " + rows + "x" + columns);
        }
        Objects.requireNonNull(values, "values");
        if (values.length != rows * columns) {
            throw new IllegalArgumentException(
                    "values length " + values.length + " does not match " + rows + "x" + columns
            );
        }
        for (double v : values) {
            if (Double.isNaN(v) || v < 0.0d) {
                throw new IllegalArgumentException("field values must be non-negative, got " + v);
            }
        }
        this.rows = rows;
        this.columns = columns;
        this.values = values.clone();
    }

    /**
     * Builds a field from a {@code [row][column]} matrix, mainly for tests and tooling.
     */
    public static PotentialField fromMatrix(double[][] matrix) {
        Objects.requireNonNull(matrix, "matrix");
        if (matrix.length == 0 || matrix[0].length == 0) {
            throw new IllegalArgumentException("matrix must be non-empty");
        }
        int rows = matrix.length;
        int columns = matrix[0].length;
        double[] flat = new double[rows * columns];
        for (int r = 0; r < rows; r++) {
            if (matrix[r].length != columns) {
                throw new IllegalArgumentException("row " + r + " has length " + matrix[r].length + ", expected " + columns);
            }
            System.arraycopy(matrix[r], 0, flat, r * columns, columns);
        }
        return new PotentialField(rows, columns, flat);
    }

    public int cellCount() {
        return values.length;
    }

    public boolean inBounds(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    public boolean inBounds(Position position) {
        return inBounds(position.row(), position.column());
    }

    /**
     * Row-major index of {@code (row, column)}. No bounds check.
     */
    public int indexOf(int row, int column) {
        return row * columns + column;
    }

    public int indexOf(Position position) {
        return indexOf(position.row(), position.column());
    }

    public Position positionOf(int index) {
        return new Position(index / columns, index % columns);
    }

    /**
     * Field value at a row-major index.
     */
    public double valueAt(int index) {
        return values[index];
    }

    /**
     * Field value at {@code (row, column)}.
     *
     * @throws IndexOutOfBoundsException when the coordinate is outside the field.
     */
    public double valueAt(int row, int column) {
        if (!inBounds(row, column)) {
            throw new IndexOutOfBoundsException(
                    "(" + row + ", " + column + ") outside field " + rows + "x" + columns
            );
        }
        return values[indexOf(row, column)];
    }

    public double valueAt(Position position) {
        return valueAt(position.row(), position.column());
    }

    public boolean isImpassable(int index) {
        return values[index] == IMPASSABLE;
    }

    public boolean isImpassable(Position position) {
        return valueAt(position) == IMPASSABLE;
    }

    /**
     * Returns a fresh {@code [row][column]} copy of the values.
     */
    public double[][] toMatrix() {
        double[][] matrix = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(values, r * columns, matrix[r], 0, columns);
        }
        return matrix;
    }
}
