package org.micronav.planning.footprint;

import lombok.experimental.UtilityClass;
import org.micronav.grid.Cell;
import org.micronav.grid.Grid;
import org.micronav.grid.Position;
import org.micronav.planning.core.PlannerConfig;

import java.util.Objects;

/**
 * Robot-footprint geometry on occupancy grids.
 *
 * <p>{@link #inflate(Grid, int, int)} grows every obstacle by the robot's half-extents so the
 * planner can treat the robot as a point. {@link #collides(Grid, Position, int, int)} checks one
 * concrete placement and is independent of inflation.</p>
 */
@UtilityClass
public class FootprintInflator {

    /**
     * Returns a new grid whose obstacles are grown by the footprint margins.
     *
     * <p>Margins are {@code (height - 1) / 2} rows and {@code (width - 1) / 2} columns. Only
     * cells that are {@link Cell#FREE} are converted; start and goal tags survive even inside
     * an obstacle's margin. Margins are applied around obstacles of the input grid only, so
     * newly marked cells do not grow further. The input grid is left untouched.</p>
     *
     * @param grid source grid.
     * @param width footprint width in cells (&ge; 1).
     * @param height footprint height in cells (&ge; 1).
     * @return inflated grid (equal to {@code grid} for a 1x1 footprint).
     */
    public Grid inflate(Grid grid, int width, int height) {
        Objects.requireNonNull(grid, "grid");
        PlannerConfig.requireFootprint(width, height);

        int verticalMargin = (height - 1) / 2;
        int horizontalMargin = (width - 1) / 2;
        Cell[][] expanded = grid.toCellMatrix();
        if (verticalMargin == 0 && horizontalMargin == 0) {
            return Grid.of(expanded);
        }

        int rows = grid.rows();
        int columns = grid.columns();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                if (!grid.isObstacle(r, c)) {
                    continue;
                }
                int rowFrom = Math.max(0, r - verticalMargin);
                int rowTo = Math.min(rows - 1, r + verticalMargin);
                int colFrom = Math.max(0, c - horizontalMargin);
                int colTo = Math.min(columns - 1, c + horizontalMargin);
                for (int tr = rowFrom; tr <= rowTo; tr++) {
                    Cell[] targetRow = expanded[tr];
                    for (int tc = colFrom; tc <= colTo; tc++) {
                        if (targetRow[tc] == Cell.FREE) {
                            targetRow[tc] = Cell.OBSTACLE;
                        }
                    }
                }
            }
        }
        return Grid.of(expanded);
    }

    /**
     * Tests whether a robot centered on {@code center} overlaps an obstacle or the grid edge.
     *
     * <p>Half-extents are {@code height / 2} rows and {@code width / 2} columns on each side of
     * the center, so even dimensions check one extra row/column compared to inflation.</p>
     *
     * @param grid grid to test against (raw or inflated).
     * @param center robot reference cell.
     * @param width footprint width in cells (&ge; 1).
     * @param height footprint height in cells (&ge; 1).
     * @return {@code true} when any footprint cell is out of bounds or an obstacle.
     */
    public boolean collides(Grid grid, Position center, int width, int height) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(center, "center");
        PlannerConfig.requireFootprint(width, height);

        int halfHeight = height / 2;
        int halfWidth = width / 2;
        for (int dr = -halfHeight; dr <= halfHeight; dr++) {
            for (int dc = -halfWidth; dc <= halfWidth; dc++) {
                int r = center.row() + dr;
                int c = center.column() + dc;
                if (!grid.inBounds(r, c) || grid.isObstacle(r, c)) {
                    return true;
                }
            }
        }
        return false;
    }
}
