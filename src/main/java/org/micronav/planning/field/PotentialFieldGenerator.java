package org.micronav.planning.field;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.micronav.grid.Grid;
import org.micronav.grid.Position;
import org.micronav.planning.core.PlannerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Synthesizes an attractive + repulsive potential field over an (inflated) grid.
 *
 * <p>For each non-obstacle cell:</p>
 * <ul>
 * <li>attractive term: {@code attractiveGain * |cell - goal|};</li>
 * <li>repulsive term: with {@code d} the Euclidean distance to the nearest obstacle cell and
 * {@code rho} the influence radius, {@code repulsiveGain * (1/d - 1/rho)^2} when
 * {@code d <= rho}, otherwise exactly {@code 0} (hard cutoff).</li>
 * </ul>
 * <p>Obstacle cells are {@link PotentialField#IMPASSABLE}. The nearest-obstacle distance is
 * found by scanning every obstacle cell, which fixes the repulsion shape exactly at the cost
 * of {@code O(cells * obstacles)} work.</p>
 *
 * <p>A zero nearest-obstacle distance can only arise for a non-obstacle cell sharing an
 * obstacle's coordinate, which a valid grid rules out. The distance is still floored at
 * {@link PlannerConfig#getMinObstacleDistance()} before inversion so the field stays finite
 * on every non-obstacle cell.</p>
 */
public final class PotentialFieldGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PotentialFieldGenerator.class);

    private final double attractiveGain;
    private final double repulsiveGain;
    private final double obstacleInfluence;
    private final double minObstacleDistance;

    /**
     * Creates a generator bound to one configuration.
     *
     * @param config planner tunables (validated here).
     */
    public PotentialFieldGenerator(PlannerConfig config) {
        Objects.requireNonNull(config, "config").validate();
        this.attractiveGain = config.getAttractiveGain();
        this.repulsiveGain = config.getRepulsiveGain();
        this.obstacleInfluence = config.getObstacleInfluence();
        this.minObstacleDistance = config.getMinObstacleDistance();
    }

    /**
     * Computes the potential field for {@code grid} toward {@code goal}.
     *
     * @param grid inflated occupancy grid.
     * @param goal goal position (must lie inside the grid).
     * @return immutable field with the grid's extent.
     */
    public PotentialField computeField(Grid grid, Position goal) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(goal, "goal");
        if (!grid.inBounds(goal)) {
            throw new IllegalArgumentException(
                    "goal " + goal + " outside grid " + grid.rows() + "x" + grid.columns()
            );
        }

        int rows = grid.rows();
        int columns = grid.columns();
        IntArrayList obstacleRows = new IntArrayList(grid.obstacleCount());
        IntArrayList obstacleColumns = new IntArrayList(grid.obstacleCount());
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                if (grid.isObstacle(r, c)) {
                    obstacleRows.add(r);
                    obstacleColumns.add(c);
                }
            }
        }

        double[] values = new double[rows * columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                int index = r * columns + c;
                if (grid.isObstacle(r, c)) {
                    values[index] = PotentialField.IMPASSABLE;
                    continue;
                }
                double attractive = attractiveGain * Math.hypot(r - goal.row(), c - goal.column());
                double nearest = nearestObstacleDistance(r, c, obstacleRows, obstacleColumns);
                values[index] = attractive + repulsivePotential(nearest);
            }
        }

        LOGGER.debug("Computed {}x{} potential field toward {} ({} obstacle cells)",
                rows, columns, goal, obstacleRows.size());
        return new PotentialField(rows, columns, values);
    }

    /**
     * Repulsive term for a nearest-obstacle distance.
     *
     * <p>{@code +INF} (no obstacles) and anything beyond the influence radius give {@code 0}.
     * Distances below the configured floor are clamped to it.</p>
     */
    double repulsivePotential(double nearestObstacleDistance) {
        if (nearestObstacleDistance > obstacleInfluence) {
            return 0.0d;
        }
        double d = Math.max(nearestObstacleDistance, minObstacleDistance);
        double delta = 1.0d / d - 1.0d / obstacleInfluence;
        return repulsiveGain * delta * delta;
    }

    private static double nearestObstacleDistance(
            int row,
            int column,
            IntArrayList obstacleRows,
            IntArrayList obstacleColumns
    ) {
        double best = Double.POSITIVE_INFINITY;
        for (int i = 0; i < obstacleRows.size(); i++) {
            double distance = Math.hypot(row - obstacleRows.getInt(i), column - obstacleColumns.getInt(i));
            if (distance < best) {
                best = distance;
            }
        }
        return best;
    }
}
