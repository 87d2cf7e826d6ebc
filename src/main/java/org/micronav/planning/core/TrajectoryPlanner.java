package org.micronav.planning.core;

import lombok.Builder;
import lombok.Getter;
import org.micronav.grid.Grid;
import org.micronav.planning.field.PotentialField;
import org.micronav.planning.field.PotentialFieldGenerator;
import org.micronav.planning.footprint.FootprintInflator;
import org.micronav.planning.search.PathExtraction;
import org.micronav.planning.search.PathExtractor;
import org.micronav.stats.PlanningStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Planning pipeline entry point.
 *
 * <p>Execution flow for one grid:</p>
 * <ul>
 * <li>Inflate obstacles by the configured robot footprint.</li>
 * <li>Synthesize the potential field toward the grid's goal.</li>
 * <li>Extract a trajectory from the grid's start (A*, then steepest descent if needed).</li>
 * <li>Package stage outputs and statistics into a {@link PlanningReport}.</li>
 * </ul>
 * <p>Each stage fully consumes its input before the next starts and nothing is cached
 * between calls, so one planner can serve independent requests from several threads.</p>
 */
public final class TrajectoryPlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrajectoryPlanner.class);

    @Getter
    private final PlannerConfig config;
    private final PotentialFieldGenerator fieldGenerator;
    private final PathExtractor pathExtractor;

    /**
     * Creates a planner.
     *
     * @param config planner tunables; {@link PlannerConfig#defaults()} when {@code null}.
     */
    @Builder
    public TrajectoryPlanner(PlannerConfig config) {
        this.config = (config == null ? PlannerConfig.defaults() : config).validate();
        this.fieldGenerator = new PotentialFieldGenerator(this.config);
        this.pathExtractor = new PathExtractor(this.config);
    }

    /**
     * Plans a trajectory from the grid's start cell to its goal cell.
     *
     * @param grid validated occupancy grid (not modified).
     * @return stage outputs and statistics.
     */
    public PlanningReport plan(Grid grid) {
        Objects.requireNonNull(grid, "grid");
        int width = config.getRobotWidth();
        int height = config.getRobotHeight();

        LOGGER.debug("Inflating {} obstacle cells for {}x{} footprint", grid.obstacleCount(), height, width);
        Grid inflated = FootprintInflator.inflate(grid, width, height);

        long startedAt = System.nanoTime();
        PotentialField field = fieldGenerator.computeField(inflated, grid.goal());
        PathExtraction extraction = pathExtractor.extractPath(field, grid.start(), grid.goal());
        long elapsed = System.nanoTime() - startedAt;

        PlanningStatistics statistics = PlanningStatistics.builder()
                .gridRows(grid.rows())
                .gridColumns(grid.columns())
                .rawObstacleCount(grid.obstacleCount())
                .inflatedObstacleCount(inflated.obstacleCount())
                .robotWidth(width)
                .robotHeight(height)
                .elapsedNanos(elapsed)
                .nodesExplored(extraction.getExpandedNodes())
                .peakFrontierSize(extraction.getPeakFrontierSize())
                .descentSteps(extraction.getDescentSteps())
                .waypointCount(extraction.getTrajectory().size())
                .pathLength(extraction.getTrajectory().cost())
                .success(extraction.isSuccess())
                .strategy(extraction.getStrategy())
                .failureReason(extraction.isSuccess() ? null : "goal not reached: " + extraction.getPartialReason().code())
                .build();

        if (extraction.isSuccess()) {
            LOGGER.info("Planned {} waypoints from {} to {} via {}",
                    statistics.getWaypointCount(), grid.start(), grid.goal(), extraction.getStrategy());
        } else {
            LOGGER.warn("Trajectory from {} stopped at {} before reaching {} ({})",
                    grid.start(), extraction.getTrajectory().last(), grid.goal(),
                    extraction.getPartialReason().code());
        }

        return PlanningReport.builder()
                .grid(grid)
                .inflatedGrid(inflated)
                .field(field)
                .extraction(extraction)
                .statistics(statistics)
                .build();
    }
}
