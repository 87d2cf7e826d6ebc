package org.micronav.stats;

import lombok.Builder;
import lombok.Value;
import org.micronav.planning.search.ExtractionStrategy;

import java.util.Locale;

/**
 * Per-request planning telemetry snapshot.
 *
 * <p>Covers map size and occupancy, footprint, timing of the field + extraction phase and the
 * search work counters. {@link #summary()} renders a fixed human-readable block.</p>
 */
@Value
@Builder
public class PlanningStatistics {
    int gridRows;
    int gridColumns;
    /** Obstacle cells in the grid as loaded. */
    int rawObstacleCount;
    /** Obstacle cells after footprint inflation. */
    int inflatedObstacleCount;
    int robotWidth;
    int robotHeight;
    /** Wall time of field synthesis plus path extraction. */
    long elapsedNanos;
    /** A* frontier pops. */
    int nodesExplored;
    /** Largest A* frontier observed. */
    int peakFrontierSize;
    /** Steepest-descent steps (0 when the fallback did not run). */
    int descentSteps;
    int waypointCount;
    /** Metric length of the trajectory in cells. */
    double pathLength;
    boolean success;
    ExtractionStrategy strategy;
    /** Short failure description, {@code null} on success. */
    String failureReason;

    /**
     * Fraction of raw cells that are obstacles, in {@code [0, 1]}.
     */
    public double obstacleDensity() {
        int cells = gridRows * gridColumns;
        return cells == 0 ? 0.0d : (double) rawObstacleCount / cells;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0d;
    }

    /**
     * Multi-line report for console output.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Planning Statistics ===\n");
        sb.append(String.format(Locale.ROOT, "Grid:              %d x %d (%d cells)%n",
                gridRows, gridColumns, gridRows * gridColumns));
        sb.append(String.format(Locale.ROOT, "Obstacles:         %d raw, %d inflated (density %.1f%%)%n",
                rawObstacleCount, inflatedObstacleCount, obstacleDensity() * 100.0d));
        sb.append(String.format(Locale.ROOT, "Robot footprint:   %d x %d cells%n", robotHeight, robotWidth));
        sb.append(String.format(Locale.ROOT, "Planning time:     %.3f ms%n", elapsedMillis()));
        sb.append(String.format(Locale.ROOT, "Nodes explored:    %d%n", nodesExplored));
        sb.append(String.format(Locale.ROOT, "Peak frontier:     %d%n", peakFrontierSize));
        if (descentSteps > 0) {
            sb.append(String.format(Locale.ROOT, "Descent steps:     %d%n", descentSteps));
        }
        sb.append(String.format(Locale.ROOT, "Strategy:          %s%n", strategy));
        sb.append(String.format(Locale.ROOT, "Waypoints:         %d%n", waypointCount));
        sb.append(String.format(Locale.ROOT, "Path length:       %.3f cells%n", pathLength));
        sb.append("Result:            ").append(success ? "SUCCESS" : "FAILED (" + failureReason + ")");
        return sb.toString();
    }
}
