package org.micronav.planning.core;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request planner tunables.
 *
 * <p>Threaded explicitly into every stage instead of living in process-wide constants,
 * so two requests with different gains or footprints can run side by side.</p>
 */
@Value
@Builder(toBuilder = true)
public class PlannerConfig {
    public static final String PROP_PREFIX = "micronav.planner.";
    public static final String PROP_ATTRACTIVE_GAIN = PROP_PREFIX + "attractiveGain";
    public static final String PROP_REPULSIVE_GAIN = PROP_PREFIX + "repulsiveGain";
    public static final String PROP_OBSTACLE_INFLUENCE = PROP_PREFIX + "obstacleInfluence";
    public static final String PROP_ROBOT_WIDTH = PROP_PREFIX + "robotWidth";
    public static final String PROP_ROBOT_HEIGHT = PROP_PREFIX + "robotHeight";
    public static final String PROP_SEARCH_ITERATION_FACTOR = PROP_PREFIX + "searchIterationFactor";
    public static final String PROP_DESCENT_STEP_FACTOR = PROP_PREFIX + "descentStepFactor";
    public static final String PROP_CYCLE_WINDOW = PROP_PREFIX + "cycleWindow";
    public static final String PROP_CYCLE_WARMUP_STEPS = PROP_PREFIX + "cycleWarmupSteps";
    public static final String PROP_CYCLE_REPEAT_LIMIT = PROP_PREFIX + "cycleRepeatLimit";
    public static final String PROP_MIN_OBSTACLE_DISTANCE = PROP_PREFIX + "minObstacleDistance";

    /** Goal attraction coefficient. */
    @Builder.Default
    double attractiveGain = 1.0d;

    /** Obstacle repulsion coefficient. */
    @Builder.Default
    double repulsiveGain = 50.0d;

    /** Repulsion radius in cells; beyond it the repulsive term is exactly zero. */
    @Builder.Default
    double obstacleInfluence = 3.0d;

    /** Robot footprint width in cells (horizontal). */
    @Builder.Default
    int robotWidth = 2;

    /** Robot footprint height in cells (vertical). */
    @Builder.Default
    int robotHeight = 2;

    /** A* expansion cap is {@code searchIterationFactor * rows * columns}. */
    @Builder.Default
    int searchIterationFactor = 4;

    /** Steepest-descent step cap is {@code descentStepFactor * rows * columns}. */
    @Builder.Default
    int descentStepFactor = 2;

    /** Number of recent positions kept for cycle detection. */
    @Builder.Default
    int cycleWindow = 20;

    /** Steps walked before cycle detection starts checking. */
    @Builder.Default
    int cycleWarmupSteps = 10;

    /** A candidate already seen more than this many times in the window halts the walk. */
    @Builder.Default
    int cycleRepeatLimit = 2;

    /**
     * Floor applied to the nearest-obstacle distance before it is inverted by the
     * repulsive term.
     */
    @Builder.Default
    double minObstacleDistance = 1.0e-3d;

    /**
     * Returns the built-in defaults.
     */
    public static PlannerConfig defaults() {
        return PlannerConfig.builder().build();
    }

    /**
     * Loads tunables from {@code micronav.planner.*} system properties.
     *
     * <p>Missing, blank or unparsable values fall back to the built-in default.</p>
     */
    public static PlannerConfig fromSystemProperties() {
        PlannerConfig d = defaults();
        return PlannerConfig.builder()
                .attractiveGain(readDouble(PROP_ATTRACTIVE_GAIN, d.attractiveGain))
                .repulsiveGain(readDouble(PROP_REPULSIVE_GAIN, d.repulsiveGain))
                .obstacleInfluence(readDouble(PROP_OBSTACLE_INFLUENCE, d.obstacleInfluence))
                .robotWidth(readInt(PROP_ROBOT_WIDTH, d.robotWidth))
                .robotHeight(readInt(PROP_ROBOT_HEIGHT, d.robotHeight))
                .searchIterationFactor(readInt(PROP_SEARCH_ITERATION_FACTOR, d.searchIterationFactor))
                .descentStepFactor(readInt(PROP_DESCENT_STEP_FACTOR, d.descentStepFactor))
                .cycleWindow(readInt(PROP_CYCLE_WINDOW, d.cycleWindow))
                .cycleWarmupSteps(readInt(PROP_CYCLE_WARMUP_STEPS, d.cycleWarmupSteps))
                .cycleRepeatLimit(readInt(PROP_CYCLE_REPEAT_LIMIT, d.cycleRepeatLimit))
                .minObstacleDistance(readDouble(PROP_MIN_OBSTACLE_DISTANCE, d.minObstacleDistance))
                .build();
    }

    /**
     * Validates all tunables.
     *
     * @return this instance for chaining.
     * @throws PlannerConfigurationException on the first invalid value.
     */
    public PlannerConfig validate() {
        if (!(attractiveGain > 0.0d) || !(repulsiveGain > 0.0d)) {
            throw new PlannerConfigurationException(
                    PlannerConfigurationException.REASON_NON_POSITIVE_GAIN,
                    "gains must be > 0, got attractive=" + attractiveGain + ", repulsive=" + repulsiveGain
            );
        }
        if (!(obstacleInfluence > 0.0d) || !Double.isFinite(obstacleInfluence)) {
            throw new PlannerConfigurationException(
                    PlannerConfigurationException.REASON_NON_POSITIVE_INFLUENCE,
                    "obstacleInfluence must be finite and > 0, got " + obstacleInfluence
            );
        }
        requireFootprint(robotWidth, robotHeight);
        if (searchIterationFactor <= 0 || descentStepFactor <= 0) {
            throw new PlannerConfigurationException(
                    PlannerConfigurationException.REASON_NON_POSITIVE_BUDGET,
                    "budget factors must be > 0, got search=" + searchIterationFactor
                            + ", descent=" + descentStepFactor
            );
        }
        if (cycleWindow <= 0 || cycleWarmupSteps < 0 || cycleRepeatLimit <= 0) {
            throw new PlannerConfigurationException(
                    PlannerConfigurationException.REASON_INVALID_CYCLE_WINDOW,
                    "cycle detection needs window > 0, warmup >= 0, repeat limit > 0; got "
                            + cycleWindow + "/" + cycleWarmupSteps + "/" + cycleRepeatLimit
            );
        }
        if (!(minObstacleDistance > 0.0d)) {
            throw new PlannerConfigurationException(
                    PlannerConfigurationException.REASON_NON_POSITIVE_MIN_DISTANCE,
                    "minObstacleDistance must be > 0, got " + minObstacleDistance
            );
        }
        return this;
    }

    /**
     * Validates footprint dimensions shared by inflation and collision checks.
     *
     * @throws PlannerConfigurationException when either dimension is below one cell.
     */
    public static void requireFootprint(int width, int height) {
        if (width < 1 || height < 1) {
            throw new PlannerConfigurationException(
                    PlannerConfigurationException.REASON_NON_POSITIVE_FOOTPRINT,
                    "footprint must be at least 1x1, got " + width + "x" + height
            );
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
