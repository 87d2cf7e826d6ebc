package org.micronav.planning.search;

import org.micronav.grid.Position;
import org.micronav.grid.Trajectory;
import org.micronav.planning.core.PlannerConfig;
import org.micronav.planning.field.PotentialField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Two-tier path extraction over a potential field.
 *
 * <p>State machine:</p>
 * <ul>
 * <li>{@code SearchPrimary -> Success} when {@link AStarSearch} pops the goal.</li>
 * <li>{@code SearchPrimary -> Fallback} when A* exhausts its frontier or expansion cap.</li>
 * <li>{@code Fallback -> Success | Partial} depending on how {@link SteepestDescentWalk} halts.</li>
 * </ul>
 * <p>Neither outcome is reported through an exception; both strategies only read the field,
 * and nothing is shared between the two attempts.</p>
 */
public final class PathExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathExtractor.class);

    private final AStarSearch primary;
    private final SteepestDescentWalk fallback;

    /**
     * Creates an extractor with budgets and cycle-detection bounds from {@code config}.
     */
    public PathExtractor(PlannerConfig config) {
        Objects.requireNonNull(config, "config").validate();
        this.primary = new AStarSearch(config.getSearchIterationFactor());
        this.fallback = new SteepestDescentWalk(
                config.getDescentStepFactor(),
                config.getCycleWindow(),
                config.getCycleWarmupSteps(),
                config.getCycleRepeatLimit()
        );
    }

    /**
     * Extracts a trajectory from {@code start} to {@code goal}.
     *
     * @param field potential field.
     * @param start start position (inside the field).
     * @param goal goal position (inside the field).
     * @return trajectory with strategy, outcome and work counters.
     * @throws IllegalArgumentException when start or goal lies outside the field.
     */
    public PathExtraction extractPath(PotentialField field, Position start, Position goal) {
        Objects.requireNonNull(field, "field");
        requireInside(field, start, "start");
        requireInside(field, goal, "goal");

        AStarSearch.Result searched = primary.search(field, start, goal);
        if (searched.reachedGoal()) {
            LOGGER.debug("A* reached {} from {} in {} expansions ({} waypoints)",
                    goal, start, searched.expandedNodes(), searched.path().size());
            return PathExtraction.builder()
                    .trajectory(Trajectory.of(searched.path()))
                    .strategy(ExtractionStrategy.A_STAR)
                    .outcome(ExtractionOutcome.SUCCESS)
                    .fallbackTrigger(FallbackTrigger.NONE)
                    .partialReason(PartialReason.NONE)
                    .expandedNodes(searched.expandedNodes())
                    .peakFrontierSize(searched.peakFrontierSize())
                    .descentSteps(0)
                    .build();
        }

        LOGGER.info("A* stopped without reaching {} ({}, {} expansions); falling back to steepest descent",
                goal, searched.termination(), searched.expandedNodes());
        SteepestDescentWalk.Result walked = fallback.walk(field, start, goal);
        ExtractionOutcome outcome = walked.reachedGoal() ? ExtractionOutcome.SUCCESS : ExtractionOutcome.PARTIAL;
        if (outcome == ExtractionOutcome.PARTIAL) {
            LOGGER.warn("Steepest descent halted at {} after {} steps: {}",
                    walked.path().get(walked.path().size() - 1), walked.steps(), walked.haltReason().code());
        }
        return PathExtraction.builder()
                .trajectory(Trajectory.of(walked.path()))
                .strategy(ExtractionStrategy.STEEPEST_DESCENT)
                .outcome(outcome)
                .fallbackTrigger(searched.termination())
                .partialReason(walked.haltReason())
                .expandedNodes(searched.expandedNodes())
                .peakFrontierSize(searched.peakFrontierSize())
                .descentSteps(walked.steps())
                .build();
    }

    private static void requireInside(PotentialField field, Position position, String name) {
        Objects.requireNonNull(position, name);
        if (!field.inBounds(position)) {
            throw new IllegalArgumentException(
                    name + " " + position + " outside field " + field.rows() + "x" + field.columns()
            );
        }
    }
}
