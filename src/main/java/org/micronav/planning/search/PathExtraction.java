package org.micronav.planning.search;

import lombok.Builder;
import lombok.Value;
import org.micronav.grid.Trajectory;

/**
 * Result of {@link PathExtractor#extractPath}.
 *
 * <p>When {@code outcome=PARTIAL} the trajectory is the fallback's walked prefix and
 * {@code partialReason} says why it stopped. {@code expandedNodes} always reports the A* work,
 * even when the fallback produced the trajectory.</p>
 */
@Value
@Builder
public class PathExtraction {
    /** Ordered waypoints, first one is the requested start. */
    Trajectory trajectory;
    /** Strategy that produced {@link #trajectory}. */
    ExtractionStrategy strategy;
    /** Whether the trajectory reaches the goal. */
    ExtractionOutcome outcome;
    /** Why A* handed over to the fallback ({@code NONE} when it did not). */
    FallbackTrigger fallbackTrigger;
    /** Why the fallback stopped short ({@code NONE} unless {@code outcome=PARTIAL}). */
    PartialReason partialReason;
    /** A* frontier pops. */
    int expandedNodes;
    /** Largest A* frontier observed. */
    int peakFrontierSize;
    /** Steps walked by the fallback (0 when it did not run). */
    int descentSteps;

    public boolean isSuccess() {
        return outcome == ExtractionOutcome.SUCCESS;
    }
}
