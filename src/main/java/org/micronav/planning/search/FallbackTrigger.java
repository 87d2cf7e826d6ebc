package org.micronav.planning.search;

/**
 * Why the A* search handed over to the steepest-descent fallback.
 */
public enum FallbackTrigger {
    /** A* reached the goal; no fallback ran. */
    NONE,
    /** Every reachable finite-potential cell was expanded without touching the goal. */
    FRONTIER_EXHAUSTED,
    /** The expansion cap was hit while the frontier was still non-empty. */
    ITERATION_LIMIT
}
