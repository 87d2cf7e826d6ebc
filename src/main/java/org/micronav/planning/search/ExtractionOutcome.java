package org.micronav.planning.search;

/**
 * Terminal state of one extraction.
 *
 * <p>{@code SUCCESS}: the trajectory ends on the goal. {@code PARTIAL}: both strategies
 * stopped short and the trajectory is the best prefix the fallback walked.</p>
 */
public enum ExtractionOutcome {
    SUCCESS,
    PARTIAL
}
