package org.micronav.planning.search;

/**
 * Path extraction strategy that produced a result.
 */
public enum ExtractionStrategy {
    A_STAR,
    STEEPEST_DESCENT
}
