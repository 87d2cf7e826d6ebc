package org.micronav.planning.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Why the steepest-descent walk stopped before the goal.
 */
@Getter
@Accessors(fluent = true)
public enum PartialReason {
    NONE("none"),
    /** No in-bounds neighbor with a finite potential. */
    DEAD_END("dead_end"),
    /** The chosen neighbor already repeats too often in the recent-position window. */
    CYCLE("cycle"),
    /** The step cap was exhausted. */
    STEP_LIMIT("step_limit");

    private final String code;

    PartialReason(String code) {
        this.code = code;
    }
}
