package org.micronav.planning.core;

import lombok.Builder;
import lombok.Value;
import org.micronav.grid.Grid;
import org.micronav.grid.Trajectory;
import org.micronav.planning.field.PotentialField;
import org.micronav.planning.search.PathExtraction;
import org.micronav.stats.PlanningStatistics;

/**
 * Everything one planning request produced, stage by stage.
 *
 * <p>The raw grid is the caller's instance; the inflated grid and field are new objects owned
 * by this report.</p>
 */
@Value
@Builder
public class PlanningReport {
    Grid grid;
    Grid inflatedGrid;
    PotentialField field;
    PathExtraction extraction;
    PlanningStatistics statistics;

    public Trajectory trajectory() {
        return extraction.getTrajectory();
    }

    public boolean isSuccess() {
        return extraction.isSuccess();
    }
}
