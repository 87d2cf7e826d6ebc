package org.micronav.app;

import org.micronav.grid.Grid;
import org.micronav.grid.GridLoader;
import org.micronav.grid.GridValidationException;
import org.micronav.planning.core.PlannerConfig;
import org.micronav.planning.core.PlannerConfigurationException;
import org.micronav.planning.core.PlanningReport;
import org.micronav.planning.core.TrajectoryPlanner;
import org.micronav.stats.PlanningStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Runs several map files through the planner in one invocation.
 *
 * <p>Each scenario gets its own footprint on top of the shared tunables. A scenario that fails
 * to load or plan is recorded and the batch moves on.</p>
 */
public final class ScenarioRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScenarioRunner.class);
    private static final String RULE = "=".repeat(60);

    private final PlannerConfig baseConfig;
    private final PrintStream out;

    public ScenarioRunner(PlannerConfig baseConfig, PrintStream out) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Outcome of one scenario.
     *
     * @param scenario the scenario that ran.
     * @param statistics planning statistics, {@code null} when the scenario errored.
     * @param error load or configuration failure message, {@code null} when planning ran.
     */
    public record Result(Scenario scenario, PlanningStatistics statistics, String error) {
        public boolean isSuccess() {
            return statistics != null && statistics.isSuccess();
        }
    }

    /**
     * Prints the scenarios without running them.
     */
    public void list(List<Scenario> scenarios) {
        out.println(RULE);
        out.println(" Available scenarios");
        out.println(RULE);
        int index = 1;
        for (Scenario s : scenarios) {
            out.printf(Locale.ROOT, "  %d. %-20s %s (robot %dx%d)%n",
                    index++, s.name(), s.mapFile(), s.robotHeight(), s.robotWidth());
        }
    }

    /**
     * Runs every scenario in order and prints the execution summary when more than one ran.
     */
    public List<Result> runAll(List<Scenario> scenarios) {
        List<Result> results = new ArrayList<>(scenarios.size());
        int index = 1;
        for (Scenario scenario : scenarios) {
            results.add(run(index++, scenario));
        }
        if (results.size() > 1) {
            out.println();
            out.println(summary(results));
        }
        return results;
    }

    Result run(int index, Scenario scenario) {
        out.println();
        out.println(RULE);
        out.println(" Scenario " + index + ": " + scenario.name());
        out.println(RULE);
        out.println("Map file: " + scenario.mapFile());
        out.println("Robot size: " + scenario.robotHeight() + "x" + scenario.robotWidth() + " cells");

        PlanningReport report;
        try {
            Grid grid = GridLoader.load(scenario.mapFile());
            out.println("Start: " + grid.start() + ", Goal: " + grid.goal());
            PlannerConfig config = baseConfig.toBuilder()
                    .robotWidth(scenario.robotWidth())
                    .robotHeight(scenario.robotHeight())
                    .build();
            report = TrajectoryPlanner.builder().config(config).build().plan(grid);
        } catch (GridValidationException | PlannerConfigurationException | UncheckedIOException ex) {
            LOGGER.warn("Scenario {} ({}) failed: {}", index, scenario.name(), ex.getMessage());
            out.println("Error running scenario: " + ex.getMessage());
            return new Result(scenario, null, ex.getMessage());
        }

        if (report.isSuccess()) {
            out.println("Path found: " + report.trajectory().size() + " waypoints");
        } else {
            out.println("Failed to reach goal");
        }
        out.println();
        out.println(report.getStatistics().summary());
        return new Result(scenario, report.getStatistics(), null);
    }

    /**
     * Renders the execution summary block.
     */
    public static String summary(List<Result> results) {
        int total = results.size();
        int successful = (int) results.stream().filter(Result::isSuccess).count();
        double rate = total == 0 ? 0.0d : successful * 100.0d / total;

        StringBuilder sb = new StringBuilder();
        sb.append("=== Execution Summary ===\n");
        sb.append(String.format(Locale.ROOT, "Scenarios run:     %d%n", total));
        sb.append(String.format(Locale.ROOT, "Successful:        %d%n", successful));
        sb.append(String.format(Locale.ROOT, "Failed:            %d%n", total - successful));
        sb.append(String.format(Locale.ROOT, "Success rate:      %.1f%%%n", rate));
        sb.append("Detailed results:");
        int index = 1;
        for (Result r : results) {
            String detail;
            if (r.isSuccess()) {
                detail = "(" + r.statistics().getWaypointCount() + " waypoints)";
            } else if (r.error() != null) {
                detail = "(error)";
            } else {
                detail = "(failed)";
            }
            sb.append(String.format(Locale.ROOT, "%n  [%s] Scenario %d: %-20s %s",
                    r.isSuccess() ? "OK" : "FAIL", index++, r.scenario().name(), detail));
        }
        return sb.toString();
    }
}
