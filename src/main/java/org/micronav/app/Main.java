package org.micronav.app;

import org.micronav.export.WaypointExporter;
import org.micronav.grid.Grid;
import org.micronav.grid.GridLoader;
import org.micronav.grid.GridValidationException;
import org.micronav.planning.core.PlannerConfig;
import org.micronav.planning.core.PlannerConfigurationException;
import org.micronav.planning.core.PlanningReport;
import org.micronav.planning.core.TrajectoryPlanner;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point running one map file through the planning pipeline.
 *
 * <p>Usage:</p>
 * <ul>
 * <li>{@code Main <map-file> [output-csv]}: plan one map.</li>
 * <li>{@code Main --batch <map-file>[@WxH]...}: plan several maps, each with its own footprint.</li>
 * <li>{@code Main --list <map-file>[@WxH]...}: print the batch without running it.</li>
 * </ul>
 * <p>Tunables come from {@code micronav.planner.*} system properties.</p>
 */
public class Main {
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_PARTIAL = 1;
    static final int EXIT_USAGE = 2;
    static final String BATCH_FLAG = "--batch";
    static final String LIST_FLAG = "--list";

    /**
     * Launches the CLI and exits with the run's status code.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the CLI without exiting the JVM.
     *
     * @return {@code 0} on success, {@code 1} on a partial trajectory, {@code 2} on bad input.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length >= 1 && (BATCH_FLAG.equals(args[0]) || LIST_FLAG.equals(args[0]))) {
            return runBatch(args, out, err);
        }
        if (args.length < 1 || args.length > 2) {
            printUsage(err);
            return EXIT_USAGE;
        }

        PlanningReport report;
        try {
            Grid grid = GridLoader.load(Paths.get(args[0]));
            PlannerConfig config = PlannerConfig.fromSystemProperties();
            out.println("Start: " + grid.start() + ", Goal: " + grid.goal());
            out.println("Robot footprint: " + config.getRobotHeight() + " x " + config.getRobotWidth() + " cells");
            report = TrajectoryPlanner.builder().config(config).build().plan(grid);
        } catch (GridValidationException | PlannerConfigurationException | UncheckedIOException ex) {
            err.println("error: " + ex.getMessage());
            return EXIT_USAGE;
        }

        if (report.isSuccess()) {
            out.println("Trajectory computed: " + report.trajectory().size() + " waypoints");
        } else {
            out.println("Warning: trajectory terminated before reaching goal");
        }

        if (args.length == 2) {
            Path csv = Paths.get(args[1]);
            try {
                WaypointExporter.export(report.trajectory(), csv);
            } catch (UncheckedIOException ex) {
                err.println("error: " + ex.getMessage());
                return EXIT_USAGE;
            }
            out.println("Waypoints exported to " + csv);
        }

        out.println();
        out.println(report.getStatistics().summary());
        return report.isSuccess() ? EXIT_SUCCESS : EXIT_PARTIAL;
    }

    private static int runBatch(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 2) {
            printUsage(err);
            return EXIT_USAGE;
        }

        PlannerConfig config;
        List<Scenario> scenarios = new ArrayList<>();
        try {
            config = PlannerConfig.fromSystemProperties().validate();
            for (int i = 1; i < args.length; i++) {
                scenarios.add(Scenario.parse(args[i], config));
            }
        } catch (IllegalArgumentException | PlannerConfigurationException ex) {
            err.println("error: " + ex.getMessage());
            return EXIT_USAGE;
        }

        ScenarioRunner runner = new ScenarioRunner(config, out);
        if (LIST_FLAG.equals(args[0])) {
            runner.list(scenarios);
            return EXIT_SUCCESS;
        }
        List<ScenarioRunner.Result> results = runner.runAll(scenarios);
        boolean allSucceeded = results.stream().allMatch(ScenarioRunner.Result::isSuccess);
        return allSucceeded ? EXIT_SUCCESS : EXIT_PARTIAL;
    }

    private static void printUsage(PrintStream err) {
        err.println("usage: micro-navigator <map-file> [output-csv]");
        err.println("       micro-navigator --batch|--list <map-file>[@WxH]...");
    }
}
