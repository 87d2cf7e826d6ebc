package org.micronav.app;

import org.micronav.planning.core.PlannerConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * One batch entry: a map file and the robot footprint to plan it with.
 *
 * @param name display name, the map file name without extension.
 * @param mapFile map file to load.
 * @param robotWidth footprint width in cells.
 * @param robotHeight footprint height in cells.
 */
public record Scenario(String name, Path mapFile, int robotWidth, int robotHeight) {

    public Scenario {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mapFile, "mapFile");
        PlannerConfig.requireFootprint(robotWidth, robotHeight);
    }

    /**
     * Parses {@code <map-file>} or {@code <map-file>@<width>x<height>}.
     *
     * @param argument command-line entry.
     * @param defaults footprint used when the entry names none.
     * @throws IllegalArgumentException when the footprint suffix is malformed.
     */
    public static Scenario parse(String argument, PlannerConfig defaults) {
        Objects.requireNonNull(argument, "argument");
        String file = argument;
        int width = defaults.getRobotWidth();
        int height = defaults.getRobotHeight();

        int at = argument.lastIndexOf('@');
        if (at >= 0) {
            file = argument.substring(0, at);
            String footprint = argument.substring(at + 1);
            int x = footprint.indexOf('x');
            if (x <= 0 || x == footprint.length() - 1) {
                throw new IllegalArgumentException("footprint must be <width>x<height>, got '" + footprint + "'");
            }
            try {
                width = Integer.parseInt(footprint.substring(0, x));
                height = Integer.parseInt(footprint.substring(x + 1));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("footprint must be <width>x<height>, got '" + footprint + "'", ex);
            }
        }
        if (file.isBlank()) {
            throw new IllegalArgumentException("missing map file in '" + argument + "'");
        }

        Path mapFile = Paths.get(file);
        String fileName = mapFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String name = dot > 0 ? fileName.substring(0, dot) : fileName;
        return new Scenario(name, mapFile, width, height);
    }
}
