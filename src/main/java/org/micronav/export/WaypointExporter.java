package org.micronav.export;

import lombok.experimental.UtilityClass;
import org.micronav.grid.Position;
import org.micronav.grid.Trajectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes trajectories as CSV waypoint lists for a robot controller.
 *
 * <p>Format: header {@code step,row,col}, then one line per waypoint in travel order.</p>
 */
@UtilityClass
public class WaypointExporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(WaypointExporter.class);
    public static final String HEADER = "step,row,col";

    /**
     * Renders the CSV content.
     */
    public String toCsv(Trajectory trajectory) {
        Objects.requireNonNull(trajectory, "trajectory");
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        int step = 0;
        for (Position p : trajectory) {
            sb.append(step++).append(',').append(p.row()).append(',').append(p.column()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Writes the CSV to {@code file}, creating parent directories as needed.
     *
     * @throws UncheckedIOException when the file cannot be written.
     */
    public void export(Trajectory trajectory, Path file) {
        Objects.requireNonNull(file, "file");
        String csv = toCsv(trajectory);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write(csv);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to export waypoints to " + file, ex);
        }
        LOGGER.debug("Exported {} waypoints to {}", trajectory.size(), file);
    }
}
