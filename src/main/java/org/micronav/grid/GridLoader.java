package org.micronav.grid;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses plain-text occupancy maps into {@link Grid} instances.
 *
 * <p>One grid row per non-blank line. A row is either whitespace-separated single
 * character tokens ({@code "0 0 1 3"}) or contiguous characters ({@code "S..#G"}).
 * Accepted characters are the numeric codes and symbols of {@link Cell}. Lines whose
 * first non-blank characters are {@code //} or {@code ;} are comments.</p>
 */
@UtilityClass
public class GridLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(GridLoader.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    /**
     * Loads a map file as UTF-8.
     *
     * @param file map file path.
     * @return validated grid.
     * @throws UncheckedIOException when the file cannot be read.
     * @throws GridValidationException when the content is not a valid grid.
     */
    public Grid load(Path file) {
        Objects.requireNonNull(file, "file");
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Grid grid = parse(reader);
            LOGGER.debug("Loaded {}x{} grid from {}", grid.rows(), grid.columns(), file);
            return grid;
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read map file " + file, ex);
        }
    }

    /**
     * Parses map text from a reader. The reader is not closed.
     */
    public Grid parse(Reader reader) {
        Objects.requireNonNull(reader, "reader");
        BufferedReader buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        try {
            String line;
            while ((line = buffered.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read map text", ex);
        }
        return parse(lines);
    }

    /**
     * Parses map lines.
     *
     * @param lines raw map lines (comments and blank lines allowed).
     * @return validated grid.
     */
    public Grid parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<Cell[]> rows = new ArrayList<>();
        for (int lineNo = 0; lineNo < lines.size(); lineNo++) {
            String line = lines.get(lineNo);
            if (lineNo == 0 && line.startsWith(BYTE_ORDER_MARK)) {
                line = line.substring(1);
            }
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("//") || trimmed.startsWith(";")) {
                continue;
            }
            rows.add(parseRow(trimmed, lineNo + 1));
        }
        return Grid.of(rows.toArray(new Cell[0][]));
    }

    private Cell[] parseRow(String line, int lineNo) {
        String compact = line.replaceAll("\\s+", "");
        Cell[] row = new Cell[compact.length()];
        for (int i = 0; i < compact.length(); i++) {
            char c = compact.charAt(i);
            Cell cell = Cell.fromChar(c);
            if (cell == null) {
                throw new GridValidationException(
                        GridValidationException.REASON_UNKNOWN_CELL_SYMBOL,
                        "unknown cell symbol '" + c + "' at line " + lineNo + ", column " + i
                );
            }
            row[i] = cell;
        }
        return row;
    }
}
