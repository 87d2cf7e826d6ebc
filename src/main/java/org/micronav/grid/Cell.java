package org.micronav.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Occupancy tag of one grid cell.
 *
 * <p>Each tag carries the numeric map code used in plain-text map files and a
 * single-character symbolic alias accepted by {@link GridLoader}.</p>
 */
@Getter
@Accessors(fluent = true)
public enum Cell {
    FREE('0', '.'),
    OBSTACLE('1', '#'),
    START('2', 'S'),
    GOAL('3', 'G');

    private final char code;
    private final char symbol;

    Cell(char code, char symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    /**
     * Resolves a map character (numeric code or symbol) to its cell tag.
     *
     * @param c map character.
     * @return matching cell tag, or {@code null} when the character is not a known cell.
     */
    public static Cell fromChar(char c) {
        for (Cell cell : values()) {
            if (cell.code == c || cell.symbol == c) {
                return cell;
            }
        }
        return null;
    }
}
