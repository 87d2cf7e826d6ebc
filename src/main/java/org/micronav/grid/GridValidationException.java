package org.micronav.grid;

import lombok.Getter;

import java.util.Objects;

/**
 * Thrown when an occupancy grid violates its structural contract.
 *
 * <p>Messages are prefixed with a deterministic reason code so callers can branch on
 * {@link #getReasonCode()} instead of parsing text.</p>
 */
@Getter
public final class GridValidationException extends RuntimeException {
    public static final String REASON_EMPTY = "GRID_EMPTY";
    public static final String REASON_RAGGED_ROWS = "GRID_RAGGED_ROWS";
    public static final String REASON_NULL_CELL = "GRID_NULL_CELL";
    public static final String REASON_MISSING_START = "GRID_MISSING_START";
    public static final String REASON_DUPLICATE_START = "GRID_DUPLICATE_START";
    public static final String REASON_MISSING_GOAL = "GRID_MISSING_GOAL";
    public static final String REASON_DUPLICATE_GOAL = "GRID_DUPLICATE_GOAL";
    public static final String REASON_UNKNOWN_CELL_SYMBOL = "GRID_UNKNOWN_CELL_SYMBOL";

    private final String reasonCode;

    /**
     * Creates a reason-coded grid contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public GridValidationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
