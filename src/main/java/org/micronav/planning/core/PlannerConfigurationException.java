package org.micronav.planning.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when planner tunables or footprint dimensions are out of their valid range.
 *
 * <p>Messages are prefixed with deterministic reason-code text.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PlannerConfigurationException extends RuntimeException {
    public static final String REASON_NON_POSITIVE_GAIN = "CONFIG_NON_POSITIVE_GAIN";
    public static final String REASON_NON_POSITIVE_INFLUENCE = "CONFIG_NON_POSITIVE_INFLUENCE";
    public static final String REASON_NON_POSITIVE_FOOTPRINT = "CONFIG_NON_POSITIVE_FOOTPRINT";
    public static final String REASON_NON_POSITIVE_BUDGET = "CONFIG_NON_POSITIVE_BUDGET";
    public static final String REASON_INVALID_CYCLE_WINDOW = "CONFIG_INVALID_CYCLE_WINDOW";
    public static final String REASON_NON_POSITIVE_MIN_DISTANCE = "CONFIG_NON_POSITIVE_MIN_DISTANCE";

    private final String reasonCode;

    /**
     * Creates a reason-coded configuration failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public PlannerConfigurationException(String reasonCode, String message) {
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
