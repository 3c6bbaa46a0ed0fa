package org.Aayush.scheduling.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure raised by {@link ScheduleSolver} before or during a solve.
 *
 * <p>The message always starts with {@code [REASON_CODE]}. Codes in use:</p>
 * <ul>
 * <li>{@link ScheduleSolver#REASON_STORE_REQUIRED}, {@link ScheduleSolver#REASON_TRIPLES_REQUIRED}
 * and {@link ScheduleSolver#REASON_TRIPLE_SHAPE}: the caller passed no input or a malformed row.</li>
 * <li>{@link ScheduleSolver#REASON_INTERVAL_BUDGET_EXCEEDED} and
 * {@link ScheduleSolver#REASON_EDGE_BUDGET_EXCEEDED}: the input is larger than the
 * configured {@link SolveBudget}; the cause carries the measured size.</li>
 * </ul>
 *
 * <p>Invalid interval values are reported separately, as
 * {@link org.Aayush.scheduling.interval.IntervalValidationException}.</p>
 */
@Getter
public final class SchedulingException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode one of the {@code ScheduleSolver.REASON_*} codes.
     * @param message detail appended after the code.
     */
    public SchedulingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Wraps a lower-level budget or graph-size failure.
     */
    public SchedulingException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
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
