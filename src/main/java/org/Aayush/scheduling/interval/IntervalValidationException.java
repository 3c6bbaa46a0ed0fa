package org.Aayush.scheduling.interval;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when an interval triple violates an acceptance constraint.
 *
 * <p>Messages are prefixed with the violation's reason code and identify the
 * rejected input by position (and source label, when the caller supplied one).</p>
 */
@Getter
@Accessors(fluent = true)
public final class IntervalValidationException extends RuntimeException {
    private final IntervalViolation violation;
    /** Zero-based position of the rejected triple in its input sequence. */
    private final int position;
    /** Caller-supplied input identity such as {@code "line 7"}; may be null. */
    private final String sourceLabel;
    private final double start;
    private final double finish;
    private final double weight;

    /**
     * Creates a validation failure for one rejected triple.
     *
     * @param violation violated constraint.
     * @param position zero-based input position.
     * @param sourceLabel optional input identity.
     * @param start rejected start.
     * @param finish rejected finish.
     * @param weight rejected weight.
     */
    public IntervalValidationException(
            IntervalViolation violation,
            int position,
            String sourceLabel,
            double start,
            double finish,
            double weight
    ) {
        super(formatMessage(violation, position, sourceLabel, start, finish, weight));
        this.violation = violation;
        this.position = position;
        this.sourceLabel = sourceLabel;
        this.start = start;
        this.finish = finish;
        this.weight = weight;
    }

    /**
     * Returns the stable reason code of the violated constraint.
     */
    public String reasonCode() {
        return violation.reasonCode();
    }

    private static String formatMessage(
            IntervalViolation violation,
            int position,
            String sourceLabel,
            double start,
            double finish,
            double weight
    ) {
        Objects.requireNonNull(violation, "violation");
        String where = sourceLabel == null || sourceLabel.isBlank()
                ? "interval #" + position
                : sourceLabel;
        return "[" + violation.reasonCode() + "] " + where
                + " (" + start + ", " + finish + ", " + weight + "): "
                + violation.description();
    }
}
