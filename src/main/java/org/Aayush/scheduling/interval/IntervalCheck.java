package org.Aayush.scheduling.interval;

import java.util.Objects;

/**
 * Outcome of validating one interval triple.
 *
 * <p>Exactly one of {@code interval} and {@code violation} is non-null.</p>
 *
 * @param interval accepted interval, or {@code null} when rejected.
 * @param violation first violated constraint, or {@code null} when accepted.
 */
public record IntervalCheck(Interval interval, IntervalViolation violation) {
    public IntervalCheck {
        if ((interval == null) == (violation == null)) {
            throw new IllegalArgumentException("exactly one of interval and violation must be set");
        }
    }

    static IntervalCheck accepted(Interval interval) {
        return new IntervalCheck(Objects.requireNonNull(interval, "interval"), null);
    }

    static IntervalCheck rejected(IntervalViolation violation) {
        return new IntervalCheck(null, Objects.requireNonNull(violation, "violation"));
    }

    /**
     * Returns whether the triple produced a valid interval.
     */
    public boolean valid() {
        return interval != null;
    }
}
