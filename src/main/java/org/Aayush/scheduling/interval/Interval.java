package org.Aayush.scheduling.interval;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable weighted time span {@code [start, finish)}.
 *
 * <p>Instances exist only in validated form: {@code start < finish},
 * {@code weight > 0}, and all three values finite. Use {@link #check} for a
 * non-throwing validation result or {@link #of} to fail fast.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Interval {
    /** Left endpoint (inclusive). */
    double start;
    /** Right endpoint (exclusive). */
    double finish;
    /** Strictly positive value gained by scheduling this interval. */
    double weight;

    /**
     * Validates one triple without throwing.
     *
     * @param start left endpoint.
     * @param finish right endpoint.
     * @param weight interval weight.
     * @return accepted interval or the first violated constraint.
     */
    public static IntervalCheck check(double start, double finish, double weight) {
        if (!Double.isFinite(start)) {
            return IntervalCheck.rejected(IntervalViolation.START_NOT_FINITE);
        }
        if (!Double.isFinite(finish)) {
            return IntervalCheck.rejected(IntervalViolation.FINISH_NOT_FINITE);
        }
        if (!Double.isFinite(weight)) {
            return IntervalCheck.rejected(IntervalViolation.WEIGHT_NOT_FINITE);
        }
        if (!(start < finish)) {
            return IntervalCheck.rejected(IntervalViolation.NON_POSITIVE_DURATION);
        }
        if (!(weight > 0.0d)) {
            return IntervalCheck.rejected(IntervalViolation.NON_POSITIVE_WEIGHT);
        }
        return IntervalCheck.accepted(new Interval(start, finish, weight));
    }

    /**
     * Creates a validated interval.
     *
     * @throws IntervalValidationException when any constraint is violated.
     */
    public static Interval of(double start, double finish, double weight) {
        IntervalCheck check = check(start, finish, weight);
        if (!check.valid()) {
            throw new IntervalValidationException(check.violation(), 0, null, start, finish, weight);
        }
        return check.interval();
    }

    /**
     * Returns whether this interval can be scheduled before {@code next}
     * ({@code finish <= next.start}).
     */
    public boolean precedes(Interval next) {
        return finish <= next.start;
    }

    /**
     * Returns a copy carrying the larger of the two weights.
     */
    Interval withMaxWeight(double candidateWeight) {
        if (candidateWeight <= weight) {
            return this;
        }
        return new Interval(start, finish, candidateWeight);
    }
}
