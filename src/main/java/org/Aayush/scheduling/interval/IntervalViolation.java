package org.Aayush.scheduling.interval;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Constraint an interval triple can violate, in the order they are checked.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum IntervalViolation {
    START_NOT_FINITE("WIS_START_NOT_FINITE", "start must be finite"),
    FINISH_NOT_FINITE("WIS_FINISH_NOT_FINITE", "finish must be finite"),
    WEIGHT_NOT_FINITE("WIS_WEIGHT_NOT_FINITE", "weight must be finite"),
    NON_POSITIVE_DURATION("WIS_NON_POSITIVE_DURATION", "start must be strictly less than finish"),
    NON_POSITIVE_WEIGHT("WIS_NON_POSITIVE_WEIGHT", "weight must be strictly positive");

    /** Stable reason code surfaced through {@link IntervalValidationException}. */
    private final String reasonCode;
    /** Human-readable constraint description. */
    private final String description;
}
