package org.Aayush.scheduling.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Fatal internal failure: a structural guarantee of the solve pipeline did not hold.
 *
 * <p>Never expected in correct operation. It indicates a construction bug and
 * must propagate to the caller unmasked.</p>
 */
@Getter
@Accessors(fluent = true)
public final class InvariantViolationException extends IllegalStateException {
    private final String reasonCode;

    InvariantViolationException(String reasonCode, String message) {
        super("[" + reasonCode + "] " + message);
        this.reasonCode = reasonCode;
    }
}
