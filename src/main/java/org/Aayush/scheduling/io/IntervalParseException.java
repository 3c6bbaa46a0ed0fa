package org.Aayush.scheduling.io;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a line of interval text cannot be read as three numbers.
 */
@Getter
@Accessors(fluent = true)
public final class IntervalParseException extends RuntimeException {
    private final String reasonCode;
    /** 1-based line number of the malformed line. */
    private final int lineNumber;

    IntervalParseException(String reasonCode, int lineNumber, String message) {
        super("[" + reasonCode + "] line " + lineNumber + ": " + message);
        this.reasonCode = reasonCode;
        this.lineNumber = lineNumber;
    }
}
