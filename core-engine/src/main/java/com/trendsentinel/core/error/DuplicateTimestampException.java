package com.trendsentinel.core.error;

import java.time.Instant;

/**
 * Raised under the strict duplicate policy when two rows of the same series
 * share a timestamp.
 */
public class DuplicateTimestampException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;

    public DuplicateTimestampException(String series, Instant timestamp) {
        super(ErrorCode.DUPLICATE_TIMESTAMP, timestamp + " appears more than once in series " + series);
        this.timestamp = timestamp;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
