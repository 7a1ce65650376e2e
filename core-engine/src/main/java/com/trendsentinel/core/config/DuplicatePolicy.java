package com.trendsentinel.core.config;

/**
 * How rows sharing a timestamp within one series are resolved. Configured as
 * {@code duplicate_policy}.
 */
public enum DuplicatePolicy {
    /** Keep the later-arriving row. */
    LAST_WRITE_WINS,
    /** Reject the input. */
    ERROR
}
