package com.trendsentinel.core.config;

/**
 * How missing values are filled after resampling. Configured as
 * {@code gap_fill_policy}.
 */
public enum GapFillPolicy {
    /** Leave missing values missing. */
    NONE,
    /** Carry the last observed value forward; leading gaps stay missing. */
    FORWARD_FILL,
    /** Linear in time between observed neighbours; edge gaps stay missing. */
    INTERPOLATE
}
