package com.trendsentinel.core.model;

/**
 * Kind of a report row.
 */
public enum RowKind {
    /** Row of the prepared input series, observed or imputed. */
    OBSERVED,
    /** Projected row beyond the last timestamp. */
    FORECAST
}
