package com.trendsentinel.core.config;

/**
 * Exponential smoothing variant used for forecasting.
 */
public enum SmoothingMode {
    /** Level only. */
    SINGLE,
    /** Holt: level and trend. */
    DOUBLE,
    /** Holt-Winters: level, trend and season. */
    TRIPLE
}
