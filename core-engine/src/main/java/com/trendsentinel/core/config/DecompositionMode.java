package com.trendsentinel.core.config;

/**
 * How trend, seasonal and residual components combine into a value.
 */
public enum DecompositionMode {
    ADDITIVE,
    MULTIPLICATIVE
}
