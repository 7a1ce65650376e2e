package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classified direction of a series.
 */
public enum TrendDirection {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    FLAT("flat");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
