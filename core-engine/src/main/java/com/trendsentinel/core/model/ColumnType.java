package com.trendsentinel.core.model;

/**
 * Declared type of a {@link Column}.
 */
public enum ColumnType {
    TIMESTAMP,
    NUMERIC,
    STRING,
    BOOLEAN
}
