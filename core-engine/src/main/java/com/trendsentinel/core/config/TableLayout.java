package com.trendsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Names the roles of the columns of an input table: one timestamp column, one
 * or more metric columns and zero or more dimension columns.
 *
 * @since 1.0.0
 */
public final class TableLayout implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String timestampColumn;
    private final List<String> metricColumns;
    private final List<String> dimensionColumns;

    /**
     * @throws IllegalArgumentException if no metric is given or a column plays
     *                                  more than one role
     */
    public TableLayout(String timestampColumn, List<String> metricColumns, List<String> dimensionColumns) {
        this.timestampColumn = Objects.requireNonNull(timestampColumn, "timestampColumn must not be null");
        this.metricColumns = List.copyOf(Objects.requireNonNull(metricColumns, "metricColumns must not be null"));
        this.dimensionColumns = List.copyOf(
                Objects.requireNonNull(dimensionColumns, "dimensionColumns must not be null"));
        if (this.metricColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one metric column is required");
        }
        List<String> all = new ArrayList<>();
        all.add(timestampColumn);
        all.addAll(this.metricColumns);
        all.addAll(this.dimensionColumns);
        Set<String> seen = new HashSet<>();
        for (String name : all) {
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Column '" + name + "' is assigned more than one role");
            }
        }
    }

    /**
     * Layout without dimension columns.
     */
    public static TableLayout of(String timestampColumn, String... metricColumns) {
        return new TableLayout(timestampColumn, List.of(metricColumns), List.of());
    }

    public TableLayout withDimensions(String... dimensionColumns) {
        return new TableLayout(timestampColumn, metricColumns, List.of(dimensionColumns));
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public List<String> getMetricColumns() {
        return metricColumns;
    }

    public List<String> getDimensionColumns() {
        return dimensionColumns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TableLayout that))
            return false;
        return timestampColumn.equals(that.timestampColumn)
                && metricColumns.equals(that.metricColumns)
                && dimensionColumns.equals(that.dimensionColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestampColumn, metricColumns, dimensionColumns);
    }

    @Override
    public String toString() {
        return "TableLayout{timestamp=" + timestampColumn + ", metrics=" + metricColumns
                + ", dimensions=" + dimensionColumns + '}';
    }
}
