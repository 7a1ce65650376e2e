package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable rectangular table: ordered rows of a fixed {@link TableSchema}.
 *
 * <p>
 * Cells hold raw objects. The table itself does not coerce values; type
 * checks against the declared column types happen at the series preparation
 * boundary, where a mismatch becomes a
 * {@link com.trendsentinel.core.error.SchemaException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataTable implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TableSchema schema;
    private final List<Object[]> rows;

    private DataTable(TableSchema schema, List<Object[]> rows) {
        this.schema = schema;
        this.rows = rows;
    }

    public static Builder builder(TableSchema schema) {
        return new Builder(schema);
    }

    public TableSchema getSchema() {
        return schema;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * @param row    row index
     * @param column column name
     * @return the raw cell, possibly {@code null}
     * @throws IllegalArgumentException if the column does not exist
     */
    public Object value(int row, String column) {
        int idx = schema.indexOf(column);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(row)[idx];
    }

    /**
     * @param row row index
     * @return unmodifiable column-name to cell map, in schema order
     */
    public Map<String, Object> row(int row) {
        Object[] cells = rows.get(row);
        Map<String, Object> map = new LinkedHashMap<>();
        List<Column> columns = schema.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            map.put(columns.get(i).getName(), cells[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            result.add(row(i));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "DataTable{schema=" + schema + ", rows=" + rows.size() + '}';
    }

    /**
     * Row-by-row builder. Rows are copied on insertion.
     */
    public static class Builder {
        private final TableSchema schema;
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(TableSchema schema) {
            this.schema = Objects.requireNonNull(schema, "schema must not be null");
        }

        /**
         * Append a row given in schema order.
         *
         * @param cells one cell per column
         * @return this builder
         * @throws IllegalArgumentException if the arity does not match the schema
         */
        public Builder addRow(Object... cells) {
            Objects.requireNonNull(cells, "cells must not be null");
            if (cells.length != schema.size()) {
                throw new IllegalArgumentException("Row has " + cells.length
                        + " cells but schema has " + schema.size() + " columns");
            }
            rows.add(cells.clone());
            return this;
        }

        /**
         * Append a row given by column name; absent columns are {@code null}.
         *
         * @param cells column-name to cell map
         * @return this builder
         * @throws IllegalArgumentException if a key is not a schema column
         */
        public Builder addRow(Map<String, ?> cells) {
            Objects.requireNonNull(cells, "cells must not be null");
            Object[] row = new Object[schema.size()];
            for (Map.Entry<String, ?> entry : cells.entrySet()) {
                int idx = schema.indexOf(entry.getKey());
                if (idx < 0) {
                    throw new IllegalArgumentException("Unknown column: " + entry.getKey());
                }
                row[idx] = entry.getValue();
            }
            rows.add(row);
            return this;
        }

        public DataTable build() {
            return new DataTable(schema, Collections.unmodifiableList(new ArrayList<>(rows)));
        }
    }
}
