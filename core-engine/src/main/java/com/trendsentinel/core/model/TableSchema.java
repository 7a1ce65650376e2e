package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of uniquely named, typed columns.
 *
 * @since 1.0.0
 */
public final class TableSchema implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Column> columns;
    private final Map<String, Integer> positions;

    private TableSchema(List<Column> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Column column = Objects.requireNonNull(columns.get(i), "Column at index " + i + " is null");
            if (index.putIfAbsent(column.getName(), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
        }
        this.positions = Collections.unmodifiableMap(index);
    }

    public static TableSchema of(Column... columns) {
        return new TableSchema(List.of(columns));
    }

    public static TableSchema of(List<Column> columns) {
        Objects.requireNonNull(columns, "Columns must not be null");
        return new TableSchema(columns);
    }

    /**
     * Return a schema with the given columns appended.
     *
     * @param extra columns to append; names must not clash with existing ones
     * @return new schema
     */
    public TableSchema extend(List<Column> extra) {
        List<Column> all = new ArrayList<>(columns);
        all.addAll(extra);
        return new TableSchema(all);
    }

    public List<Column> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    /**
     * @param name column name
     * @return position of the column, or {@code -1} if absent
     */
    public int indexOf(String name) {
        return positions.getOrDefault(name, -1);
    }

    public Optional<Column> column(String name) {
        int idx = indexOf(name);
        return idx < 0 ? Optional.empty() : Optional.of(columns.get(idx));
    }

    public List<String> names() {
        return List.copyOf(positions.keySet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TableSchema that))
            return false;
        return columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "TableSchema" + columns;
    }
}
