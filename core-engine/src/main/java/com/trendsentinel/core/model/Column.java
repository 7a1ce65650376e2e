package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A named, typed column of a {@link TableSchema}.
 *
 * @since 1.0.0
 */
public final class Column implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final ColumnType type;

    public Column(String name, ColumnType type) {
        this.name = Objects.requireNonNull(name, "Column name must not be null");
        this.type = Objects.requireNonNull(type, "Column type must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
    }

    public static Column of(String name, ColumnType type) {
        return new Column(name, type);
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Column that))
            return false;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
