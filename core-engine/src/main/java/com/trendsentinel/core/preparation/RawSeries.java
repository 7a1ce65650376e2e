package com.trendsentinel.core.preparation;

import com.trendsentinel.core.model.SeriesKey;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Schema-validated rows of one (metric, dimension group) pair, in input order
 * and not yet deduplicated or resampled.
 *
 * @since 1.0.0
 */
public final class RawSeries {

    private final SeriesKey key;
    private final List<Row> rows;

    RawSeries(SeriesKey key, List<Row> rows) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.rows = Collections.unmodifiableList(rows);
    }

    public SeriesKey getKey() {
        return key;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    @Override
    public String toString() {
        return "RawSeries{" + key + ", rows=" + rows.size() + '}';
    }

    /**
     * One input row reduced to the series it belongs to.
     */
    public static final class Row {
        private final int rowIndex;
        private final Instant timestamp;
        private final double value;
        private final Map<String, Object> cells;

        Row(int rowIndex, Instant timestamp, double value, Map<String, Object> cells) {
            this.rowIndex = rowIndex;
            this.timestamp = timestamp;
            this.value = value;
            this.cells = cells;
        }

        /**
         * @return position of the row in the input table
         */
        public int getRowIndex() {
            return rowIndex;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        /**
         * @return the metric value, {@code NaN} if the cell was empty
         */
        public double getValue() {
            return value;
        }

        public Map<String, Object> getCells() {
            return cells;
        }
    }
}
