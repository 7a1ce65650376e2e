package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One prepared observation.
 *
 * <p>
 * A missing value is represented as {@link Double#NaN}. {@code sourceRow}
 * holds the original cells of the input row that survived deduplication, and
 * is empty for points inserted while resampling.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;
    private final boolean imputed;
    private final Map<String, Object> sourceRow;

    public SeriesPoint(Instant timestamp, double value, boolean imputed, Map<String, Object> sourceRow) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
        this.imputed = imputed;
        this.sourceRow = sourceRow == null || sourceRow.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sourceRow));
    }

    public static SeriesPoint observed(Instant timestamp, double value) {
        return new SeriesPoint(timestamp, value, false, Map.of());
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public boolean isMissing() {
        return Double.isNaN(value);
    }

    public boolean isImputed() {
        return imputed;
    }

    public Map<String, Object> getSourceRow() {
        return sourceRow;
    }

    /**
     * @param newValue replacement value
     * @return a copy flagged as imputed
     */
    public SeriesPoint withImputedValue(double newValue) {
        return new SeriesPoint(timestamp, newValue, true, sourceRow);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && imputed == that.imputed
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, imputed);
    }

    @Override
    public String toString() {
        return timestamp + "=" + (isMissing() ? "missing" : value) + (imputed ? "*" : "");
    }
}
