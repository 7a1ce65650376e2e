package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identifies one series: a metric column plus the dimension values of its
 * group.
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final Map<String, String> dimensions;

    public SeriesKey(String metric, Map<String, String> dimensions) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(dimensions, "dimensions must not be null")));
    }

    public static SeriesKey of(String metric) {
        return new SeriesKey(metric, Map.of());
    }

    public String getMetric() {
        return metric;
    }

    public Map<String, String> getDimensions() {
        return dimensions;
    }

    /**
     * @return compact label such as {@code TotalSales[Region=EU]}
     */
    @JsonIgnore
    public String label() {
        return dimensions.isEmpty() ? metric : metric + dimensions.toString().replace('{', '[').replace('}', ']');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return metric.equals(that.metric) && dimensions.equals(that.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, dimensions);
    }

    @Override
    public String toString() {
        return label();
    }
}
