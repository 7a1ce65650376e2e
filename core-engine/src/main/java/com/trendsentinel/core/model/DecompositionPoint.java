package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Trend, seasonal and residual components of one observation.
 * The residual is {@link Double#NaN} for missing observations.
 */
public final class DecompositionPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double trend;
    private final double seasonal;
    private final double residual;

    public DecompositionPoint(Instant timestamp, double trend, double seasonal, double residual) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.trend = trend;
        this.seasonal = seasonal;
        this.residual = residual;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getTrend() {
        return trend;
    }

    public double getSeasonal() {
        return seasonal;
    }

    public double getResidual() {
        return residual;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DecompositionPoint that))
            return false;
        return Double.compare(trend, that.trend) == 0
                && Double.compare(seasonal, that.seasonal) == 0
                && Double.compare(residual, that.residual) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, trend, seasonal, residual);
    }

    @Override
    public String toString() {
        return "DecompositionPoint{" + timestamp + ", trend=" + trend + ", seasonal=" + seasonal
                + ", residual=" + residual + '}';
    }
}
