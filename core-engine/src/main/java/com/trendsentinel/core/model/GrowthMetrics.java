package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Period-over-period growth of the observed values.
 *
 * <p>
 * Percentages are {@code null} when their base value is zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class GrowthMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double startValue;
    private final double currentValue;
    private final Double lastPeriodChangePct;
    private final Double averagePeriodChangePct;
    private final Double totalChangePct;

    public GrowthMetrics(double startValue, double currentValue, Double lastPeriodChangePct,
            Double averagePeriodChangePct, Double totalChangePct) {
        this.startValue = startValue;
        this.currentValue = currentValue;
        this.lastPeriodChangePct = lastPeriodChangePct;
        this.averagePeriodChangePct = averagePeriodChangePct;
        this.totalChangePct = totalChangePct;
    }

    public double getStartValue() {
        return startValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public Double getLastPeriodChangePct() {
        return lastPeriodChangePct;
    }

    public Double getAveragePeriodChangePct() {
        return averagePeriodChangePct;
    }

    public Double getTotalChangePct() {
        return totalChangePct;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GrowthMetrics that))
            return false;
        return Double.compare(startValue, that.startValue) == 0
                && Double.compare(currentValue, that.currentValue) == 0
                && Objects.equals(lastPeriodChangePct, that.lastPeriodChangePct)
                && Objects.equals(averagePeriodChangePct, that.averagePeriodChangePct)
                && Objects.equals(totalChangePct, that.totalChangePct);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startValue, currentValue, lastPeriodChangePct, averagePeriodChangePct, totalChangePct);
    }

    @Override
    public String toString() {
        return "GrowthMetrics{start=" + startValue + ", current=" + currentValue + ", total%=" + totalChangePct + '}';
    }
}
