package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Seasonal period used for decomposition and Holt-Winters smoothing, and where
 * it came from.
 *
 * @since 1.0.0
 */
public final class SeasonalityProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Origin of the period. */
    public enum Source {
        /** Set explicitly through {@code seasonal_period}. */
        CONFIGURED,
        /** First autocorrelation peak above the minimum correlation. */
        DETECTED,
        /** No period configured or detected. */
        DEFAULT
    }

    private final boolean seasonal;
    private final int period;
    private final double autocorrelation;
    private final Source source;

    public SeasonalityProfile(boolean seasonal, int period, double autocorrelation, Source source) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, got: " + period);
        }
        this.seasonal = seasonal;
        this.period = period;
        this.autocorrelation = autocorrelation;
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * @return {@code true} if autocorrelation confirmed a seasonal pattern
     */
    public boolean isSeasonal() {
        return seasonal;
    }

    public int getPeriod() {
        return period;
    }

    /**
     * @return autocorrelation at {@link #getPeriod()}, {@code NaN} if not computed
     */
    public double getAutocorrelation() {
        return autocorrelation;
    }

    public Source getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalityProfile that))
            return false;
        return seasonal == that.seasonal
                && period == that.period
                && Double.compare(autocorrelation, that.autocorrelation) == 0
                && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(seasonal, period, autocorrelation, source);
    }

    @Override
    public String toString() {
        return "SeasonalityProfile{period=" + period + ", source=" + source + ", acf=" + autocorrelation + '}';
    }
}
