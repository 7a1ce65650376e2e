package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Projected value for one future timestamp with its confidence band.
 *
 * <p>
 * Invariant: {@code lowerBound <= pointEstimate <= upperBound}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final int step;
    private final double pointEstimate;
    private final double lowerBound;
    private final double upperBound;

    public ForecastPoint(Instant timestamp, int step, double pointEstimate, double lowerBound, double upperBound) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (step < 1) {
            throw new IllegalArgumentException("step must be >= 1, got: " + step);
        }
        if (!(lowerBound <= pointEstimate && pointEstimate <= upperBound)) {
            throw new IllegalArgumentException("Bounds must enclose the estimate: "
                    + lowerBound + " <= " + pointEstimate + " <= " + upperBound);
        }
        this.step = step;
        this.pointEstimate = pointEstimate;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getStep() {
        return step;
    }

    public double getPointEstimate() {
        return pointEstimate;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastPoint that))
            return false;
        return step == that.step
                && Double.compare(pointEstimate, that.pointEstimate) == 0
                && Double.compare(lowerBound, that.lowerBound) == 0
                && Double.compare(upperBound, that.upperBound) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, step, pointEstimate, lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return "ForecastPoint{" + timestamp + " (+" + step + "), " + pointEstimate
                + " [" + lowerBound + ", " + upperBound + "]}";
    }
}
