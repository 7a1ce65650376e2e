package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Least-squares trend of the observed values against the period index.
 *
 * <p>
 * {@code strength} is the coefficient of determination (R²) of the fit, in
 * {@code [0, 1]}; it is {@code 0} for a constant series.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TrendDirection direction;
    private final double slope;
    private final double relativeSlope;
    private final double strength;
    private final double noiseFloor;

    public TrendSummary(TrendDirection direction, double slope, double relativeSlope, double strength,
            double noiseFloor) {
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.slope = slope;
        this.relativeSlope = relativeSlope;
        this.strength = strength;
        this.noiseFloor = noiseFloor;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    /**
     * @return change per period in value units
     */
    public double getSlope() {
        return slope;
    }

    /**
     * @return slope divided by the mean absolute value
     */
    public double getRelativeSlope() {
        return relativeSlope;
    }

    public double getStrength() {
        return strength;
    }

    public double getNoiseFloor() {
        return noiseFloor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendSummary that))
            return false;
        return direction == that.direction
                && Double.compare(slope, that.slope) == 0
                && Double.compare(relativeSlope, that.relativeSlope) == 0
                && Double.compare(strength, that.strength) == 0
                && Double.compare(noiseFloor, that.noiseFloor) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, slope, relativeSlope, strength, noiseFloor);
    }

    @Override
    public String toString() {
        return "TrendSummary{" + direction.getLabel() + ", slope=" + slope + ", r2=" + strength + '}';
    }
}
