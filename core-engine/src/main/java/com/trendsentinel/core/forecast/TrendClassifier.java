package com.trendsentinel.core.forecast;

import com.trendsentinel.core.model.TrendDirection;
import com.trendsentinel.core.model.TrendSummary;

/**
 * Classifies the direction of a series from the least-squares slope of its
 * observed values against the period index.
 *
 * <p>
 * The slope is made scale-free by dividing it by the mean absolute value (the
 * raw slope is used when that mean is zero). A relative slope within the noise
 * floor is {@link TrendDirection#FLAT}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendClassifier {

    private final double noiseFloor;

    public TrendClassifier(double noiseFloor) {
        this.noiseFloor = noiseFloor;
    }

    /**
     * @param values series values, {@code NaN} where missing; at least two
     *               observed
     * @return trend summary
     */
    public TrendSummary classify(double[] values) {
        int n = 0;
        double sumX = 0;
        double sumY = 0;
        double sumAbs = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                n++;
                sumX += i;
                sumY += values[i];
                sumAbs += Math.abs(values[i]);
            }
        }
        if (n < 2) {
            throw new IllegalArgumentException("At least two observed values are required, got " + n);
        }
        double meanX = sumX / n;
        double meanY = sumY / n;
        double sxx = 0;
        double sxy = 0;
        double syy = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                double dx = i - meanX;
                double dy = values[i] - meanY;
                sxx += dx * dx;
                sxy += dx * dy;
                syy += dy * dy;
            }
        }
        double slope = sxy / sxx;
        double meanAbs = sumAbs / n;
        double relativeSlope = meanAbs == 0 ? slope : slope / meanAbs;
        double strength = syy == 0 ? 0 : Math.min(1, Math.max(0, (sxy * sxy) / (sxx * syy)));

        TrendDirection direction;
        if (Math.abs(relativeSlope) <= noiseFloor) {
            direction = TrendDirection.FLAT;
        } else {
            direction = relativeSlope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }
        return new TrendSummary(direction, slope, relativeSlope, strength, noiseFloor);
    }

    public double getNoiseFloor() {
        return noiseFloor;
    }
}
