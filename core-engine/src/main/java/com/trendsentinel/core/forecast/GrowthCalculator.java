package com.trendsentinel.core.forecast;

import com.trendsentinel.core.model.GrowthMetrics;

/**
 * Period-over-period growth of the observed values. A percentage whose base
 * value is zero is undefined and reported as {@code null}.
 */
public final class GrowthCalculator {

    /**
     * @param observed observed values in order, at least two
     * @return growth metrics
     */
    public GrowthMetrics calculate(double[] observed) {
        if (observed.length < 2) {
            throw new IllegalArgumentException("At least two observed values are required, got " + observed.length);
        }
        double start = observed[0];
        double current = observed[observed.length - 1];
        double previous = observed[observed.length - 2];

        double sum = 0;
        int defined = 0;
        for (int i = 1; i < observed.length; i++) {
            Double change = percentChange(observed[i - 1], observed[i]);
            if (change != null) {
                sum += change;
                defined++;
            }
        }
        Double average = defined == 0 ? null : sum / defined;
        return new GrowthMetrics(start, current, percentChange(previous, current), average,
                percentChange(start, current));
    }

    private static Double percentChange(double base, double value) {
        return base == 0 ? null : (value - base) / base * 100;
    }
}
