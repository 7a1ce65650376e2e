package com.trendsentinel.core.forecast;

import com.trendsentinel.core.config.SmoothingMode;

/**
 * Final state of an exponential smoothing run and its in-sample error.
 *
 * @since 1.0.0
 */
public final class SmoothingFit {

    private final SmoothingMode mode;
    private final boolean multiplicative;
    private final double level;
    private final double trend;
    private final double[] seasonals;
    private final int lastIndex;
    private final double residualStd;
    private final int residualCount;

    SmoothingFit(SmoothingMode mode, boolean multiplicative, double level, double trend, double[] seasonals,
            int lastIndex, double residualStd, int residualCount) {
        this.mode = mode;
        this.multiplicative = multiplicative;
        this.level = level;
        this.trend = trend;
        this.seasonals = seasonals;
        this.lastIndex = lastIndex;
        this.residualStd = residualStd;
        this.residualCount = residualCount;
    }

    /**
     * Extrapolate from the final state.
     *
     * @param steps periods after the last point, &gt;= 1
     * @return point forecast
     */
    public double forecast(int steps) {
        return switch (mode) {
            case SINGLE -> level;
            case DOUBLE -> level + steps * trend;
            case TRIPLE -> {
                double season = seasonals[(lastIndex + steps) % seasonals.length];
                double base = level + steps * trend;
                yield multiplicative ? base * season : base + season;
            }
        };
    }

    public SmoothingMode getMode() {
        return mode;
    }

    public double getLevel() {
        return level;
    }

    public double getTrend() {
        return trend;
    }

    /**
     * @return RMS of the in-sample one-step-ahead residuals, 0 when there are
     *         none
     */
    public double getResidualStd() {
        return residualStd;
    }

    public int getResidualCount() {
        return residualCount;
    }
}
