package com.trendsentinel.core.forecast;

import com.trendsentinel.core.config.DecompositionMode;
import com.trendsentinel.core.config.SmoothingMode;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.error.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Single, double (Holt) and triple (Holt-Winters) exponential smoothing.
 *
 * <p>
 * The recurrence runs strictly in timestamp order. Leading missing values are
 * skipped; any later missing observation is replaced by its one-step
 * prediction, which leaves the state on its current path. Residuals are only
 * collected for observed points.
 * </p>
 *
 * <h3>Initialization</h3>
 * <ul>
 * <li>{@code SINGLE}: level = first value.</li>
 * <li>{@code DOUBLE}: level = first value, trend = slope to the next observed
 * value.</li>
 * <li>{@code TRIPLE}: level = mean of the first season, trend = difference of
 * the first two season means divided by {@code p}, seasonals = first season
 * relative to the level.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ExponentialSmoother {

    private static final Logger LOG = LoggerFactory.getLogger(ExponentialSmoother.class);

    private final SmoothingMode mode;
    private final DecompositionMode seasonalMode;
    private final double alpha;
    private final double beta;
    private final double gamma;

    /**
     * @throws InvalidParameterException if a coefficient is outside (0, 1)
     */
    public ExponentialSmoother(SmoothingMode mode, DecompositionMode seasonalMode, double alpha, double beta,
            double gamma) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.seasonalMode = Objects.requireNonNull(seasonalMode, "seasonalMode must not be null");
        requireOpenUnit("alpha", alpha);
        requireOpenUnit("beta", beta);
        requireOpenUnit("gamma", gamma);
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
    }

    /**
     * Minimum number of observed values the mode needs.
     *
     * @param period seasonal period, only used by {@code TRIPLE}
     * @return minimum observed count
     */
    public int requiredObservations(int period) {
        return switch (mode) {
            case SINGLE -> 2;
            case DOUBLE -> 3;
            case TRIPLE -> 2 * period;
        };
    }

    /**
     * Run the recurrence over the series.
     *
     * @param values series values, {@code NaN} where missing
     * @param period seasonal period, only used by {@code TRIPLE}
     * @return final state and in-sample error
     * @throws InsufficientDataException if the series is too short
     * @throws InvalidParameterException if multiplicative seasonality meets a
     *                                   non-positive value
     */
    public SmoothingFit fit(double[] values, int period) {
        Objects.requireNonNull(values, "values must not be null");
        int observed = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                observed++;
            }
        }
        int required = requiredObservations(period);
        if (observed < required) {
            throw new InsufficientDataException(mode.name().toLowerCase(Locale.ROOT) + " exponential smoothing", required,
                    observed);
        }
        int start = 0;
        while (Double.isNaN(values[start])) {
            start++;
        }
        SmoothingFit fit = switch (mode) {
            case SINGLE -> single(values, start);
            case DOUBLE -> holt(values, start);
            case TRIPLE -> holtWinters(values, start, period);
        };
        LOG.debug("{} smoothing: level={} trend={} residualStd={}", mode, fit.getLevel(), fit.getTrend(),
                fit.getResidualStd());
        return fit;
    }

    public SmoothingMode getMode() {
        return mode;
    }

    // ---------------------------------------------------------------
    // Recurrences
    // ---------------------------------------------------------------

    private SmoothingFit single(double[] y, int start) {
        double level = y[start];
        double sse = 0;
        int count = 0;
        for (int t = start + 1; t < y.length; t++) {
            double prediction = level;
            double actual = y[t];
            if (Double.isNaN(actual)) {
                actual = prediction;
            } else {
                sse += (actual - prediction) * (actual - prediction);
                count++;
            }
            level = alpha * actual + (1 - alpha) * level;
        }
        return new SmoothingFit(SmoothingMode.SINGLE, false, level, 0, null, y.length - 1, rms(sse, count), count);
    }

    private SmoothingFit holt(double[] y, int start) {
        int next = start + 1;
        while (Double.isNaN(y[next])) {
            next++;
        }
        double level = y[start];
        double trend = (y[next] - y[start]) / (next - start);
        double sse = 0;
        int count = 0;
        for (int t = start + 1; t < y.length; t++) {
            double prediction = level + trend;
            double actual = y[t];
            if (Double.isNaN(actual)) {
                actual = prediction;
            } else {
                sse += (actual - prediction) * (actual - prediction);
                count++;
            }
            double previousLevel = level;
            level = alpha * actual + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
        }
        return new SmoothingFit(SmoothingMode.DOUBLE, false, level, trend, null, y.length - 1, rms(sse, count),
                count);
    }

    private SmoothingFit holtWinters(double[] y, int start, int period) {
        boolean multiplicative = seasonalMode == DecompositionMode.MULTIPLICATIVE;
        if (multiplicative) {
            for (double v : y) {
                if (!Double.isNaN(v) && v <= 0) {
                    throw new InvalidParameterException(
                            "multiplicative Holt-Winters requires strictly positive values, got: " + v);
                }
            }
        }
        if (y.length - start < 2 * period) {
            throw new InsufficientDataException("triple exponential smoothing", 2 * period, y.length - start);
        }
        double firstSeason = observedMean(y, start, start + period);
        double secondSeason = observedMean(y, start + period, start + 2 * period);
        if (Double.isNaN(firstSeason) || Double.isNaN(secondSeason)) {
            throw new InsufficientDataException(
                    "triple exponential smoothing needs observations in each of the first two seasons");
        }
        double level = firstSeason;
        double trend = (secondSeason - firstSeason) / period;
        double[] seasonals = new double[period];
        for (int i = 0; i < period; i++) {
            int t = start + i;
            double v = y[t];
            // seasonals are indexed by absolute position so forecasts line up with the series
            if (Double.isNaN(v)) {
                seasonals[t % period] = multiplicative ? 1 : 0;
            } else {
                seasonals[t % period] = multiplicative ? v / level : v - level;
            }
        }

        double sse = 0;
        int count = 0;
        for (int t = start + period; t < y.length; t++) {
            int phase = t % period;
            double season = seasonals[phase];
            double prediction = multiplicative ? (level + trend) * season : level + trend + season;
            double actual = y[t];
            if (Double.isNaN(actual)) {
                actual = prediction;
            } else {
                sse += (actual - prediction) * (actual - prediction);
                count++;
            }
            double previousLevel = level;
            if (multiplicative) {
                level = alpha * (actual / season) + (1 - alpha) * (level + trend);
                trend = beta * (level - previousLevel) + (1 - beta) * trend;
                seasonals[phase] = gamma * (actual / level) + (1 - gamma) * season;
            } else {
                level = alpha * (actual - season) + (1 - alpha) * (level + trend);
                trend = beta * (level - previousLevel) + (1 - beta) * trend;
                seasonals[phase] = gamma * (actual - level) + (1 - gamma) * season;
            }
        }
        return new SmoothingFit(SmoothingMode.TRIPLE, multiplicative, level, trend, seasonals, y.length - 1,
                rms(sse, count), count);
    }

    private static double observedMean(double[] y, int from, int to) {
        double sum = 0;
        int count = 0;
        for (int t = from; t < to; t++) {
            if (!Double.isNaN(y[t])) {
                sum += y[t];
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    private static double rms(double sse, int count) {
        return count == 0 ? 0 : Math.sqrt(sse / count);
    }

    private static void requireOpenUnit(String name, double value) {
        if (!(value > 0 && value < 1)) {
            throw new InvalidParameterException(name + " must be strictly between 0 and 1, got: " + value);
        }
    }
}
