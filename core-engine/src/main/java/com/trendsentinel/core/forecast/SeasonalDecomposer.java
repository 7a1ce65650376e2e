package com.trendsentinel.core.forecast;

import com.trendsentinel.core.config.DecompositionMode;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.error.InvalidParameterException;
import com.trendsentinel.core.model.Decomposition;
import com.trendsentinel.core.model.DecompositionPoint;
import com.trendsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classical moving-average decomposition into trend, seasonal and residual
 * components.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Trend: centered moving average over {@code p} points ({@code 2 x p}
 * weighting for even {@code p}). The first and last {@code p/2} positions are
 * extrapolated linearly from the nearest {@code p} trend values.</li>
 * <li>Seasonal: mean detrended value per phase, normalized to sum 0
 * (additive) or mean 1 (multiplicative).</li>
 * <li>Residual: the remainder, so components reproduce each observed
 * value.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class SeasonalDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDecomposer.class);

    /**
     * @param series prepared series
     * @param period seasonal period, &gt;= 2
     * @param mode   additive or multiplicative
     * @return the decomposition, one point per series point
     * @throws InsufficientDataException if fewer than {@code 2p} points are
     *                                   observed
     * @throws InvalidParameterException if multiplicative mode meets a
     *                                   non-positive value or trend
     */
    public Decomposition decompose(TimeSeries series, int period, DecompositionMode mode) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (period < 2) {
            throw new InvalidParameterException("seasonal period must be >= 2, got: " + period);
        }
        int observed = series.observedCount();
        if (observed < 2 * period) {
            throw new InsufficientDataException("decomposition with period " + period, 2 * period, observed);
        }
        double[] values = series.values();
        boolean multiplicative = mode == DecompositionMode.MULTIPLICATIVE;
        if (multiplicative) {
            for (double v : values) {
                if (!Double.isNaN(v) && v <= 0) {
                    throw new InvalidParameterException(
                            "multiplicative decomposition requires strictly positive values, got: " + v);
                }
            }
        }

        double[] bridged = bridgeGaps(values);
        double[] trend = trend(bridged, period);
        if (multiplicative) {
            for (double t : trend) {
                if (!(t > 0)) {
                    throw new InvalidParameterException(
                            "multiplicative decomposition produced a non-positive trend: " + t);
                }
            }
        }

        double[] indices = seasonalIndices(values, trend, period, multiplicative);

        List<DecompositionPoint> points = new ArrayList<>(values.length);
        for (int t = 0; t < values.length; t++) {
            double seasonal = indices[t % period];
            double residual;
            if (Double.isNaN(values[t])) {
                residual = Double.NaN;
            } else if (multiplicative) {
                residual = values[t] / (trend[t] * seasonal);
            } else {
                residual = values[t] - trend[t] - seasonal;
            }
            points.add(new DecompositionPoint(series.timestampAt(t), trend[t], seasonal, residual));
        }
        LOG.debug("Series [{}]: {} decomposition with period {}", series.getKey(), mode, period);
        return new Decomposition(mode, period, points, indices);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Linear interpolation over interior gaps, nearest observed value at the
     * edges.
     */
    static double[] bridgeGaps(double[] values) {
        double[] result = values.clone();
        int first = -1;
        int prev = -1;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                continue;
            }
            if (first < 0) {
                first = i;
            }
            if (prev >= 0 && i - prev > 1) {
                for (int j = prev + 1; j < i; j++) {
                    result[j] = values[prev] + (values[i] - values[prev]) * (j - prev) / (double) (i - prev);
                }
            }
            prev = i;
        }
        for (int i = 0; i < first; i++) {
            result[i] = values[first];
        }
        for (int i = prev + 1; i < values.length; i++) {
            result[i] = values[prev];
        }
        return result;
    }

    static double[] trend(double[] x, int period) {
        int n = x.length;
        int half = period / 2;
        boolean even = period % 2 == 0;
        double[] trend = new double[n];
        for (int t = half; t < n - half; t++) {
            double sum = 0;
            if (even) {
                sum += 0.5 * x[t - half] + 0.5 * x[t + half];
                for (int k = t - half + 1; k < t + half; k++) {
                    sum += x[k];
                }
            } else {
                for (int k = t - half; k <= t + half; k++) {
                    sum += x[k];
                }
            }
            trend[t] = sum / period;
        }
        int firstComputed = half;
        int lastComputed = n - half - 1;
        int span = Math.min(period, lastComputed - firstComputed + 1);

        double[] head = fitLine(trend, firstComputed, firstComputed + span);
        for (int t = 0; t < firstComputed; t++) {
            trend[t] = head[0] + head[1] * t;
        }
        double[] tail = fitLine(trend, lastComputed - span + 1, lastComputed + 1);
        for (int t = lastComputed + 1; t < n; t++) {
            trend[t] = tail[0] + tail[1] * t;
        }
        return trend;
    }

    /**
     * Least-squares line through {@code (t, y[t])} for {@code t} in
     * {@code [from, to)}.
     *
     * @return {@code {intercept, slope}}
     */
    private static double[] fitLine(double[] y, int from, int to) {
        int n = to - from;
        if (n == 1) {
            return new double[] { y[from], 0 };
        }
        double meanT = (from + to - 1) / 2.0;
        double meanY = 0;
        for (int t = from; t < to; t++) {
            meanY += y[t];
        }
        meanY /= n;
        double sxy = 0;
        double sxx = 0;
        for (int t = from; t < to; t++) {
            sxy += (t - meanT) * (y[t] - meanY);
            sxx += (t - meanT) * (t - meanT);
        }
        double slope = sxy / sxx;
        return new double[] { meanY - slope * meanT, slope };
    }

    private static double[] seasonalIndices(double[] values, double[] trend, int period, boolean multiplicative) {
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int t = 0; t < values.length; t++) {
            if (Double.isNaN(values[t])) {
                continue;
            }
            sums[t % period] += multiplicative ? values[t] / trend[t] : values[t] - trend[t];
            counts[t % period]++;
        }
        double[] indices = new double[period];
        double total = 0;
        for (int phase = 0; phase < period; phase++) {
            indices[phase] = counts[phase] > 0 ? sums[phase] / counts[phase] : (multiplicative ? 1 : 0);
            total += indices[phase];
        }
        double mean = total / period;
        for (int phase = 0; phase < period; phase++) {
            indices[phase] = multiplicative ? indices[phase] / mean : indices[phase] - mean;
        }
        return indices;
    }
}
