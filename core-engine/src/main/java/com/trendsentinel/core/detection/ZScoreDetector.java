package com.trendsentinel.core.detection;

import com.trendsentinel.core.config.DetectorType;
import com.trendsentinel.core.error.DetectorUnavailableException;
import com.trendsentinel.core.error.InvalidParameterException;
import com.trendsentinel.core.model.DetectorResult;
import com.trendsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Z-score outlier detector.
 *
 * <p>
 * Each observed value is compared with a reference set that excludes the
 * value itself: every other observed value of the series, or the
 * {@code window} observed values preceding it when a window is configured.
 * The score is {@code |value - mean| / std} (population standard deviation of
 * the reference set) and the point is an outlier when the score exceeds the
 * threshold.
 * </p>
 *
 * <h3>Degenerate windows</h3>
 * <ul>
 * <li>Reference and value all identical: score 0, never an outlier.</li>
 * <li>Constant reference, different value: score {@link Double#POSITIVE_INFINITY}.</li>
 * <li>Fewer than {@value #MIN_REFERENCE} reference values: not scored.</li>
 * </ul>
 *
 * <h3>Availability</h3>
 * <p>
 * Requires at least {@value #MIN_OBSERVED} observed points.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    static final int MIN_OBSERVED = 3;
    static final int MIN_REFERENCE = 2;

    private final double threshold;
    private final Integer window;

    /**
     * @param threshold score above which a point is an outlier, &gt; 0
     * @param window    number of preceding observed values in the reference set,
     *                  or {@code null} for the whole series
     * @throws InvalidParameterException if a parameter is out of range
     */
    public ZScoreDetector(double threshold, Integer window) {
        if (!(threshold > 0)) {
            throw new InvalidParameterException("z_threshold must be > 0, got: " + threshold);
        }
        if (window != null && window < MIN_REFERENCE) {
            throw new InvalidParameterException("z_window must be >= " + MIN_REFERENCE + ", got: " + window);
        }
        this.threshold = threshold;
        this.window = window;
    }

    @Override
    public List<DetectorResult> detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.values();
        int[] observed = SeriesStatistics.observedIndices(values);
        if (observed.length < MIN_OBSERVED) {
            throw new DetectorUnavailableException(getName(),
                    "needs at least " + MIN_OBSERVED + " observed points, got " + observed.length);
        }

        double[] scores = window == null ? leaveOneOutScores(values, observed) : trailingScores(values, observed);

        List<DetectorResult> results = new ArrayList<>(values.length);
        int flagged = 0;
        for (int i = 0; i < values.length; i++) {
            double score = scores[i];
            boolean outlier = !Double.isNaN(score) && score > threshold;
            if (outlier) {
                flagged++;
                LOG.trace("Series [{}]: z-score outlier at {} value={} score={}", series.getKey(),
                        series.timestampAt(i), values[i], score);
            }
            results.add(new DetectorResult(getName(), series.timestampAt(i), score, outlier));
        }
        LOG.debug("Series [{}]: z-score flagged {} of {} point(s)", series.getKey(), flagged, observed.length);
        return results;
    }

    @Override
    public String getName() {
        return DetectorType.ZSCORE.getDetectorName();
    }

    public double getThreshold() {
        return threshold;
    }

    public Integer getWindow() {
        return window;
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    private static double[] leaveOneOutScores(double[] values, int[] observed) {
        double[] scores = SeriesStatistics.nanArray(values.length);
        int m = observed.length;

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (int idx : observed) {
            min = Math.min(min, values[idx]);
            max = Math.max(max, values[idx]);
            sum += values[idx];
        }
        double center = sum / m;
        double centeredSumSq = 0;
        int minCount = 0;
        int maxCount = 0;
        for (int idx : observed) {
            double d = values[idx] - center;
            centeredSumSq += d * d;
            if (values[idx] == min) {
                minCount++;
            }
            if (values[idx] == max) {
                maxCount++;
            }
        }
        boolean twoValued = min != max && minCount + maxCount == m;

        for (int idx : observed) {
            double v = values[idx];
            if (min == max) {
                scores[idx] = 0;
                continue;
            }
            // the reference is constant only when v is the single value that differs
            if (twoValued && ((v == min && minCount == 1) || (v == max && maxCount == 1))) {
                scores[idx] = Double.POSITIVE_INFINITY;
                continue;
            }
            double d = v - center;
            double refMean = -d / (m - 1);
            double refVar = Math.max(0, (centeredSumSq - d * d) / (m - 1) - refMean * refMean);
            scores[idx] = Math.abs(d - refMean) / Math.sqrt(refVar);
        }
        return scores;
    }

    private double[] trailingScores(double[] values, int[] observed) {
        double[] scores = SeriesStatistics.nanArray(values.length);
        double[] compact = SeriesStatistics.compact(values, observed);
        for (int k = 0; k < observed.length; k++) {
            int from = Math.max(0, k - window);
            if (k - from < MIN_REFERENCE) {
                continue;
            }
            double v = compact[k];
            if (SeriesStatistics.allEqual(compact, from, k + 1)) {
                scores[observed[k]] = 0;
                continue;
            }
            double mean = SeriesStatistics.mean(compact, from, k);
            double std = SeriesStatistics.populationStd(compact, from, k, mean);
            scores[observed[k]] = std == 0 ? Double.POSITIVE_INFINITY : Math.abs(v - mean) / std;
        }
        return scores;
    }
}
