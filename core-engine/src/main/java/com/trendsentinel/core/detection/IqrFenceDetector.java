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
 * Interquartile-range fence detector.
 *
 * <p>
 * Q1 and Q3 are computed by linear interpolation over the whole series, or over
 * the trailing {@code window} observed values including the point. A value
 * outside {@code [Q1 - k * IQR, Q3 + k * IQR]} is an outlier. The score is the
 * distance beyond the nearer quartile in IQR units, so a point is flagged
 * exactly when its score exceeds {@code k}. With a zero IQR any value outside
 * {@code [Q1, Q3]} scores {@link Double#POSITIVE_INFINITY}.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrFenceDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IqrFenceDetector.class);

    static final int MIN_OBSERVED = 4;

    private final double multiplier;
    private final Integer window;

    /**
     * @param multiplier fence width {@code k} in IQR units, &gt; 0
     * @param window     trailing window of observed values, or {@code null} for
     *                   the whole series
     * @throws InvalidParameterException if a parameter is out of range
     */
    public IqrFenceDetector(double multiplier, Integer window) {
        if (!(multiplier > 0)) {
            throw new InvalidParameterException("iqr_multiplier must be > 0, got: " + multiplier);
        }
        if (window != null && window < MIN_OBSERVED) {
            throw new InvalidParameterException("iqr_window must be >= " + MIN_OBSERVED + ", got: " + window);
        }
        this.multiplier = multiplier;
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

        double[] compact = SeriesStatistics.compact(values, observed);
        double[] scores = SeriesStatistics.nanArray(values.length);
        if (window == null) {
            double[] sorted = SeriesStatistics.sortedCopy(compact, 0, compact.length);
            double q1 = SeriesStatistics.quantile(sorted, 0.25);
            double q3 = SeriesStatistics.quantile(sorted, 0.75);
            LOG.debug("Series [{}]: Q1={} Q3={} IQR={}", series.getKey(), q1, q3, q3 - q1);
            for (int k = 0; k < observed.length; k++) {
                scores[observed[k]] = score(compact[k], q1, q3);
            }
        } else {
            for (int k = window - 1; k < observed.length; k++) {
                double[] sorted = SeriesStatistics.sortedCopy(compact, k - window + 1, k + 1);
                scores[observed[k]] = score(compact[k], SeriesStatistics.quantile(sorted, 0.25),
                        SeriesStatistics.quantile(sorted, 0.75));
            }
        }

        List<DetectorResult> results = new ArrayList<>(values.length);
        int flagged = 0;
        for (int i = 0; i < values.length; i++) {
            boolean outlier = !Double.isNaN(scores[i]) && scores[i] > multiplier;
            if (outlier) {
                flagged++;
            }
            results.add(new DetectorResult(getName(), series.timestampAt(i), scores[i], outlier));
        }
        LOG.debug("Series [{}]: IQR fence flagged {} of {} point(s)", series.getKey(), flagged, observed.length);
        return results;
    }

    @Override
    public String getName() {
        return DetectorType.IQR.getDetectorName();
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Integer getWindow() {
        return window;
    }

    private static double score(double value, double q1, double q3) {
        double iqr = q3 - q1;
        double distance;
        if (value < q1) {
            distance = q1 - value;
        } else if (value > q3) {
            distance = value - q3;
        } else {
            return 0;
        }
        return iqr == 0 ? Double.POSITIVE_INFINITY : distance / iqr;
    }
}
