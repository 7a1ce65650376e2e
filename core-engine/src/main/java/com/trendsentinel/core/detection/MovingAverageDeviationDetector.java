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
 * Moving-average deviation detector.
 *
 * <p>
 * Compares each observed value with the mean of the trailing {@code window}
 * observed values, the value itself included. The point is an outlier when
 * {@code |value - mean| > threshold * std} with the sample standard deviation
 * of the window. Points before the first full window are not scored.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageDeviationDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MovingAverageDeviationDetector.class);

    private final int window;
    private final double threshold;

    /**
     * @param window    trailing window size, &gt;= 2
     * @param threshold allowed deviation in standard deviations, &gt; 0
     * @throws InvalidParameterException if a parameter is out of range
     */
    public MovingAverageDeviationDetector(int window, double threshold) {
        if (window < 2) {
            throw new InvalidParameterException("moving_average_window must be >= 2, got: " + window);
        }
        if (!(threshold > 0)) {
            throw new InvalidParameterException("moving_average_threshold must be > 0, got: " + threshold);
        }
        this.window = window;
        this.threshold = threshold;
    }

    @Override
    public List<DetectorResult> detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.values();
        int[] observed = SeriesStatistics.observedIndices(values);
        if (observed.length < window) {
            throw new DetectorUnavailableException(getName(),
                    "needs at least " + window + " observed points, got " + observed.length);
        }

        double[] compact = SeriesStatistics.compact(values, observed);
        double[] scores = SeriesStatistics.nanArray(values.length);
        for (int k = window - 1; k < compact.length; k++) {
            int from = k - window + 1;
            double mean = SeriesStatistics.mean(compact, from, k + 1);
            double std = SeriesStatistics.sampleStd(compact, from, k + 1, mean);
            scores[observed[k]] = std == 0 ? 0 : Math.abs(compact[k] - mean) / std;
        }

        List<DetectorResult> results = new ArrayList<>(values.length);
        int flagged = 0;
        for (int i = 0; i < values.length; i++) {
            boolean outlier = !Double.isNaN(scores[i]) && scores[i] > threshold;
            if (outlier) {
                flagged++;
            }
            results.add(new DetectorResult(getName(), series.timestampAt(i), scores[i], outlier));
        }
        LOG.debug("Series [{}]: moving average flagged {} of {} point(s)", series.getKey(), flagged,
                observed.length);
        return results;
    }

    @Override
    public String getName() {
        return DetectorType.MOVING_AVERAGE.getDetectorName();
    }

    public int getWindow() {
        return window;
    }

    public double getThreshold() {
        return threshold;
    }
}
