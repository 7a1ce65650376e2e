package com.trendsentinel.core.forecast;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.model.SeasonalityProfile;
import com.trendsentinel.core.model.SeasonalityProfile.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the seasonal period of a series from its autocorrelation.
 *
 * <p>
 * The autocorrelation is evaluated for lags {@code 2 .. n/2} of the observed
 * values; the first local peak reaching the minimum correlation is the
 * detected period. A configured period always wins, and
 * {@link AnalysisConfig#DEFAULT_SEASONAL_PERIOD} is used when nothing is
 * configured or detected.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalityDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalityDetector.class);

    private final double minCorrelation;

    public SeasonalityDetector(double minCorrelation) {
        this.minCorrelation = minCorrelation;
    }

    /**
     * @param observed   observed values in order
     * @param configured configured period, or {@code null}
     * @return the resolved profile
     */
    public SeasonalityProfile resolve(double[] observed, Integer configured) {
        if (configured != null) {
            double acf = configured < observed.length ? autocorrelation(observed, configured) : Double.NaN;
            return new SeasonalityProfile(acf >= minCorrelation, configured, acf, Source.CONFIGURED);
        }
        int maxLag = observed.length / 2;
        for (int lag = 2; lag <= maxLag; lag++) {
            double acf = autocorrelation(observed, lag);
            if (Double.isNaN(acf) || acf < minCorrelation) {
                continue;
            }
            double before = autocorrelation(observed, lag - 1);
            double after = lag + 1 < observed.length ? autocorrelation(observed, lag + 1) : Double.NEGATIVE_INFINITY;
            if (acf > before && acf >= after) {
                LOG.debug("Detected seasonal period {} (acf={})", lag, acf);
                return new SeasonalityProfile(true, lag, acf, Source.DETECTED);
            }
        }
        return new SeasonalityProfile(false, AnalysisConfig.DEFAULT_SEASONAL_PERIOD, Double.NaN, Source.DEFAULT);
    }

    /**
     * Sample autocorrelation at {@code lag}; {@code NaN} for a constant series.
     */
    static double autocorrelation(double[] x, int lag) {
        int n = x.length;
        double mean = 0;
        for (double v : x) {
            mean += v;
        }
        mean /= n;
        double denominator = 0;
        for (double v : x) {
            denominator += (v - mean) * (v - mean);
        }
        if (denominator == 0) {
            return Double.NaN;
        }
        double numerator = 0;
        for (int t = 0; t + lag < n; t++) {
            numerator += (x[t] - mean) * (x[t + lag] - mean);
        }
        return numerator / denominator;
    }

    public double getMinCorrelation() {
        return minCorrelation;
    }
}
