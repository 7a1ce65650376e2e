package com.trendsentinel.core.forecast;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.config.DecompositionMode;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.error.InvalidParameterException;
import com.trendsentinel.core.model.Decomposition;
import com.trendsentinel.core.model.ForecastPoint;
import com.trendsentinel.core.model.SeasonalityProfile;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.model.TrendSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Trend and forecast branch of an analysis.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Resolve the seasonal period ({@link SeasonalityDetector}).</li>
 * <li>Decompose the series when enabled and the period is configured or
 * detected ({@link SeasonalDecomposer}).</li>
 * <li>Fit the configured exponential smoothing ({@link ExponentialSmoother})
 * and project {@code forecast_horizon} points with bounds
 * {@code point +/- z * sigma * sqrt(k)}.</li>
 * <li>Classify the trend ({@link TrendClassifier}) and compute growth
 * ({@link GrowthCalculator}).</li>
 * </ol>
 *
 * <p>
 * Stateless and thread-safe; one instance may serve any number of series.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastEngine.class);

    private final AnalysisConfig config;
    private final SeasonalityDetector seasonalityDetector;
    private final SeasonalDecomposer decomposer;
    private final ExponentialSmoother smoother;
    private final TrendClassifier classifier;
    private final GrowthCalculator growthCalculator;

    public ForecastEngine(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (config.getForecastHorizon() == null || config.getForecastHorizon() < 1) {
            throw new InvalidParameterException("forecast_horizon must be >= 1, got: " + config.getForecastHorizon());
        }
        this.seasonalityDetector = new SeasonalityDetector(config.getSeasonalityMinCorrelation());
        this.decomposer = new SeasonalDecomposer();
        this.smoother = new ExponentialSmoother(config.getSmoothingMode(), config.getDecompositionMode(),
                config.getAlpha(), config.getBeta(), config.getGamma());
        this.classifier = new TrendClassifier(config.getTrendNoiseFloor());
        this.growthCalculator = new GrowthCalculator();
    }

    /**
     * Resolve the seasonal period of a series.
     *
     * @param series prepared series
     * @return seasonality profile
     */
    public SeasonalityProfile resolveSeasonality(TimeSeries series) {
        return seasonalityDetector.resolve(series.observedValues(), config.getSeasonalPeriod());
    }

    /**
     * Fail early when the series is too short for the enabled methods.
     *
     * @param series prepared series
     * @throws InsufficientDataException naming the first method that cannot run
     */
    public void checkSufficient(TimeSeries series) {
        checkSufficient(series, resolveSeasonality(series));
    }

    /**
     * Run the full branch.
     *
     * @param series prepared series
     * @return decomposition, forecast, trend and growth
     * @throws InsufficientDataException if the series is too short
     * @throws InvalidParameterException if the values do not suit the mode
     */
    public TrendForecastResult analyze(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        SeasonalityProfile seasonality = resolveSeasonality(series);
        checkSufficient(series, seasonality);
        int period = seasonality.getPeriod();

        Decomposition decomposition = null;
        if (decomposes(seasonality)) {
            decomposition = decomposer.decompose(series, period, config.getDecompositionMode());
        } else if (config.isDecompositionEnabled()) {
            LOG.debug("Series [{}]: no seasonal period configured or detected, decomposition skipped",
                    series.getKey());
        }

        SmoothingFit fit = smoother.fit(series.values(), period);
        double sigma = fit.getResidualStd();
        int horizon = config.getForecastHorizon();
        List<ForecastPoint> forecast = new ArrayList<>(horizon);
        for (int k = 1; k <= horizon; k++) {
            double point = fit.forecast(k);
            double margin = config.getConfidenceZ() * sigma * Math.sqrt(k);
            forecast.add(new ForecastPoint(series.timestampAfterLast(k), k, point, point - margin, point + margin));
        }

        TrendSummary trend = classifier.classify(series.values());
        LOG.debug("Series [{}]: trend {} (slope={}, r2={}), {} forecast point(s), sigma={}", series.getKey(),
                trend.getDirection().getLabel(), trend.getSlope(), trend.getStrength(), horizon, sigma);
        return new TrendForecastResult(seasonality, decomposition, config.getSmoothingMode(), sigma, forecast, trend,
                growthCalculator.calculate(series.observedValues()));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean decomposes(SeasonalityProfile seasonality) {
        return config.isDecompositionEnabled() && seasonality.getSource() != SeasonalityProfile.Source.DEFAULT;
    }

    private void checkSufficient(TimeSeries series, SeasonalityProfile seasonality) {
        int observed = series.observedCount();
        int period = seasonality.getPeriod();
        if (decomposes(seasonality) && observed < 2 * period) {
            throw new InsufficientDataException("decomposition with period " + period, 2 * period, observed);
        }
        int smoothing = smoother.requiredObservations(period);
        if (observed < smoothing) {
            throw new InsufficientDataException(
                    config.getSmoothingMode().name().toLowerCase(Locale.ROOT) + " exponential smoothing",
                    smoothing, observed);
        }
        if (config.getDecompositionMode() == DecompositionMode.MULTIPLICATIVE && decomposes(seasonality)) {
            for (double v : series.observedValues()) {
                if (v <= 0) {
                    throw new InvalidParameterException(
                            "multiplicative decomposition requires strictly positive values, got: " + v);
                }
            }
        }
    }
}
