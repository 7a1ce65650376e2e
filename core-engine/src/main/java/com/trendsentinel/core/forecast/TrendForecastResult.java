package com.trendsentinel.core.forecast;

import com.trendsentinel.core.config.SmoothingMode;
import com.trendsentinel.core.model.Decomposition;
import com.trendsentinel.core.model.ForecastPoint;
import com.trendsentinel.core.model.GrowthMetrics;
import com.trendsentinel.core.model.SeasonalityProfile;
import com.trendsentinel.core.model.TrendSummary;

import java.util.List;
import java.util.Objects;

/**
 * Output of the trend and forecast engine for one series.
 *
 * @since 1.0.0
 */
public final class TrendForecastResult {

    private final SeasonalityProfile seasonality;
    private final Decomposition decomposition;
    private final SmoothingMode smoothingMode;
    private final double residualStd;
    private final List<ForecastPoint> forecast;
    private final TrendSummary trend;
    private final GrowthMetrics growth;

    TrendForecastResult(SeasonalityProfile seasonality, Decomposition decomposition, SmoothingMode smoothingMode,
            double residualStd, List<ForecastPoint> forecast, TrendSummary trend, GrowthMetrics growth) {
        this.seasonality = Objects.requireNonNull(seasonality, "seasonality must not be null");
        this.decomposition = decomposition;
        this.smoothingMode = Objects.requireNonNull(smoothingMode, "smoothingMode must not be null");
        this.residualStd = residualStd;
        this.forecast = List.copyOf(forecast);
        this.trend = Objects.requireNonNull(trend, "trend must not be null");
        this.growth = Objects.requireNonNull(growth, "growth must not be null");
    }

    public SeasonalityProfile getSeasonality() {
        return seasonality;
    }

    /**
     * @return the decomposition, or {@code null} when it was disabled or no
     *         period was configured or detected
     */
    public Decomposition getDecomposition() {
        return decomposition;
    }

    public SmoothingMode getSmoothingMode() {
        return smoothingMode;
    }

    public double getResidualStd() {
        return residualStd;
    }

    public List<ForecastPoint> getForecast() {
        return forecast;
    }

    public TrendSummary getTrend() {
        return trend;
    }

    public GrowthMetrics getGrowth() {
        return growth;
    }
}
