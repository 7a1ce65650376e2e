package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.trendsentinel.core.config.DecompositionMode;
import com.trendsentinel.core.config.SmoothingMode;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of analyzing one series: row-aligned anomaly and decomposition data
 * followed by forecast rows, plus series-level summaries.
 *
 * <p>
 * Constructed once per invocation by the result assembler and immutable
 * afterwards. Trend-related members are {@code null} when trend analysis is
 * disabled.
 * </p>
 *
 * <h3>Row order</h3>
 * <p>
 * Rows are sorted by timestamp, all observed rows precede all forecast rows.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SeriesKey seriesKey;
    private final Duration frequency;
    private final List<ReportRow> rows;
    private final List<String> detectors;
    private final List<DetectorFailure> detectorFailures;
    private final DecompositionMode decompositionMode;
    private final Integer decompositionPeriod;
    private final SmoothingMode smoothingMode;
    private final double residualStd;
    private final TrendSummary trend;
    private final GrowthMetrics growth;
    private final SeasonalityProfile seasonality;
    private final AnomalySummary anomalySummary;

    private AnalysisReport(Builder builder) {
        this.seriesKey = Objects.requireNonNull(builder.seriesKey, "seriesKey must not be null");
        this.frequency = builder.frequency;
        this.rows = Collections.unmodifiableList(new ArrayList<>(builder.rows));
        this.detectors = List.copyOf(builder.detectors);
        this.detectorFailures = List.copyOf(builder.detectorFailures);
        this.decompositionMode = builder.decompositionMode;
        this.decompositionPeriod = builder.decompositionPeriod;
        this.smoothingMode = builder.smoothingMode;
        this.residualStd = builder.residualStd;
        this.trend = builder.trend;
        this.growth = builder.growth;
        this.seasonality = builder.seasonality;
        this.anomalySummary = Objects.requireNonNull(builder.anomalySummary, "anomalySummary must not be null");
        for (int i = 1; i < rows.size(); i++) {
            ReportRow prev = rows.get(i - 1);
            ReportRow cur = rows.get(i);
            if (prev.getKind() == RowKind.FORECAST && cur.getKind() == RowKind.OBSERVED) {
                throw new IllegalArgumentException("Observed rows must precede forecast rows");
            }
            if (!cur.getTimestamp().isAfter(prev.getTimestamp())) {
                throw new IllegalArgumentException("Rows must be in strictly ascending timestamp order");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    public Duration getFrequency() {
        return frequency;
    }

    /**
     * Rendered separately as a table, see
     * {@code com.trendsentinel.core.report.ReportTableWriter}.
     *
     * @return all rows, observed first
     */
    @JsonIgnore
    public List<ReportRow> getRows() {
        return rows;
    }

    @JsonIgnore
    public List<ReportRow> getObservedRows() {
        return rows.stream().filter(r -> r.getKind() == RowKind.OBSERVED).toList();
    }

    @JsonIgnore
    public List<ForecastPoint> getForecast() {
        return rows.stream()
                .filter(r -> r.getKind() == RowKind.FORECAST)
                .map(ReportRow::getForecast)
                .toList();
    }

    /**
     * @return names of detectors that contributed to the consensus
     */
    public List<String> getDetectors() {
        return detectors;
    }

    public List<DetectorFailure> getDetectorFailures() {
        return detectorFailures;
    }

    public DecompositionMode getDecompositionMode() {
        return decompositionMode;
    }

    public Integer getDecompositionPeriod() {
        return decompositionPeriod;
    }

    public SmoothingMode getSmoothingMode() {
        return smoothingMode;
    }

    /**
     * @return RMS of the in-sample one-step residuals, {@code null} when no
     *         forecast was produced
     */
    public Double getResidualStd() {
        return Double.isNaN(residualStd) ? null : residualStd;
    }

    public TrendSummary getTrend() {
        return trend;
    }

    public GrowthMetrics getGrowth() {
        return growth;
    }

    public SeasonalityProfile getSeasonality() {
        return seasonality;
    }

    public AnomalySummary getAnomalySummary() {
        return anomalySummary;
    }

    @Override
    public String toString() {
        return "AnalysisReport{" + seriesKey + ", rows=" + rows.size() + ", detectors=" + detectors
                + ", trend=" + trend + '}';
    }

    /**
     * Fluent builder for {@link AnalysisReport}. {@code seriesKey} and
     * {@code anomalySummary} are required.
     */
    public static class Builder {
        private SeriesKey seriesKey;
        private Duration frequency;
        private final List<ReportRow> rows = new ArrayList<>();
        private List<String> detectors = List.of();
        private List<DetectorFailure> detectorFailures = List.of();
        private DecompositionMode decompositionMode;
        private Integer decompositionPeriod;
        private SmoothingMode smoothingMode;
        private double residualStd = Double.NaN;
        private TrendSummary trend;
        private GrowthMetrics growth;
        private SeasonalityProfile seasonality;
        private AnomalySummary anomalySummary;

        public Builder seriesKey(SeriesKey seriesKey) {
            this.seriesKey = seriesKey;
            return this;
        }

        public Builder frequency(Duration frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder addRow(ReportRow row) {
            this.rows.add(Objects.requireNonNull(row, "row must not be null"));
            return this;
        }

        public Builder detectors(List<String> detectors) {
            this.detectors = detectors;
            return this;
        }

        public Builder detectorFailures(List<DetectorFailure> detectorFailures) {
            this.detectorFailures = detectorFailures;
            return this;
        }

        public Builder decomposition(DecompositionMode mode, Integer period) {
            this.decompositionMode = mode;
            this.decompositionPeriod = period;
            return this;
        }

        public Builder smoothingMode(SmoothingMode smoothingMode) {
            this.smoothingMode = smoothingMode;
            return this;
        }

        public Builder residualStd(double residualStd) {
            this.residualStd = residualStd;
            return this;
        }

        public Builder trend(TrendSummary trend) {
            this.trend = trend;
            return this;
        }

        public Builder growth(GrowthMetrics growth) {
            this.growth = growth;
            return this;
        }

        public Builder seasonality(SeasonalityProfile seasonality) {
            this.seasonality = seasonality;
            return this;
        }

        public Builder anomalySummary(AnomalySummary anomalySummary) {
            this.anomalySummary = anomalySummary;
            return this;
        }

        /**
         * @return a new {@link AnalysisReport}
         * @throws NullPointerException     if a required member is missing
         * @throws IllegalArgumentException if rows are out of order
         */
        public AnalysisReport build() {
            return new AnalysisReport(this);
        }
    }
}
