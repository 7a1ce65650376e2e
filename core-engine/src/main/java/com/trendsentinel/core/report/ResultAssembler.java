package com.trendsentinel.core.report;

import com.trendsentinel.core.detection.EnsembleResult;
import com.trendsentinel.core.forecast.TrendForecastResult;
import com.trendsentinel.core.model.AnalysisReport;
import com.trendsentinel.core.model.ConsensusResult;
import com.trendsentinel.core.model.Decomposition;
import com.trendsentinel.core.model.DecompositionPoint;
import com.trendsentinel.core.model.DetectorResult;
import com.trendsentinel.core.model.ForecastPoint;
import com.trendsentinel.core.model.ReportRow;
import com.trendsentinel.core.model.RowKind;
import com.trendsentinel.core.model.SeriesPoint;
import com.trendsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges the ensemble and forecast outputs of one series into an
 * {@link AnalysisReport}.
 *
 * <p>
 * The merge is pure: every analytical value is taken as computed, nothing is
 * recalculated. Rows follow the prepared series, so points dropped during
 * preparation never reappear, and forecast rows are appended after the last
 * observed row.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResultAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(ResultAssembler.class);

    /**
     * @param series   prepared series
     * @param ensemble ensemble output for {@code series}
     * @param trend    trend and forecast output, or {@code null} when trend
     *                 analysis is disabled
     * @return the report
     * @throws IllegalStateException if a result is not aligned with the series
     */
    public AnalysisReport assemble(TimeSeries series, EnsembleResult ensemble, TrendForecastResult trend) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(ensemble, "ensemble must not be null");

        List<ConsensusResult> consensus = ensemble.getConsensus();
        Map<String, List<DetectorResult>> detectorResults = ensemble.getResults();
        Decomposition decomposition = trend != null ? trend.getDecomposition() : null;

        AnalysisReport.Builder report = AnalysisReport.builder()
                .seriesKey(series.getKey())
                .frequency(series.getFrequency())
                .detectors(ensemble.getDetectorNames())
                .detectorFailures(ensemble.getFailures())
                .anomalySummary(ensemble.summarize(series.recordedCount()));

        for (int i = 0; i < series.size(); i++) {
            SeriesPoint point = series.getPoints().get(i);
            Instant ts = point.getTimestamp();
            ReportRow.Builder row = ReportRow.builder()
                    .kind(RowKind.OBSERVED)
                    .timestamp(ts)
                    .value(point.getValue())
                    .imputed(point.isImputed())
                    .sourceRow(point.getSourceRow())
                    .consensus(aligned(consensus.get(i).getTimestamp(), ts, consensus.get(i)));
            for (List<DetectorResult> results : detectorResults.values()) {
                DetectorResult result = results.get(i);
                row.detectorResult(aligned(result.getTimestamp(), ts, result));
            }
            if (decomposition != null) {
                DecompositionPoint component = decomposition.getPoints().get(i);
                row.decomposition(aligned(component.getTimestamp(), ts, component));
            }
            report.addRow(row.build());
        }

        if (trend != null) {
            for (ForecastPoint forecast : trend.getForecast()) {
                report.addRow(ReportRow.builder()
                        .kind(RowKind.FORECAST)
                        .timestamp(forecast.getTimestamp())
                        .forecast(forecast)
                        .build());
            }
            report.smoothingMode(trend.getSmoothingMode())
                    .residualStd(trend.getResidualStd())
                    .trend(trend.getTrend())
                    .growth(trend.getGrowth())
                    .seasonality(trend.getSeasonality());
            if (decomposition != null) {
                report.decomposition(decomposition.getMode(), decomposition.getPeriod());
            }
        }

        AnalysisReport result = report.build();
        LOG.debug("Assembled report for [{}]: {} row(s)", series.getKey(), result.getRows().size());
        return result;
    }

    private static <T> T aligned(Instant actual, Instant expected, T value) {
        if (!actual.equals(expected)) {
            throw new IllegalStateException("Result at " + actual + " is not aligned with series point " + expected);
        }
        return value;
    }
}
