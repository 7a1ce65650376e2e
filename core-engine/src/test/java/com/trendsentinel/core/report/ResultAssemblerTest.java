package com.trendsentinel.core.report;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.config.DetectorType;
import com.trendsentinel.core.detection.AnomalyEnsemble;
import com.trendsentinel.core.detection.EnsembleResult;
import com.trendsentinel.core.forecast.ForecastEngine;
import com.trendsentinel.core.forecast.TrendForecastResult;
import com.trendsentinel.core.model.AnalysisReport;
import com.trendsentinel.core.model.ReportRow;
import com.trendsentinel.core.model.RowKind;
import com.trendsentinel.core.model.SeriesKey;
import com.trendsentinel.core.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.trendsentinel.core.SeriesFixtures.config;
import static com.trendsentinel.core.SeriesFixtures.daily;
import static com.trendsentinel.core.SeriesFixtures.ramp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ResultAssembler}.
 */
class ResultAssemblerTest {

    private AnalysisConfig config;
    private ResultAssembler assembler;

    @BeforeEach
    void setUp() {
        config = config().detectors(DetectorType.ZSCORE, DetectorType.IQR).forecastHorizon(3).build();
        assembler = new ResultAssembler();
    }

    @Test
    @DisplayName("Should append forecast rows after every observed row")
    void shouldAppendForecastRows() {
        TimeSeries series = daily(ramp(12, 10, 2));
        EnsembleResult ensemble = AnomalyEnsemble.fromConfig(config, null).run(series);
        TrendForecastResult trend = new ForecastEngine(config).analyze(series);

        AnalysisReport report = assembler.assemble(series, ensemble, trend);

        assertThat(report.getRows()).hasSize(15);
        assertThat(report.getRows().subList(0, 12)).allMatch(r -> r.getKind() == RowKind.OBSERVED);
        assertThat(report.getRows().subList(12, 15)).allMatch(r -> r.getKind() == RowKind.FORECAST);
        assertThat(report.getObservedRows()).extracting(ReportRow::getValue)
                .containsExactly(10.0, 12.0, 14.0, 16.0, 18.0, 20.0, 22.0, 24.0, 26.0, 28.0, 30.0, 32.0);
        assertThat(report.getForecast()).isEqualTo(trend.getForecast());
        assertThat(report.getTrend()).isEqualTo(trend.getTrend());
        assertThat(report.getDetectors()).containsExactly("zscore", "iqr");
        assertThat(report.getRows().get(0).getDetectorResults()).containsOnlyKeys("zscore", "iqr");
    }

    @Test
    @DisplayName("Should carry the ensemble values unchanged")
    void shouldCarryEnsembleValues() {
        TimeSeries series = daily(10, 10, 10, 10, 100, 10, 10);
        EnsembleResult ensemble = AnomalyEnsemble.fromConfig(config, null).run(series);

        AnalysisReport report = assembler.assemble(series, ensemble, null);

        for (int i = 0; i < series.size(); i++) {
            ReportRow row = report.getRows().get(i);
            assertThat(row.getConsensus()).isEqualTo(ensemble.getConsensus().get(i));
            assertThat(row.getDetectorResults().get("zscore")).isEqualTo(ensemble.getResults().get("zscore").get(i));
        }
        assertThat(report.getAnomalySummary().getConsensusAnomalies()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should omit trend fields when trend analysis did not run")
    void shouldOmitTrendFields() {
        TimeSeries series = daily(1, 2, 3, 4, 5);
        EnsembleResult ensemble = AnomalyEnsemble.fromConfig(config, null).run(series);

        AnalysisReport report = assembler.assemble(series, ensemble, null);

        assertThat(report.getRows()).hasSize(5);
        assertThat(report.getForecast()).isEmpty();
        assertThat(report.getTrend()).isNull();
        assertThat(report.getSeasonality()).isNull();
        assertThat(report.getResidualStd()).isNull();
    }

    @Test
    @DisplayName("Should reject results computed for another series")
    void shouldRejectMisalignedResults() {
        TimeSeries series = daily(1, 2, 3, 4, 5);
        TimeSeries shifted = TimeSeries.regular(SeriesKey.of("TotalSales"), Instant.parse("2023-06-01T00:00:00Z"),
                Duration.ofDays(1), 1, 2, 3, 4, 5);
        EnsembleResult ensemble = AnomalyEnsemble.fromConfig(config, null).run(shifted);

        assertThatThrownBy(() -> assembler.assemble(series, ensemble, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not aligned");
    }
}
