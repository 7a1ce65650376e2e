package com.trendsentinel.job;

import com.trendsentinel.core.analysis.AnalysisOutcome;
import com.trendsentinel.core.analysis.TimeSeriesAnalyzer;
import com.trendsentinel.core.error.ErrorCode;
import com.trendsentinel.core.model.SeriesKey;
import com.trendsentinel.core.preparation.RawSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesFanOut}.
 */
class SeriesFanOutTest {

    private TimeSeriesAnalyzer analyzer;
    private List<RawSeries> series;
    private JobMetrics metrics;

    @BeforeEach
    void setUp() {
        analyzer = new TimeSeriesAnalyzer(JobFixtures.config());
        series = analyzer.split(JobFixtures.stores(), JobFixtures.LAYOUT);
        metrics = new JobMetrics();
    }

    @Test
    @DisplayName("Should return outcomes in input order")
    void keepsInputOrder() {
        List<AnalysisOutcome> outcomes = analyzeAll(4);

        assertThat(outcomes).extracting(AnalysisOutcome::getSeriesKey).containsExactly(
                new SeriesKey("TotalSales", Map.of("Store", "north")),
                new SeriesKey("TotalSales", Map.of("Store", "south")),
                new SeriesKey("TotalSales", Map.of("Store", "east")));
    }

    @Test
    @DisplayName("Should isolate a failing series from its siblings")
    void isolatesFailures() {
        List<AnalysisOutcome> outcomes = analyzeAll(2);

        assertThat(outcomes.get(0).isSuccess()).isTrue();
        assertThat(outcomes.get(1).isSuccess()).isTrue();
        assertThat(outcomes.get(2).isSuccess()).isFalse();
        assertThat(outcomes.get(2).getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("Should produce the same reports as sequential analysis")
    void matchesSequentialAnalysis() {
        List<AnalysisOutcome> parallel = analyzeAll(3);

        for (int i = 0; i < series.size(); i++) {
            AnalysisOutcome sequential = analyzer.analyzeSafely(series.get(i));
            assertThat(parallel.get(i).isSuccess()).isEqualTo(sequential.isSuccess());
            if (sequential.isSuccess()) {
                assertThat(parallel.get(i).getReport().getRows()).isEqualTo(sequential.getReport().getRows());
                assertThat(parallel.get(i).getReport().getAnomalySummary())
                        .isEqualTo(sequential.getReport().getAnomalySummary());
            } else {
                assertThat(parallel.get(i).getMessage()).isEqualTo(sequential.getMessage());
            }
        }
    }

    @Test
    @DisplayName("Should count analyzed and failed series")
    void recordsMetrics() {
        List<AnalysisOutcome> outcomes = analyzeAll(2);

        long anomalies = outcomes.stream()
                .filter(AnalysisOutcome::isSuccess)
                .mapToLong(o -> o.getReport().getAnomalySummary().getConsensusAnomalies())
                .sum();
        assertThat(metrics.seriesAnalyzed()).isEqualTo(2);
        assertThat(metrics.seriesFailed()).isEqualTo(1);
        assertThat(metrics.consensusAnomalies()).isEqualTo(anomalies);
        assertThat(metrics.getRegistry().get(JobMetrics.ANALYSIS_DURATION).timer().count()).isEqualTo(3);
        assertThat(metrics.getRegistry().get(JobMetrics.SERIES_FAILED).tag("code", "TS-003").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should handle an empty series list")
    void emptyInput() {
        try (SeriesFanOut fanOut = new SeriesFanOut(analyzer, 2, metrics)) {
            assertThat(fanOut.analyzeAll(List.of())).isEmpty();
        }
    }

    @Test
    @DisplayName("Should reject parallelism below one")
    void rejectsZeroParallelism() {
        assertThatThrownBy(() -> new SeriesFanOut(analyzer, 0, metrics))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("parallelism must be >= 1, got: 0");
    }

    // ---------------------------------------------------------------
    // Helper
    // ---------------------------------------------------------------

    private List<AnalysisOutcome> analyzeAll(int parallelism) {
        try (SeriesFanOut fanOut = new SeriesFanOut(analyzer, parallelism, metrics)) {
            return fanOut.analyzeAll(series);
        }
    }
}
