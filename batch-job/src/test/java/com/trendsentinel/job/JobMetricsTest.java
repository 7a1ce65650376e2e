package com.trendsentinel.job;

import com.trendsentinel.core.analysis.AnalysisOutcome;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.error.SchemaException;
import com.trendsentinel.core.model.SeriesKey;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JobMetrics}.
 */
class JobMetricsTest {

    private SimpleMeterRegistry registry;
    private JobMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new JobMetrics(registry);
    }

    @Test
    @DisplayName("Should start with zero counts")
    void startsEmpty() {
        assertThat(metrics.seriesAnalyzed()).isZero();
        assertThat(metrics.seriesFailed()).isZero();
        assertThat(metrics.consensusAnomalies()).isZero();
    }

    @Test
    @DisplayName("Should tag failures with their error code")
    void tagsFailures() {
        metrics.record(AnalysisOutcome.failure(SeriesKey.of("TotalSales"),
                new InsufficientDataException("double exponential smoothing", 3, 2)));
        metrics.record(AnalysisOutcome.failure(null, new SchemaException("Date", "column does not exist")));
        metrics.record(AnalysisOutcome.failure(SeriesKey.of("Units"),
                new InsufficientDataException("double exponential smoothing", 3, 1)));

        assertThat(metrics.seriesFailed()).isEqualTo(3);
        assertThat(registry.get(JobMetrics.SERIES_FAILED).tag("code", "TS-003").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(JobMetrics.SERIES_FAILED).tag("code", "TS-001").counter().count()).isEqualTo(1.0);
        assertThat(metrics.seriesAnalyzed()).isZero();
    }

    @Test
    @DisplayName("Should time the supplied analysis and return its outcome")
    void timesAnalysis() {
        AnalysisOutcome expected = AnalysisOutcome.failure(SeriesKey.of("TotalSales"),
                new InsufficientDataException("series TotalSales", 2, 0));

        AnalysisOutcome actual = metrics.time(() -> expected);

        assertThat(actual).isSameAs(expected);
        assertThat(registry.get(JobMetrics.ANALYSIS_DURATION).timer().count()).isEqualTo(1);
        metrics.logSummary();
    }
}
