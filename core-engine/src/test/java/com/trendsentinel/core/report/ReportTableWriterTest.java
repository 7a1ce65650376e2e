package com.trendsentinel.core.report;

import com.trendsentinel.core.analysis.TimeSeriesAnalyzer;
import com.trendsentinel.core.config.DetectorType;
import com.trendsentinel.core.config.TableLayout;
import com.trendsentinel.core.model.AnalysisReport;
import com.trendsentinel.core.model.Column;
import com.trendsentinel.core.model.ColumnType;
import com.trendsentinel.core.model.DataTable;
import com.trendsentinel.core.model.TableSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static com.trendsentinel.core.SeriesFixtures.config;
import static com.trendsentinel.core.SeriesFixtures.daily;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportTableWriter}.
 */
class ReportTableWriterTest {

    private TimeSeriesAnalyzer analyzer;
    private ReportTableWriter writer;

    @BeforeEach
    void setUp() {
        analyzer = new TimeSeriesAnalyzer(config()
                .detectors(DetectorType.ZSCORE, DetectorType.IQR)
                .forecastHorizon(2)
                .build());
        writer = new ReportTableWriter();
    }

    @Test
    @DisplayName("Should add the documented columns after the base columns")
    void shouldNameColumns() {
        AnalysisReport report = analyzer.analyze(daily(10, 10, 10, 10, 100, 10, 10));

        DataTable table = writer.toTable(report);

        assertThat(table.getSchema().names()).containsExactly(
                "timestamp", "TotalSales",
                "is_imputed", "row_kind",
                "is_anomaly_zscore", "anomaly_score_zscore",
                "is_anomaly_iqr", "anomaly_score_iqr",
                "is_anomaly_consensus", "consensus_votes", "consensus_total",
                "trend_component", "seasonal_component", "residual_component",
                "forecast_point", "forecast_lower", "forecast_upper");
        assertThat(table.rowCount()).isEqualTo(9);
    }

    @Test
    @DisplayName("Should fill observed and forecast rows with their own fields")
    void shouldRenderRows() {
        AnalysisReport report = analyzer.analyze(daily(10, 10, 10, 10, 100, 10, 10));

        DataTable table = writer.toTable(report);

        Map<String, Object> spike = table.row(4);
        assertThat(spike).containsEntry("timestamp", Instant.parse("2024-01-05T00:00:00Z"))
                .containsEntry("TotalSales", 100.0)
                .containsEntry("row_kind", "OBSERVED")
                .containsEntry("is_anomaly_zscore", true)
                .containsEntry("is_anomaly_consensus", true)
                .containsEntry("consensus_votes", 2)
                .containsEntry("consensus_total", 2)
                .containsEntry("forecast_point", null)
                .containsEntry("trend_component", null);

        Map<String, Object> forecast = table.row(7);
        assertThat(forecast).containsEntry("row_kind", "FORECAST")
                .containsEntry("TotalSales", null)
                .containsEntry("is_anomaly_zscore", null)
                .containsEntry("is_anomaly_consensus", null);
        assertThat(forecast.get("forecast_point")).isInstanceOf(Double.class);
        assertThat((Double) forecast.get("forecast_lower")).isLessThanOrEqualTo((Double) forecast.get("forecast_point"));
    }

    @Test
    @DisplayName("Should render missing values as empty cells")
    void shouldRenderMissingValuesAsNull() {
        AnalysisReport report = analyzer.analyze(daily(1, 2, Double.NaN, 4, 5, 6));

        Map<String, Object> missing = writer.toTable(report).row(2);

        assertThat(missing).containsEntry("TotalSales", null)
                .containsEntry("anomaly_score_zscore", null)
                .containsEntry("is_anomaly_zscore", false);
    }

    @Test
    @DisplayName("Should keep every input column and carry its values")
    void shouldKeepInputColumns() {
        TableSchema schema = TableSchema.of(
                Column.of("Date", ColumnType.TIMESTAMP),
                Column.of("Store", ColumnType.STRING),
                Column.of("TotalSales", ColumnType.NUMERIC));
        DataTable.Builder input = DataTable.builder(schema);
        for (int i = 0; i < 6; i++) {
            input.addRow(LocalDate.of(2024, 1, 1).plusDays(i), "S-" + i, 10.0 + i);
        }
        AnalysisReport report = analyzer.analyze(input.build(), TableLayout.of("Date", "TotalSales"));

        DataTable table = writer.toTable(report, schema, "Date");

        assertThat(table.getSchema().names()).startsWith("Date", "Store", "TotalSales", "is_imputed");
        assertThat(table.getSchema().column("Date").map(Column::getType)).contains(ColumnType.TIMESTAMP);
        assertThat(table.row(3)).containsEntry("Store", "S-3")
                .containsEntry("Date", Instant.parse("2024-01-04T00:00:00Z"));
        assertThat(table.row(6)).containsEntry("Store", null).containsEntry("row_kind", "FORECAST");
    }
}
