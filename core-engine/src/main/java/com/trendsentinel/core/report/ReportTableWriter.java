package com.trendsentinel.core.report;

import com.trendsentinel.core.model.AnalysisReport;
import com.trendsentinel.core.model.Column;
import com.trendsentinel.core.model.ColumnType;
import com.trendsentinel.core.model.ConsensusResult;
import com.trendsentinel.core.model.DataTable;
import com.trendsentinel.core.model.DecompositionPoint;
import com.trendsentinel.core.model.DetectorResult;
import com.trendsentinel.core.model.ForecastPoint;
import com.trendsentinel.core.model.ReportRow;
import com.trendsentinel.core.model.TableSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders an {@link AnalysisReport} as an augmented {@link DataTable}.
 *
 * <h3>Columns</h3>
 * <ul>
 * <li>The base columns: every input column, or just timestamp, metric and
 * dimensions when no input schema is given. The timestamp column holds the
 * normalized {@link java.time.Instant}, the metric column the prepared value,
 * and dimension columns the series' dimension values on every row.</li>
 * <li>{@value #IS_IMPUTED}, {@value #ROW_KIND}</li>
 * <li>{@code is_anomaly_<detector>}, {@code anomaly_score_<detector>} per
 * contributing detector</li>
 * <li>{@value #IS_ANOMALY_CONSENSUS}, {@value #CONSENSUS_VOTES},
 * {@value #CONSENSUS_TOTAL}</li>
 * <li>{@value #TREND_COMPONENT}, {@value #SEASONAL_COMPONENT},
 * {@value #RESIDUAL_COMPONENT}</li>
 * <li>{@value #FORECAST_POINT}, {@value #FORECAST_LOWER},
 * {@value #FORECAST_UPPER} (forecast rows only)</li>
 * </ul>
 * <p>
 * {@code NaN} values are rendered as {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReportTableWriter {

    public static final String DEFAULT_TIMESTAMP_COLUMN = "timestamp";

    public static final String IS_IMPUTED = "is_imputed";
    public static final String ROW_KIND = "row_kind";
    public static final String IS_ANOMALY_PREFIX = "is_anomaly_";
    public static final String ANOMALY_SCORE_PREFIX = "anomaly_score_";
    public static final String IS_ANOMALY_CONSENSUS = "is_anomaly_consensus";
    public static final String CONSENSUS_VOTES = "consensus_votes";
    public static final String CONSENSUS_TOTAL = "consensus_total";
    public static final String TREND_COMPONENT = "trend_component";
    public static final String SEASONAL_COMPONENT = "seasonal_component";
    public static final String RESIDUAL_COMPONENT = "residual_component";
    public static final String FORECAST_POINT = "forecast_point";
    public static final String FORECAST_LOWER = "forecast_lower";
    public static final String FORECAST_UPPER = "forecast_upper";

    /**
     * Render with minimal base columns: {@value #DEFAULT_TIMESTAMP_COLUMN}, the
     * metric and the dimensions.
     *
     * @param report analysis report
     * @return augmented table
     */
    public DataTable toTable(AnalysisReport report) {
        Objects.requireNonNull(report, "report must not be null");
        List<Column> base = new ArrayList<>();
        base.add(Column.of(DEFAULT_TIMESTAMP_COLUMN, ColumnType.TIMESTAMP));
        base.add(Column.of(report.getSeriesKey().getMetric(), ColumnType.NUMERIC));
        for (String dimension : report.getSeriesKey().getDimensions().keySet()) {
            base.add(Column.of(dimension, ColumnType.STRING));
        }
        return render(report, TableSchema.of(base), DEFAULT_TIMESTAMP_COLUMN);
    }

    /**
     * Render with every column of the input table.
     *
     * @param report          analysis report
     * @param inputSchema     schema of the analyzed table
     * @param timestampColumn timestamp column of the analyzed table
     * @return augmented table
     * @throws IllegalArgumentException if an added column clashes with an input
     *                                  column
     */
    public DataTable toTable(AnalysisReport report, TableSchema inputSchema, String timestampColumn) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(inputSchema, "inputSchema must not be null");
        Objects.requireNonNull(timestampColumn, "timestampColumn must not be null");
        String metric = report.getSeriesKey().getMetric();
        List<Column> base = new ArrayList<>();
        for (Column column : inputSchema.getColumns()) {
            if (column.getName().equals(timestampColumn)) {
                base.add(Column.of(column.getName(), ColumnType.TIMESTAMP));
            } else if (column.getName().equals(metric)) {
                base.add(Column.of(column.getName(), ColumnType.NUMERIC));
            } else {
                base.add(column);
            }
        }
        return render(report, TableSchema.of(base), timestampColumn);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DataTable render(AnalysisReport report, TableSchema base, String timestampColumn) {
        List<String> detectors = report.getDetectors();
        List<Column> added = new ArrayList<>();
        added.add(Column.of(IS_IMPUTED, ColumnType.BOOLEAN));
        added.add(Column.of(ROW_KIND, ColumnType.STRING));
        for (String detector : detectors) {
            added.add(Column.of(IS_ANOMALY_PREFIX + detector, ColumnType.BOOLEAN));
            added.add(Column.of(ANOMALY_SCORE_PREFIX + detector, ColumnType.NUMERIC));
        }
        added.add(Column.of(IS_ANOMALY_CONSENSUS, ColumnType.BOOLEAN));
        added.add(Column.of(CONSENSUS_VOTES, ColumnType.NUMERIC));
        added.add(Column.of(CONSENSUS_TOTAL, ColumnType.NUMERIC));
        added.add(Column.of(TREND_COMPONENT, ColumnType.NUMERIC));
        added.add(Column.of(SEASONAL_COMPONENT, ColumnType.NUMERIC));
        added.add(Column.of(RESIDUAL_COMPONENT, ColumnType.NUMERIC));
        added.add(Column.of(FORECAST_POINT, ColumnType.NUMERIC));
        added.add(Column.of(FORECAST_LOWER, ColumnType.NUMERIC));
        added.add(Column.of(FORECAST_UPPER, ColumnType.NUMERIC));
        TableSchema schema = base.extend(added);

        String metric = report.getSeriesKey().getMetric();
        Map<String, String> dimensions = report.getSeriesKey().getDimensions();
        DataTable.Builder table = DataTable.builder(schema);
        for (ReportRow row : report.getRows()) {
            Map<String, Object> cells = new LinkedHashMap<>();
            for (Column column : base.getColumns()) {
                cells.put(column.getName(), row.getSourceRow().get(column.getName()));
            }
            cells.put(timestampColumn, row.getTimestamp());
            cells.put(metric, nullIfNaN(row.getValue()));
            cells.putAll(dimensions);

            cells.put(IS_IMPUTED, row.isImputed());
            cells.put(ROW_KIND, row.getKind().name());
            for (String detector : detectors) {
                DetectorResult result = row.getDetectorResults().get(detector);
                cells.put(IS_ANOMALY_PREFIX + detector, result != null ? result.isOutlier() : null);
                cells.put(ANOMALY_SCORE_PREFIX + detector, result != null ? nullIfNaN(result.getScore()) : null);
            }
            ConsensusResult consensus = row.getConsensus();
            cells.put(IS_ANOMALY_CONSENSUS, consensus != null ? consensus.isAnomalyConsensus() : null);
            cells.put(CONSENSUS_VOTES, consensus != null ? consensus.getVotes() : null);
            cells.put(CONSENSUS_TOTAL, consensus != null ? consensus.getTotalDetectors() : null);
            DecompositionPoint components = row.getDecomposition();
            cells.put(TREND_COMPONENT, components != null ? nullIfNaN(components.getTrend()) : null);
            cells.put(SEASONAL_COMPONENT, components != null ? nullIfNaN(components.getSeasonal()) : null);
            cells.put(RESIDUAL_COMPONENT, components != null ? nullIfNaN(components.getResidual()) : null);
            ForecastPoint forecast = row.getForecast();
            cells.put(FORECAST_POINT, forecast != null ? forecast.getPointEstimate() : null);
            cells.put(FORECAST_LOWER, forecast != null ? forecast.getLowerBound() : null);
            cells.put(FORECAST_UPPER, forecast != null ? forecast.getUpperBound() : null);
            table.addRow(cells);
        }
        return table.build();
    }

    private static Double nullIfNaN(double value) {
        return Double.isNaN(value) ? null : value;
    }
}
