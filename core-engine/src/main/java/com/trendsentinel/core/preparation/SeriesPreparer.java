package com.trendsentinel.core.preparation;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.config.DuplicatePolicy;
import com.trendsentinel.core.config.GapFillPolicy;
import com.trendsentinel.core.config.TableLayout;
import com.trendsentinel.core.error.DuplicateTimestampException;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.error.SchemaException;
import com.trendsentinel.core.model.Column;
import com.trendsentinel.core.model.ColumnType;
import com.trendsentinel.core.model.DataTable;
import com.trendsentinel.core.model.SeriesKey;
import com.trendsentinel.core.model.SeriesPoint;
import com.trendsentinel.core.model.TableSchema;
import com.trendsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Turns a raw input table into uniform, gap-aware {@link TimeSeries} values.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li>{@link #split(DataTable, TableLayout)}: validates the table against the
 * layout, coerces timestamps and metric cells, and groups rows by dimension
 * tuple in first-appearance order. One {@link RawSeries} per metric and
 * group.</li>
 * <li>{@link #prepare(RawSeries)}: orders and deduplicates rows, infers the
 * dominant frequency, inserts missing timestamps for whole-multiple gaps and
 * fills missing values per {@link GapFillPolicy}.</li>
 * </ol>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesPreparer {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesPreparer.class);

    /** Minimum number of observed values any series must have. */
    public static final int MIN_OBSERVED = 2;

    /** Upper bound on timestamps inserted into one series to close gaps. */
    public static final int MAX_INSERTED_POINTS = 100_000;

    private final GapFillPolicy gapFillPolicy;
    private final DuplicatePolicy duplicatePolicy;

    public SeriesPreparer(GapFillPolicy gapFillPolicy, DuplicatePolicy duplicatePolicy) {
        this.gapFillPolicy = Objects.requireNonNull(gapFillPolicy, "gapFillPolicy must not be null");
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy must not be null");
    }

    public SeriesPreparer(AnalysisConfig config) {
        this(Objects.requireNonNull(config, "config must not be null").getGapFillPolicy(),
                config.getDuplicatePolicy());
    }

    // ---------------------------------------------------------------
    // Split
    // ---------------------------------------------------------------

    /**
     * Validate the table and split it into raw series.
     *
     * <p>
     * Without dimension columns every metric yields exactly one series, even
     * for an empty table.
     * </p>
     *
     * @param table  input table
     * @param layout column roles
     * @return raw series, grouped by dimension tuple then by metric
     * @throws SchemaException if a column is missing or mistyped, or a cell
     *                         cannot be coerced
     */
    public List<RawSeries> split(DataTable table, TableLayout layout) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(layout, "layout must not be null");
        TableSchema schema = table.getSchema();

        requireColumn(schema, layout.getTimestampColumn(), ColumnType.TIMESTAMP, ColumnType.STRING);
        for (String metric : layout.getMetricColumns()) {
            requireColumn(schema, metric, ColumnType.NUMERIC, ColumnType.STRING);
        }
        for (String dimension : layout.getDimensionColumns()) {
            if (!schema.contains(dimension)) {
                throw new SchemaException(dimension, "dimension column does not exist");
            }
        }

        Instant[] timestamps = TimestampCoercer.coerceColumn(table, layout.getTimestampColumn());
        Map<String, double[]> metricValues = new LinkedHashMap<>();
        for (String metric : layout.getMetricColumns()) {
            metricValues.put(metric, coerceMetric(table, metric));
        }

        Map<Map<String, String>, List<Integer>> groups = new LinkedHashMap<>();
        if (layout.getDimensionColumns().isEmpty()) {
            groups.put(Map.of(), new ArrayList<>());
        }
        for (int row = 0; row < table.rowCount(); row++) {
            Map<String, String> dims = new LinkedHashMap<>();
            for (String dimension : layout.getDimensionColumns()) {
                Object cell = table.value(row, dimension);
                dims.put(dimension, cell == null ? "" : String.valueOf(cell));
            }
            groups.computeIfAbsent(dims, k -> new ArrayList<>()).add(row);
        }

        List<RawSeries> result = new ArrayList<>();
        for (Map.Entry<Map<String, String>, List<Integer>> group : groups.entrySet()) {
            for (Map.Entry<String, double[]> metric : metricValues.entrySet()) {
                List<RawSeries.Row> rows = new ArrayList<>(group.getValue().size());
                for (int row : group.getValue()) {
                    rows.add(new RawSeries.Row(row, timestamps[row], metric.getValue()[row], table.row(row)));
                }
                result.add(new RawSeries(new SeriesKey(metric.getKey(), group.getKey()), rows));
            }
        }
        LOG.debug("Split {} row(s) into {} series", table.rowCount(), result.size());
        return result;
    }

    // ---------------------------------------------------------------
    // Prepare
    // ---------------------------------------------------------------

    /**
     * Normalize one raw series.
     *
     * @param raw raw series
     * @return prepared series with strictly increasing timestamps
     * @throws DuplicateTimestampException under {@link DuplicatePolicy#ERROR}
     * @throws InsufficientDataException   if fewer than {@value #MIN_OBSERVED}
     *                                     values are observed, or closing the
     *                                     gaps would insert more than
     *                                     {@value #MAX_INSERTED_POINTS}
     *                                     timestamps
     */
    public TimeSeries prepare(RawSeries raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        SeriesKey key = raw.getKey();

        // TreeMap keeps timestamp order; rows arrive in index order so put() keeps the later row
        TreeMap<Instant, RawSeries.Row> byTimestamp = new TreeMap<>();
        for (RawSeries.Row row : raw.getRows()) {
            RawSeries.Row previous = byTimestamp.put(row.getTimestamp(), row);
            if (previous != null) {
                if (duplicatePolicy == DuplicatePolicy.ERROR) {
                    throw new DuplicateTimestampException(key.label(), row.getTimestamp());
                }
                LOG.debug("Series [{}]: row {} replaces row {} at {}", key, row.getRowIndex(),
                        previous.getRowIndex(), row.getTimestamp());
            }
        }

        int observed = (int) byTimestamp.values().stream().filter(r -> !Double.isNaN(r.getValue())).count();
        if (observed < MIN_OBSERVED) {
            throw new InsufficientDataException("series " + key.label(), MIN_OBSERVED, observed);
        }

        List<Instant> instants = new ArrayList<>(byTimestamp.keySet());
        Duration frequency = dominantFrequency(instants);

        List<SeriesPoint> points = new ArrayList<>();
        Instant previous = null;
        int inserted = 0;
        for (RawSeries.Row row : byTimestamp.values()) {
            if (previous != null) {
                Duration delta = Duration.between(previous, row.getTimestamp());
                if (!delta.equals(frequency)) {
                    long steps = delta.dividedBy(frequency);
                    if (delta.equals(frequency.multipliedBy(steps))) {
                        if (inserted + steps - 1 > MAX_INSERTED_POINTS) {
                            throw new InsufficientDataException("series " + key.label() + " is too sparse for its "
                                    + frequency + " frequency: the gap before " + row.getTimestamp()
                                    + " needs " + (steps - 1) + " inserted timestamps, limit "
                                    + MAX_INSERTED_POINTS + " per series");
                        }
                        for (long k = 1; k < steps; k++) {
                            points.add(new SeriesPoint(previous.plus(frequency.multipliedBy(k)), Double.NaN,
                                    true, Map.of()));
                            inserted++;
                        }
                    } else {
                        LOG.debug("Series [{}]: irregular spacing {} before {} kept as-is", key, delta,
                                row.getTimestamp());
                    }
                }
            }
            points.add(new SeriesPoint(row.getTimestamp(), row.getValue(), false, row.getCells()));
            previous = row.getTimestamp();
        }

        List<SeriesPoint> filled = GapFiller.fill(points, gapFillPolicy);
        TimeSeries series = new TimeSeries(key, filled, frequency);
        LOG.debug("Prepared series [{}]: {} point(s), {} inserted, frequency {}", key, series.size(), inserted,
                frequency);
        return series;
    }

    /**
     * Split and prepare every series of the table.
     *
     * @param table  input table
     * @param layout column roles
     * @return prepared series in split order
     */
    public List<TimeSeries> prepareAll(DataTable table, TableLayout layout) {
        return split(table, layout).stream().map(this::prepare).toList();
    }

    public GapFillPolicy getGapFillPolicy() {
        return gapFillPolicy;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Most common positive delta between consecutive instants; ties go to the
     * smallest delta.
     *
     * @param instants strictly increasing instants, at least two
     * @return dominant delta
     */
    static Duration dominantFrequency(List<Instant> instants) {
        Map<Duration, Integer> counts = new HashMap<>();
        for (int i = 1; i < instants.size(); i++) {
            Duration delta = Duration.between(instants.get(i - 1), instants.get(i));
            if (!delta.isZero() && !delta.isNegative()) {
                counts.merge(delta, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .max(Comparator.<Map.Entry<Duration, Integer>>comparingInt(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElseThrow(() -> new IllegalArgumentException("At least two distinct instants are required"));
    }

    private static void requireColumn(TableSchema schema, String name, ColumnType... allowed) {
        Column column = schema.column(name)
                .orElseThrow(() -> new SchemaException(name, "column does not exist"));
        for (ColumnType type : allowed) {
            if (column.getType() == type) {
                return;
            }
        }
        throw new SchemaException(name, "declared as " + column.getType() + ", expected one of "
                + List.of(allowed));
    }

    private static double[] coerceMetric(DataTable table, String column) {
        double[] values = new double[table.rowCount()];
        for (int row = 0; row < values.length; row++) {
            values[row] = toDouble(table.value(row, column), column, row);
        }
        return values;
    }

    private static double toDouble(Object cell, String column, int row) {
        if (cell == null) {
            return Double.NaN;
        }
        if (cell instanceof Number n) {
            double v = n.doubleValue();
            if (Double.isInfinite(v)) {
                throw new SchemaException(column, "row " + row + " holds an infinite value");
            }
            return v;
        }
        if (cell instanceof String s) {
            String text = s.trim();
            if (text.isEmpty() || text.equalsIgnoreCase("NaN")) {
                return Double.NaN;
            }
            try {
                double v = Double.parseDouble(text);
                if (Double.isInfinite(v)) {
                    throw new SchemaException(column, "row " + row + " holds an infinite value");
                }
                return v;
            } catch (NumberFormatException e) {
                throw new SchemaException(column, "row " + row + " value '" + s + "' is not numeric");
            }
        }
        throw new SchemaException(column, "row " + row + " holds a " + cell.getClass().getSimpleName()
                + ", expected a number");
    }
}
