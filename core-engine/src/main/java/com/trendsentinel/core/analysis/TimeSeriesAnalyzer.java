package com.trendsentinel.core.analysis;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.config.TableLayout;
import com.trendsentinel.core.detection.AnomalyEnsemble;
import com.trendsentinel.core.detection.EnsembleResult;
import com.trendsentinel.core.error.AnalysisException;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.error.InvalidParameterException;
import com.trendsentinel.core.forecast.ForecastEngine;
import com.trendsentinel.core.forecast.TrendForecastResult;
import com.trendsentinel.core.model.AnalysisReport;
import com.trendsentinel.core.model.DataTable;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.preparation.RawSeries;
import com.trendsentinel.core.preparation.SeriesPreparer;
import com.trendsentinel.core.report.ResultAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point of the analysis core.
 *
 * <p>
 * Wires the pipeline Preparation &rarr; {Ensemble, Trend &amp; Forecast}
 * &rarr; Assembler for one series at a time. The analyzer is stateless apart
 * from its immutable configuration; concurrent calls are safe.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * With an {@link Executor} the detectors and the trend branch run as separate
 * tasks on it while the calling thread joins them; none of those tasks waits
 * on another, so even a single-threaded executor cannot deadlock. Without an
 * executor everything runs on the calling thread. Callers that fan out over
 * many series on their own pool should pass no executor.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * The {@code analyze} methods throw {@link AnalysisException} subclasses.
 * {@code analyzeSafely} and {@code analyzeTable} convert every failure into an
 * {@link AnalysisOutcome}; unexpected runtime exceptions become
 * {@link com.trendsentinel.core.error.ErrorCode#INTERNAL} failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesAnalyzer.class);

    private final AnalysisConfig config;
    private final SeriesPreparer preparer;
    private final AnomalyEnsemble ensemble;
    private final ForecastEngine forecastEngine;
    private final ResultAssembler assembler;
    private final Executor executor;

    public TimeSeriesAnalyzer(AnalysisConfig config) {
        this(config, null);
    }

    /**
     * @param config   analysis parameters
     * @param executor executor for detector and trend tasks, or {@code null}
     */
    public TimeSeriesAnalyzer(AnalysisConfig config, Executor executor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executor = executor;
        this.preparer = new SeriesPreparer(config);
        this.ensemble = AnomalyEnsemble.fromConfig(config, executor);
        this.forecastEngine = config.isTrendAnalysisEnabled() ? new ForecastEngine(config) : null;
        this.assembler = new ResultAssembler();
    }

    // ---------------------------------------------------------------
    // Throwing API
    // ---------------------------------------------------------------

    /**
     * Analyze a prepared series.
     *
     * @param series prepared series
     * @return the report
     * @throws InsufficientDataException if the series is too short for the
     *                                   enabled methods
     */
    public AnalysisReport analyze(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int observed = series.observedCount();
        if (observed < SeriesPreparer.MIN_OBSERVED) {
            throw new InsufficientDataException("series " + series.getKey().label(), SeriesPreparer.MIN_OBSERVED,
                    observed);
        }
        if (forecastEngine != null) {
            forecastEngine.checkSufficient(series);
        }

        TrendForecastResult trend;
        EnsembleResult detection;
        if (executor != null && forecastEngine != null) {
            CompletableFuture<TrendForecastResult> trendTask =
                    CompletableFuture.supplyAsync(() -> forecastEngine.analyze(series), executor);
            detection = ensemble.run(series);
            trend = join(trendTask);
        } else {
            detection = ensemble.run(series);
            trend = forecastEngine != null ? forecastEngine.analyze(series) : null;
        }

        AnalysisReport report = assembler.assemble(series, detection, trend);
        LOG.debug("Analyzed [{}]: {} consensus anomalie(s), trend {}", series.getKey(),
                report.getAnomalySummary().getConsensusAnomalies(),
                trend != null ? trend.getTrend().getDirection().getLabel() : "n/a");
        return report;
    }

    /**
     * Analyze a table holding exactly one series.
     *
     * @param table  input table
     * @param layout column roles
     * @return the report
     * @throws InvalidParameterException if the layout yields more than one
     *                                   series
     */
    public AnalysisReport analyze(DataTable table, TableLayout layout) {
        List<RawSeries> split = preparer.split(table, layout);
        if (split.size() != 1) {
            throw new InvalidParameterException("the layout yields " + split.size()
                    + " series; use analyzeTable for more than one");
        }
        return analyze(preparer.prepare(split.get(0)));
    }

    // ---------------------------------------------------------------
    // Non-throwing API
    // ---------------------------------------------------------------

    /**
     * Prepare and analyze one raw series, never throwing.
     *
     * @param raw raw series from {@link #split(DataTable, TableLayout)}
     * @return success or failure outcome
     */
    public AnalysisOutcome analyzeSafely(RawSeries raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        try {
            return AnalysisOutcome.success(analyze(preparer.prepare(raw)));
        } catch (AnalysisException e) {
            LOG.warn("Analysis of [{}] failed: {}", raw.getKey(), e.getMessage());
            return AnalysisOutcome.failure(raw.getKey(), e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure analyzing [{}]", raw.getKey(), e);
            return AnalysisOutcome.internalFailure(raw.getKey(), e);
        }
    }

    /**
     * Analyze a table holding exactly one series, never throwing.
     *
     * @param table  input table
     * @param layout column roles
     * @return success or failure outcome
     */
    public AnalysisOutcome analyzeSafely(DataTable table, TableLayout layout) {
        try {
            return AnalysisOutcome.success(analyze(table, layout));
        } catch (AnalysisException e) {
            LOG.warn("Analysis failed: {}", e.getMessage());
            return AnalysisOutcome.failure(null, e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected analysis failure", e);
            return AnalysisOutcome.internalFailure(null, e);
        }
    }

    /**
     * Analyze every series of a table, in split order. A table that cannot be
     * split yields a single failure outcome without a series key.
     *
     * @param table  input table
     * @param layout column roles
     * @return one outcome per series
     */
    public List<AnalysisOutcome> analyzeTable(DataTable table, TableLayout layout) {
        List<RawSeries> split;
        try {
            split = split(table, layout);
        } catch (AnalysisException e) {
            LOG.warn("Input table rejected: {}", e.getMessage());
            return List.of(AnalysisOutcome.failure(null, e));
        }
        List<AnalysisOutcome> outcomes = new ArrayList<>(split.size());
        for (RawSeries raw : split) {
            outcomes.add(analyzeSafely(raw));
        }
        return outcomes;
    }

    /**
     * Validate a table and split it into raw series.
     *
     * @see SeriesPreparer#split(DataTable, TableLayout)
     */
    public List<RawSeries> split(DataTable table, TableLayout layout) {
        return preparer.split(table, layout);
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
