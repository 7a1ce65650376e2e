package com.trendsentinel.job;

import com.trendsentinel.core.analysis.AnalysisOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer metric definitions for a Trend Sentinel batch run.
 *
 * <p>
 * The job registers its meters in a {@link MeterRegistry}; a standalone run
 * uses an in-memory {@link SimpleMeterRegistry} and logs a summary at the
 * end. All meters are safe to update from worker threads.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code trend_sentinel.series.analyzed} – counter of successful series</li>
 *   <li>{@code trend_sentinel.series.failed} – counter of failed series, tagged by error code</li>
 *   <li>{@code trend_sentinel.anomalies.consensus} – counter of consensus anomalies</li>
 *   <li>{@code trend_sentinel.series.duration} – timer of per-series analysis time</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class JobMetrics {

    private static final Logger LOG = LoggerFactory.getLogger(JobMetrics.class);

    static final String SERIES_ANALYZED = "trend_sentinel.series.analyzed";
    static final String SERIES_FAILED = "trend_sentinel.series.failed";
    static final String CONSENSUS_ANOMALIES = "trend_sentinel.anomalies.consensus";
    static final String ANALYSIS_DURATION = "trend_sentinel.series.duration";

    private final MeterRegistry registry;
    private final Counter seriesAnalyzed;
    private final Counter consensusAnomalies;
    private final Timer analysisDuration;

    public JobMetrics() {
        this(new SimpleMeterRegistry());
    }

    public JobMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.seriesAnalyzed = registry.counter(SERIES_ANALYZED);
        this.consensusAnomalies = registry.counter(CONSENSUS_ANOMALIES);
        this.analysisDuration = Timer.builder(ANALYSIS_DURATION)
                .description("Wall time of one series analysis")
                .register(registry);
    }

    /**
     * Run one analysis under the duration timer.
     */
    public AnalysisOutcome time(Supplier<AnalysisOutcome> analysis) {
        return analysisDuration.record(analysis);
    }

    public void record(AnalysisOutcome outcome) {
        if (outcome.isSuccess()) {
            seriesAnalyzed.increment();
            consensusAnomalies.increment(outcome.getReport().getAnomalySummary().getConsensusAnomalies());
        } else {
            registry.counter(SERIES_FAILED, "code", outcome.getErrorCode().getCode()).increment();
        }
    }

    public long seriesAnalyzed() {
        return (long) seriesAnalyzed.count();
    }

    public long seriesFailed() {
        return (long) registry.find(SERIES_FAILED).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public long consensusAnomalies() {
        return (long) consensusAnomalies.count();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void logSummary() {
        LOG.info("Series analyzed: {}, failed: {}, consensus anomalies: {}, mean analysis time: {} ms",
                seriesAnalyzed(), seriesFailed(), consensusAnomalies(),
                String.format(Locale.ROOT, "%.2f", analysisDuration.mean(TimeUnit.MILLISECONDS)));
    }
}
