package com.trendsentinel.job;

import com.trendsentinel.core.analysis.AnalysisOutcome;
import com.trendsentinel.core.analysis.TimeSeriesAnalyzer;
import com.trendsentinel.core.preparation.RawSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyzes independent series concurrently on a fixed worker pool.
 *
 * <p>
 * Each series is one task calling
 * {@link TimeSeriesAnalyzer#analyzeSafely(RawSeries)}, so a failing series
 * yields a failure outcome and never affects its siblings. Outcomes are
 * returned in input order regardless of completion order.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * The analyzer handed in must not share this pool as its internal executor:
 * a worker blocking on a sub-task queued behind other workers would starve.
 * The job therefore builds the analyzer without an executor.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesFanOut implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesFanOut.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final TimeSeriesAnalyzer analyzer;
    private final JobMetrics metrics;
    private final ExecutorService pool;

    /**
     * @param analyzer    analyzer shared by all workers
     * @param parallelism number of worker threads, at least 1
     * @param metrics     metrics updated per series
     */
    public SeriesFanOut(TimeSeriesAnalyzer analyzer, int parallelism, JobMetrics metrics) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.pool = Executors.newFixedThreadPool(parallelism, workerThreads());
    }

    /**
     * @param series raw series in output order
     * @return one outcome per series, same order
     */
    public List<AnalysisOutcome> analyzeAll(List<RawSeries> series) {
        Objects.requireNonNull(series, "series must not be null");
        LOG.info("Analyzing {} series", series.size());

        List<CompletableFuture<AnalysisOutcome>> futures = new ArrayList<>(series.size());
        for (RawSeries raw : series) {
            futures.add(CompletableFuture.supplyAsync(() -> analyzeOne(raw), pool));
        }
        List<AnalysisOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<AnalysisOutcome> future : futures) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private AnalysisOutcome analyzeOne(RawSeries raw) {
        AnalysisOutcome outcome = metrics.time(() -> analyzer.analyzeSafely(raw));
        metrics.record(outcome);
        LOG.debug("Finished [{}]: {}", raw.getKey(), outcome.isSuccess() ? "ok" : outcome.getErrorCode());
        return outcome;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "series-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
