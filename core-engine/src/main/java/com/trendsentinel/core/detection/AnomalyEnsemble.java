package com.trendsentinel.core.detection;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.error.DetectorUnavailableException;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.model.ConsensusResult;
import com.trendsentinel.core.model.DetectorFailure;
import com.trendsentinel.core.model.DetectorResult;
import com.trendsentinel.core.model.SeriesPoint;
import com.trendsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs independent outlier detectors on one series and combines their verdicts
 * through a {@link ConsensusVoter}.
 *
 * <h3>Execution</h3>
 * <p>
 * With an {@link Executor} every detector is submitted as its own task and the
 * results are joined in configured order; without one the detectors run on
 * the calling thread. Detectors share no state, so the output does not depend
 * on execution order.
 * </p>
 *
 * <h3>Degradation</h3>
 * <p>
 * A detector throwing {@link DetectorUnavailableException} is dropped from the
 * vote and reported as a {@link DetectorFailure}. When no detector can run
 * the ensemble raises {@link InsufficientDataException}. Any other exception
 * propagates.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEnsemble {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEnsemble.class);

    private final List<OutlierDetector> detectors;
    private final ConsensusVoter voter;
    private final Executor executor;

    /**
     * @param detectors detectors in output order; must not be empty
     * @param voter     consensus rule
     * @param executor  executor for the detector tasks, or {@code null} to run
     *                  on the calling thread
     */
    public AnomalyEnsemble(List<OutlierDetector> detectors, ConsensusVoter voter, Executor executor) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("At least one detector is required");
        }
        this.detectors = List.copyOf(detectors);
        this.voter = Objects.requireNonNull(voter, "voter must not be null");
        this.executor = executor;
    }

    /**
     * Build the ensemble the configuration describes.
     *
     * @param config   analysis parameters
     * @param executor optional executor, may be {@code null}
     * @return configured ensemble
     */
    public static AnomalyEnsemble fromConfig(AnalysisConfig config, Executor executor) {
        Objects.requireNonNull(config, "config must not be null");
        return new AnomalyEnsemble(DetectorFactory.createAll(config),
                new ConsensusVoter(config.getConsensusMajorityFraction()), executor);
    }

    /**
     * Run every detector and vote. Imputed values are hidden from the
     * detectors, so gap fills are never scored and never vote.
     *
     * @param series prepared series
     * @return per-detector results, consensus and failures
     * @throws InsufficientDataException if every detector is unavailable
     */
    public EnsembleResult run(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        TimeSeries recorded = series.recordedOnly();

        List<CompletableFuture<List<DetectorResult>>> futures = new ArrayList<>(detectors.size());
        for (OutlierDetector detector : detectors) {
            futures.add(executor != null
                    ? CompletableFuture.supplyAsync(() -> detector.detect(recorded), executor)
                    : runInline(detector, recorded));
        }

        Map<String, List<DetectorResult>> results = new LinkedHashMap<>();
        List<DetectorFailure> failures = new ArrayList<>();
        for (int d = 0; d < detectors.size(); d++) {
            OutlierDetector detector = detectors.get(d);
            try {
                List<DetectorResult> detected = futures.get(d).join();
                if (detected.size() != series.size()) {
                    throw new IllegalStateException("Detector '" + detector.getName() + "' returned "
                            + detected.size() + " results for " + series.size() + " points");
                }
                results.put(detector.getName(), detected);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof DetectorUnavailableException unavailable) {
                    LOG.warn("Series [{}]: detector '{}' unavailable: {}", series.getKey(),
                            detector.getName(), unavailable.getReason());
                    failures.add(new DetectorFailure(detector.getName(), unavailable.getReason()));
                } else if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                } else if (cause instanceof Error error) {
                    throw error;
                } else {
                    throw e;
                }
            }
        }

        if (results.isEmpty()) {
            throw new InsufficientDataException("no detector could run on series " + series.getKey().label()
                    + " (" + failures.stream().map(DetectorFailure::toString).collect(Collectors.joining("; "))
                    + ")");
        }

        List<Instant> timestamps = series.getPoints().stream().map(SeriesPoint::getTimestamp).toList();
        List<ConsensusResult> consensus = voter.vote(timestamps, new ArrayList<>(results.values()));
        LOG.debug("Series [{}]: ensemble of {} detector(s), {} unavailable", series.getKey(), results.size(),
                failures.size());
        return new EnsembleResult(results, consensus, failures);
    }

    public List<OutlierDetector> getDetectors() {
        return detectors;
    }

    private static CompletableFuture<List<DetectorResult>> runInline(OutlierDetector detector, TimeSeries series) {
        try {
            return CompletableFuture.completedFuture(detector.detect(series));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
