package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.AnomalySummary;
import com.trendsentinel.core.model.ConsensusResult;
import com.trendsentinel.core.model.DetectorFailure;
import com.trendsentinel.core.model.DetectorResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one ensemble run: per-detector results of the contributing
 * detectors in configured order, the consensus per point, and the detectors
 * that could not run.
 *
 * @since 1.0.0
 */
public final class EnsembleResult {

    private final Map<String, List<DetectorResult>> results;
    private final List<ConsensusResult> consensus;
    private final List<DetectorFailure> failures;

    EnsembleResult(Map<String, List<DetectorResult>> results, List<ConsensusResult> consensus,
            List<DetectorFailure> failures) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.consensus = List.copyOf(consensus);
        this.failures = List.copyOf(failures);
    }

    /**
     * @return names of the detectors that contributed to the vote
     */
    public List<String> getDetectorNames() {
        return List.copyOf(results.keySet());
    }

    public Map<String, List<DetectorResult>> getResults() {
        return results;
    }

    public List<ConsensusResult> getConsensus() {
        return consensus;
    }

    public List<DetectorFailure> getFailures() {
        return failures;
    }

    /**
     * @param observedRecords number of recorded, non-imputed points of the series
     * @return flag counts per detector and for the consensus
     */
    public AnomalySummary summarize(int observedRecords) {
        Map<String, Integer> flagged = new LinkedHashMap<>();
        results.forEach((name, list) -> flagged.put(name,
                (int) list.stream().filter(DetectorResult::isOutlier).count()));
        int consensusCount = (int) consensus.stream().filter(ConsensusResult::isAnomalyConsensus).count();
        return new AnomalySummary(observedRecords, flagged, consensusCount);
    }
}
