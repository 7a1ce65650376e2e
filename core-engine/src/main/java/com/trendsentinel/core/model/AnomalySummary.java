package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Counts of flagged points for one series.
 *
 * @since 1.0.0
 */
public final class AnomalySummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int observedRecords;
    private final Map<String, Integer> flaggedByDetector;
    private final int consensusAnomalies;

    public AnomalySummary(int observedRecords, Map<String, Integer> flaggedByDetector, int consensusAnomalies) {
        this.observedRecords = observedRecords;
        this.flaggedByDetector = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(flaggedByDetector, "flaggedByDetector must not be null")));
        this.consensusAnomalies = consensusAnomalies;
    }

    public int getObservedRecords() {
        return observedRecords;
    }

    /**
     * @return flag count per contributing detector, in configured order
     */
    public Map<String, Integer> getFlaggedByDetector() {
        return flaggedByDetector;
    }

    public int getConsensusAnomalies() {
        return consensusAnomalies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalySummary that))
            return false;
        return observedRecords == that.observedRecords
                && consensusAnomalies == that.consensusAnomalies
                && flaggedByDetector.equals(that.flaggedByDetector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(observedRecords, flaggedByDetector, consensusAnomalies);
    }

    @Override
    public String toString() {
        return "AnomalySummary{records=" + observedRecords + ", flagged=" + flaggedByDetector
                + ", consensus=" + consensusAnomalies + '}';
    }
}
