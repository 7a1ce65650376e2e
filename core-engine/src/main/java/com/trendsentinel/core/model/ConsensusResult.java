package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Aggregated verdict for one timestamp.
 *
 * <p>
 * Invariant: {@code 0 <= votes <= totalDetectors}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConsensusResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final int votes;
    private final int totalDetectors;
    private final boolean anomalyConsensus;

    public ConsensusResult(Instant timestamp, int votes, int totalDetectors, boolean anomalyConsensus) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (votes < 0 || votes > totalDetectors) {
            throw new IllegalArgumentException(
                    "votes must be in [0, " + totalDetectors + "], got: " + votes);
        }
        this.votes = votes;
        this.totalDetectors = totalDetectors;
        this.anomalyConsensus = anomalyConsensus;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getVotes() {
        return votes;
    }

    public int getTotalDetectors() {
        return totalDetectors;
    }

    public boolean isAnomalyConsensus() {
        return anomalyConsensus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConsensusResult that))
            return false;
        return votes == that.votes
                && totalDetectors == that.totalDetectors
                && anomalyConsensus == that.anomalyConsensus
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, votes, totalDetectors, anomalyConsensus);
    }

    @Override
    public String toString() {
        return "ConsensusResult{" + timestamp + ", votes=" + votes + "/" + totalDetectors
                + ", anomaly=" + anomalyConsensus + '}';
    }
}
