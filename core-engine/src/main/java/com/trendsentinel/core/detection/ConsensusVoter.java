package com.trendsentinel.core.detection;

import com.trendsentinel.core.error.InvalidParameterException;
import com.trendsentinel.core.model.ConsensusResult;
import com.trendsentinel.core.model.DetectorResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Combines per-detector verdicts into a per-timestamp consensus.
 *
 * <p>
 * A point is a consensus anomaly when at least
 * {@code ceil(fraction * total)} of the {@code total} contributing detectors
 * flag it, and at least one detector contributes.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConsensusVoter {

    /** Products within this many ulps of an integer are that integer. */
    private static final int ROUNDING_ULPS = 4;

    private final double majorityFraction;

    /**
     * @param majorityFraction share of detectors that must agree, in (0, 1]
     * @throws InvalidParameterException if the fraction is out of range
     */
    public ConsensusVoter(double majorityFraction) {
        if (!(majorityFraction > 0 && majorityFraction <= 1)) {
            throw new InvalidParameterException(
                    "consensus_majority_fraction must be in (0, 1], got: " + majorityFraction);
        }
        this.majorityFraction = majorityFraction;
    }

    /**
     * @param total number of contributing detectors
     * @return votes needed for a consensus anomaly
     */
    public int requiredVotes(int total) {
        double product = majorityFraction * total;
        double nearest = Math.rint(product);
        if (Math.abs(product - nearest) <= ROUNDING_ULPS * Math.ulp(nearest)) {
            return (int) nearest;
        }
        return (int) Math.ceil(product);
    }

    public boolean isConsensus(int votes, int total) {
        return total > 0 && votes >= requiredVotes(total);
    }

    /**
     * Vote on every timestamp.
     *
     * @param timestamps series timestamps
     * @param results    one result list per contributing detector, each aligned
     *                   with {@code timestamps}
     * @return one consensus per timestamp
     */
    public List<ConsensusResult> vote(List<Instant> timestamps, List<List<DetectorResult>> results) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        Objects.requireNonNull(results, "results must not be null");
        int total = results.size();
        List<ConsensusResult> consensus = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            int votes = 0;
            for (List<DetectorResult> detector : results) {
                if (detector.get(i).isOutlier()) {
                    votes++;
                }
            }
            consensus.add(new ConsensusResult(timestamps.get(i), votes, total, isConsensus(votes, total)));
        }
        return consensus;
    }

    public double getMajorityFraction() {
        return majorityFraction;
    }
}
