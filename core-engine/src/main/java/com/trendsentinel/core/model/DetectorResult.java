package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Verdict of one detector for one timestamp.
 *
 * <p>
 * {@code score} is {@link Double#NaN} when the detector could not score the
 * point (missing value or warm-up); such points are never outliers.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String detector;
    private final Instant timestamp;
    private final double score;
    private final boolean outlier;

    public DetectorResult(String detector, Instant timestamp, double score, boolean outlier) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (outlier && Double.isNaN(score)) {
            throw new IllegalArgumentException("An unscored point cannot be an outlier");
        }
        this.score = score;
        this.outlier = outlier;
    }

    public static DetectorResult unscored(String detector, Instant timestamp) {
        return new DetectorResult(detector, timestamp, Double.NaN, false);
    }

    public String getDetector() {
        return detector;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getScore() {
        return score;
    }

    public boolean isScored() {
        return !Double.isNaN(score);
    }

    public boolean isOutlier() {
        return outlier;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorResult that))
            return false;
        return Double.compare(score, that.score) == 0
                && outlier == that.outlier
                && detector.equals(that.detector)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detector, timestamp, score, outlier);
    }

    @Override
    public String toString() {
        return "DetectorResult{" + detector + " @ " + timestamp + ", score=" + score + ", outlier=" + outlier + '}';
    }
}
