package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Ensemble member that could not run on a series.
 */
public final class DetectorFailure implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String detector;
    private final String reason;

    public DetectorFailure(String detector, String reason) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public String getDetector() {
        return detector;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorFailure that))
            return false;
        return detector.equals(that.detector) && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detector, reason);
    }

    @Override
    public String toString() {
        return detector + ": " + reason;
    }
}
