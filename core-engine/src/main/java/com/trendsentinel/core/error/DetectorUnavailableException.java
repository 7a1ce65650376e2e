package com.trendsentinel.core.error;

/**
 * Raised by a single ensemble member that cannot run on the given series.
 *
 * <p>
 * The ensemble catches it, drops the detector from the vote and records the
 * reason in the report. It never aborts an analysis on its own.
 * </p>
 */
public class DetectorUnavailableException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final String detector;

    public DetectorUnavailableException(String detector, String reason) {
        super(ErrorCode.DETECTOR_UNAVAILABLE, detector + ": " + reason);
        this.detector = detector;
    }

    public String getDetector() {
        return detector;
    }

    /**
     * @return the reason without the detector prefix
     */
    public String getReason() {
        String detail = getDetail();
        return detail.substring(detector.length() + 2);
    }
}
