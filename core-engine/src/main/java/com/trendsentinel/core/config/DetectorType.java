package com.trendsentinel.core.config;

import java.util.Locale;

/**
 * Outlier detectors known to the ensemble.
 *
 * <p>
 * The detector name is used in configuration ({@code detectors}) and in the
 * output column names ({@code is_anomaly_<name>}).
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorType {

    ZSCORE("zscore"),
    IQR("iqr"),
    ISOLATION("isolation"),
    MOVING_AVERAGE("moving_average");

    private final String detectorName;

    DetectorType(String detectorName) {
        this.detectorName = detectorName;
    }

    public String getDetectorName() {
        return detectorName;
    }

    /**
     * Resolve a detector by its configuration name, case-insensitively.
     *
     * @param name detector name, e.g. {@code zscore}
     * @return the detector type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DetectorType fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DetectorType type : values()) {
            if (type.detectorName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown detector: '" + name
                + "'. Supported detectors: zscore, iqr, isolation, moving_average");
    }
}
