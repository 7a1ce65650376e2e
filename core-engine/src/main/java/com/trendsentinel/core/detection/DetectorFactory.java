package com.trendsentinel.core.detection;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.config.DetectorType;
import com.trendsentinel.core.error.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link OutlierDetector} instances from an
 * {@link AnalysisConfig}.
 *
 * <p>
 * This is the single point of extension when adding new detectors: add the
 * {@link DetectorType} constant and create the corresponding detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create one detector.
     *
     * @param type   detector to create; must not be {@code null}
     * @param config parameters; must not be {@code null}
     * @return a configured detector
     * @throws InvalidParameterException if the isolation seed is missing
     */
    public static OutlierDetector create(DetectorType type, AnalysisConfig config) {
        Objects.requireNonNull(type, "DetectorType must not be null");
        Objects.requireNonNull(config, "AnalysisConfig must not be null");

        return switch (type) {
            case ZSCORE -> new ZScoreDetector(config.getZThreshold(), config.getZWindow());
            case IQR -> new IqrFenceDetector(config.getIqrMultiplier(), config.getIqrWindow());
            case ISOLATION -> {
                if (config.getIsolationSeed() == null) {
                    throw new InvalidParameterException("isolation_seed is required for the isolation detector");
                }
                yield new IsolationForestDetector(config.getIsolationSeed(), config.getIsolationTrees(),
                        config.getIsolationSampleSize(), config.getIsolationScoreThreshold());
            }
            case MOVING_AVERAGE -> new MovingAverageDeviationDetector(config.getMovingAverageWindow(),
                    config.getMovingAverageThreshold());
        };
    }

    /**
     * Create every detector the configuration enables, in configured order.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param config parameters; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<OutlierDetector> createAll(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        LOG.debug("Creating {} detector(s) from configuration", config.getDetectors().size());
        List<OutlierDetector> detectors = config.getDetectors().stream()
                .map(type -> create(type, config))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
