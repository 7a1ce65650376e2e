package com.trendsentinel.core.config;

import com.trendsentinel.core.error.InvalidParameterException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable analysis parameters shared by every component of one invocation.
 *
 * <p>
 * Construct with {@link #builder()} or load from YAML through
 * {@link AnalysisConfigLoader}. Every numeric parameter has a documented
 * default except {@code forecast_horizon} (required while trend analysis is
 * enabled) and {@code isolation_seed} (required while the isolation detector is
 * enabled).
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * {@link Builder#build()} checks every parameter, collects all problems and
 * throws a single {@link InvalidParameterException} listing them.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Period used when none is configured and none is detected. */
    public static final int DEFAULT_SEASONAL_PERIOD = 7;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final List<DetectorType> detectors;
    private final double zThreshold;
    private final Integer zWindow;
    private final double iqrMultiplier;
    private final Integer iqrWindow;
    private final Long isolationSeed;
    private final double isolationScoreThreshold;
    private final int isolationTrees;
    private final Integer isolationSampleSize;
    private final int movingAverageWindow;
    private final double movingAverageThreshold;
    private final double consensusMajorityFraction;

    // ---------------------------------------------------------------
    // Trend & forecast
    // ---------------------------------------------------------------
    private final boolean trendAnalysisEnabled;
    private final boolean decompositionEnabled;
    private final Integer seasonalPeriod;
    private final double seasonalityMinCorrelation;
    private final DecompositionMode decompositionMode;
    private final SmoothingMode smoothingMode;
    private final double alpha;
    private final double beta;
    private final double gamma;
    private final Integer forecastHorizon;
    private final double confidenceZ;
    private final double trendNoiseFloor;

    // ---------------------------------------------------------------
    // Preparation
    // ---------------------------------------------------------------
    private final GapFillPolicy gapFillPolicy;
    private final DuplicatePolicy duplicatePolicy;

    private AnalysisConfig(Builder b) {
        this.detectors = List.copyOf(b.detectors);
        this.zThreshold = b.zThreshold;
        this.zWindow = b.zWindow;
        this.iqrMultiplier = b.iqrMultiplier;
        this.iqrWindow = b.iqrWindow;
        this.isolationSeed = b.isolationSeed;
        this.isolationScoreThreshold = b.isolationScoreThreshold;
        this.isolationTrees = b.isolationTrees;
        this.isolationSampleSize = b.isolationSampleSize;
        this.movingAverageWindow = b.movingAverageWindow;
        this.movingAverageThreshold = b.movingAverageThreshold;
        this.consensusMajorityFraction = b.consensusMajorityFraction;
        this.trendAnalysisEnabled = b.trendAnalysisEnabled;
        this.decompositionEnabled = b.decompositionEnabled;
        this.seasonalPeriod = b.seasonalPeriod;
        this.seasonalityMinCorrelation = b.seasonalityMinCorrelation;
        this.decompositionMode = b.decompositionMode;
        this.smoothingMode = b.smoothingMode;
        this.alpha = b.alpha;
        this.beta = b.beta;
        this.gamma = b.gamma;
        this.forecastHorizon = b.forecastHorizon;
        this.confidenceZ = b.confidenceZ;
        this.trendNoiseFloor = b.trendNoiseFloor;
        this.gapFillPolicy = b.gapFillPolicy;
        this.duplicatePolicy = b.duplicatePolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .detectors(detectors)
                .zThreshold(zThreshold)
                .zWindow(zWindow)
                .iqrMultiplier(iqrMultiplier)
                .iqrWindow(iqrWindow)
                .isolationSeed(isolationSeed)
                .isolationScoreThreshold(isolationScoreThreshold)
                .isolationTrees(isolationTrees)
                .isolationSampleSize(isolationSampleSize)
                .movingAverageWindow(movingAverageWindow)
                .movingAverageThreshold(movingAverageThreshold)
                .consensusMajorityFraction(consensusMajorityFraction)
                .trendAnalysisEnabled(trendAnalysisEnabled)
                .decompositionEnabled(decompositionEnabled)
                .seasonalPeriod(seasonalPeriod)
                .seasonalityMinCorrelation(seasonalityMinCorrelation)
                .decompositionMode(decompositionMode)
                .smoothingMode(smoothingMode)
                .alpha(alpha)
                .beta(beta)
                .gamma(gamma)
                .forecastHorizon(forecastHorizon)
                .confidenceZ(confidenceZ)
                .trendNoiseFloor(trendNoiseFloor)
                .gapFillPolicy(gapFillPolicy)
                .duplicatePolicy(duplicatePolicy);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return enabled detectors in configured order
     */
    public List<DetectorType> getDetectors() {
        return detectors;
    }

    public double getZThreshold() {
        return zThreshold;
    }

    /**
     * @return number of preceding points used as the z-score reference, or
     *         {@code null} for the whole series
     */
    public Integer getZWindow() {
        return zWindow;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    /**
     * @return trailing window for the quartiles, or {@code null} for the whole
     *         series
     */
    public Integer getIqrWindow() {
        return iqrWindow;
    }

    public Long getIsolationSeed() {
        return isolationSeed;
    }

    public double getIsolationScoreThreshold() {
        return isolationScoreThreshold;
    }

    public int getIsolationTrees() {
        return isolationTrees;
    }

    /**
     * @return explicit subsample size, or {@code null} for {@code min(256, n)}
     */
    public Integer getIsolationSampleSize() {
        return isolationSampleSize;
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow;
    }

    public double getMovingAverageThreshold() {
        return movingAverageThreshold;
    }

    public double getConsensusMajorityFraction() {
        return consensusMajorityFraction;
    }

    public boolean isTrendAnalysisEnabled() {
        return trendAnalysisEnabled;
    }

    public boolean isDecompositionEnabled() {
        return decompositionEnabled;
    }

    /**
     * @return configured period, or {@code null} to detect it
     */
    public Integer getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public double getSeasonalityMinCorrelation() {
        return seasonalityMinCorrelation;
    }

    public DecompositionMode getDecompositionMode() {
        return decompositionMode;
    }

    public SmoothingMode getSmoothingMode() {
        return smoothingMode;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    public double getGamma() {
        return gamma;
    }

    public Integer getForecastHorizon() {
        return forecastHorizon;
    }

    public double getConfidenceZ() {
        return confidenceZ;
    }

    public double getTrendNoiseFloor() {
        return trendNoiseFloor;
    }

    public GapFillPolicy getGapFillPolicy() {
        return gapFillPolicy;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisConfig that))
            return false;
        return Double.compare(zThreshold, that.zThreshold) == 0
                && Double.compare(iqrMultiplier, that.iqrMultiplier) == 0
                && Double.compare(isolationScoreThreshold, that.isolationScoreThreshold) == 0
                && isolationTrees == that.isolationTrees
                && movingAverageWindow == that.movingAverageWindow
                && Double.compare(movingAverageThreshold, that.movingAverageThreshold) == 0
                && Double.compare(consensusMajorityFraction, that.consensusMajorityFraction) == 0
                && trendAnalysisEnabled == that.trendAnalysisEnabled
                && decompositionEnabled == that.decompositionEnabled
                && Double.compare(seasonalityMinCorrelation, that.seasonalityMinCorrelation) == 0
                && Double.compare(alpha, that.alpha) == 0
                && Double.compare(beta, that.beta) == 0
                && Double.compare(gamma, that.gamma) == 0
                && Double.compare(confidenceZ, that.confidenceZ) == 0
                && Double.compare(trendNoiseFloor, that.trendNoiseFloor) == 0
                && detectors.equals(that.detectors)
                && Objects.equals(zWindow, that.zWindow)
                && Objects.equals(iqrWindow, that.iqrWindow)
                && Objects.equals(isolationSeed, that.isolationSeed)
                && Objects.equals(isolationSampleSize, that.isolationSampleSize)
                && Objects.equals(seasonalPeriod, that.seasonalPeriod)
                && decompositionMode == that.decompositionMode
                && smoothingMode == that.smoothingMode
                && Objects.equals(forecastHorizon, that.forecastHorizon)
                && gapFillPolicy == that.gapFillPolicy
                && duplicatePolicy == that.duplicatePolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectors, zThreshold, zWindow, iqrMultiplier, iqrWindow, isolationSeed,
                isolationScoreThreshold, isolationTrees, isolationSampleSize, movingAverageWindow,
                movingAverageThreshold, consensusMajorityFraction, trendAnalysisEnabled, decompositionEnabled,
                seasonalPeriod, seasonalityMinCorrelation, decompositionMode, smoothingMode, alpha, beta, gamma,
                forecastHorizon, confidenceZ, trendNoiseFloor, gapFillPolicy, duplicatePolicy);
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "detectors=" + detectors +
                ", zThreshold=" + zThreshold +
                ", iqrMultiplier=" + iqrMultiplier +
                ", isolationSeed=" + isolationSeed +
                ", consensusMajorityFraction=" + consensusMajorityFraction +
                ", trendAnalysisEnabled=" + trendAnalysisEnabled +
                ", smoothingMode=" + smoothingMode +
                ", decompositionMode=" + decompositionMode +
                ", forecastHorizon=" + forecastHorizon +
                ", gapFillPolicy=" + gapFillPolicy +
                ", duplicatePolicy=" + duplicatePolicy +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnalysisConfig}. Unset parameters keep their
     * documented defaults.
     */
    public static class Builder {
        private List<DetectorType> detectors = List.of(DetectorType.ZSCORE, DetectorType.IQR,
                DetectorType.ISOLATION);
        private double zThreshold = 3.0;
        private Integer zWindow;
        private double iqrMultiplier = 1.5;
        private Integer iqrWindow;
        private Long isolationSeed;
        private double isolationScoreThreshold = 0.6;
        private int isolationTrees = 100;
        private Integer isolationSampleSize;
        private int movingAverageWindow = 7;
        private double movingAverageThreshold = 2.0;
        private double consensusMajorityFraction = 0.5;
        private boolean trendAnalysisEnabled = true;
        private boolean decompositionEnabled = true;
        private Integer seasonalPeriod;
        private double seasonalityMinCorrelation = 0.5;
        private DecompositionMode decompositionMode = DecompositionMode.ADDITIVE;
        private SmoothingMode smoothingMode = SmoothingMode.DOUBLE;
        private double alpha = 0.3;
        private double beta = 0.1;
        private double gamma = 0.1;
        private Integer forecastHorizon;
        private double confidenceZ = 1.96;
        private double trendNoiseFloor = 0.001;
        private GapFillPolicy gapFillPolicy = GapFillPolicy.NONE;
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.LAST_WRITE_WINS;

        public Builder detectors(List<DetectorType> v) {
            this.detectors = v;
            return this;
        }

        public Builder detectors(DetectorType... v) {
            this.detectors = List.of(v);
            return this;
        }

        public Builder zThreshold(double v) {
            this.zThreshold = v;
            return this;
        }

        public Builder zWindow(Integer v) {
            this.zWindow = v;
            return this;
        }

        public Builder iqrMultiplier(double v) {
            this.iqrMultiplier = v;
            return this;
        }

        public Builder iqrWindow(Integer v) {
            this.iqrWindow = v;
            return this;
        }

        public Builder isolationSeed(Long v) {
            this.isolationSeed = v;
            return this;
        }

        public Builder isolationScoreThreshold(double v) {
            this.isolationScoreThreshold = v;
            return this;
        }

        public Builder isolationTrees(int v) {
            this.isolationTrees = v;
            return this;
        }

        public Builder isolationSampleSize(Integer v) {
            this.isolationSampleSize = v;
            return this;
        }

        public Builder movingAverageWindow(int v) {
            this.movingAverageWindow = v;
            return this;
        }

        public Builder movingAverageThreshold(double v) {
            this.movingAverageThreshold = v;
            return this;
        }

        public Builder consensusMajorityFraction(double v) {
            this.consensusMajorityFraction = v;
            return this;
        }

        public Builder trendAnalysisEnabled(boolean v) {
            this.trendAnalysisEnabled = v;
            return this;
        }

        public Builder decompositionEnabled(boolean v) {
            this.decompositionEnabled = v;
            return this;
        }

        public Builder seasonalPeriod(Integer v) {
            this.seasonalPeriod = v;
            return this;
        }

        public Builder seasonalityMinCorrelation(double v) {
            this.seasonalityMinCorrelation = v;
            return this;
        }

        public Builder decompositionMode(DecompositionMode v) {
            this.decompositionMode = v;
            return this;
        }

        public Builder smoothingMode(SmoothingMode v) {
            this.smoothingMode = v;
            return this;
        }

        public Builder alpha(double v) {
            this.alpha = v;
            return this;
        }

        public Builder beta(double v) {
            this.beta = v;
            return this;
        }

        public Builder gamma(double v) {
            this.gamma = v;
            return this;
        }

        public Builder forecastHorizon(Integer v) {
            this.forecastHorizon = v;
            return this;
        }

        public Builder confidenceZ(double v) {
            this.confidenceZ = v;
            return this;
        }

        public Builder trendNoiseFloor(double v) {
            this.trendNoiseFloor = v;
            return this;
        }

        public Builder gapFillPolicy(GapFillPolicy v) {
            this.gapFillPolicy = v;
            return this;
        }

        public Builder duplicatePolicy(DuplicatePolicy v) {
            this.duplicatePolicy = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AnalysisConfig}
         * @throws InvalidParameterException listing every invalid parameter
         */
        public AnalysisConfig build() {
            List<String> errors = new ArrayList<>();

            if (detectors == null || detectors.isEmpty()) {
                errors.add("'detectors' must name at least one detector");
            } else {
                Set<DetectorType> seen = EnumSet.noneOf(DetectorType.class);
                for (DetectorType type : detectors) {
                    if (type == null) {
                        errors.add("'detectors' must not contain null entries");
                    } else if (!seen.add(type)) {
                        errors.add("'detectors' lists '" + type.getDetectorName() + "' more than once");
                    }
                }
                if (seen.contains(DetectorType.ISOLATION) && isolationSeed == null) {
                    errors.add("'isolation_seed' is required when the isolation detector is enabled");
                }
            }

            positive(errors, "z_threshold", zThreshold);
            if (zWindow != null && zWindow < 2) {
                errors.add("'z_window' must be >= 2, got: " + zWindow);
            }
            positive(errors, "iqr_multiplier", iqrMultiplier);
            if (iqrWindow != null && iqrWindow < 4) {
                errors.add("'iqr_window' must be >= 4, got: " + iqrWindow);
            }
            openUnit(errors, "isolation_score_threshold", isolationScoreThreshold);
            if (isolationTrees < 1) {
                errors.add("'isolation_trees' must be >= 1, got: " + isolationTrees);
            }
            if (isolationSampleSize != null && isolationSampleSize < 2) {
                errors.add("'isolation_sample_size' must be >= 2, got: " + isolationSampleSize);
            }
            if (movingAverageWindow < 2) {
                errors.add("'moving_average_window' must be >= 2, got: " + movingAverageWindow);
            }
            positive(errors, "moving_average_threshold", movingAverageThreshold);
            if (!(consensusMajorityFraction > 0 && consensusMajorityFraction <= 1)) {
                errors.add("'consensus_majority_fraction' must be in (0, 1], got: " + consensusMajorityFraction);
            }

            if (seasonalPeriod != null && seasonalPeriod < 2) {
                errors.add("'seasonal_period' must be >= 2, got: " + seasonalPeriod);
            }
            if (!(seasonalityMinCorrelation > 0 && seasonalityMinCorrelation <= 1)) {
                errors.add("'seasonality_min_correlation' must be in (0, 1], got: " + seasonalityMinCorrelation);
            }
            if (decompositionMode == null) {
                errors.add("'decomposition_mode' must not be null");
            }
            if (smoothingMode == null) {
                errors.add("'smoothing_mode' must not be null");
            }
            openUnit(errors, "alpha", alpha);
            openUnit(errors, "beta", beta);
            openUnit(errors, "gamma", gamma);
            if (forecastHorizon == null) {
                if (trendAnalysisEnabled) {
                    errors.add("'forecast_horizon' is required when trend analysis is enabled");
                }
            } else if (forecastHorizon < 1) {
                errors.add("'forecast_horizon' must be >= 1, got: " + forecastHorizon);
            }
            positive(errors, "confidence_z", confidenceZ);
            if (!(trendNoiseFloor >= 0)) {
                errors.add("'trend_noise_floor' must be >= 0, got: " + trendNoiseFloor);
            }

            if (gapFillPolicy == null) {
                errors.add("'gap_fill_policy' must not be null");
            }
            if (duplicatePolicy == null) {
                errors.add("'duplicate_policy' must not be null");
            }

            if (!errors.isEmpty()) {
                throw new InvalidParameterException(
                        "analysis configuration is invalid:\n  - " + String.join("\n  - ", errors));
            }
            return new AnalysisConfig(this);
        }

        private static void positive(List<String> errors, String name, double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                errors.add("'" + name + "' must be a finite value > 0, got: " + value);
            }
        }

        private static void openUnit(List<String> errors, String name, double value) {
            if (!(value > 0 && value < 1)) {
                errors.add("'" + name + "' must be strictly between 0 and 1, got: " + value);
            }
        }
    }
}
