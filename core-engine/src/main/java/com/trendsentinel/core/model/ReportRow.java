package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of an {@link AnalysisReport}.
 *
 * <p>
 * Observed rows carry the prepared value, detector verdicts, the consensus and
 * the decomposition point. Forecast rows carry only a {@link ForecastPoint};
 * their value is {@link Double#NaN}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code kind} and {@code timestamp} are required and
 * a forecast row must carry a forecast point.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReportRow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final RowKind kind;
    private final Instant timestamp;
    private final double value;
    private final boolean imputed;
    private final Map<String, Object> sourceRow;
    private final Map<String, DetectorResult> detectorResults;
    private final ConsensusResult consensus;
    private final DecompositionPoint decomposition;
    private final ForecastPoint forecast;

    private ReportRow(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        if (kind == RowKind.FORECAST && builder.forecast == null) {
            throw new IllegalArgumentException("A forecast row needs a forecast point");
        }
        this.value = builder.value;
        this.imputed = builder.imputed;
        this.sourceRow = builder.sourceRow;
        this.detectorResults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.detectorResults));
        this.consensus = builder.consensus;
        this.decomposition = builder.decomposition;
        this.forecast = builder.forecast;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RowKind getKind() {
        return kind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public boolean isImputed() {
        return imputed;
    }

    public Map<String, Object> getSourceRow() {
        return sourceRow;
    }

    /**
     * @return verdict per contributing detector, in configured order
     */
    public Map<String, DetectorResult> getDetectorResults() {
        return detectorResults;
    }

    /**
     * @return consensus, {@code null} on forecast rows
     */
    public ConsensusResult getConsensus() {
        return consensus;
    }

    /**
     * @return decomposition components, {@code null} when not computed or on
     *         forecast rows
     */
    public DecompositionPoint getDecomposition() {
        return decomposition;
    }

    /**
     * @return forecast, {@code null} on observed rows
     */
    public ForecastPoint getForecast() {
        return forecast;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ReportRow that))
            return false;
        return kind == that.kind
                && Double.compare(value, that.value) == 0
                && imputed == that.imputed
                && timestamp.equals(that.timestamp)
                && detectorResults.equals(that.detectorResults)
                && Objects.equals(consensus, that.consensus)
                && Objects.equals(decomposition, that.decomposition)
                && Objects.equals(forecast, that.forecast);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, timestamp, value, imputed, detectorResults, consensus, decomposition, forecast);
    }

    @Override
    public String toString() {
        return "ReportRow{" + kind + " @ " + timestamp + ", value=" + value + '}';
    }

    /**
     * Fluent builder for {@link ReportRow}.
     */
    public static class Builder {
        private RowKind kind;
        private Instant timestamp;
        private double value = Double.NaN;
        private boolean imputed;
        private Map<String, Object> sourceRow = Map.of();
        private final Map<String, DetectorResult> detectorResults = new LinkedHashMap<>();
        private ConsensusResult consensus;
        private DecompositionPoint decomposition;
        private ForecastPoint forecast;

        public Builder kind(RowKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder imputed(boolean imputed) {
            this.imputed = imputed;
            return this;
        }

        public Builder sourceRow(Map<String, Object> sourceRow) {
            this.sourceRow = sourceRow != null ? sourceRow : Map.of();
            return this;
        }

        public Builder detectorResult(DetectorResult result) {
            this.detectorResults.put(result.getDetector(), result);
            return this;
        }

        public Builder consensus(ConsensusResult consensus) {
            this.consensus = consensus;
            return this;
        }

        public Builder decomposition(DecompositionPoint decomposition) {
            this.decomposition = decomposition;
            return this;
        }

        public Builder forecast(ForecastPoint forecast) {
            this.forecast = forecast;
            return this;
        }

        /**
         * @return a new {@link ReportRow}
         * @throws NullPointerException     if {@code kind} or {@code timestamp} is
         *                                  {@code null}
         * @throws IllegalArgumentException if a forecast row has no forecast point
         */
        public ReportRow build() {
            return new ReportRow(this);
        }
    }
}
