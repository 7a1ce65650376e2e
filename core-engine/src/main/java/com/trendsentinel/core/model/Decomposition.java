package com.trendsentinel.core.model;

import com.trendsentinel.core.config.DecompositionMode;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Full decomposition of a series under one mode and seasonal period.
 *
 * <p>
 * Additive: {@code trend + seasonal + residual = value}. Multiplicative:
 * {@code trend * seasonal * residual = value}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Decomposition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DecompositionMode mode;
    private final int period;
    private final List<DecompositionPoint> points;
    private final double[] seasonalIndices;

    public Decomposition(DecompositionMode mode, int period, List<DecompositionPoint> points,
            double[] seasonalIndices) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.period = period;
        this.points = Collections.unmodifiableList(List.copyOf(points));
        this.seasonalIndices = seasonalIndices.clone();
    }

    public DecompositionMode getMode() {
        return mode;
    }

    public int getPeriod() {
        return period;
    }

    public List<DecompositionPoint> getPoints() {
        return points;
    }

    /**
     * @return one normalized seasonal effect per phase (copy)
     */
    public double[] getSeasonalIndices() {
        return seasonalIndices.clone();
    }

    @Override
    public String toString() {
        return "Decomposition{mode=" + mode + ", period=" + period + ", points=" + points.size() + '}';
    }
}
