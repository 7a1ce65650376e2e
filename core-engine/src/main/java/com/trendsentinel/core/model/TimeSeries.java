package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Prepared, gap-aware series of one metric for one dimension group.
 *
 * <p>
 * Timestamps are strictly increasing and unique. Values are numeric or
 * explicitly missing ({@link Double#NaN}). Instances are immutable and are
 * owned by a single analysis invocation; every read method hands out copies,
 * so concurrent readers never observe each other.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SeriesKey key;
    private final List<SeriesPoint> points;
    private final Duration frequency;

    /**
     * @param key       series identity
     * @param points    points in timestamp order
     * @param frequency dominant spacing, {@code null} only for fewer than two
     *                  points
     * @throws IllegalArgumentException if timestamps are not strictly
     *                                  increasing, or the frequency is
     *                                  missing for two or more points
     */
    public TimeSeries(SeriesKey key, List<SeriesPoint> points, Duration frequency) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(points, "points must not be null");
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).getTimestamp().isAfter(points.get(i - 1).getTimestamp())) {
                throw new IllegalArgumentException("Timestamps must be strictly increasing: "
                        + points.get(i - 1).getTimestamp() + " then " + points.get(i).getTimestamp());
            }
        }
        if (frequency == null && points.size() >= 2) {
            throw new IllegalArgumentException("frequency is required for a series of " + points.size()
                    + " points");
        }
        if (frequency != null && (frequency.isZero() || frequency.isNegative())) {
            throw new IllegalArgumentException("frequency must be positive, got: " + frequency);
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.frequency = frequency;
    }

    /**
     * Build a regular series starting at {@code start} with one point per
     * {@code step}. {@code NaN} entries are missing values.
     *
     * @param key    series identity
     * @param start  first timestamp
     * @param step   spacing between points
     * @param values observed values
     * @return new series
     */
    public static TimeSeries regular(SeriesKey key, Instant start, Duration step, double... values) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(step, "step must not be null");
        List<SeriesPoint> pts = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            pts.add(SeriesPoint.observed(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new TimeSeries(key, pts, step);
    }

    public SeriesKey getKey() {
        return key;
    }

    public List<SeriesPoint> getPoints() {
        return points;
    }

    /**
     * @return dominant spacing, or {@code null} if undetermined
     */
    public Duration getFrequency() {
        return frequency;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Instant timestampAt(int index) {
        return points.get(index).getTimestamp();
    }

    public double valueAt(int index) {
        return points.get(index).getValue();
    }

    public boolean isMissing(int index) {
        return points.get(index).isMissing();
    }

    /**
     * @return copy of all values, {@code NaN} where missing
     */
    public double[] values() {
        double[] result = new double[points.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = points.get(i).getValue();
        }
        return result;
    }

    /**
     * @return number of non-missing values
     */
    public int observedCount() {
        int count = 0;
        for (SeriesPoint p : points) {
            if (!p.isMissing()) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return number of non-missing values that came from the input, gap
     *         fills excluded
     */
    public int recordedCount() {
        int count = 0;
        for (SeriesPoint p : points) {
            if (!p.isMissing() && !p.isImputed()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Same series with every imputed value put back to missing. Timestamps
     * and source rows are unchanged.
     *
     * @return this series if nothing was filled in, otherwise a masked copy
     */
    public TimeSeries recordedOnly() {
        boolean filled = points.stream().anyMatch(p -> p.isImputed() && !p.isMissing());
        if (!filled) {
            return this;
        }
        List<SeriesPoint> masked = new ArrayList<>(points.size());
        for (SeriesPoint p : points) {
            masked.add(p.isImputed() && !p.isMissing()
                    ? new SeriesPoint(p.getTimestamp(), Double.NaN, true, p.getSourceRow())
                    : p);
        }
        return new TimeSeries(key, masked, frequency);
    }

    /**
     * @return non-missing values in order
     */
    public double[] observedValues() {
        return points.stream()
                .filter(p -> !p.isMissing())
                .mapToDouble(SeriesPoint::getValue)
                .toArray();
    }

    /**
     * Timestamp {@code steps} periods after the last point.
     *
     * @param steps number of periods ahead, at least 1
     * @return projected timestamp
     * @throws IllegalStateException if the series has no frequency
     */
    public Instant timestampAfterLast(int steps) {
        if (frequency == null || points.isEmpty()) {
            throw new IllegalStateException("Series " + key + " has no frequency to project from");
        }
        return points.get(points.size() - 1).getTimestamp().plus(frequency.multipliedBy(steps));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return key.equals(that.key) && points.equals(that.points) && Objects.equals(frequency, that.frequency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, points, frequency);
    }

    @Override
    public String toString() {
        return "TimeSeries{key=" + key + ", points=" + points.size() + ", frequency=" + frequency + '}';
    }
}
