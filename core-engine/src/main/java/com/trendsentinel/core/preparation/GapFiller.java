package com.trendsentinel.core.preparation;

import com.trendsentinel.core.config.GapFillPolicy;
import com.trendsentinel.core.model.SeriesPoint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fills missing values of a resampled series according to a
 * {@link GapFillPolicy}.
 *
 * <p>
 * Only interior gaps are interpolated; forward fill leaves leading gaps
 * missing. Every filled point is marked imputed.
 * </p>
 *
 * @since 1.0.0
 */
final class GapFiller {

    private GapFiller() {
        // utility class, not instantiable
    }

    static List<SeriesPoint> fill(List<SeriesPoint> points, GapFillPolicy policy) {
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        return switch (policy) {
            case NONE -> points;
            case FORWARD_FILL -> forwardFill(points);
            case INTERPOLATE -> interpolate(points);
        };
    }

    private static List<SeriesPoint> forwardFill(List<SeriesPoint> points) {
        List<SeriesPoint> result = new ArrayList<>(points.size());
        double last = Double.NaN;
        for (SeriesPoint p : points) {
            if (!p.isMissing()) {
                last = p.getValue();
                result.add(p);
            } else if (!Double.isNaN(last)) {
                result.add(p.withImputedValue(last));
            } else {
                result.add(p);
            }
        }
        return result;
    }

    private static List<SeriesPoint> interpolate(List<SeriesPoint> points) {
        List<SeriesPoint> result = new ArrayList<>(points);
        int prev = -1;
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).isMissing()) {
                continue;
            }
            if (prev >= 0 && i - prev > 1) {
                SeriesPoint a = points.get(prev);
                SeriesPoint b = points.get(i);
                double span = Duration.between(a.getTimestamp(), b.getTimestamp()).toMillis();
                for (int j = prev + 1; j < i; j++) {
                    SeriesPoint gap = points.get(j);
                    double offset = Duration.between(a.getTimestamp(), gap.getTimestamp()).toMillis();
                    double value = a.getValue() + (b.getValue() - a.getValue()) * (offset / span);
                    result.set(j, gap.withImputedValue(value));
                }
            }
            prev = i;
        }
        return result;
    }
}
