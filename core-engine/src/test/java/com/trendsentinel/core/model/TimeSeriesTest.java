package com.trendsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.trendsentinel.core.SeriesFixtures.METRIC;
import static com.trendsentinel.core.SeriesFixtures.START;
import static com.trendsentinel.core.SeriesFixtures.daily;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeSeries}.
 */
class TimeSeriesTest {

    private static final SeriesKey KEY = SeriesKey.of(METRIC);

    @Test
    @DisplayName("Should reject a missing frequency for two or more points")
    void shouldRequireFrequency() {
        List<SeriesPoint> points = List.of(
                SeriesPoint.observed(START, 1.0),
                SeriesPoint.observed(START.plus(Duration.ofDays(1)), 2.0));

        assertThatThrownBy(() -> new TimeSeries(KEY, points, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("frequency is required");
    }

    @Test
    @DisplayName("Should accept a missing frequency for a single point")
    void shouldAllowSinglePointWithoutFrequency() {
        TimeSeries series = new TimeSeries(KEY, List.of(SeriesPoint.observed(START, 1.0)), null);

        assertThat(series.getFrequency()).isNull();
        assertThat(series.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject timestamps that do not increase")
    void shouldRejectUnorderedTimestamps() {
        List<SeriesPoint> points = List.of(SeriesPoint.observed(START, 1.0), SeriesPoint.observed(START, 2.0));

        assertThatThrownBy(() -> new TimeSeries(KEY, points, Duration.ofDays(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increasing");
    }

    @Test
    @DisplayName("Should hide filled-in values and count only recorded ones")
    void shouldMaskImputedValues() {
        Instant gap = START.plus(Duration.ofDays(1));
        TimeSeries series = new TimeSeries(KEY, List.of(
                SeriesPoint.observed(START, 10.0),
                new SeriesPoint(gap, 10.0, true, Map.of()),
                SeriesPoint.observed(START.plus(Duration.ofDays(2)), 12.0)), Duration.ofDays(1));

        TimeSeries recorded = series.recordedOnly();

        assertThat(series.observedCount()).isEqualTo(3);
        assertThat(series.recordedCount()).isEqualTo(2);
        assertThat(recorded.isMissing(1)).isTrue();
        assertThat(recorded.getPoints().get(1).isImputed()).isTrue();
        assertThat(recorded.timestampAt(1)).isEqualTo(gap);
        assertThat(recorded.valueAt(2)).isEqualTo(12.0);
        assertThat(recorded.getFrequency()).isEqualTo(Duration.ofDays(1));
    }

    @Test
    @DisplayName("Should return itself when nothing was filled in")
    void shouldKeepUnfilledSeries() {
        TimeSeries series = daily(1, Double.NaN, 3);

        assertThat(series.recordedOnly()).isSameAs(series);
        assertThat(series.recordedCount()).isEqualTo(2);
    }
}
