package com.trendsentinel.core.detection;

import com.trendsentinel.core.error.DetectorUnavailableException;
import com.trendsentinel.core.error.InvalidParameterException;
import com.trendsentinel.core.model.DetectorResult;
import com.trendsentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static com.trendsentinel.core.SeriesFixtures.daily;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link IsolationForestDetector}.
 */
class IsolationForestDetectorTest {

    private static final int SPIKE = 25;

    @Test
    @DisplayName("Should give the spike the highest score")
    void shouldIsolateSpike() {
        IsolationForestDetector detector = new IsolationForestDetector(42L, 100, null, 0.6);

        List<DetectorResult> results = detector.detect(spikySeries());

        double spikeScore = results.get(SPIKE).getScore();
        assertThat(results.get(SPIKE).isOutlier()).isTrue();
        assertThat(results).allSatisfy(r -> assertThat(r.getScore()).isBetween(0.0, 1.0));
        assertThat(results).extracting(DetectorResult::getScore).allMatch(s -> s <= spikeScore);
    }

    @Test
    @DisplayName("Should give equal scores for equal seeds")
    void shouldBeDeterministic() {
        TimeSeries series = spikySeries();

        List<DetectorResult> first = new IsolationForestDetector(7L, 50, 16, 0.6).detect(series);
        List<DetectorResult> second = new IsolationForestDetector(7L, 50, 16, 0.6).detect(series);
        List<DetectorResult> other = new IsolationForestDetector(8L, 50, 16, 0.6).detect(series);

        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(other);
    }

    @Test
    @DisplayName("Should be unavailable below eight observed points")
    void shouldBeUnavailableForShortSeries() {
        IsolationForestDetector detector = new IsolationForestDetector(1L, 10, null, 0.6);

        assertThatThrownBy(() -> detector.detect(daily(10, 10, 10, 10, 100, 10, 10)))
                .isInstanceOf(DetectorUnavailableException.class)
                .satisfies(e -> assertThat(((DetectorUnavailableException) e).getDetector())
                        .isEqualTo("isolation"));
    }

    @Test
    @DisplayName("Should be unavailable when the sample size exceeds the observed points")
    void shouldBeUnavailableForOversizedSample() {
        IsolationForestDetector detector = new IsolationForestDetector(1L, 10, 64, 0.6);

        assertThatThrownBy(() -> detector.detect(spikySeries()))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasMessageContaining("sample size 64");
    }

    @Test
    @DisplayName("Should reject a score threshold outside (0, 1)")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new IsolationForestDetector(1L, 10, null, 1.0))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("Should compute the average unsuccessful search path length")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationForestDetector.averagePathLength(1)).isZero();
        assertThat(IsolationForestDetector.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForestDetector.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private static TimeSeries spikySeries() {
        double[] values = IntStream.range(0, 40).mapToDouble(i -> 100 + 3 * Math.sin(i)).toArray();
        values[SPIKE] = 300;
        return daily(values);
    }
}
