package com.trendsentinel.core.detection;

import com.trendsentinel.core.error.DetectorUnavailableException;
import com.trendsentinel.core.model.DetectorResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.trendsentinel.core.SeriesFixtures.daily;
import static com.trendsentinel.core.detection.ZScoreDetectorTest.flagged;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MovingAverageDeviationDetector}.
 */
class MovingAverageDeviationDetectorTest {

    @Test
    @DisplayName("Should flag a point far from its trailing average")
    void shouldFlagDeviation() {
        MovingAverageDeviationDetector detector = new MovingAverageDeviationDetector(7, 2.0);

        List<DetectorResult> results = detector.detect(daily(10, 10, 10, 10, 10, 10, 10, 10, 100, 10));

        assertThat(results.subList(0, 6)).noneMatch(DetectorResult::isScored);
        assertThat(results.get(6).getScore()).isZero();
        assertThat(flagged(results)).containsExactly(8);
        assertThat(results.get(8).getScore()).isCloseTo(6 / Math.sqrt(7), within(1e-9));
    }

    @Test
    @DisplayName("Should skip missing points when filling the window")
    void shouldSkipMissingPoints() {
        MovingAverageDeviationDetector detector = new MovingAverageDeviationDetector(3, 2.0);

        List<DetectorResult> results = detector.detect(daily(1, Double.NaN, 2, 3, 4));

        assertThat(results.get(1).isScored()).isFalse();
        assertThat(results.get(2).isScored()).isFalse();
        assertThat(results.get(3).getScore()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should be unavailable when the series is shorter than the window")
    void shouldBeUnavailableForShortSeries() {
        MovingAverageDeviationDetector detector = new MovingAverageDeviationDetector(7, 2.0);

        assertThatThrownBy(() -> detector.detect(daily(1, 2, 3)))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasMessageContaining("at least 7");
    }
}
