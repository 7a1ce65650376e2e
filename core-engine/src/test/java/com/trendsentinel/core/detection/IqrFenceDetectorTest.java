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
 * Unit tests for {@link IqrFenceDetector}.
 */
class IqrFenceDetectorTest {

    @Test
    @DisplayName("Should flag values beyond the fences")
    void shouldFlagBeyondFences() {
        IqrFenceDetector detector = new IqrFenceDetector(1.5, null);

        List<DetectorResult> results = detector.detect(daily(10, 12, 11, 13, 12, 11, 10, 40));

        assertThat(flagged(results)).containsExactly(7);
        assertThat(results.get(7).getScore()).isCloseTo(18.5, within(1e-9));
        assertThat(results.get(0).getScore()).isCloseTo(0.5, within(1e-9));
        assertThat(results.get(4).getScore()).isZero();
    }

    @Test
    @DisplayName("Should give an infinite score outside a zero-width box")
    void shouldHandleZeroIqr() {
        IqrFenceDetector detector = new IqrFenceDetector(1.5, null);

        List<DetectorResult> results = detector.detect(daily(10, 10, 10, 10, 100, 10, 10));

        assertThat(flagged(results)).containsExactly(4);
        assertThat(results.get(4).getScore()).isInfinite();
        assertThat(results.get(4).isOutlier()).isTrue();
        assertThat(results.get(0).getScore()).isZero();
    }

    @Test
    @DisplayName("Should not score points before the first full window")
    void shouldUseTrailingWindow() {
        IqrFenceDetector detector = new IqrFenceDetector(1.5, 4);

        List<DetectorResult> results = detector.detect(daily(1, 2, 3, 4, 5, 6, 7, 80));

        assertThat(results.subList(0, 3)).noneMatch(DetectorResult::isScored);
        assertThat(results.get(3).isScored()).isTrue();
        assertThat(flagged(results)).containsExactly(7);
    }

    @Test
    @DisplayName("Should be unavailable below four observed points")
    void shouldBeUnavailableForShortSeries() {
        IqrFenceDetector detector = new IqrFenceDetector(1.5, null);

        assertThatThrownBy(() -> detector.detect(daily(1, 2, 3)))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasMessageContaining("at least 4");
    }
}
