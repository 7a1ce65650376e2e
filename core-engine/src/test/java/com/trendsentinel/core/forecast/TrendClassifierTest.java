package com.trendsentinel.core.forecast;

import com.trendsentinel.core.model.TrendDirection;
import com.trendsentinel.core.model.TrendSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.trendsentinel.core.SeriesFixtures.ramp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrendClassifier}.
 */
class TrendClassifierTest {

    private final TrendClassifier classifier = new TrendClassifier(0.001);

    @Test
    @DisplayName("Should classify a rising line as increasing with full strength")
    void shouldClassifyIncreasing() {
        TrendSummary trend = classifier.classify(ramp(30, 100, 5));

        assertThat(trend.getDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(trend.getSlope()).isCloseTo(5, within(1e-9));
        assertThat(trend.getStrength()).isCloseTo(1, within(1e-9));
    }

    @Test
    @DisplayName("Should classify a falling series as decreasing")
    void shouldClassifyDecreasing() {
        TrendSummary trend = classifier.classify(new double[] { 10, 9, Double.NaN, 7 });

        assertThat(trend.getDirection()).isEqualTo(TrendDirection.DECREASING);
        assertThat(trend.getSlope()).isCloseTo(-1, within(1e-9));
    }

    @Test
    @DisplayName("Should classify a constant series as flat with zero strength")
    void shouldClassifyFlat() {
        TrendSummary trend = classifier.classify(new double[] { 5, 5, 5 });

        assertThat(trend.getDirection()).isEqualTo(TrendDirection.FLAT);
        assertThat(trend.getStrength()).isZero();
    }

    @Test
    @DisplayName("Should treat a slope below the noise floor as flat")
    void shouldApplyNoiseFloor() {
        TrendSummary trend = new TrendClassifier(0.01).classify(ramp(10, 1000, 1));

        assertThat(trend.getRelativeSlope()).isLessThan(0.01);
        assertThat(trend.getDirection()).isEqualTo(TrendDirection.FLAT);
    }

    @Test
    @DisplayName("Should require two observed values")
    void shouldRejectSingleValue() {
        assertThatThrownBy(() -> classifier.classify(new double[] { 1, Double.NaN }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
