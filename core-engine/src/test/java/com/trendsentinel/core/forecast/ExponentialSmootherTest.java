package com.trendsentinel.core.forecast;

import com.trendsentinel.core.config.DecompositionMode;
import com.trendsentinel.core.config.SmoothingMode;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.error.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.trendsentinel.core.SeriesFixtures.ramp;
import static com.trendsentinel.core.SeriesFixtures.seasonal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ExponentialSmoother}.
 */
class ExponentialSmootherTest {

    @Test
    @DisplayName("Should forecast the level of a constant series with zero error")
    void shouldSmoothConstantSeries() {
        SmoothingFit fit = smoother(SmoothingMode.SINGLE).fit(new double[] { 4, 4, 4, 4 }, 7);

        assertThat(fit.forecast(1)).isEqualTo(4.0);
        assertThat(fit.forecast(10)).isEqualTo(4.0);
        assertThat(fit.getResidualStd()).isZero();
        assertThat(fit.getResidualCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should extrapolate a straight line exactly")
    void shouldExtrapolateLine() {
        SmoothingFit fit = smoother(SmoothingMode.DOUBLE).fit(ramp(20, 100, 5), 7);

        assertThat(fit.getTrend()).isCloseTo(5, within(1e-9));
        assertThat(fit.forecast(1)).isCloseTo(200, within(1e-9));
        assertThat(fit.forecast(3)).isCloseTo(210, within(1e-9));
        assertThat(fit.getResidualStd()).isCloseTo(0, within(1e-9));
    }

    @Test
    @DisplayName("Should skip leading missing values")
    void shouldSkipLeadingMissingValues() {
        SmoothingFit fit = smoother(SmoothingMode.DOUBLE).fit(new double[] { Double.NaN, 1, 2, 3, 4 }, 7);

        assertThat(fit.forecast(1)).isCloseTo(5, within(1e-9));
        assertThat(fit.getResidualCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should continue a stable seasonal pattern in phase")
    void shouldContinueSeasonalPattern() {
        double[] pattern = { 0, 10, 0, -10 };
        SmoothingFit fit = smoother(SmoothingMode.TRIPLE).fit(seasonal(18, 100, 0, pattern), 4);

        // 18 points end at phase 1, so the next point is phase 2
        assertThat(fit.forecast(1)).isCloseTo(100, within(1e-9));
        assertThat(fit.forecast(2)).isCloseTo(90, within(1e-9));
        assertThat(fit.forecast(3)).isCloseTo(100, within(1e-9));
        assertThat(fit.forecast(4)).isCloseTo(110, within(1e-9));
        assertThat(fit.getResidualStd()).isCloseTo(0, within(1e-9));
    }

    @Test
    @DisplayName("Should require two full seasons for triple smoothing")
    void shouldRejectShortSeasonalSeries() {
        ExponentialSmoother smoother = smoother(SmoothingMode.TRIPLE);

        assertThat(smoother.requiredObservations(7)).isEqualTo(14);
        assertThatThrownBy(() -> smoother.fit(ramp(10, 1, 1), 7))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("triple exponential smoothing");
    }

    @Test
    @DisplayName("Should require three observations for double smoothing")
    void shouldRejectShortTrendSeries() {
        assertThatThrownBy(() -> smoother(SmoothingMode.DOUBLE).fit(new double[] { 1, Double.NaN, 2 }, 7))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Should reject coefficients outside (0, 1)")
    void shouldRejectInvalidCoefficients() {
        assertThatThrownBy(() -> new ExponentialSmoother(SmoothingMode.SINGLE, DecompositionMode.ADDITIVE,
                0, 0.1, 0.1))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("alpha");
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private static ExponentialSmoother smoother(SmoothingMode mode) {
        return new ExponentialSmoother(mode, DecompositionMode.ADDITIVE, 0.3, 0.1, 0.1);
    }
}
