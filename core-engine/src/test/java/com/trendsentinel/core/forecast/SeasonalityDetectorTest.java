package com.trendsentinel.core.forecast;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.model.SeasonalityProfile;
import com.trendsentinel.core.model.SeasonalityProfile.Source;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.trendsentinel.core.SeriesFixtures.ramp;
import static com.trendsentinel.core.SeriesFixtures.seasonal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalityDetector}.
 */
class SeasonalityDetectorTest {

    private final SeasonalityDetector detector = new SeasonalityDetector(0.5);

    @Test
    @DisplayName("Should detect the first autocorrelation peak")
    void shouldDetectPeriod() {
        SeasonalityProfile profile = detector.resolve(seasonal(24, 100, 0, 0, 10, 0, -10), null);

        assertThat(profile.getSource()).isEqualTo(Source.DETECTED);
        assertThat(profile.getPeriod()).isEqualTo(4);
        assertThat(profile.isSeasonal()).isTrue();
        assertThat(profile.getAutocorrelation()).isCloseTo(1000.0 / 1200, within(1e-9));
    }

    @Test
    @DisplayName("Should prefer the configured period")
    void shouldUseConfiguredPeriod() {
        SeasonalityProfile profile = detector.resolve(seasonal(24, 100, 0, 0, 10, 0, -10), 3);

        assertThat(profile.getSource()).isEqualTo(Source.CONFIGURED);
        assertThat(profile.getPeriod()).isEqualTo(3);
        assertThat(profile.isSeasonal()).isFalse();
        assertThat(profile.getAutocorrelation()).isCloseTo(0, within(1e-9));
    }

    @Test
    @DisplayName("Should fall back to the default period for a trend without seasonality")
    void shouldFallBackForRamp() {
        SeasonalityProfile profile = detector.resolve(ramp(30, 100, 5), null);

        assertThat(profile.getSource()).isEqualTo(Source.DEFAULT);
        assertThat(profile.getPeriod()).isEqualTo(AnalysisConfig.DEFAULT_SEASONAL_PERIOD);
        assertThat(profile.isSeasonal()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to the default period for a constant series")
    void shouldFallBackForConstant() {
        SeasonalityProfile profile = detector.resolve(new double[] { 3, 3, 3, 3, 3, 3 }, null);

        assertThat(profile.getSource()).isEqualTo(Source.DEFAULT);
        assertThat(SeasonalityDetector.autocorrelation(new double[] { 3, 3, 3 }, 1)).isNaN();
    }
}
