package com.trendsentinel.core.config;

import com.trendsentinel.core.error.ErrorCode;
import com.trendsentinel.core.error.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfig}.
 */
class AnalysisConfigTest {

    @Test
    @DisplayName("Should build with documented defaults")
    void shouldBuildWithDefaults() {
        AnalysisConfig config = AnalysisConfig.builder()
                .isolationSeed(1L)
                .forecastHorizon(4)
                .build();

        assertThat(config.getDetectors())
                .containsExactly(DetectorType.ZSCORE, DetectorType.IQR, DetectorType.ISOLATION);
        assertThat(config.getZThreshold()).isEqualTo(3.0);
        assertThat(config.getIqrMultiplier()).isEqualTo(1.5);
        assertThat(config.getConsensusMajorityFraction()).isEqualTo(0.5);
        assertThat(config.getSmoothingMode()).isEqualTo(SmoothingMode.DOUBLE);
        assertThat(config.getGapFillPolicy()).isEqualTo(GapFillPolicy.NONE);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.LAST_WRITE_WINS);
    }

    @Test
    @DisplayName("Should require a seed only when the isolation detector is enabled")
    void shouldRequireSeedForIsolation() {
        assertThatThrownBy(() -> AnalysisConfig.builder().forecastHorizon(3).build())
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("'isolation_seed' is required");

        AnalysisConfig config = AnalysisConfig.builder()
                .detectors(DetectorType.ZSCORE, DetectorType.IQR)
                .forecastHorizon(3)
                .build();
        assertThat(config.getIsolationSeed()).isNull();
    }

    @Test
    @DisplayName("Should require a horizon only when trend analysis is enabled")
    void shouldRequireHorizonForTrendAnalysis() {
        assertThatThrownBy(() -> AnalysisConfig.builder().isolationSeed(1L).build())
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("'forecast_horizon' is required");

        AnalysisConfig config = AnalysisConfig.builder()
                .isolationSeed(1L)
                .trendAnalysisEnabled(false)
                .build();
        assertThat(config.getForecastHorizon()).isNull();
    }

    @Test
    @DisplayName("Should list every invalid parameter in one error")
    void shouldCollectAllErrors() {
        AnalysisConfig.Builder builder = AnalysisConfig.builder()
                .isolationSeed(1L)
                .forecastHorizon(0)
                .alpha(1.0)
                .zThreshold(-1)
                .consensusMajorityFraction(0);

        assertThatThrownBy(builder::build)
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("'forecast_horizon' must be >= 1")
                .hasMessageContaining("'alpha' must be strictly between 0 and 1")
                .hasMessageContaining("'z_threshold'")
                .hasMessageContaining("'consensus_majority_fraction'")
                .satisfies(e -> assertThat(((InvalidParameterException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_PARAMETER));
    }

    @Test
    @DisplayName("Should reject duplicated detectors and short windows")
    void shouldRejectDuplicatesAndShortWindows() {
        AnalysisConfig.Builder builder = AnalysisConfig.builder()
                .detectors(DetectorType.ZSCORE, DetectorType.ZSCORE)
                .zWindow(1)
                .iqrWindow(3)
                .forecastHorizon(1);

        assertThatThrownBy(builder::build)
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("more than once")
                .hasMessageContaining("'z_window'")
                .hasMessageContaining("'iqr_window'");
    }

    @Test
    @DisplayName("Should copy every value through toBuilder")
    void shouldRoundTripThroughToBuilder() {
        AnalysisConfig config = AnalysisConfig.builder()
                .isolationSeed(9L)
                .forecastHorizon(2)
                .seasonalPeriod(12)
                .smoothingMode(SmoothingMode.TRIPLE)
                .build();

        assertThat(config.toBuilder().build()).isEqualTo(config);
        assertThat(config.toBuilder().forecastHorizon(3).build()).isNotEqualTo(config);
    }

    @Test
    @DisplayName("Should resolve detector names case-insensitively")
    void shouldResolveDetectorNames() {
        assertThat(DetectorType.fromName("Moving_Average")).isEqualTo(DetectorType.MOVING_AVERAGE);
        assertThatThrownBy(() -> DetectorType.fromName("prophet"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prophet");
    }
}
