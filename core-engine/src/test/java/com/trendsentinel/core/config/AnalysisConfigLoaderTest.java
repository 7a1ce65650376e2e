package com.trendsentinel.core.config;

import com.trendsentinel.core.error.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfigLoader}.
 */
class AnalysisConfigLoaderTest {

    @Test
    @DisplayName("Should load every parameter from a classpath YAML file")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getDetectors()).containsExactly(
                DetectorType.ZSCORE, DetectorType.IQR, DetectorType.ISOLATION, DetectorType.MOVING_AVERAGE);
        assertThat(config.getZThreshold()).isEqualTo(2.5);
        assertThat(config.getZWindow()).isEqualTo(10);
        assertThat(config.getIqrMultiplier()).isEqualTo(2.0);
        assertThat(config.getIsolationSeed()).isEqualTo(7L);
        assertThat(config.getIsolationTrees()).isEqualTo(50);
        assertThat(config.getMovingAverageWindow()).isEqualTo(5);
        assertThat(config.getConsensusMajorityFraction()).isEqualTo(0.75);
        assertThat(config.getSeasonalPeriod()).isEqualTo(12);
        assertThat(config.getDecompositionMode()).isEqualTo(DecompositionMode.MULTIPLICATIVE);
        assertThat(config.getSmoothingMode()).isEqualTo(SmoothingMode.TRIPLE);
        assertThat(config.getAlpha()).isEqualTo(0.5);
        assertThat(config.getForecastHorizon()).isEqualTo(6);
        assertThat(config.getGapFillPolicy()).isEqualTo(GapFillPolicy.INTERPOLATE);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.ERROR);
    }

    @Test
    @DisplayName("Should keep defaults for keys the file does not set")
    void shouldKeepDefaultsForUnsetKeys() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getBeta()).isEqualTo(0.1);
        assertThat(config.getConfidenceZ()).isEqualTo(1.96);
        assertThat(config.isTrendAnalysisEnabled()).isTrue();
        assertThat(config.getIqrWindow()).isNull();
    }

    @Test
    @DisplayName("Should throw on a missing classpath resource")
    void shouldThrowOnMissingResource() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("nonexistent.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw on a missing file")
    void shouldThrowOnMissingFile(@TempDir Path dir) {
        String path = dir.resolve("absent.yml").toString();

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject an unknown key")
    void shouldRejectUnknownKey() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("unknown-key.yml"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("unknown key 'z_treshold'");
    }

    @Test
    @DisplayName("Should reject a duplicated key")
    void shouldRejectDuplicateKey() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("duplicate-key.yml"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("not valid YAML");
    }

    @Test
    @DisplayName("Should reject an unknown enum value")
    void shouldRejectUnknownEnumValue() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("invalid-values.yml"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("'smoothing_mode'")
                .hasMessageContaining("quadruple");
    }

    @Test
    @DisplayName("Should reject a document that is not a mapping")
    void shouldRejectNonMappingDocument(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("list.yml");
        Files.writeString(file, "- zscore\n- iqr\n");

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(file.toString()))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("must be a mapping");
    }

    @Test
    @DisplayName("Should report a missing seed for an empty document")
    void shouldValidateEmptyDocument(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(file.toString()))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("isolation_seed")
                .hasMessageContaining("forecast_horizon");
    }

    @Test
    @DisplayName("Should prefer the file named by the environment")
    void shouldLoadFromEnvironmentPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("env.yml");
        Files.writeString(file, "detectors: zscore, iqr\nforecast_horizon: 2\n");

        AnalysisConfig config = AnalysisConfigLoader.load(
                Map.of(AnalysisConfigLoader.ENV_CONFIG_PATH, file.toString()));

        assertThat(config.getDetectors()).containsExactly(DetectorType.ZSCORE, DetectorType.IQR);
        assertThat(config.getForecastHorizon()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should accept hyphenated enum names and wrong-typed values are reported")
    void shouldConvertValuesFromMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("detectors", List.of("zscore"));
        values.put("gap_fill_policy", "forward-fill");
        values.put("forecast_horizon", 3);
        assertThat(AnalysisConfigLoader.fromMap(values).getGapFillPolicy()).isEqualTo(GapFillPolicy.FORWARD_FILL);

        values.put("z_threshold", "high");
        assertThatThrownBy(() -> AnalysisConfigLoader.fromMap(values))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("'z_threshold': expected a number");
    }
}
