package com.trendsentinel.core.detection;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.config.DetectorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create ZScoreDetector for type=zscore")
    void shouldCreateZScoreDetector() {
        OutlierDetector detector = DetectorFactory.create(DetectorType.ZSCORE, config().zWindow(5).build());

        assertThat(detector).isInstanceOf(ZScoreDetector.class);
        assertThat(((ZScoreDetector) detector).getWindow()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should create IqrFenceDetector for type=iqr")
    void shouldCreateIqrDetector() {
        OutlierDetector detector = DetectorFactory.create(DetectorType.IQR, config().iqrMultiplier(3).build());

        assertThat(detector).isInstanceOf(IqrFenceDetector.class);
        assertThat(((IqrFenceDetector) detector).getMultiplier()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should create IsolationForestDetector for type=isolation")
    void shouldCreateIsolationDetector() {
        OutlierDetector detector = DetectorFactory.create(DetectorType.ISOLATION, config().build());

        assertThat(detector).isInstanceOf(IsolationForestDetector.class);
        assertThat(((IsolationForestDetector) detector).getSeed()).isEqualTo(42L);
    }

    @Test
    @DisplayName("Should create MovingAverageDeviationDetector for type=moving_average")
    void shouldCreateMovingAverageDetector() {
        OutlierDetector detector = DetectorFactory.create(DetectorType.MOVING_AVERAGE, config().build());

        assertThat(detector).isInstanceOf(MovingAverageDeviationDetector.class);
        assertThat(detector.getName()).isEqualTo("moving_average");
    }

    @Test
    @DisplayName("Should create every enabled detector in configured order")
    void shouldCreateAllInOrder() {
        AnalysisConfig config = config()
                .detectors(DetectorType.MOVING_AVERAGE, DetectorType.ZSCORE)
                .build();

        List<OutlierDetector> detectors = DetectorFactory.createAll(config);

        assertThat(detectors).extracting(OutlierDetector::getName).containsExactly("moving_average", "zscore");
        assertThatThrownBy(() -> detectors.add(new ZScoreDetector(1, null)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private AnalysisConfig.Builder config() {
        return AnalysisConfig.builder().isolationSeed(42L).forecastHorizon(1);
    }
}
