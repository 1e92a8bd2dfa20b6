package com.patternsentinel.core.detection;

import com.patternsentinel.core.config.EngineConfig;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.scoring.SeverityScorer;
import com.patternsentinel.core.stats.CorrelationAnalyzer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    private final AnomalyFactory anomalies = new AnomalyFactory();
    private final CorrelationAnalyzer analyzer = new CorrelationAnalyzer(48, 5, 500);
    private final SeverityScorer scorer = new SeverityScorer(2, 3, 4);

    @Test
    @DisplayName("Default config should enable every detector in fixed order")
    void defaultConfigShouldEnableAll() {
        DetectorPipeline pipeline = DetectorFactory.createPipeline(
                new EngineConfig(), analyzer, anomalies, Clock.systemUTC());

        assertThat(pipeline.enabledTypes()).containsExactly(AnomalyType.values());
        assertThat(pipeline.getCorrelationDetector()).isPresent();
    }

    @Test
    @DisplayName("Only configured detectors should be created")
    void subsetShouldBeHonoured() {
        EngineConfig config = new EngineConfig();
        config.setDetectors(List.of("frequency", "SPIKE"));

        DetectorPipeline pipeline = DetectorFactory.createPipeline(config, analyzer, anomalies, Clock.systemUTC());

        assertThat(pipeline.enabledTypes()).containsExactly(AnomalyType.SPIKE, AnomalyType.FREQUENCY);
        assertThat(pipeline.getCorrelationDetector()).isEmpty();
    }

    @Test
    @DisplayName("Each per-entity type should map to its detector class")
    void shouldCreateMatchingDetectors() {
        EngineConfig config = new EngineConfig();

        assertThat(DetectorFactory.create(AnomalyType.SPIKE, config, scorer, anomalies))
                .isInstanceOf(SpikeDetector.class);
        assertThat(DetectorFactory.create(AnomalyType.DRIFT, config, scorer, anomalies))
                .isInstanceOf(DriftDetector.class);
        assertThat(DetectorFactory.create(AnomalyType.FLATLINE, config, scorer, anomalies))
                .isInstanceOf(FlatlineDetector.class);
        assertThat(DetectorFactory.create(AnomalyType.SEASONAL, config, scorer, anomalies))
                .isInstanceOf(SeasonalDetector.class);
        assertThat(DetectorFactory.create(AnomalyType.FREQUENCY, config, scorer, anomalies))
                .isInstanceOf(FrequencyDetector.class)
                .extracting(AnomalyDetector::getType)
                .isEqualTo(AnomalyType.FREQUENCY);
    }

    @Test
    @DisplayName("Correlation is not a per-entity detector")
    void correlationShouldNotBeCreatedPerEntity() {
        assertThatThrownBy(() -> DetectorFactory.create(AnomalyType.CORRELATION, new EngineConfig(), scorer, anomalies))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("createCorrelationDetector");
    }

    @Test
    @DisplayName("Null type should throw NullPointerException")
    void nullTypeShouldThrow() {
        assertThatThrownBy(() -> DetectorFactory.create(null, new EngineConfig(), scorer, anomalies))
                .isInstanceOf(NullPointerException.class);
    }
}
