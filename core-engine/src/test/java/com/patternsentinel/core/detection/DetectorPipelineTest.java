package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.CorrelationPair;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.model.context.FlatlineContext;
import com.patternsentinel.core.stats.CorrelationAnalyzer;
import com.patternsentinel.core.stats.CorrelationTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorPipeline}.
 */
class DetectorPipelineTest {

    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-01-06T00:00:00Z");

    private final AnomalyFactory factory = new AnomalyFactory();

    @Test
    @DisplayName("Detectors should run in type order regardless of input order")
    void shouldRunInTypeOrder() {
        List<AnomalyType> calls = new ArrayList<>();
        DetectorPipeline pipeline = new DetectorPipeline(List.of(
                new RecordingDetector(AnomalyType.FREQUENCY, calls),
                new RecordingDetector(AnomalyType.SPIKE, calls),
                new RecordingDetector(AnomalyType.FLATLINE, calls)), null);

        List<Anomaly> found = pipeline.evaluate(snapshot());

        assertThat(calls).containsExactly(AnomalyType.SPIKE, AnomalyType.FLATLINE, AnomalyType.FREQUENCY);
        assertThat(found).extracting(Anomaly::getType)
                .containsExactly(AnomalyType.SPIKE, AnomalyType.FLATLINE, AnomalyType.FREQUENCY);
        assertThat(pipeline.enabledTypes())
                .containsExactly(AnomalyType.SPIKE, AnomalyType.FLATLINE, AnomalyType.FREQUENCY);
    }

    @Test
    @DisplayName("A failing detector should not stop the others")
    void failingDetectorShouldBeIsolated() {
        List<AnomalyType> calls = new ArrayList<>();
        DetectorPipeline pipeline = new DetectorPipeline(List.of(
                new RecordingDetector(AnomalyType.SPIKE, calls),
                new FailingDetector(AnomalyType.DRIFT),
                new RecordingDetector(AnomalyType.FLATLINE, calls)), null);

        List<Anomaly> found = pipeline.evaluate(snapshot());

        assertThat(found).extracting(Anomaly::getType)
                .containsExactly(AnomalyType.SPIKE, AnomalyType.FLATLINE);
        assertThat(pipeline.failures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Two detectors of the same type should be rejected")
    void duplicateTypeShouldBeRejected() {
        List<AnomalyType> calls = new ArrayList<>();
        assertThatThrownBy(() -> new DetectorPipeline(List.of(
                new RecordingDetector(AnomalyType.SPIKE, calls),
                new RecordingDetector(AnomalyType.SPIKE, calls)), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spike");
    }

    @Test
    @DisplayName("Without a correlation detector the cross-entity check should be empty")
    void disabledCorrelationShouldYieldNothing() {
        DetectorPipeline pipeline = new DetectorPipeline(List.of(), null);
        CorrelationTable table = new CorrelationTable(List.of(new CorrelationPair("a", "b", 0.9, 48)));

        assertThat(pipeline.getCorrelationDetector()).isEmpty();
        assertThat(pipeline.evaluateCorrelations(table, id -> List.of())).isEmpty();
        assertThat(pipeline.enabledTypes()).isEmpty();
    }

    @Test
    @DisplayName("An enabled correlation detector should be listed last")
    void correlationShouldBeListedLast() {
        CorrelationBreakDetector correlation = new CorrelationBreakDetector(0.7, 24, 0.5, 0.8,
                new CorrelationAnalyzer(48, 5, 500), factory, Clock.systemUTC());
        DetectorPipeline pipeline = new DetectorPipeline(
                List.of(new FlatlineDetector(12, factory)), correlation);

        assertThat(pipeline.enabledTypes()).containsExactly(AnomalyType.FLATLINE, AnomalyType.CORRELATION);
        assertThat(pipeline.evaluateCorrelations(CorrelationTable.EMPTY, id -> List.of())).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SeriesSnapshot snapshot() {
        return new SeriesSnapshot("sensor.a",
                List.of(new DataPoint("sensor.a", 1.0, T0, null)),
                PatternProfile.builder("sensor.a").globalMean(1).globalStd(1).build());
    }

    private final class RecordingDetector implements AnomalyDetector {
        private final AnomalyType type;
        private final List<AnomalyType> calls;

        RecordingDetector(AnomalyType type, List<AnomalyType> calls) {
            this.type = type;
            this.calls = calls;
        }

        @Override
        public List<Anomaly> evaluate(SeriesSnapshot snapshot) {
            calls.add(type);
            return List.of(factory.newAnomaly(snapshot.getEntityId(), type)
                    .severity(Severity.INFO)
                    .detectedAt(T0)
                    .context(new FlatlineContext(1, 1.0))
                    .build());
        }

        @Override
        public AnomalyType getType() {
            return type;
        }
    }

    private static final class FailingDetector implements AnomalyDetector {
        private final AnomalyType type;

        FailingDetector(AnomalyType type) {
            this.type = type;
        }

        @Override
        public List<Anomaly> evaluate(SeriesSnapshot snapshot) {
            throw new IllegalStateException("boom");
        }

        @Override
        public AnomalyType getType() {
            return type;
        }
    }
}
