package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.model.context.FlatlineContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FlatlineDetector}.
 */
class FlatlineDetectorTest {

    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-01-06T00:00:00Z");
    private static final PatternProfile PROFILE =
            PatternProfile.builder("sensor.a").globalMean(20).globalStd(1).build();

    private final FlatlineDetector detector = new FlatlineDetector(12, new AnomalyFactory());

    @Test
    @DisplayName("Should flag twelve identical readings as a warning with score 60")
    void shouldFlagStuckSensor() {
        List<Anomaly> found = detector.evaluate(snapshot(repeat(21.5, 12)));

        assertThat(found).hasSize(1);
        Anomaly a = found.get(0);
        assertThat(a.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(a.getScore()).isEqualTo(60.0);
        assertThat(a.getValue()).isEqualTo(21.5);
        assertThat(a.getExpectedValue()).isEqualTo(21.5);
        assertThat(a.getDeviationPct()).isZero();
        assertThat(a.getDetectedAt()).isEqualTo(T0.plusHours(11));

        FlatlineContext ctx = a.getContext(FlatlineContext.class);
        assertThat(ctx.getConsecutiveIdentical()).isEqualTo(12);
        assertThat(ctx.getStuckValue()).isEqualTo(21.5);
    }

    @Test
    @DisplayName("Should NOT fire with fewer than twelve readings")
    void shouldSkipShortHistory() {
        assertThat(detector.evaluate(snapshot(repeat(21.5, 11)))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when one of the last twelve readings differs")
    void shouldNotFireOnSingleDifference() {
        double[] values = repeat(21.5, 20);
        values[10] = 21.6;

        assertThat(detector.evaluate(snapshot(values))).isEmpty();
    }

    @Test
    @DisplayName("Should ignore variation older than the last twelve readings")
    void shouldIgnoreOlderVariation() {
        double[] values = repeat(7.0, 30);
        values[17] = 100.0;

        assertThat(detector.evaluate(snapshot(values))).hasSize(1);
    }

    @Test
    @DisplayName("0.0 and -0.0 should count as different values")
    void shouldCompareBitwise() {
        double[] values = repeat(0.0, 12);
        values[5] = -0.0;

        assertThat(detector.evaluate(snapshot(values))).isEmpty();
    }

    @Test
    @DisplayName("Should reject a threshold below two")
    void shouldRejectTinyThreshold() {
        assertThatThrownBy(() -> new FlatlineDetector(1, new AnomalyFactory()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[] repeat(double value, int n) {
        double[] out = new double[n];
        Arrays.fill(out, value);
        return out;
    }

    private static SeriesSnapshot snapshot(double... values) {
        List<DataPoint> history = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            history.add(new DataPoint("sensor.a", values[i], T0.plusHours(i), null));
        }
        return new SeriesSnapshot("sensor.a", history, PROFILE);
    }
}
